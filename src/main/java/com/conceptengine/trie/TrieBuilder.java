package com.conceptengine.trie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 概念字典树构建器。
 *
 * <p>先对概念按词项字典序排序，使共享首词项的概念连续排列；再逐层分组：
 * 当前层存在空后缀时标记节点为概念结尾，其余条目按首词项分组并对去掉首词项的后缀构建子节点。
 */
public final class TrieBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TrieBuilder.class);

    /** 逐词项比较，真前缀排在其扩展之前 */
    static final Comparator<List<String>> CONCEPT_ORDER = TrieBuilder::compareConcepts;

    private TrieBuilder() {
    }

    /**
     * 由概念集合构建不可变字典树。
     *
     * @param concepts 概念集合，允许重复、空序列及互为前缀的概念
     * @return 字典树根节点
     * @throws IllegalArgumentException 集合或其中某个概念为 null 时抛出
     */
    public static TrieNode build(Iterable<? extends List<String>> concepts) {
        if (concepts == null) {
            throw new IllegalArgumentException("概念词典不能为null");
        }

        List<List<String>> entries = new ArrayList<>();
        for (List<String> concept : concepts) {
            if (concept == null) {
                throw new IllegalArgumentException("概念不能为null，位置=" + entries.size());
            }
            entries.add(List.copyOf(concept));
        }
        entries.sort(CONCEPT_ORDER);

        TrieNode root = buildRoot(entries);
        logger.debug("概念字典树构建完成: entries={}, concepts={}, nodes={}, maxDepth={}",
            entries.size(), root.conceptCount(), root.nodeCount(), root.maxDepth());
        return root;
    }

    /**
     * 用显式工作栈构建整棵树，子节点先于父节点完成，避免长概念导致栈溢出。
     */
    private static TrieNode buildRoot(List<List<String>> entries) {
        Deque<PendingNode> stack = new ArrayDeque<>();
        stack.push(new PendingNode(entries, 0, 0, entries.size()));
        TrieNode completed = null;

        while (true) {
            PendingNode pending = stack.peek();
            if (completed != null) {
                pending.children.put(pending.pendingHead, completed);
                completed = null;
            }

            if (pending.cursor < pending.to) {
                int groupStart = pending.cursor;
                String head = entries.get(groupStart).get(pending.depth);
                int groupEnd = groupStart + 1;
                while (groupEnd < pending.to && head.equals(entries.get(groupEnd).get(pending.depth))) {
                    groupEnd++;
                }
                pending.pendingHead = head;
                pending.cursor = groupEnd;
                stack.push(new PendingNode(entries, pending.depth + 1, groupStart, groupEnd));
            } else {
                stack.pop();
                completed = new TrieNode(pending.conceptEnd, pending.children);
                if (stack.isEmpty()) {
                    return completed;
                }
            }
        }
    }

    /**
     * 待构建节点，对应 entries[from, to)，区间内条目共享长度为 depth 的前缀。
     */
    private static final class PendingNode {
        private final int depth;
        private final int to;
        private final boolean conceptEnd;
        private final Map<String, TrieNode> children = new LinkedHashMap<>();
        private int cursor;
        private String pendingHead;

        PendingNode(List<List<String>> entries, int depth, int from, int to) {
            this.depth = depth;
            this.to = to;
            int skipped = from;
            // 排序后空后缀（含重复）位于区间开头
            while (skipped < to && entries.get(skipped).size() == depth) {
                skipped++;
            }
            this.conceptEnd = skipped > from;
            this.cursor = skipped;
        }
    }

    private static int compareConcepts(List<String> left, List<String> right) {
        int shared = Math.min(left.size(), right.size());
        for (int index = 0; index < shared; index++) {
            int compared = left.get(index).compareTo(right.get(index));
            if (compared != 0) {
                return compared;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}

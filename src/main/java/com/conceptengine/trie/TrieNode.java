package com.conceptengine.trie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 概念字典树节点，构建完成后不可变。
 *
 * <p>从根节点到当前节点的词项路径恰好等于某个概念时，{@link #isConceptEnd()} 为 true。
 * 子节点按词项字典序排列，每个子节点只属于其父节点。
 */
public final class TrieNode {
    private final boolean conceptEnd;
    private final Map<String, TrieNode> children;
    private final int nodeCount;
    private final int conceptCount;
    private final int maxDepth;

    /**
     * 由构建器调用，children 的所有权随之转移给节点。
     */
    TrieNode(boolean conceptEnd, Map<String, TrieNode> children) {
        this.conceptEnd = conceptEnd;
        this.children = Collections.unmodifiableMap(children);

        int nodes = 1;
        int concepts = conceptEnd ? 1 : 0;
        int depth = 0;
        for (TrieNode child : children.values()) {
            nodes += child.nodeCount;
            concepts += child.conceptCount;
            depth = Math.max(depth, child.maxDepth + 1);
        }
        this.nodeCount = nodes;
        this.conceptCount = concepts;
        this.maxDepth = depth;
    }

    public boolean isConceptEnd() {
        return conceptEnd;
    }

    /**
     * 查找词项对应的子节点。
     *
     * @param token 下一个词项
     * @return 子节点，不存在时返回 null
     */
    public TrieNode child(String token) {
        return children.get(token);
    }

    /**
     * 返回只读子节点映射，按词项字典序迭代。
     */
    public Map<String, TrieNode> children() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * 沿词项路径向下查找节点。
     *
     * @param path 相对当前节点的词项路径
     * @return 路径终点节点，路径中断时返回 null
     */
    public TrieNode find(List<String> path) {
        if (path == null) {
            throw new IllegalArgumentException("路径不能为null");
        }
        TrieNode current = this;
        for (String token : path) {
            current = current.child(token);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * 判断词项序列是否为字典中的完整概念。
     */
    public boolean contains(List<String> concept) {
        TrieNode node = find(concept);
        return node != null && node.conceptEnd;
    }

    /**
     * 子树节点总数，包含当前节点。
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * 子树中去重后的概念数量。
     */
    public int conceptCount() {
        return conceptCount;
    }

    /**
     * 子树最大深度，即最长概念的词项数。
     */
    public int maxDepth() {
        return maxDepth;
    }

    /**
     * 按字典序枚举子树中的全部概念。
     *
     * @return 不可变概念列表，每个概念为不可变词项列表
     */
    public List<List<String>> concepts() {
        List<List<String>> collected = new ArrayList<>(conceptCount);
        collectConcepts(this, new ArrayList<>(maxDepth), collected);
        return List.copyOf(collected);
    }

    private static void collectConcepts(TrieNode root, List<String> path, List<List<String>> collected) {
        if (root.conceptEnd) {
            collected.add(List.copyOf(path));
        }
        Deque<Iterator<Map.Entry<String, TrieNode>>> stack = new ArrayDeque<>();
        stack.push(root.children.entrySet().iterator());
        while (!stack.isEmpty()) {
            Iterator<Map.Entry<String, TrieNode>> siblings = stack.peek();
            if (siblings.hasNext()) {
                Map.Entry<String, TrieNode> entry = siblings.next();
                TrieNode node = entry.getValue();
                path.add(entry.getKey());
                if (node.conceptEnd) {
                    collected.add(List.copyOf(path));
                }
                stack.push(node.children.entrySet().iterator());
            } else {
                stack.pop();
                // 根节点没有对应词项
                if (!path.isEmpty()) {
                    path.remove(path.size() - 1);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "TrieNode{conceptEnd=" + conceptEnd
            + ", children=" + children.keySet()
            + ", nodeCount=" + nodeCount
            + ", maxDepth=" + maxDepth + "}";
    }
}

package com.conceptengine.extract;

import com.conceptengine.trie.TrieNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 惰性匹配迭代器，逐个消费输入词项，只在需要下一个结果时才继续读取。
 *
 * <p>每个词项依次执行：在当前下标新建一个锚定根节点的活跃匹配（追加在延续匹配之后），
 * 按顺序推进全部活跃匹配，无法推进的丢弃，到达概念结尾的立即输出，最后交换工作表。
 * 因此结果按完成下标递增输出，同一完成下标内按起始下标递增输出。
 */
final class MatchIterator implements Iterator<ConceptMatch> {
    private static final Logger logger = LoggerFactory.getLogger(MatchIterator.class);

    private final TrieNode root;
    private final Iterator<String> tokens;
    private final boolean emitEmptyConcepts;
    private final Deque<ConceptMatch> pending = new ArrayDeque<>();
    private List<ActiveMatch> active;
    private List<ActiveMatch> retained;
    private long index;
    private long emittedCount;
    private boolean exhausted;

    MatchIterator(TrieNode root, Iterator<String> tokens, boolean emitEmptyConcepts, int worklistCapacity) {
        this.root = root;
        this.tokens = tokens;
        this.emitEmptyConcepts = emitEmptyConcepts;
        this.active = new ArrayList<>(worklistCapacity);
        this.retained = new ArrayList<>(worklistCapacity);
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty()) {
            if (exhausted) {
                return false;
            }
            if (!tokens.hasNext()) {
                exhausted = true;
                active.clear();
                logger.debug("概念抽取结束: tokens={}, matches={}", index, emittedCount);
                return false;
            }
            consume(tokens.next());
        }
        return true;
    }

    @Override
    public ConceptMatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException("没有更多匹配结果");
        }
        emittedCount++;
        return pending.poll();
    }

    private void consume(String token) {
        // 空序列概念在消费当前词项之前完成
        if (emitEmptyConcepts && root.isConceptEnd()) {
            pending.add(new ConceptMatch(index, List.of()));
        }

        active.add(new ActiveMatch(index, root));
        for (ActiveMatch match : active) {
            TrieNode next = match.node().child(token);
            if (next == null) {
                continue;
            }
            match.advance(token, next);
            if (next.isConceptEnd()) {
                pending.add(match.toConceptMatch());
            }
            // 叶子节点无法继续延伸
            if (next.hasChildren()) {
                retained.add(match);
            }
        }

        List<ActiveMatch> swap = active;
        active = retained;
        retained = swap;
        retained.clear();
        index++;
    }
}

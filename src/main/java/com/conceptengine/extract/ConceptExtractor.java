package com.conceptengine.extract;

import com.conceptengine.config.ExtractorConfig;
import com.conceptengine.trie.TrieBuilder;
import com.conceptengine.trie.TrieNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 基于字典树的概念抽取器。
 *
 * <p>字典树只读，同一个抽取器可被多个线程同时使用；每次抽取拥有独立的活跃匹配状态。
 * 支持重叠与嵌套匹配：每个起始位置上命中的每个概念都会输出。
 */
public class ConceptExtractor {
    private final TrieNode root;
    private final boolean emitEmptyConcepts;
    private final int worklistCapacity;

    /**
     * 使用默认配置包装已构建的字典树。
     */
    public ConceptExtractor(TrieNode root) {
        this(root, ExtractorConfig.defaults());
    }

    /**
     * 使用指定配置包装已构建的字典树，配置取值在此刻固定。
     *
     * @throws IllegalArgumentException 字典树或配置为 null，或配置非法时抛出
     */
    public ConceptExtractor(TrieNode root, ExtractorConfig config) {
        if (root == null) {
            throw new IllegalArgumentException("字典树根节点不能为null");
        }
        if (config == null) {
            throw new IllegalArgumentException("抽取器配置不能为null");
        }
        config.validate();
        this.root = root;
        this.emitEmptyConcepts = config.isEmitEmptyConcepts();
        // 活跃匹配数不超过最长概念长度加上新建的一个
        this.worklistCapacity = Math.max(config.getInitialActiveCapacity(), root.maxDepth() + 1);
    }

    /**
     * 由概念集合构建字典树并创建抽取器。
     */
    public static ConceptExtractor of(Iterable<? extends List<String>> concepts) {
        return new ConceptExtractor(TrieBuilder.build(concepts));
    }

    public static ConceptExtractor of(Iterable<? extends List<String>> concepts, ExtractorConfig config) {
        return new ConceptExtractor(TrieBuilder.build(concepts), config);
    }

    /**
     * 使用默认配置在给定字典树上抽取概念。
     */
    public static Iterator<ConceptMatch> extract(TrieNode root, Iterable<String> tokens) {
        return new ConceptExtractor(root).extract(tokens);
    }

    public TrieNode getTrie() {
        return root;
    }

    /**
     * 惰性抽取输入中的全部概念。
     *
     * @param tokens 词项序列，可以是无限序列
     * @return 不可重启的惰性迭代器
     */
    public Iterator<ConceptMatch> extract(Iterable<String> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("词项序列不能为null");
        }
        return extract(tokens.iterator());
    }

    public Iterator<ConceptMatch> extract(Iterator<String> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("词项迭代器不能为null");
        }
        return new MatchIterator(root, tokens, emitEmptyConcepts, worklistCapacity);
    }

    /**
     * 以顺序流形式返回抽取结果，流同样惰性求值。
     */
    public Stream<ConceptMatch> stream(Iterable<String> tokens) {
        Spliterator<ConceptMatch> spliterator = Spliterators.spliteratorUnknownSize(
            extract(tokens), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * 抽取有限输入中的全部概念。
     */
    public List<ConceptMatch> extractAll(Iterable<String> tokens) {
        List<ConceptMatch> matches = new ArrayList<>();
        extract(tokens).forEachRemaining(matches::add);
        return List.copyOf(matches);
    }

    /**
     * 每发现一个匹配即回调一次。
     */
    public void forEachMatch(Iterable<String> tokens, Consumer<? super ConceptMatch> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("回调不能为null");
        }
        extract(tokens).forEachRemaining(consumer);
    }
}

package com.conceptengine;

import com.conceptengine.extract.ConceptExtractor;
import com.conceptengine.extract.ConceptMatch;
import com.conceptengine.trie.TrieBuilder;
import com.conceptengine.trie.TrieNode;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 字典树构建与概念抽取性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ExtractionBenchmark {

    @State(Scope.Benchmark)
    public static class DictionaryState {
        List<List<String>> concepts;
        List<String> tokens;
        ConceptExtractor extractor;

        @Setup
        public void setup() {
            Random random = new Random(2020L);
            // 2000个词的词表，生成10000个1~5词长的概念
            String[] vocabulary = new String[2000];
            for (int i = 0; i < vocabulary.length; i++) {
                vocabulary[i] = "w" + i;
            }
            concepts = new ArrayList<>();
            for (int i = 0; i < 10000; i++) {
                int length = 1 + random.nextInt(5);
                List<String> concept = new ArrayList<>(length);
                for (int j = 0; j < length; j++) {
                    concept.add(vocabulary[random.nextInt(200)]);
                }
                concepts.add(concept);
            }
            tokens = new ArrayList<>(100_000);
            for (int i = 0; i < 100_000; i++) {
                tokens.add(vocabulary[random.nextInt(vocabulary.length)]);
            }
            extractor = ConceptExtractor.of(concepts);
        }
    }

    @Benchmark
    public TrieNode buildTrie(DictionaryState state) {
        return TrieBuilder.build(state.concepts);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void extractLatency(DictionaryState state, Blackhole blackhole) {
        Iterator<ConceptMatch> matches = state.extractor.extract(state.tokens);
        while (matches.hasNext()) {
            blackhole.consume(matches.next());
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(ExtractionBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}

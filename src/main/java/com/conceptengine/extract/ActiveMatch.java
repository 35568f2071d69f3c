package com.conceptengine.extract;

import com.conceptengine.trie.TrieNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 抽取过程中的活跃匹配，锚定在某个起始下标上，只在单次抽取内存在。
 * 每一步要么被丢弃要么只前进一次，因此词项列表可原地追加。
 */
final class ActiveMatch {
    private final long startIndex;
    private final List<String> matchedTokens;
    private TrieNode node;

    ActiveMatch(long startIndex, TrieNode root) {
        this.startIndex = startIndex;
        this.matchedTokens = new ArrayList<>();
        this.node = root;
    }

    TrieNode node() {
        return node;
    }

    void advance(String token, TrieNode next) {
        matchedTokens.add(token);
        node = next;
    }

    ConceptMatch toConceptMatch() {
        return new ConceptMatch(startIndex, matchedTokens);
    }
}

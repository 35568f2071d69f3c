package com.conceptengine.extract;

import java.util.List;

/**
 * 抽取结果，记录概念在输入词项流中的起始下标与匹配到的词项。
 *
 * @param startIndex 起始下标，相对本次抽取输入从0开始
 * @param tokens 匹配到的词项，不可变
 */
public record ConceptMatch(long startIndex, List<String> tokens) {
    public ConceptMatch {
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex不能为负数: " + startIndex);
        }
        if (tokens == null) {
            throw new IllegalArgumentException("tokens不能为null");
        }
        tokens = List.copyOf(tokens);
    }

    public int length() {
        return tokens.size();
    }

    /**
     * 结束下标（不含）。
     */
    public long endIndex() {
        return startIndex + tokens.size();
    }
}

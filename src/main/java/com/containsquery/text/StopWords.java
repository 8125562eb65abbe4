package com.containsquery.text;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class StopWords {

    /** 回退分词默认停用词：代词、冠词以及连接词 and/or/not */
    public static final Set<String> DEFAULT = Set.of(
        "and", "or", "not",
        "a", "an", "the",
        "i", "me", "my", "we", "us", "our", "you", "your",
        "he", "his", "him", "she", "her", "hers", "it", "its",
        "they", "them", "their"
    );

    private StopWords() {
    }

    /**
     * 判断词项是否在给定停用词表中，比较时忽略大小写。
     */
    public static boolean isStopWord(String term, Set<String> stopWords) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return stopWords.contains(term.toLowerCase(Locale.ROOT));
    }

    /**
     * 判断词项是否为默认停用词。
     */
    public static boolean isStopWord(String term) {
        return isStopWord(term, DEFAULT);
    }

    /**
     * 将自定义停用词统一为小写的不可变集合。
     */
    public static Set<String> normalize(Iterable<String> words) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                normalized.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}

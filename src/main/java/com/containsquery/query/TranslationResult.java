package com.containsquery.query;

/**
 * 翻译结果；succeeded 为 false 表示结果来自回退分词，只是尽力而为。
 */
public record TranslationResult(
        String text,
        boolean succeeded
) {
}

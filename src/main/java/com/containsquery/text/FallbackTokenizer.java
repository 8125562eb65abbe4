package com.containsquery.text;

import com.containsquery.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 不依赖语法的简单分词：删除标点，按空白切分，过滤停用词。
 */
public class FallbackTokenizer {

    private static final Pattern STRIP_PATTERN = characterClass(Constants.FALLBACK_STRIPPED_PUNCTUATION);
    private static final Pattern SPLIT_PATTERN = Pattern.compile("[ \r\n\t]");

    private final Set<String> stopWords;

    public FallbackTokenizer() {
        this(StopWords.DEFAULT);
    }

    /**
     * 使用自定义停用词表创建分词器。
     */
    public FallbackTokenizer(Set<String> stopWords) {
        this.stopWords = StopWords.normalize(stopWords);
    }

    /**
     * 返回保留下来的原文词项，大小写与顺序不变。
     */
    public List<String> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("文本不能为 null");
        }

        String cleaned = STRIP_PATTERN.matcher(text).replaceAll("");
        List<String> tokens = new ArrayList<>();
        for (String token : SPLIT_PATTERN.split(cleaned, -1)) {
            if (token.isEmpty() || StopWords.isStopWord(token, stopWords)) {
                continue;
            }
            tokens.add(token);
        }
        return List.copyOf(tokens);
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    /**
     * 由字符集合构造正则字符类，标点一律按字面转义。
     */
    static Pattern characterClass(String characters) {
        StringBuilder builder = new StringBuilder("[");
        for (char value : characters.toCharArray()) {
            if (!Character.isLetterOrDigit(value)) {
                builder.append('\\');
            }
            builder.append(value);
        }
        return Pattern.compile(builder.append(']').toString());
    }
}

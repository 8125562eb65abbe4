package com.containsquery.config;

import com.containsquery.query.SearchPhraseMode;
import com.containsquery.text.StopWords;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * 翻译器运行时配置
 * 
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class TranslatorConfig {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private SearchPhraseMode phraseMode = SearchPhraseMode.INFLECTIONAL;
    private Set<String> stopWords = StopWords.DEFAULT;
    private int maxNestingDepth = Constants.MAX_NESTING_DEPTH;
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;

    public SearchPhraseMode getPhraseMode() {
        return phraseMode;
    }

    public void setPhraseMode(SearchPhraseMode phraseMode) {
        if (phraseMode == null) {
            throw new IllegalArgumentException("phraseMode 不能为 null");
        }
        this.phraseMode = phraseMode;
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    public void setStopWords(Set<String> stopWords) {
        if (stopWords == null) {
            throw new IllegalArgumentException("stopWords 不能为 null，不需要停用词时请使用空数组");
        }
        this.stopWords = StopWords.normalize(stopWords);
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    /**
     * 使用默认配置创建实例
     */
    public static TranslatorConfig defaults() {
        return new TranslatorConfig();
    }

    /**
     * 从JSON文件读取配置，文件中缺失的字段保留默认值
     */
    public static TranslatorConfig load(Path configFile) throws IOException {
        return MAPPER.readerForUpdating(defaults()).readValue(configFile.toFile());
    }
}

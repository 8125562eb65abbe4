package com.containsquery.query;

import com.containsquery.config.TranslatorConfig;
import com.containsquery.text.FallbackTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将 Google 风格搜索表达式翻译为 SQL Server CONTAINS / CONTAINSTABLE 语法。
 * 结构化解析失败时回退到简单分词。
 */
public class SearchTranslator {
    private static final Logger logger = LoggerFactory.getLogger(SearchTranslator.class);

    private final QueryParser parser;
    private final ContainsCompiler compiler;
    private final SimpleCompiler simpleCompiler;
    private final SearchPhraseMode defaultPhraseMode;

    /**
     * 使用默认配置构造翻译器。
     */
    public SearchTranslator() {
        this(TranslatorConfig.defaults());
    }

    /**
     * 使用 TranslatorConfig 注入短语模式、停用词与嵌套上限。
     */
    public SearchTranslator(TranslatorConfig config) {
        this.parser = new QueryParser(config.getMaxNestingDepth());
        this.compiler = new ContainsCompiler();
        this.simpleCompiler = new SimpleCompiler(new FallbackTokenizer(config.getStopWords()));
        this.defaultPhraseMode = config.getPhraseMode();
    }

    public SearchPhraseMode getDefaultPhraseMode() {
        return defaultPhraseMode;
    }

    /**
     * 按默认短语模式翻译。
     */
    public TranslationResult translate(String sourceText) {
        return translate(sourceText, defaultPhraseMode);
    }

    /**
     * 先尝试结构化解析与编译；语法错误时回退到简单分词并返回 succeeded=false。
     */
    public TranslationResult translate(String sourceText, SearchPhraseMode phraseMode) {
        if (sourceText == null) {
            throw new IllegalArgumentException("源文本不能为 null");
        }
        if (phraseMode == null) {
            throw new IllegalArgumentException("phraseMode 不能为 null");
        }

        QueryNode ast;
        try {
            ast = parser.parse(sourceText);
        } catch (QueryParseException exception) {
            logger.debug("结构化解析失败({}，位置 {})，回退到简单分词: {}",
                exception.getKind(), exception.getPosition(), sourceText);
            return new TranslationResult(simpleCompiler.compile(sourceText, phraseMode), false);
        }

        String compiled = compiler.compile(ast, phraseMode);
        logger.trace("翻译完成: {} -> {}", sourceText, compiled);
        return new TranslationResult(compiled, true);
    }

    /**
     * 仅解析，错误以 QueryParseException 抛出。
     */
    public QueryNode parse(String sourceText) {
        if (sourceText == null) {
            throw new IllegalArgumentException("源文本不能为 null");
        }
        return parser.parse(sourceText);
    }

    /**
     * 编译已解析的树，可对同一棵树按不同模式多次调用。
     */
    public String compile(QueryNode ast, SearchPhraseMode phraseMode) {
        return compiler.compile(ast, phraseMode);
    }

    /**
     * 直接使用回退分词。
     */
    public String simpleCompile(String sourceText, SearchPhraseMode phraseMode) {
        return simpleCompiler.compile(sourceText, phraseMode);
    }
}

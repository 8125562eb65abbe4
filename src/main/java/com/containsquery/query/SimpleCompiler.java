package com.containsquery.query;

import com.containsquery.config.Constants;
import com.containsquery.text.FallbackTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构化解析失败时使用的回退编译：所有保留词项以 AND 连接，永不失败。
 */
public class SimpleCompiler {

    private final FallbackTokenizer tokenizer;

    public SimpleCompiler() {
        this(new FallbackTokenizer());
    }

    public SimpleCompiler(FallbackTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * 对原始文本做简单分词并生成 CONTAINS 语法；全部为停用词时返回空串。
     */
    public String compile(String sourceText, SearchPhraseMode phraseMode) {
        if (sourceText == null) {
            throw new IllegalArgumentException("源文本不能为 null");
        }
        if (phraseMode == null) {
            throw new IllegalArgumentException("phraseMode 不能为 null");
        }

        List<String> tokens = tokenizer.tokenize(sourceText);
        List<String> formsExpressions = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (phraseMode == SearchPhraseMode.PREFIX) {
                formsExpressions.add(ContainsCompiler.quote(token + Constants.WILDCARD));
            } else {
                formsExpressions.add("FORMSOF(INFLECTIONAL, " + token + ")");
            }
        }
        return String.join(" AND ", formsExpressions);
    }
}

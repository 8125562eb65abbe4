package com.containsquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.containsquery.config.TranslatorConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SearchTranslatorTest {

    private final SearchTranslator translator = new SearchTranslator();

    @Test
    void testNullSourceRejected() {
        assertThrows(IllegalArgumentException.class, () -> translator.translate(null, SearchPhraseMode.INFLECTIONAL));
        assertThrows(IllegalArgumentException.class, () -> translator.translate(null));
        assertThrows(IllegalArgumentException.class, () -> translator.parse(null));
        assertThrows(IllegalArgumentException.class, () -> translator.simpleCompile(null, SearchPhraseMode.PREFIX));
    }

    @Test
    @DisplayName("OR 的优先级低于 AND")
    void testOrBindsLooserThanAnd() {
        TranslationResult result = translator.translate("a or b and c", SearchPhraseMode.INFLECTIONAL);

        assertTrue(result.succeeded());
        assertTrue(result.text().startsWith("(FORMSOF (INFLECTIONAL, a) OR "));
        assertTrue(result.text().substring(result.text().indexOf(" OR ")).contains(" AND "));
    }

    @Test
    void testExclusion() {
        TranslationResult result = translator.translate("drugs -marijuana", SearchPhraseMode.INFLECTIONAL);

        assertTrue(result.succeeded());
        assertTrue(result.text().contains(
            "FORMSOF (INFLECTIONAL, drugs) AND NOT(FORMSOF (INFLECTIONAL, marijuana))"));
    }

    @Test
    @DisplayName("已带通配符的词项不重复追加 *")
    void testWildcardPassthrough() {
        assertEquals(new TranslationResult("\"cat*\"", true), translator.translate("cat*", SearchPhraseMode.PREFIX));
        assertEquals(new TranslationResult("\"cat*\"", true), translator.translate("cat*", SearchPhraseMode.INFLECTIONAL));
    }

    @Test
    void testProximity() {
        assertEquals(new TranslationResult("(alpha NEAR beta NEAR gamma)", true),
            translator.translate("<alpha beta gamma>", SearchPhraseMode.INFLECTIONAL));
    }

    @Test
    @DisplayName("未闭合引号回退到简单分词")
    void testUnterminatedPhraseFallsBack() {
        TranslationResult result = translator.translate("\"unterminated", SearchPhraseMode.INFLECTIONAL);

        assertFalse(result.succeeded());
        assertEquals("FORMSOF(INFLECTIONAL, unterminated)", result.text());
    }

    @Test
    void testSyntaxErrorFallsBack() {
        TranslationResult result = translator.translate("-draft (report or", SearchPhraseMode.PREFIX);

        assertFalse(result.succeeded());
        assertEquals("\"draft*\" AND \"report*\"", result.text());
    }

    @Test
    void testQuotedPhraseRoundTrip() {
        TranslationResult result = translator.translate("\"C: drive, 100 % / full\" +\"a < b\"",
            SearchPhraseMode.PREFIX);

        assertTrue(result.succeeded());
        assertEquals("\"C: drive, 100 % / full\" AND \"a < b\"", result.text());
    }

    @Test
    void testEmptyInputSucceedsWithEmptyText() {
        assertEquals(new TranslationResult("", true), translator.translate("", SearchPhraseMode.INFLECTIONAL));
    }

    @Test
    @DisplayName("合法输入均能结构化翻译")
    void testWellFormedInputsSucceed() {
        List<String> queries = List.of(
            "hello", "a b c", "a and b or c & d | e", "(a or b) -(c d)", "~car +bike +'red car'",
            "<one two> \"three four\" five*", "((x))", "A OR b AND -c");
        for (String query : queries) {
            assertTrue(translator.translate(query, SearchPhraseMode.INFLECTIONAL).succeeded(), query);
            assertTrue(translator.translate(query, SearchPhraseMode.PREFIX).succeeded(), query);
        }
    }

    @Test
    @DisplayName("超长隐式 AND 链不依赖调用栈深度")
    void testLongAndChain() {
        TranslationResult result = translator.translate("a ".repeat(20000), SearchPhraseMode.PREFIX);

        assertTrue(result.succeeded());
        assertEquals(4 + 19999 * " AND \"a*\"".length(), result.text().length());
        assertTrue(result.text().startsWith("\"a*\" AND \"a*\" AND "));
        assertTrue(result.text().endsWith(" AND \"a*\""));
    }

    @Test
    @DisplayName("超长 OR 链不依赖调用栈深度")
    void testLongOrChain() {
        TranslationResult result = translator.translate("a" + " or a".repeat(20000), SearchPhraseMode.PREFIX);

        assertTrue(result.succeeded());
        assertEquals(20000 + 4 + 20000 * " OR \"a*\")".length(), result.text().length());
        assertTrue(result.text().startsWith("((((\"a*\" OR \"a*\") OR "));
        assertTrue(result.text().endsWith(" OR \"a*\")"));
    }

    @Test
    void testConfiguredDefaults() {
        TranslatorConfig config = TranslatorConfig.defaults();
        config.setPhraseMode(SearchPhraseMode.PREFIX);
        config.setStopWords(Set.of("foo"));
        config.setMaxNestingDepth(1);
        SearchTranslator configured = new SearchTranslator(config);

        assertEquals(SearchPhraseMode.PREFIX, configured.getDefaultPhraseMode());
        assertEquals(new TranslationResult("\"bar*\"", true), configured.translate("bar"));
        assertEquals(new TranslationResult("\"the*\" AND \"bar*\"", false), configured.translate("((the foo bar))"));
    }

    @Test
    void testParseOnceCompileTwice() {
        QueryNode ast = translator.parse("walk ~run");

        assertEquals("FORMSOF (INFLECTIONAL, walk) AND FORMSOF (THESAURUS, run)",
            translator.compile(ast, SearchPhraseMode.INFLECTIONAL));
        assertEquals("\"walk*\" AND FORMSOF (THESAURUS, run)", translator.compile(ast, SearchPhraseMode.PREFIX));
    }

    @Test
    @DisplayName("同一实例可被多线程共享")
    void testConcurrentTranslation() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<TranslationResult>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String query = "term" + i + " or (x" + i + " -y)";
                futures.add(executor.submit(() -> translator.translate(query, SearchPhraseMode.PREFIX)));
            }
            for (int i = 0; i < futures.size(); i++) {
                TranslationResult result = futures.get(i).get();
                assertTrue(result.succeeded());
                assertEquals("(\"term" + i + "*\" OR (\"x" + i + "*\" AND NOT(\"y*\")))", result.text());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}

package com.containsquery.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.containsquery.query.SearchPhraseMode;
import com.containsquery.text.StopWords;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslatorConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        TranslatorConfig config = TranslatorConfig.defaults();

        assertNotNull(config);
        assertEquals(SearchPhraseMode.INFLECTIONAL, config.getPhraseMode());
        assertEquals(StopWords.DEFAULT, config.getStopWords());
        assertEquals(Constants.MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertEquals(Constants.MAX_QUERY_LENGTH, config.getMaxQueryLength());
    }

    @Test
    void testSetters() {
        TranslatorConfig config = new TranslatorConfig();

        config.setPhraseMode(SearchPhraseMode.PREFIX);
        config.setStopWords(Set.of("Alpha", "beta"));
        config.setMaxNestingDepth(8);
        config.setMaxQueryLength(100);

        assertEquals(SearchPhraseMode.PREFIX, config.getPhraseMode());
        assertEquals(Set.of("alpha", "beta"), config.getStopWords());
        assertEquals(8, config.getMaxNestingDepth());
        assertEquals(100, config.getMaxQueryLength());
    }

    @Test
    void testLoadPartialJson() throws IOException {
        Path configFile = tempDir.resolve("translator.json");
        Files.writeString(configFile, "{\"phraseMode\": \"prefix\", \"stopWords\": [\"Foo\", \"bar\"], \"unknown\": 1}");

        TranslatorConfig config = TranslatorConfig.load(configFile);

        assertEquals(SearchPhraseMode.PREFIX, config.getPhraseMode());
        assertEquals(Set.of("foo", "bar"), config.getStopWords());
        assertEquals(Constants.MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertEquals(Constants.MAX_QUERY_LENGTH, config.getMaxQueryLength());
    }

    @Test
    void testNullValuesRejected() {
        TranslatorConfig config = TranslatorConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.setPhraseMode(null));
        assertThrows(IllegalArgumentException.class, () -> config.setStopWords(null));
        assertEquals(SearchPhraseMode.INFLECTIONAL, config.getPhraseMode());
        assertEquals(StopWords.DEFAULT, config.getStopWords());
    }

    @Test
    void testLoadNullValuesRejected() throws IOException {
        Path nullStopWords = tempDir.resolve("null-stop-words.json");
        Files.writeString(nullStopWords, "{\"stopWords\": null}");
        Path nullMode = tempDir.resolve("null-mode.json");
        Files.writeString(nullMode, "{\"phraseMode\": null}");

        assertThrows(IOException.class, () -> TranslatorConfig.load(nullStopWords));
        assertThrows(IOException.class, () -> TranslatorConfig.load(nullMode));
    }

    @Test
    void testLoadMissingFile() {
        assertThrows(IOException.class, () -> TranslatorConfig.load(tempDir.resolve("missing.json")));
    }
}

package com.containsquery;

import com.containsquery.query.QueryNode;
import com.containsquery.query.SearchPhraseMode;
import com.containsquery.query.SearchTranslator;
import com.containsquery.query.TranslationResult;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 翻译性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranslatorBenchmark {

    private static final String COMPLEX_QUERY =
        "(java or kotlin) <virtual thread> -\"legacy code\" ~fast +'exact match' perf* | benchmark & jmh";

    private SearchTranslator translator;
    private QueryNode parsedComplexQuery;
    private String deepQuery;

    @Setup
    public void setup() {
        translator = new SearchTranslator();
        parsedComplexQuery = translator.parse(COMPLEX_QUERY);
        // 接近默认嵌套上限的括号
        deepQuery = "(".repeat(60) + "deep" + ")".repeat(60);
    }

    @Benchmark
    public TranslationResult translateSimple() {
        return translator.translate("quick brown fox", SearchPhraseMode.INFLECTIONAL);
    }

    @Benchmark
    public TranslationResult translateComplex() {
        return translator.translate(COMPLEX_QUERY, SearchPhraseMode.PREFIX);
    }

    @Benchmark
    public String compileOnly() {
        return translator.compile(parsedComplexQuery, SearchPhraseMode.INFLECTIONAL);
    }

    @Benchmark
    public TranslationResult translateDeepNesting() {
        return translator.translate(deepQuery, SearchPhraseMode.INFLECTIONAL);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public TranslationResult translateFallback() {
        return translator.translate("\"unterminated phrase with (many) words", SearchPhraseMode.INFLECTIONAL);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(TranslatorBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}

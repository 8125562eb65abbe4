package com.containsquery.cli;

import com.containsquery.config.TranslatorConfig;
import com.containsquery.query.QueryNode;
import com.containsquery.query.QueryParseException;
import com.containsquery.query.SearchPhraseMode;
import com.containsquery.query.SearchTranslator;
import com.containsquery.query.TranslationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "cqt",
    description = "🔍 将 Google 风格搜索表达式翻译为 SQL Server CONTAINS 语法",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.TranslateSubcommand.class,
        MainCommand.ParseSubcommand.class,
        MainCommand.SimpleSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    /** 结构化解析失败、输出来自回退分词时的退出码 */
    static final int EXIT_FALLBACK = 3;

    @Option(names = {"-m", "--mode"}, description = "词项默认检索方式 (INFLECTIONAL|PREFIX)")
    private SearchPhraseMode mode;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new MainCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 搜索表达式翻译器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private TranslatorConfig loadConfig() throws IOException {
        TranslatorConfig config = configFile == null ? TranslatorConfig.defaults() : TranslatorConfig.load(configFile);
        if (mode != null) {
            config.setPhraseMode(mode);
        }
        return config;
    }

    private String sanitizeQuery(String rawQuery, TranslatorConfig config) {
        if (rawQuery == null) {
            return "";
        }
        if (rawQuery.length() > config.getMaxQueryLength()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + config.getMaxQueryLength() + " 字符）");
        }
        return rawQuery;
    }

    private static ObjectMapper jsonMapper() {
        return new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    @Command(name = "translate", description = "🔄 翻译搜索表达式，失败时回退到简单分词")
    static class TranslateSubcommand implements Callable<Integer> {

        @Parameters(description = "搜索表达式", arity = "1")
        private String query;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TranslatorConfig config = main.loadConfig();
                String safeQuery = main.sanitizeQuery(query, config);
                TranslationResult result = new SearchTranslator(config).translate(safeQuery);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }
                return result.succeeded() ? 0 : EXIT_FALLBACK;
            } catch (CommandLine.ParameterException exception) {
                throw exception;
            } catch (Exception exception) {
                System.err.println("❌ 翻译失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(TranslationResult result) {
            if (!result.succeeded()) {
                System.err.println("⚠️ 表达式无法解析，已回退到简单分词");
            }
            System.out.println(result.text());
        }

        private void printJsonResult(TranslationResult result) throws IOException {
            System.out.println(jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "parse", description = "🌲 输出表达式树 (JSON)")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "搜索表达式", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TranslatorConfig config = main.loadConfig();
                QueryNode ast = new SearchTranslator(config).parse(main.sanitizeQuery(query, config));
                System.out.println(jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(ast));
                return 0;
            } catch (QueryParseException exception) {
                System.err.println("❌ " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 解析失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "simple", description = "✂️ 仅使用简单分词生成 AND 连接的表达式")
    static class SimpleSubcommand implements Callable<Integer> {

        @Parameters(description = "搜索文本", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TranslatorConfig config = main.loadConfig();
                SearchTranslator translator = new SearchTranslator(config);
                System.out.println(translator.simpleCompile(main.sanitizeQuery(query, config),
                    translator.getDefaultPhraseMode()));
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 读取配置失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}

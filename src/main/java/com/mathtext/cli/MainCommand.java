package com.mathtext.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathtext.config.Constants;
import com.mathtext.config.PipelineConfig;
import com.mathtext.model.Segment;
import com.mathtext.normalize.NormalizationResult;
import com.mathtext.pipeline.JsonContentSanitizer;
import com.mathtext.pipeline.MathTextPipeline;
import com.mathtext.pipeline.PipelineReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "mtp",
    description = "🧮 数学文本处理流水线：分段、修复与纯文本转换",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ParseSubcommand.class,
        MainCommand.NormalizeSubcommand.class,
        MainCommand.ConvertSubcommand.class,
        MainCommand.PlainSubcommand.class,
        MainCommand.CleanSubcommand.class,
        MainCommand.SanitizeJsonSubcommand.class,
        MainCommand.InspectSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "properties 配置文件路径")
    private Path configFile;

    @Option(names = {"--marker"}, description = "占位符替换标记")
    private String marker;

    @Option(names = {"--lenient-dollar"}, description = "未闭合的单个 $ 按普通文本处理")
    private boolean lenientDollar;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧮 数学文本处理流水线");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 读取配置文件后用命令行参数覆盖。
     */
    PipelineConfig resolveConfig() throws IOException {
        PipelineConfig config = configFile == null ? PipelineConfig.defaults() : PipelineConfig.load(configFile);
        if (marker != null) {
            config.setPlaceholderMarker(marker);
        }
        if (lenientDollar) {
            config.setLenientDollar(true);
        }
        return config;
    }

    MathTextPipeline createPipeline() throws IOException {
        return new MathTextPipeline(resolveConfig());
    }

    /**
     * 参数为 "-" 时从标准输入读取，超过长度上限时报参数错误。
     */
    String readInput(String argument) throws IOException {
        String input = Constants.STDIN_ARGUMENT.equals(argument)
            ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
            : argument;
        if (input == null) {
            return "";
        }
        if (input.length() > Constants.MAX_INPUT_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "输入长度超过限制（最大 " + Constants.MAX_INPUT_LENGTH + " 字符）");
        }
        return input;
    }

    String toPrettyJson(Object value) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    @Command(name = "parse", description = "✂️ 将文本切分为纯文本与数学片段")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "待分段的文本，\"-\" 表示标准输入", arity = "1")
        private String text;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                List<Segment> segments = pipeline.segments(main.readInput(text));
                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(main.toPrettyJson(segments));
                } else {
                    printTextResult(segments);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 分段失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(List<Segment> segments) {
            if (segments.isEmpty()) {
                System.out.println("⚠️ 没有片段");
                return;
            }
            int index = 1;
            for (Segment segment : segments) {
                System.out.printf("%d. [%s] %s%n", index++, describe(segment), segment.content());
            }
            System.out.println("📊 共 " + segments.size() + " 个片段");
        }

        private String describe(Segment segment) {
            if (!segment.isLatex()) {
                return "text";
            }
            return segment.isDisplayMode() ? "math/display" : "math/inline";
        }
    }

    @Command(name = "normalize", description = "🔧 修复单个数学片段内容")
    static class NormalizeSubcommand implements Callable<Integer> {

        @Parameters(description = "数学内容（不含定界符），\"-\" 表示标准输入", arity = "1")
        private String latex;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                NormalizationResult result = pipeline.normalizer().repair(main.readInput(latex));
                System.out.println(result.content());
                if (pipeline.normalizer().isLikelyValid(result.content())) {
                    System.out.println("✅ 可排版");
                } else {
                    System.out.println("⚠️ 内容可能无效");
                }
                if (!result.issues().isEmpty()) {
                    System.out.println("🔧 已修复: " + result.issues());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 规范化失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "convert", description = "🔤 将数学内容转换为 Unicode 纯文本")
    static class ConvertSubcommand implements Callable<Integer> {

        @Parameters(description = "数学内容，\"-\" 表示标准输入", arity = "1")
        private String latex;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                String normalized = pipeline.normalizer().normalize(main.readInput(latex));
                System.out.println(pipeline.converter().convert(normalized));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "plain", description = "📤 生成整段文本的纯文本近似")
    static class PlainSubcommand implements Callable<Integer> {

        @Parameters(description = "混合文本，\"-\" 表示标准输入", arity = "1")
        private String text;

        @Option(names = {"--max-length"}, description = "最大长度，0 表示不限制")
        private Integer maxLength;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                String input = main.readInput(text);
                String plain = maxLength == null ? pipeline.toPlainText(input) : pipeline.toPlainText(input, maxLength);
                System.out.println(plain);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 纯文本生成失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "clean", description = "🧹 替换泄漏的缓存占位符")
    static class CleanSubcommand implements Callable<Integer> {

        @Parameters(description = "原始文本，\"-\" 表示标准输入", arity = "1")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                System.out.println(pipeline.cleaner().clean(main.readInput(text)));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 清理失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "sanitize-json", description = "🧼 清理 JSON 文档中的泄漏占位符")
    static class SanitizeJsonSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 文件路径", arity = "1")
        private Path file;

        @Option(names = {"--field"}, description = "只清理这些字段（可指定多个）")
        private List<String> fields;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                JsonContentSanitizer sanitizer = fields == null
                    ? new JsonContentSanitizer(pipeline.cleaner())
                    : new JsonContentSanitizer(pipeline.cleaner(), new HashSet<>(fields));
                String json = Files.readString(file, StandardCharsets.UTF_8);
                JsonNode sanitized = sanitizer.sanitize(sanitizer.objectMapper().readTree(json));
                System.out.println(main.toPrettyJson(sanitized));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ JSON 清理失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "inspect", description = "🔬 输出完整分析报告（JSON）")
    static class InspectSubcommand implements Callable<Integer> {

        @Parameters(description = "混合文本，\"-\" 表示标准输入", arity = "1")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MathTextPipeline pipeline = main.createPipeline();
                PipelineReport report = pipeline.analyze(main.readInput(text));
                System.out.println(main.toPrettyJson(report));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 分析失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}

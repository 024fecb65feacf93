package com.textlocator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.textlocator.config.LocatorConfig;
import com.textlocator.highlight.ContextExtractor;
import com.textlocator.highlight.MatchContext;
import com.textlocator.match.MatchResult;
import com.textlocator.match.TextLocator;
import com.textlocator.patch.AnchorCheck;
import com.textlocator.patch.AnchorValidator;
import com.textlocator.patch.PatchResult;
import com.textlocator.patch.TextPatcher;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "tlocate",
    description = "🎯 近似文本定位与修改工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.LocateSubcommand.class,
        MainCommand.ApplySubcommand.class,
        MainCommand.AnchorSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🎯 近似文本定位与修改工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    LocatorConfig loadConfig() throws IOException {
        if (configFile == null) {
            return LocatorConfig.defaults();
        }
        return LocatorConfig.load(configFile);
    }

    static String readText(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * 位置参数与 --xxx-file 二选一，均未给出时报参数错误。
     */
    private static String resolveText(String inline, Path file, String name) throws IOException {
        if (file != null) {
            return readText(file);
        }
        if (inline != null) {
            return inline;
        }
        throw new IllegalArgumentException("缺少" + name + "：请直接给出文本或使用对应的 --" + name + "-file 选项");
    }

    private static Map<String, Object> describeMatch(MatchResult match) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("found", match.found());
        node.put("index", match.index());
        node.put("length", match.length());
        node.put("confidence", match.confidence());
        node.put("matchType", match.matchType().label());
        node.put("matchedText", match.matchedText());
        return node;
    }

    private static void printJson(Map<String, Object> node) throws IOException {
        System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node));
    }

    @Command(name = "locate", description = "🔎 在文件中定位一段文本")
    static class LocateSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "被搜索的文件")
        private Path contentFile;

        @Parameters(index = "1", arity = "0..1", description = "要定位的文本")
        private String query;

        @Option(names = {"--query-file"}, description = "从文件读取要定位的文本")
        private Path queryFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--context"}, description = "命中位置两侧展示的字符数，缺省取配置值")
        private Integer contextRadius;

        @Option(names = {"--no-color"}, description = "关闭高亮")
        private boolean noColor;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LocatorConfig config = main.loadConfig();
                String content = readText(contentFile);
                String target = resolveText(query, queryFile, "query");
                MatchResult match = new TextLocator(config).locate(content, target);
                int radius = contextRadius == null ? config.getContextRadius() : Math.max(0, contextRadius);
                Optional<MatchContext> context = ContextExtractor.extract(content, match, radius);

                if ("json".equalsIgnoreCase(format)) {
                    Map<String, Object> node = describeMatch(match);
                    context.ifPresent(value -> node.put("lineNumber", value.lineNumber()));
                    printJson(node);
                } else {
                    printTextResult(match, context);
                }
                return match.found() ? 0 : 1;
            } catch (Exception exception) {
                System.err.println("❌ 定位失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(MatchResult match, Optional<MatchContext> context) {
            if (!match.found()) {
                System.out.println("⚠️ 未找到匹配文本");
                return;
            }
            System.out.printf("✅ %s 匹配 (confidence: %.2f)%n", match.matchType().label(), match.confidence());
            System.out.println("📍 偏移: " + match.index() + "，长度: " + match.length());
            context.ifPresent(value -> {
                System.out.println("📄 第 " + value.lineNumber() + " 行:");
                System.out.println("   " + value.render(!noColor).replace("\n", " "));
            });
        }
    }

    @Command(name = "apply", description = "✏️ 定位原文并替换为新文本")
    static class ApplySubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "要修改的文件")
        private Path contentFile;

        @Option(names = {"--original"}, description = "待替换的原文")
        private String original;

        @Option(names = {"--original-file"}, description = "从文件读取待替换的原文")
        private Path originalFile;

        @Option(names = {"--changed"}, description = "替换后的文本")
        private String changed;

        @Option(names = {"--changed-file"}, description = "从文件读取替换后的文本")
        private Path changedFile;

        @Option(names = {"--strict"}, description = "启用严格校验（置信度、覆盖度、首尾关键词）")
        private boolean strict;

        @Option(names = {"--in-place"}, description = "直接写回原文件")
        private boolean inPlace;

        @Option(names = {"-o", "--output"}, description = "输出文件，缺省时打印到标准输出")
        private Path output;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LocatorConfig config = main.loadConfig();
                if (strict) {
                    config.setStrictPatchValidation(true);
                }
                String content = readText(contentFile);
                String originalText = resolveText(original, originalFile, "original");
                String changedText = resolveText(changed, changedFile, "changed");

                PatchResult result = new TextPatcher(config).apply(content, originalText, changedText);
                if (!result.applied()) {
                    if ("json".equalsIgnoreCase(format)) {
                        printJson(describePatch(result));
                    } else {
                        System.err.println("❌ 修改未应用: " + result.error().message());
                    }
                    return 1;
                }

                Path destination = inPlace ? contentFile : output;
                if (destination != null) {
                    Files.writeString(destination, result.content(), StandardCharsets.UTF_8);
                }
                if ("json".equalsIgnoreCase(format)) {
                    Map<String, Object> node = describePatch(result);
                    if (destination == null) {
                        node.put("content", result.content());
                    }
                    printJson(node);
                } else if (destination == null) {
                    System.out.print(result.content());
                } else {
                    System.out.printf("✅ 已使用 %s 匹配完成修改 (confidence: %.2f)%n",
                        result.match().matchType().label(), result.match().confidence());
                    System.out.println("💾 写入: " + destination);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 修改失败: " + exception.getMessage());
                return 1;
            }
        }

        private Map<String, Object> describePatch(PatchResult result) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("applied", result.applied());
            node.put("match", describeMatch(result.match()));
            if (result.error() != null) {
                node.put("error", result.error().kind().name());
                node.put("message", result.error().message());
            }
            return node;
        }
    }

    @Command(name = "anchor", description = "⚓ 检查锚点之后是否适合插入内容")
    static class AnchorSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "被检查的文件")
        private Path contentFile;

        @Parameters(index = "1", description = "锚点文本")
        private String anchorText;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LocatorConfig config = main.loadConfig();
                String content = readText(contentFile);
                AnchorCheck check = new AnchorValidator(new TextLocator(config)).validate(content, anchorText);
                if (check.valid()) {
                    System.out.println("✅ 锚点合适，插入位置: " + check.insertionPoint());
                    return 0;
                }
                System.out.println("⚠️ " + check.message());
                if (check.suggestedAnchor() != null) {
                    System.out.println("💡 建议锚点: " + check.suggestedAnchor());
                }
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 锚点检查失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}

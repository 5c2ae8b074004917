package com.calcbridge.cli;

import com.calcbridge.compile.BatchCompiler;
import com.calcbridge.compile.BatchReport;
import com.calcbridge.compile.CalculatedField;
import com.calcbridge.compile.FieldCompilation;
import com.calcbridge.compile.FormulaCompiler;
import com.calcbridge.config.CompilerConfig;
import com.calcbridge.config.Constants;
import com.calcbridge.render.FieldNameMapper;
import com.calcbridge.render.FunctionMapping;
import com.calcbridge.render.FunctionTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "calc-bridge",
    description = "🔁 Tableau 计算字段到 LookML 表达式编译器",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.CompileSubcommand.class,
        MainCommand.BatchSubcommand.class,
        MainCommand.FunctionsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Option(names = {"--function-table"}, description = "自定义函数映射表（JSON），覆盖内置条目")
    private Path functionTable;

    @Option(names = {"--strict"}, description = "未知函数按语法错误处理")
    private boolean strict;

    @Option(names = {"--fail-on-unsupported"}, description = "遇到无法映射的构造时字段编译失败")
    private boolean failOnUnsupported;

    @Option(names = {"--threads"}, description = "编译线程数，默认为处理器核数")
    private Integer threads;

    @Option(names = {"--table-context"}, description = "字段引用的表上下文", defaultValue = Constants.DEFAULT_TABLE_CONTEXT)
    private String tableContext;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔁 Tableau 计算字段到 LookML 表达式编译器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private int resolveThreadCount() {
        if (threads == null) {
            return defaultThreads();
        }
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, defaultThreads());
            return defaultThreads();
        }
        if (threads > Constants.MAX_COMPILE_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_COMPILE_THREADS);
            return Constants.MAX_COMPILE_THREADS;
        }
        return threads;
    }

    private static int defaultThreads() {
        return Math.min(Constants.DEFAULT_COMPILE_THREADS, Constants.MAX_COMPILE_THREADS);
    }

    CompilerConfig buildConfig() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setPermissive(!strict);
        config.setFailOnUnsupported(failOnUnsupported);
        config.setTableContext(tableContext);
        config.setCompileThreads(resolveThreadCount());
        return config;
    }

    FunctionTable loadFunctionTable() throws IOException {
        return functionTable == null ? FunctionTable.loadDefault() : FunctionTable.load(functionTable);
    }

    static void printJson(Object value) throws IOException {
        System.out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    static void printTextResult(String label, FieldCompilation result) {
        System.out.println("─────────────────────────────────");
        if (!result.isSuccess()) {
            System.out.println("❌ " + label + " [" + result.error().kind() + "]");
            System.out.println("   " + result.error().message().replace("\n", "\n   "));
            return;
        }
        System.out.println((result.isPartial() ? "⚠️ " : "✅ ") + label);
        System.out.println("   sql: " + result.expression().text());
        for (String warning : result.expression().warnings()) {
            System.out.println("   ⚠️ " + warning);
        }
        System.out.println("   fields: " + result.dependencies().fieldNames());
    }

    @Command(name = "compile", description = "🛠 编译单个公式")
    static class CompileSubcommand implements Callable<Integer> {

        @Parameters(description = "源语言公式", arity = "1")
        private String formula;

        @Option(names = {"-m", "--field-map"}, description = "字段映射 原名=LookML名（可指定多个）")
        private Map<String, String> fieldMap;

        @Option(names = {"--compute-using"}, description = "表计算分区维度（可指定多个）")
        private List<String> computeUsing;

        @Option(names = {"--view-dimension"}, description = "视图维度，INCLUDE/EXCLUDE 的外层上下文（可指定多个）")
        private List<String> viewDimensions;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FieldNameMapper.Builder builder = FieldNameMapper.builder();
                if (fieldMap != null) {
                    fieldMap.forEach(builder::register);
                }
                FormulaCompiler compiler = new FormulaCompiler(main.loadFunctionTable(), builder.build(),
                    main.buildConfig());
                FieldCompilation result = compiler.compile(
                    new CalculatedField("formula", "formula", formula, null, computeUsing, viewDimensions));
                if ("json".equalsIgnoreCase(format)) {
                    printJson(result);
                } else {
                    printTextResult(formula, result);
                }
                return result.isSuccess() ? 0 : 2;
            } catch (Exception exception) {
                System.err.println("❌ 编译失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "batch", description = "📦 批量编译工作簿导出的计算字段")
    static class BatchSubcommand implements Callable<Integer> {

        @Parameters(description = "工作簿 JSON 文件，包含 fields 与 calculated_fields 数组", arity = "1")
        private Path workbook;

        @Option(names = {"-o", "--output"}, description = "将 JSON 报告写入文件")
        private Path output;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                JsonNode root = OBJECT_MAPPER.readTree(workbook.toFile());
                List<CalculatedField> fields = readCalculatedFields(root);
                FieldNameMapper mapper = buildFieldMapper(root, fields);
                CompilerConfig config = main.buildConfig();
                System.out.println("🚀 开始编译 " + fields.size() + " 个计算字段...");
                System.out.println("🔧 线程数: " + config.getCompileThreads());

                FormulaCompiler compiler = new FormulaCompiler(main.loadFunctionTable(), mapper, config);
                BatchReport report = new BatchCompiler(compiler, config.getCompileThreads()).compile(fields);

                if (output != null) {
                    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), report);
                    System.out.println("💾 报告已写入: " + output);
                }
                if ("json".equalsIgnoreCase(format)) {
                    printJson(report);
                } else {
                    for (int index = 0; index < fields.size(); index++) {
                        printTextResult(fields.get(index).name(), report.fields().get(index));
                    }
                }
                System.out.println();
                System.out.printf("📊 共 %d 个字段：成功 %d，失败 %d，部分支持 %d%n",
                    report.total(), report.succeeded(), report.failed(), report.partial());
                return report.failed() == 0 ? 0 : 2;
            } catch (Exception exception) {
                System.err.println("❌ 批量编译失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        static List<CalculatedField> readCalculatedFields(JsonNode root) {
            List<CalculatedField> fields = new ArrayList<>();
            for (JsonNode node : root.path("calculated_fields")) {
                String name = node.path("name").asText();
                String id = node.hasNonNull("id") ? node.get("id").asText() : name;
                String datatype = node.hasNonNull("datatype") ? node.get("datatype").asText() : null;
                fields.add(new CalculatedField(id, name, node.path("formula").asText(null), datatype,
                    textList(node.path("compute_using")), textList(node.path("view_dimensions"))));
            }
            return fields;
        }

        private static List<String> textList(JsonNode array) {
            List<String> values = new ArrayList<>();
            for (JsonNode value : array) {
                values.add(value.asText());
            }
            return values;
        }

        /**
         * 普通字段按 lookml_name 或标题注册，计算字段按名称与 id 注册为计算字段。
         */
        static FieldNameMapper buildFieldMapper(JsonNode root, List<CalculatedField> fields) {
            FieldNameMapper.Builder builder = FieldNameMapper.builder();
            for (JsonNode node : root.path("fields")) {
                String name = node.path("name").asText();
                if (node.hasNonNull("lookml_name")) {
                    builder.register(name, node.get("lookml_name").asText());
                } else {
                    builder.registerWithCaption(name, node.path("caption").asText(null), false);
                }
            }
            for (CalculatedField field : fields) {
                String clean = FieldNameMapper.cleanNameFromCaption(field.name());
                builder.register(field.name(), clean, true);
                if (!field.id().equals(field.name())) {
                    builder.register(field.id(), clean, true);
                }
            }
            return builder.build();
        }
    }

    @Command(name = "functions", description = "📚 列出函数映射表")
    static class FunctionsSubcommand implements Callable<Integer> {

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FunctionTable table = main.loadFunctionTable();
                if ("json".equalsIgnoreCase(format)) {
                    printJson(table.mappings());
                    return 0;
                }
                System.out.println("📚 函数映射表");
                System.out.println("═══════════");
                for (FunctionMapping mapping : table.mappings()) {
                    String marker = mapping.kind() == FunctionMapping.Kind.UNSUPPORTED ? "⚠️" : "✅";
                    System.out.printf("%s %-16s %-11s %s%n", marker, mapping.name(), mapping.kind(),
                        mapping.target() == null ? "" : mapping.target());
                }
                System.out.println("📊 共 " + table.size() + " 个函数");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取函数映射表失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}

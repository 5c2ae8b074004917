package com.calcbridge.render;

import com.calcbridge.config.CompilerConfig;
import com.calcbridge.formula.FormulaNode;
import com.calcbridge.formula.FormulaNodeVisitor;
import com.calcbridge.formula.FormulaPrinter;
import com.calcbridge.formula.WindowBound;
import com.calcbridge.formula.WindowKind;
import com.calcbridge.formula.WindowRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 将语法树渲染为 LookML SQL 表达式。
 * <p>
 * 渲染器本身无状态，每次调用创建独立的 {@link Lowering} 访问者，可在多线程间共享。
 */
public class ExpressionRenderer {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionRenderer.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String FULL_PARTITION_FRAME = "ROWS BETWEEN UNBOUNDED PRECEDING AND UNBOUNDED FOLLOWING";
    private static final String RUNNING_FRAME = "ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW";

    private final FunctionTable functions;
    private final CompilerConfig config;

    public ExpressionRenderer(FunctionTable functions) {
        this(functions, CompilerConfig.defaults());
    }

    public ExpressionRenderer(FunctionTable functions, CompilerConfig config) {
        this.functions = functions;
        this.config = config;
    }

    /**
     * 使用配置中的表上下文渲染。
     */
    public RenderedExpression render(FormulaNode ast, FieldResolver resolver) {
        return render(ast, resolver, config.getTableContext(), List.of());
    }

    public RenderedExpression render(FormulaNode ast, FieldResolver resolver, String table) {
        return render(ast, resolver, table, List.of());
    }

    /**
     * 渲染语法树。
     *
     * @param ast 语法树
     * @param resolver 字段名解析器
     * @param table 表上下文，字段渲染为 ${table}.field
     * @param viewDimensions 视图维度，作为 INCLUDE/EXCLUDE 的外层上下文
     * @return 表达式文本与警告
     * @throws UnresolvedReferenceException 字段或参数没有映射时抛出
     * @throws UnsupportedConstructException 配置为遇到不支持构造即失败时抛出
     */
    public RenderedExpression render(FormulaNode ast, FieldResolver resolver, String table,
                                     List<String> viewDimensions) {
        Lowering lowering = new Lowering(resolver, table, viewDimensions);
        String text = ast.accept(lowering);
        return new RenderedExpression(text, lowering.warnings);
    }

    /**
     * 不支持构造的占位符，保持 SQL 可解析。
     */
    static String placeholder(String sourceText) {
        return "NULL /* unsupported: " + sourceText.replace("*/", "* /") + " */";
    }

    /** 正在渲染的 LOD 表达式 */
    private static final class LodFrame {
        private final List<String> partition;
        private int aggregateDepth;
        private int aggregatesEmitted;

        private LodFrame(List<String> partition) {
            this.partition = partition;
        }
    }

    private final class Lowering implements FormulaNodeVisitor<String> {
        private final FieldResolver resolver;
        private final String table;
        private final List<String> viewDimensions;
        private final List<String> warnings = new ArrayList<>();
        private final Deque<LodFrame> lodStack = new ArrayDeque<>();

        private Lowering(FieldResolver resolver, String table, List<String> viewDimensions) {
            this.resolver = resolver;
            this.table = table;
            this.viewDimensions = viewDimensions;
        }

        @Override
        public String visitLiteral(FormulaNode.Literal literal) {
            Object value = literal.value();
            return switch (literal.dataType()) {
                case STRING -> "'" + ((String) value).replace("\\", "\\\\").replace("'", "\\'") + "'";
                case INTEGER -> value.toString();
                case REAL -> ((BigDecimal) value).toPlainString();
                case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
                case DATE -> "DATE '" + value + "'";
                case DATETIME -> "TIMESTAMP '" + TIMESTAMP_FORMAT.format((LocalDateTime) value) + "'";
                case NULL -> "NULL";
            };
        }

        @Override
        public String visitFieldRef(FormulaNode.FieldRef fieldRef) {
            String column = fieldSql(fieldRef.name());
            if (fieldRef.aggregation() == null) {
                return column;
            }
            return guarded(fieldRef, () -> {
                String aggregated = aggregate(fieldRef.aggregation(), column);
                LodFrame frame = lodStack.peek();
                if (frame == null) {
                    return aggregated;
                }
                if (frame.aggregateDepth > 0) {
                    throw new UnsupportedConstructException(FormulaPrinter.print(fieldRef),
                            "LOD 聚合中嵌套了预聚合字段");
                }
                frame.aggregatesEmitted++;
                return aggregated + " " + over(frame.partition, null, null);
            });
        }

        @Override
        public String visitParameterRef(FormulaNode.ParameterRef parameterRef) {
            String id = resolver.resolve(parameterRef.name())
                .orElseThrow(() -> new UnresolvedReferenceException(parameterRef.name(), ReferenceKind.PARAMETER));
            return "{% parameter " + id + " %}";
        }

        @Override
        public String visitUnary(FormulaNode.Unary unary) {
            String operand = unary.operand().accept(this);
            if (unary.op() == FormulaNode.UnaryOp.NOT) {
                return "NOT " + operand;
            }
            return operand.startsWith("-") ? "-(" + operand + ")" : "-" + operand;
        }

        @Override
        public String visitBinary(FormulaNode.Binary binary) {
            String left = binary.left().accept(this);
            String right = binary.right().accept(this);
            return switch (binary.op()) {
                case MODULO -> "MOD(" + left + ", " + right + ")";
                case POWER -> "POWER(" + left + ", " + right + ")";
                case CONCAT -> "CONCAT(" + left + ", " + right + ")";
                case NE -> "(" + left + " != " + right + ")";
                default -> "(" + left + " " + binary.op().symbol() + " " + right + ")";
            };
        }

        @Override
        public String visitConditional(FormulaNode.Conditional conditional) {
            StringBuilder builder = new StringBuilder("CASE");
            for (FormulaNode.Branch branch : conditional.branches()) {
                builder.append(" WHEN ").append(branch.condition().accept(this))
                    .append(" THEN ").append(branch.result().accept(this));
            }
            if (conditional.elseResult() != null) {
                builder.append(" ELSE ").append(conditional.elseResult().accept(this));
            }
            return builder.append(" END").toString();
        }

        @Override
        public String visitFunctionCall(FormulaNode.FunctionCall functionCall) {
            return guarded(functionCall, () -> lowerFunction(functionCall));
        }

        private String lowerFunction(FormulaNode.FunctionCall functionCall) {
            String name = functionCall.name();
            FunctionMapping mapping = functions.lookup(name)
                .orElseThrow(() -> new UnsupportedConstructException(name, "目标端没有对应函数"));
            if (mapping.kind() == FunctionMapping.Kind.UNSUPPORTED) {
                String reason = mapping.target() == null || mapping.target().isBlank() ? "目标端不支持" : mapping.target();
                throw new UnsupportedConstructException(name, reason);
            }
            int arity = mapping.templateArity();
            if (mapping.kind() == FunctionMapping.Kind.TEMPLATE && arity != functionCall.args().size()) {
                throw new UnsupportedConstructException(name,
                    "模板需要 " + arity + " 个参数，实际为 " + functionCall.args().size());
            }
            LodFrame frame = mapping.aggregate() ? lodStack.peek() : null;
            if (frame == null) {
                return applyMapping(mapping, renderArguments(functionCall.args()));
            }
            if (frame.aggregateDepth > 0) {
                throw new UnsupportedConstructException(name, "LOD 聚合中嵌套了聚合函数");
            }
            List<String> args;
            frame.aggregateDepth++;
            try {
                args = renderArguments(functionCall.args());
            } finally {
                frame.aggregateDepth--;
            }
            frame.aggregatesEmitted++;
            logger.debug("聚合函数 {} 按 LOD 分区 {} 开窗", name, frame.partition);
            return applyMapping(mapping, args) + " " + over(frame.partition, null, null);
        }

        @Override
        public String visitLodExpression(FormulaNode.LodExpression lodExpression) {
            return guarded(lodExpression, () -> {
                LodFrame enclosing = lodStack.peek();
                if (enclosing != null && enclosing.aggregateDepth > 0) {
                    throw new UnsupportedConstructException(lodExpression.scope().name(),
                        "LOD 表达式嵌套在另一个 LOD 的聚合函数中");
                }
                LodFrame frame = new LodFrame(lodPartition(lodExpression, enclosing));
                lodStack.push(frame);
                String text;
                try {
                    text = lodExpression.aggregation().accept(this);
                } finally {
                    lodStack.pop();
                }
                if (enclosing != null) {
                    enclosing.aggregatesEmitted += frame.aggregatesEmitted;
                }
                if (frame.aggregatesEmitted == 0) {
                    warnings.add("LOD 表达式不包含聚合函数，按行级表达式输出: " + FormulaPrinter.print(lodExpression));
                }
                return text;
            });
        }

        /**
         * FIXED 取自身维度，INCLUDE 取外层上下文与自身维度的并集，EXCLUDE 取差集。
         */
        private List<String> lodPartition(FormulaNode.LodExpression lodExpression, LodFrame enclosing) {
            Set<String> dimensions = new LinkedHashSet<>();
            for (String dimension : lodExpression.dimensions()) {
                dimensions.add(fieldSql(dimension));
            }
            if (lodExpression.scope() == FormulaNode.LodScope.FIXED) {
                return List.copyOf(dimensions);
            }
            Set<String> context = new LinkedHashSet<>();
            if (enclosing != null) {
                context.addAll(enclosing.partition);
            } else if (viewDimensions.isEmpty()) {
                warnings.add(lodExpression.scope() + " LOD 缺少视图维度上下文，"
                    + (lodExpression.scope() == FormulaNode.LodScope.INCLUDE ? "仅按自身维度分区" : "按总计计算")
                    + ": " + FormulaPrinter.print(lodExpression));
            } else {
                for (String dimension : viewDimensions) {
                    context.add(fieldSql(dimension));
                }
            }
            if (lodExpression.scope() == FormulaNode.LodScope.INCLUDE) {
                context.addAll(dimensions);
                return List.copyOf(context);
            }
            for (String dimension : lodExpression.dimensions()) {
                if (!context.remove(fieldSql(dimension))) {
                    warnings.add("EXCLUDE 维度 [" + dimension + "] 不在外层上下文中，已忽略");
                }
            }
            return List.copyOf(context);
        }

        @Override
        public String visitWindowFunction(FormulaNode.WindowFunction windowFunction) {
            return guarded(windowFunction, () -> lowerWindow(windowFunction));
        }

        private String lowerWindow(FormulaNode.WindowFunction windowFunction) {
            WindowKind kind = windowFunction.kind();
            if (!lodStack.isEmpty()) {
                throw new UnsupportedConstructException(kind.name(), "LOD 表达式中不能使用表计算");
            }
            List<String> partition = new ArrayList<>();
            for (String dimension : windowFunction.partitionHint()) {
                partition.add(fieldSql(dimension));
            }
            return switch (kind.shape()) {
                case RUNNING -> kind.sqlFunction() + "(" + windowFunction.target().accept(this) + ") "
                    + over(partition, null, RUNNING_FRAME);
                case WINDOW -> {
                    if (kind.sqlFunction() == null) {
                        throw new UnsupportedConstructException(kind.name(), "目标端没有对应的窗口聚合");
                    }
                    yield kind.sqlFunction() + "(" + windowFunction.target().accept(this) + ") "
                        + over(partition, null, frame(windowFunction.range(), kind));
                }
                case RANK -> {
                    if (kind.sqlFunction() == null) {
                        throw new UnsupportedConstructException(kind.name(), "目标端没有对应的排名函数");
                    }
                    FormulaNode.SortDirection direction = windowFunction.sortDirection() == null
                        ? kind.defaultSortDirection()
                        : windowFunction.sortDirection();
                    String orderBy = windowFunction.target().accept(this) + " " + direction.name();
                    yield kind.sqlFunction() + "() " + over(partition, orderBy, null);
                }
                case POSITION -> lowerPosition(kind, partition);
                case LOOKUP -> lowerLookup(windowFunction, partition);
                case TOTAL -> lowerTotal(windowFunction, partition);
                case PREVIOUS -> throw new UnsupportedConstructException(kind.name(), "依赖上一行计算结果的递归表计算无法映射");
            };
        }

        private String lowerPosition(WindowKind kind, List<String> partition) {
            String over = over(partition, null, null);
            return switch (kind) {
                case INDEX -> "ROW_NUMBER() " + over;
                case FIRST -> "(1 - ROW_NUMBER() " + over + ")";
                case LAST -> "(COUNT(*) " + over + " - ROW_NUMBER() " + over + ")";
                case SIZE -> "COUNT(*) " + over;
                default -> throw new IllegalStateException("不是位置类表计算: " + kind);
            };
        }

        private String lowerLookup(FormulaNode.WindowFunction windowFunction, List<String> partition) {
            WindowBound bound = windowFunction.range().start();
            String target = windowFunction.target().accept(this);
            if (bound.anchor() != WindowBound.Anchor.CURRENT) {
                if (bound.offset() != 0) {
                    throw new UnsupportedConstructException("LOOKUP", "相对 FIRST()/LAST() 的偏移无法映射");
                }
                String function = bound.anchor() == WindowBound.Anchor.FIRST ? "FIRST_VALUE" : "LAST_VALUE";
                return function + "(" + target + ") " + over(partition, null, FULL_PARTITION_FRAME);
            }
            int offset = bound.offset();
            if (offset == 0) {
                return target;
            }
            String function = offset < 0 ? "LAG" : "LEAD";
            return function + "(" + target + ", " + Math.abs(offset) + ") " + over(partition, null, null);
        }

        /**
         * 仅可加或取极值的聚合能在分区上重新汇总。
         */
        private String lowerTotal(FormulaNode.WindowFunction windowFunction, List<String> partition) {
            FormulaNode target = windowFunction.target();
            String aggregate = null;
            if (target instanceof FormulaNode.FunctionCall call) {
                aggregate = call.name();
            } else if (target instanceof FormulaNode.FieldRef fieldRef && fieldRef.aggregation() != null) {
                aggregate = fieldRef.aggregation().name();
            }
            String outer;
            if ("SUM".equals(aggregate) || "COUNT".equals(aggregate)) {
                outer = "SUM";
            } else if ("MIN".equals(aggregate) || "MAX".equals(aggregate)) {
                outer = aggregate;
            } else {
                throw new UnsupportedConstructException("TOTAL", "只支持 SUM、COUNT、MIN 与 MAX 的总计");
            }
            return outer + "(" + target.accept(this) + ") " + over(partition, null, null);
        }

        @Override
        public String visitUnsupported(FormulaNode.Unsupported unsupported) {
            if (config.isFailOnUnsupported()) {
                throw new UnsupportedConstructException(unsupported.rawText(), unsupported.reason());
            }
            warnings.add("不支持的构造 " + unsupported.rawText() + ": " + unsupported.reason());
            return placeholder(unsupported.rawText());
        }

        /**
         * 在构造边界捕获不支持异常，输出占位符与一条警告；配置为失败时继续抛出。
         */
        private String guarded(FormulaNode node, Supplier<String> lowering) {
            try {
                return lowering.get();
            } catch (UnsupportedConstructException exception) {
                if (config.isFailOnUnsupported()) {
                    throw exception;
                }
                String source = FormulaPrinter.print(node);
                logger.warn("无法映射 {}: {}", source, exception.getMessage());
                warnings.add("不支持的构造 " + exception.getMessage());
                return placeholder(source);
            }
        }

        private List<String> renderArguments(List<FormulaNode> args) {
            List<String> rendered = new ArrayList<>(args.size());
            for (FormulaNode arg : args) {
                rendered.add(arg.accept(this));
            }
            return rendered;
        }

        private String fieldSql(String name) {
            String id = resolver.resolve(name)
                .orElseThrow(() -> new UnresolvedReferenceException(name, ReferenceKind.FIELD));
            return resolver.isCalculated(name) ? "${" + id + "}" : "${" + table + "}." + id;
        }

        private String frame(WindowRange range, WindowKind kind) {
            if (range == null) {
                return FULL_PARTITION_FRAME;
            }
            return "ROWS BETWEEN " + frameBound(range.start(), kind) + " AND " + frameBound(range.end(), kind);
        }

        private String frameBound(WindowBound bound, WindowKind kind) {
            if (bound.anchor() != WindowBound.Anchor.CURRENT) {
                if (bound.offset() != 0) {
                    throw new UnsupportedConstructException(kind.name(), "相对 FIRST()/LAST() 的偏移无法映射");
                }
                return bound.anchor() == WindowBound.Anchor.FIRST ? "UNBOUNDED PRECEDING" : "UNBOUNDED FOLLOWING";
            }
            int offset = bound.offset();
            if (offset == 0) {
                return "CURRENT ROW";
            }
            return offset < 0 ? -offset + " PRECEDING" : offset + " FOLLOWING";
        }
    }

    private String applyMapping(FunctionMapping mapping, List<String> args) {
        if (mapping.kind() == FunctionMapping.Kind.DIRECT) {
            return mapping.target() + "(" + String.join(", ", args) + ")";
        }
        String template = mapping.target();
        StringBuilder builder = new StringBuilder(template.length() + 16);
        int index = 0;
        while (index < template.length()) {
            char currentChar = template.charAt(index);
            int close = currentChar == '{' ? template.indexOf('}', index) : -1;
            if (close > index + 1 && isDigits(template, index + 1, close)) {
                builder.append(args.get(Integer.parseInt(template.substring(index + 1, close))));
                index = close + 1;
                continue;
            }
            builder.append(currentChar);
            index++;
        }
        return builder.toString();
    }

    private static boolean isDigits(String text, int from, int to) {
        for (int index = from; index < to; index++) {
            if (!Character.isDigit(text.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    private static String aggregate(FormulaNode.Aggregation aggregation, String column) {
        return switch (aggregation) {
            case SUM -> "SUM(" + column + ")";
            case AVG -> "AVG(" + column + ")";
            case COUNT -> "COUNT(" + column + ")";
            case COUNTD -> "COUNT(DISTINCT " + column + ")";
            case MIN -> "MIN(" + column + ")";
            case MAX -> "MAX(" + column + ")";
            case MEDIAN -> "MEDIAN(" + column + ")";
            case ATTR -> "ANY_VALUE(" + column + ")";
        };
    }

    private static String over(List<String> partition, String orderBy, String frame) {
        List<String> parts = new ArrayList<>();
        if (!partition.isEmpty()) {
            parts.add("PARTITION BY " + String.join(", ", partition));
        }
        if (orderBy != null) {
            parts.add("ORDER BY " + orderBy);
        }
        if (frame != null) {
            parts.add(frame);
        }
        return "OVER (" + String.join(" ", parts) + ")";
    }
}

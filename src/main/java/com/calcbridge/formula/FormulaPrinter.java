package com.calcbridge.formula;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将语法树打印回源语言文本，用于不支持构造的占位符与日志。
 * <p>
 * 输出可被重新解析为结构相同的语法树；二元运算的子表达式总是加括号，因此不保留原文的空白与括号。
 */
public final class FormulaPrinter implements FormulaNodeVisitor<String> {
    private static final FormulaPrinter INSTANCE = new FormulaPrinter();
    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private FormulaPrinter() {
    }

    public static String print(FormulaNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(FormulaNode.Literal literal) {
        Object value = literal.value();
        return switch (literal.dataType()) {
            case STRING -> "\"" + ((String) value).replace("\"", "\"\"") + "\"";
            case INTEGER -> value.toString();
            case REAL -> ((BigDecimal) value).toPlainString();
            case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
            case DATE -> "#" + ((LocalDate) value) + "#";
            case DATETIME -> "#" + DATETIME_FORMAT.format((LocalDateTime) value) + "#";
            case NULL -> "NULL";
        };
    }

    @Override
    public String visitFieldRef(FormulaNode.FieldRef fieldRef) {
        return bracket(fieldRef.name());
    }

    @Override
    public String visitParameterRef(FormulaNode.ParameterRef parameterRef) {
        return "[Parameters]." + bracket(parameterRef.name());
    }

    @Override
    public String visitUnary(FormulaNode.Unary unary) {
        String operand = operand(unary.operand());
        return unary.op() == FormulaNode.UnaryOp.NOT ? "NOT " + operand : "-" + operand;
    }

    @Override
    public String visitBinary(FormulaNode.Binary binary) {
        return operand(binary.left()) + " " + binary.op().symbol() + " " + operand(binary.right());
    }

    @Override
    public String visitConditional(FormulaNode.Conditional conditional) {
        StringBuilder builder = new StringBuilder();
        List<FormulaNode.Branch> branches = conditional.branches();
        for (int index = 0; index < branches.size(); index++) {
            FormulaNode.Branch branch = branches.get(index);
            builder.append(index == 0 ? "IF " : " ELSEIF ")
                .append(branch.condition().accept(this))
                .append(" THEN ")
                .append(branch.result().accept(this));
        }
        if (conditional.elseResult() != null) {
            builder.append(" ELSE ").append(conditional.elseResult().accept(this));
        }
        return builder.append(" END").toString();
    }

    @Override
    public String visitFunctionCall(FormulaNode.FunctionCall functionCall) {
        List<String> args = new ArrayList<>();
        for (FormulaNode arg : functionCall.args()) {
            args.add(arg.accept(this));
        }
        return functionCall.name() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitLodExpression(FormulaNode.LodExpression lodExpression) {
        StringBuilder builder = new StringBuilder("{").append(lodExpression.scope().name());
        List<String> dimensions = new ArrayList<>();
        for (String dimension : lodExpression.dimensions()) {
            dimensions.add(bracket(dimension));
        }
        if (!dimensions.isEmpty()) {
            builder.append(' ').append(String.join(", ", dimensions));
        }
        return builder.append(" : ").append(lodExpression.aggregation().accept(this)).append('}').toString();
    }

    @Override
    public String visitWindowFunction(FormulaNode.WindowFunction windowFunction) {
        List<String> args = new ArrayList<>();
        if (windowFunction.target() != null) {
            args.add(windowFunction.target().accept(this));
        }
        WindowRange range = windowFunction.range();
        if (range != null) {
            args.add(bound(range.start()));
            if (windowFunction.kind().shape() == WindowKind.Shape.WINDOW) {
                args.add(bound(range.end()));
            }
        }
        if (windowFunction.sortDirection() != null) {
            args.add("'" + windowFunction.sortDirection().name().toLowerCase(Locale.ROOT) + "'");
        }
        return windowFunction.kind().name() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitUnsupported(FormulaNode.Unsupported unsupported) {
        return unsupported.rawText();
    }

    private String operand(FormulaNode node) {
        String text = node.accept(this);
        if (node instanceof FormulaNode.Binary) {
            return "(" + text + ")";
        }
        return text;
    }

    private static String bracket(String name) {
        return "[" + name.replace("]", "]]") + "]";
    }

    private static String bound(WindowBound bound) {
        String anchor = switch (bound.anchor()) {
            case FIRST -> "FIRST()";
            case LAST -> "LAST()";
            case CURRENT -> null;
        };
        if (anchor == null) {
            return Integer.toString(bound.offset());
        }
        if (bound.offset() == 0) {
            return anchor;
        }
        return anchor + (bound.offset() > 0 ? "+" : "") + bound.offset();
    }
}

package com.calcbridge.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 计算字段公式的抽象语法树节点。
 * <p>
 * 节点一经构造不再修改，子节点由父节点独占；所有消费者通过 {@link FormulaNodeVisitor} 穷举处理各变体。
 */
public sealed interface FormulaNode permits FormulaNode.Literal, FormulaNode.FieldRef,
        FormulaNode.ParameterRef, FormulaNode.Unary, FormulaNode.Binary, FormulaNode.Conditional,
        FormulaNode.FunctionCall, FormulaNode.LodExpression, FormulaNode.WindowFunction,
        FormulaNode.Unsupported {

    <R> R accept(FormulaNodeVisitor<R> visitor);

    /** 字面量数据类型 */
    enum DataType {
        STRING,
        INTEGER,
        REAL,
        BOOLEAN,
        DATE,
        DATETIME,
        NULL
    }

    /** 源端预聚合字段引用的聚合方式 */
    enum Aggregation {
        SUM,
        AVG,
        COUNT,
        COUNTD,
        MIN,
        MAX,
        MEDIAN,
        ATTR
    }

    enum UnaryOp {
        NEGATE,
        NOT
    }

    enum BinaryOp {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        POWER("^"),
        CONCAT("+"),
        EQ("="),
        NE("<>"),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        AND("AND"),
        OR("OR");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        /**
         * 源语言中的运算符写法。
         */
        public String symbol() {
            return symbol;
        }
    }

    /** LOD 表达式作用域 */
    enum LodScope {
        FIXED,
        INCLUDE,
        EXCLUDE
    }

    enum SortDirection {
        ASC,
        DESC
    }

    record Literal(Object value, DataType dataType) implements FormulaNode {
        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record FieldRef(String name, Aggregation aggregation) implements FormulaNode {
        public FieldRef(String name) {
            this(name, null);
        }

        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitFieldRef(this);
        }
    }

    record ParameterRef(String name) implements FormulaNode {
        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitParameterRef(this);
        }
    }

    record Unary(UnaryOp op, FormulaNode operand) implements FormulaNode {
        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Binary(BinaryOp op, FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /** 条件分支，按顺序求值，首个成立的分支生效 */
    record Branch(FormulaNode condition, FormulaNode result) {
    }

    /**
     * IF/ELSEIF 链与脱糖后的 CASE/WHEN 链；elseResult 可为 null。
     */
    record Conditional(List<Branch> branches, FormulaNode elseResult) implements FormulaNode {
        public Conditional {
            branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    record FunctionCall(String name, List<FormulaNode> args) implements FormulaNode {
        public FunctionCall {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * LOD 表达式，维度保持书写顺序去重。
     */
    record LodExpression(LodScope scope, Set<String> dimensions, FormulaNode aggregation) implements FormulaNode {
        public LodExpression {
            dimensions = Collections.unmodifiableSet(new LinkedHashSet<>(dimensions));
        }

        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitLodExpression(this);
        }
    }

    /**
     * 表计算窗口函数。target 仅对 INDEX/FIRST/LAST/SIZE 为 null；sortDirection 与 range 可选。
     */
    record WindowFunction(WindowKind kind, FormulaNode target, List<String> partitionHint,
                          SortDirection sortDirection, WindowRange range) implements FormulaNode {
        public WindowFunction {
            partitionHint = List.copyOf(partitionHint);
        }

        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitWindowFunction(this);
        }
    }

    /**
     * 语法可识别但无法完整解释的构造，保留原始文本供人工迁移。
     */
    record Unsupported(String rawText, String reason) implements FormulaNode {
        @Override
        public <R> R accept(FormulaNodeVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }
}

package com.calcbridge.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * 深拷贝语法树，用于 CASE 脱糖时为每个分支生成独立的主体表达式。
 */
final class NodeCopier implements FormulaNodeVisitor<FormulaNode> {
    static final NodeCopier INSTANCE = new NodeCopier();

    private NodeCopier() {
    }

    static FormulaNode copy(FormulaNode node) {
        return node == null ? null : node.accept(INSTANCE);
    }

    @Override
    public FormulaNode visitLiteral(FormulaNode.Literal literal) {
        return new FormulaNode.Literal(literal.value(), literal.dataType());
    }

    @Override
    public FormulaNode visitFieldRef(FormulaNode.FieldRef fieldRef) {
        return new FormulaNode.FieldRef(fieldRef.name(), fieldRef.aggregation());
    }

    @Override
    public FormulaNode visitParameterRef(FormulaNode.ParameterRef parameterRef) {
        return new FormulaNode.ParameterRef(parameterRef.name());
    }

    @Override
    public FormulaNode visitUnary(FormulaNode.Unary unary) {
        return new FormulaNode.Unary(unary.op(), copy(unary.operand()));
    }

    @Override
    public FormulaNode visitBinary(FormulaNode.Binary binary) {
        return new FormulaNode.Binary(binary.op(), copy(binary.left()), copy(binary.right()));
    }

    @Override
    public FormulaNode visitConditional(FormulaNode.Conditional conditional) {
        List<FormulaNode.Branch> branches = new ArrayList<>(conditional.branches().size());
        for (FormulaNode.Branch branch : conditional.branches()) {
            branches.add(new FormulaNode.Branch(copy(branch.condition()), copy(branch.result())));
        }
        return new FormulaNode.Conditional(branches, copy(conditional.elseResult()));
    }

    @Override
    public FormulaNode visitFunctionCall(FormulaNode.FunctionCall functionCall) {
        List<FormulaNode> args = new ArrayList<>(functionCall.args().size());
        for (FormulaNode arg : functionCall.args()) {
            args.add(copy(arg));
        }
        return new FormulaNode.FunctionCall(functionCall.name(), args);
    }

    @Override
    public FormulaNode visitLodExpression(FormulaNode.LodExpression lodExpression) {
        return new FormulaNode.LodExpression(lodExpression.scope(), lodExpression.dimensions(),
                copy(lodExpression.aggregation()));
    }

    @Override
    public FormulaNode visitWindowFunction(FormulaNode.WindowFunction windowFunction) {
        return new FormulaNode.WindowFunction(windowFunction.kind(), copy(windowFunction.target()),
                windowFunction.partitionHint(), windowFunction.sortDirection(), windowFunction.range());
    }

    @Override
    public FormulaNode visitUnsupported(FormulaNode.Unsupported unsupported) {
        return new FormulaNode.Unsupported(unsupported.rawText(), unsupported.reason());
    }
}

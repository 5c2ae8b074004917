package com.calcbridge.formula;

/**
 * 语法树访问者，每种节点变体对应一个方法。
 */
public interface FormulaNodeVisitor<R> {

    R visitLiteral(FormulaNode.Literal literal);

    R visitFieldRef(FormulaNode.FieldRef fieldRef);

    R visitParameterRef(FormulaNode.ParameterRef parameterRef);

    R visitUnary(FormulaNode.Unary unary);

    R visitBinary(FormulaNode.Binary binary);

    R visitConditional(FormulaNode.Conditional conditional);

    R visitFunctionCall(FormulaNode.FunctionCall functionCall);

    R visitLodExpression(FormulaNode.LodExpression lodExpression);

    R visitWindowFunction(FormulaNode.WindowFunction windowFunction);

    R visitUnsupported(FormulaNode.Unsupported unsupported);
}

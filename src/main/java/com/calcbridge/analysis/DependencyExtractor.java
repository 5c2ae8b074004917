package com.calcbridge.analysis;

import com.calcbridge.formula.FormulaNode;
import com.calcbridge.formula.FormulaNodeVisitor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class DependencyExtractor {

    /**
     * 单次后序遍历收集字段、参数、函数使用次数、最大深度与 Unsupported 标记。
     */
    public FormulaDependencies extract(FormulaNode ast) {
        Collector collector = new Collector();
        int maxDepth = ast.accept(collector);
        return new FormulaDependencies(collector.fields, collector.parameters, collector.functionsUsed,
                maxDepth, collector.hasUnsupported);
    }

    /**
     * 访问结果为以当前节点为根的子树深度。
     */
    private static final class Collector implements FormulaNodeVisitor<Integer> {
        private final Set<FieldReference> fields = new LinkedHashSet<>();
        private final Set<String> parameters = new LinkedHashSet<>();
        private final Map<String, Integer> functionsUsed = new LinkedHashMap<>();
        private boolean hasUnsupported;

        @Override
        public Integer visitLiteral(FormulaNode.Literal literal) {
            return 1;
        }

        @Override
        public Integer visitFieldRef(FormulaNode.FieldRef fieldRef) {
            fields.add(new FieldReference(fieldRef.name(), fieldRef.aggregation()));
            return 1;
        }

        @Override
        public Integer visitParameterRef(FormulaNode.ParameterRef parameterRef) {
            parameters.add(parameterRef.name());
            return 1;
        }

        @Override
        public Integer visitUnary(FormulaNode.Unary unary) {
            return unary.operand().accept(this) + 1;
        }

        @Override
        public Integer visitBinary(FormulaNode.Binary binary) {
            int left = binary.left().accept(this);
            int right = binary.right().accept(this);
            return Math.max(left, right) + 1;
        }

        @Override
        public Integer visitConditional(FormulaNode.Conditional conditional) {
            int deepest = 0;
            for (FormulaNode.Branch branch : conditional.branches()) {
                deepest = Math.max(deepest, branch.condition().accept(this));
                deepest = Math.max(deepest, branch.result().accept(this));
            }
            if (conditional.elseResult() != null) {
                deepest = Math.max(deepest, conditional.elseResult().accept(this));
            }
            return deepest + 1;
        }

        @Override
        public Integer visitFunctionCall(FormulaNode.FunctionCall functionCall) {
            int deepest = 0;
            for (FormulaNode arg : functionCall.args()) {
                deepest = Math.max(deepest, arg.accept(this));
            }
            functionsUsed.merge(functionCall.name(), 1, Integer::sum);
            return deepest + 1;
        }

        @Override
        public Integer visitLodExpression(FormulaNode.LodExpression lodExpression) {
            int aggregationDepth = lodExpression.aggregation().accept(this);
            for (String dimension : lodExpression.dimensions()) {
                fields.add(new FieldReference(dimension, null));
            }
            return aggregationDepth + 1;
        }

        @Override
        public Integer visitWindowFunction(FormulaNode.WindowFunction windowFunction) {
            int targetDepth = windowFunction.target() == null ? 0 : windowFunction.target().accept(this);
            for (String dimension : windowFunction.partitionHint()) {
                fields.add(new FieldReference(dimension, null));
            }
            functionsUsed.merge(windowFunction.kind().name(), 1, Integer::sum);
            return targetDepth + 1;
        }

        @Override
        public Integer visitUnsupported(FormulaNode.Unsupported unsupported) {
            hasUnsupported = true;
            return 1;
        }
    }
}

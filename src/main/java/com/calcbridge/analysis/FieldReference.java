package com.calcbridge.analysis;

import com.calcbridge.formula.FormulaNode;

/**
 * 公式引用的字段；aggregation 为 null 表示行级引用。
 */
public record FieldReference(String name, FormulaNode.Aggregation aggregation) {
}

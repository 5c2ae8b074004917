package com.calcbridge.render;

import com.calcbridge.formula.FormulaException;

/**
 * 字段或参数在目标端没有映射，放弃当前表达式的渲染。
 */
public class UnresolvedReferenceException extends FormulaException {
    private final String reference;
    private final ReferenceKind kind;

    public UnresolvedReferenceException(String reference, ReferenceKind kind) {
        super((kind == ReferenceKind.PARAMETER ? "无法解析参数引用: " : "无法解析字段引用: ") + "[" + reference + "]");
        this.reference = reference;
        this.kind = kind;
    }

    public String getReference() {
        return reference;
    }

    public ReferenceKind getKind() {
        return kind;
    }
}

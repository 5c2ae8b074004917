package com.calcbridge.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 源端函数到目标端表达式的映射条目。
 * <p>
 * TEMPLATE 类型的 target 使用 {0}、{1} 等占位符引用参数；UNSUPPORTED 类型的 target 为不支持原因。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionMapping(
    String name,
    Kind kind,
    String target,
    boolean aggregate,
    boolean returnsString
) {

    public enum Kind {
        /** 同参数顺序调用目标函数 */
        DIRECT,
        /** 按模板替换参数 */
        TEMPLATE,
        UNSUPPORTED
    }

    public FunctionMapping {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("函数名不能为空");
        }
        if (kind == null) {
            throw new IllegalArgumentException("函数 " + name + " 缺少映射类型");
        }
        if (kind != Kind.UNSUPPORTED && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("函数 " + name + " 缺少目标表达式");
        }
    }

    /**
     * 模板中引用的参数个数，即最大占位符下标加一。
     */
    public int templateArity() {
        if (kind != Kind.TEMPLATE) {
            return -1;
        }
        int arity = 0;
        int index = target.indexOf('{');
        while (index >= 0) {
            int close = target.indexOf('}', index);
            if (close < 0) {
                break;
            }
            String slot = target.substring(index + 1, close);
            if (!slot.isEmpty() && slot.chars().allMatch(Character::isDigit)) {
                arity = Math.max(arity, Integer.parseInt(slot) + 1);
            }
            index = target.indexOf('{', close);
        }
        return arity;
    }
}

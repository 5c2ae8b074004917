package com.calcbridge.render;

import java.util.List;

/**
 * 目标端表达式文本与渲染过程中产生的警告。
 */
public record RenderedExpression(String text, List<String> warnings) {
    public RenderedExpression {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

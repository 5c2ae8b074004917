package com.calcbridge.compile;

import com.calcbridge.analysis.FormulaDependencies;
import com.calcbridge.render.RenderedExpression;

/**
 * 单个字段的编译结果。成功时 error 为 null；解析成功但渲染失败时仍保留依赖信息。
 */
public record FieldCompilation(
    String fieldId,
    RenderedExpression expression,
    FormulaDependencies dependencies,
    FieldError error
) {

    public static FieldCompilation success(String fieldId, RenderedExpression expression,
                                           FormulaDependencies dependencies) {
        return new FieldCompilation(fieldId, expression, dependencies, null);
    }

    public static FieldCompilation failure(String fieldId, FormulaDependencies dependencies, FieldError error) {
        return new FieldCompilation(fieldId, null, dependencies, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * 编译成功但包含不支持构造或其他警告。
     */
    public boolean isPartial() {
        return isSuccess() && expression.hasWarnings();
    }
}

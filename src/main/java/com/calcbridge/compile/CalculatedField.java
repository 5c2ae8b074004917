package com.calcbridge.compile;

import java.util.List;

/**
 * 待编译的计算字段。
 *
 * @param id 字段在工作簿中的唯一标识
 * @param name 显示名称
 * @param formula 源语言公式
 * @param datatype 声明的数据类型，可为 null
 * @param computeUsing 表计算的计算依据维度，作为窗口函数的分区
 * @param viewDimensions 字段所在视图的维度，作为 INCLUDE/EXCLUDE 的外层上下文
 */
public record CalculatedField(
    String id,
    String name,
    String formula,
    String datatype,
    List<String> computeUsing,
    List<String> viewDimensions
) {
    public CalculatedField {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("计算字段 id 不能为空");
        }
        computeUsing = computeUsing == null ? List.of() : List.copyOf(computeUsing);
        viewDimensions = viewDimensions == null ? List.of() : List.copyOf(viewDimensions);
    }

    public CalculatedField(String id, String name, String formula, String datatype, List<String> computeUsing) {
        this(id, name, formula, datatype, computeUsing, List.of());
    }

    public CalculatedField(String id, String formula) {
        this(id, id, formula, null, List.of(), List.of());
    }
}

package com.calcbridge.formula;

import java.util.Locale;
import java.util.Optional;

/**
 * 源语言支持的表计算函数，按参数形态分组。
 */
public enum WindowKind {
    RUNNING_SUM(Shape.RUNNING, "SUM"),
    RUNNING_AVG(Shape.RUNNING, "AVG"),
    RUNNING_COUNT(Shape.RUNNING, "COUNT"),
    RUNNING_MIN(Shape.RUNNING, "MIN"),
    RUNNING_MAX(Shape.RUNNING, "MAX"),
    WINDOW_SUM(Shape.WINDOW, "SUM"),
    WINDOW_AVG(Shape.WINDOW, "AVG"),
    WINDOW_COUNT(Shape.WINDOW, "COUNT"),
    WINDOW_MIN(Shape.WINDOW, "MIN"),
    WINDOW_MAX(Shape.WINDOW, "MAX"),
    WINDOW_MEDIAN(Shape.WINDOW, null),
    RANK(Shape.RANK, "RANK"),
    RANK_DENSE(Shape.RANK, "DENSE_RANK"),
    RANK_UNIQUE(Shape.RANK, "ROW_NUMBER"),
    RANK_PERCENTILE(Shape.RANK, "PERCENT_RANK"),
    RANK_MODIFIED(Shape.RANK, null),
    INDEX(Shape.POSITION, "ROW_NUMBER"),
    FIRST(Shape.POSITION, "ROW_NUMBER"),
    LAST(Shape.POSITION, "ROW_NUMBER"),
    SIZE(Shape.POSITION, "COUNT"),
    LOOKUP(Shape.LOOKUP, null),
    TOTAL(Shape.TOTAL, null),
    PREVIOUS_VALUE(Shape.PREVIOUS, null);

    /** 参数形态 */
    public enum Shape {
        /** 单个目标表达式 */
        RUNNING,
        /** 目标表达式加可选的起止偏移 */
        WINDOW,
        /** 目标表达式加可选的 'asc' / 'desc' */
        RANK,
        /** 无参数 */
        POSITION,
        /** 目标表达式加偏移 */
        LOOKUP,
        TOTAL,
        PREVIOUS
    }

    private final Shape shape;
    private final String sqlFunction;

    WindowKind(Shape shape, String sqlFunction) {
        this.shape = shape;
        this.sqlFunction = sqlFunction;
    }

    public Shape shape() {
        return shape;
    }

    /**
     * 目标端的窗口函数名，LOOKUP 与 TOTAL 由渲染器单独处理，其余为 null 的类型无法映射。
     */
    public String sqlFunction() {
        return sqlFunction;
    }

    /**
     * 排名函数未指定排序方向时的默认方向：RANK_PERCENTILE 为升序，其余排名函数为降序。
     */
    public FormulaNode.SortDirection defaultSortDirection() {
        return this == RANK_PERCENTILE ? FormulaNode.SortDirection.ASC : FormulaNode.SortDirection.DESC;
    }

    /**
     * 按函数名（不区分大小写）查找窗口函数类型。
     */
    public static Optional<WindowKind> fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (WindowKind kind : values()) {
            if (kind.name().equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

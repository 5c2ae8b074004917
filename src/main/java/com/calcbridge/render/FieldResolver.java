package com.calcbridge.render;

import java.util.Optional;

/**
 * 将源端字段名映射为目标端安全标识符，实现必须在加载后不可变以便多线程共享。
 */
public interface FieldResolver {

    /**
     * 返回目标端标识符，没有映射时返回 empty。
     */
    Optional<String> resolve(String sourceFieldName);

    /**
     * 被引用的字段本身是否为计算字段，计算字段渲染为 ${name} 而不是表列。
     */
    default boolean isCalculated(String sourceFieldName) {
        return false;
    }
}

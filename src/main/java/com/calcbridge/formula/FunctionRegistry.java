package com.calcbridge.formula;

/**
 * 解析阶段使用的函数注册表，用于区分已知函数与未知函数。
 */
public interface FunctionRegistry {

    /**
     * 函数名不区分大小写。
     */
    boolean isKnown(String name);

    /**
     * 函数返回值是否为字符串，决定 + 是否按拼接解析。
     */
    default boolean returnsString(String name) {
        return false;
    }
}

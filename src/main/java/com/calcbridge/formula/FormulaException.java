package com.calcbridge.formula;

/**
 * 编译计算字段公式时抛出的异常基类。
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }
}

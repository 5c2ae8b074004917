package com.calcbridge.formula;

/**
 * 词法错误：未闭合的字符串、方括号、花括号或日期字面量，以及无法识别的字符。
 */
public class FormulaLexException extends FormulaParseException {

    public FormulaLexException(String message, int offset, String formula) {
        super(message, offset, formula);
    }
}

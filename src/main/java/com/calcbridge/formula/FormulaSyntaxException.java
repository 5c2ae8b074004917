package com.calcbridge.formula;

/**
 * 语法错误，记录期望内容与实际遇到的 token。
 */
public class FormulaSyntaxException extends FormulaParseException {
    private final String expected;
    private final String found;

    public FormulaSyntaxException(String expected, String found, int offset, String formula) {
        super("期望 " + expected + "，实际为 " + describe(found), offset, formula);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    private static String describe(String found) {
        return found == null || found.isEmpty() ? "公式结尾" : "'" + found + "'";
    }
}

package com.calcbridge.formula;

public class FormulaParseException extends FormulaException {
    private final int offset;
    private final String formula;
    private final String detail;

    public FormulaParseException(String message, int offset, String formula) {
        super(buildMessage(message, offset, formula == null ? "" : formula));
        this.offset = offset;
        this.formula = formula == null ? "" : formula;
        this.detail = message;
    }

    public int getOffset() {
        return offset;
    }

    public String getFormula() {
        return formula;
    }

    /**
     * 不带源文本与指示符的原始错误描述。
     */
    public String getDetail() {
        return detail;
    }

    private static String buildMessage(String message, int pos, String formula) {
        int caretPos = Math.max(0, Math.min(pos, formula.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Formula error at offset " + pos + ": " + message + System.lineSeparator()
                + formula + System.lineSeparator() + pointer;
    }
}

package com.calcbridge.formula;

/**
 * 分类后的 token：text 为规范化值，lexeme 与 offset 指向源文本。
 */
public record ClassifiedToken(TokenType type, String text, String lexeme, int offset) {

    public boolean is(TokenType expectedType) {
        return type == expectedType;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && keyword.equals(text);
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && operator.equals(text);
    }

    /**
     * 源文本中该 token 之后的位置。
     */
    public int endOffset() {
        return offset + lexeme.length();
    }
}

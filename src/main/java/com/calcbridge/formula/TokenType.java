package com.calcbridge.formula;

public enum TokenType {
    STRING_LITERAL,
    INTEGER_LITERAL,
    REAL_LITERAL,
    DATE_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,
    FIELD_REF,
    PARAMETER_REF,
    KEYWORD,
    LOD_SCOPE,
    OPERATOR,
    FUNCTION_NAME,
    /** 方括号之外的裸标识符，不是合法的字段引用 */
    BARE_IDENTIFIER,
    LBRACE,
    RBRACE,
    COLON,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
}

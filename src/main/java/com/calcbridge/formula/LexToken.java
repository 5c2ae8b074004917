package com.calcbridge.formula;

/**
 * 词法 token，lexeme 保留源文本原样切片。
 */
public record LexToken(TokenKind kind, String lexeme, int offset) {
}

enum TokenKind {
    STRING,
    INTEGER,
    REAL,
    DATE,
    FIELD,
    PARAMETER,
    KEYWORD,
    OPERATOR,
    LBRACE,
    RBRACE,
    COLON,
    LPAREN,
    RPAREN,
    COMMA,
    IDENTIFIER,
    EOF
}

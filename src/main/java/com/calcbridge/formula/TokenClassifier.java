package com.calcbridge.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class TokenClassifier {

    /**
     * 规范化关键字大小写、剥离字面量与引用的修饰符，并通过单 token 前瞻区分函数名与裸标识符。
     */
    public List<ClassifiedToken> classify(List<LexToken> tokens) {
        List<ClassifiedToken> classified = new ArrayList<>(tokens.size());
        for (int index = 0; index < tokens.size(); index++) {
            LexToken token = tokens.get(index);
            LexToken next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
            classified.add(classifyToken(token, next));
        }
        return List.copyOf(classified);
    }

    private ClassifiedToken classifyToken(LexToken token, LexToken next) {
        String lexeme = token.lexeme();
        int offset = token.offset();
        return switch (token.kind()) {
            case STRING -> new ClassifiedToken(TokenType.STRING_LITERAL, unquote(lexeme), lexeme, offset);
            case INTEGER -> new ClassifiedToken(TokenType.INTEGER_LITERAL, lexeme, lexeme, offset);
            case REAL -> new ClassifiedToken(TokenType.REAL_LITERAL, lexeme, lexeme, offset);
            case DATE -> new ClassifiedToken(TokenType.DATE_LITERAL,
                    lexeme.substring(1, lexeme.length() - 1).trim(), lexeme, offset);
            case FIELD -> new ClassifiedToken(TokenType.FIELD_REF, lastSegment(lexeme), lexeme, offset);
            case PARAMETER -> new ClassifiedToken(TokenType.PARAMETER_REF, lastSegment(lexeme), lexeme, offset);
            case KEYWORD -> classifyKeyword(lexeme, offset);
            case OPERATOR -> new ClassifiedToken(TokenType.OPERATOR, normalizeOperator(lexeme), lexeme, offset);
            case IDENTIFIER -> next != null && next.kind() == TokenKind.LPAREN
                    ? new ClassifiedToken(TokenType.FUNCTION_NAME, lexeme.toUpperCase(Locale.ROOT), lexeme, offset)
                    : new ClassifiedToken(TokenType.BARE_IDENTIFIER, lexeme, lexeme, offset);
            case LBRACE -> new ClassifiedToken(TokenType.LBRACE, lexeme, lexeme, offset);
            case RBRACE -> new ClassifiedToken(TokenType.RBRACE, lexeme, lexeme, offset);
            case COLON -> new ClassifiedToken(TokenType.COLON, lexeme, lexeme, offset);
            case LPAREN -> new ClassifiedToken(TokenType.LPAREN, lexeme, lexeme, offset);
            case RPAREN -> new ClassifiedToken(TokenType.RPAREN, lexeme, lexeme, offset);
            case COMMA -> new ClassifiedToken(TokenType.COMMA, lexeme, lexeme, offset);
            case EOF -> new ClassifiedToken(TokenType.EOF, "", "", offset);
        };
    }

    private ClassifiedToken classifyKeyword(String lexeme, int offset) {
        String keyword = lexeme.toUpperCase(Locale.ROOT);
        return switch (keyword) {
            case "TRUE", "FALSE" -> new ClassifiedToken(TokenType.BOOLEAN_LITERAL, keyword, lexeme, offset);
            case "NULL" -> new ClassifiedToken(TokenType.NULL_LITERAL, keyword, lexeme, offset);
            case "FIXED", "INCLUDE", "EXCLUDE" -> new ClassifiedToken(TokenType.LOD_SCOPE, keyword, lexeme, offset);
            default -> new ClassifiedToken(TokenType.KEYWORD, keyword, lexeme, offset);
        };
    }

    /**
     * == 与 != 是 = 与 <> 的别名。
     */
    private String normalizeOperator(String operator) {
        return switch (operator) {
            case "==" -> "=";
            case "!=" -> "<>";
            default -> operator;
        };
    }

    private String unquote(String lexeme) {
        String quote = lexeme.substring(0, 1);
        return lexeme.substring(1, lexeme.length() - 1).replace(quote + quote, quote);
    }

    /**
     * 取限定引用 [a].[b] 的最后一段并还原 ]] 转义。
     */
    private String lastSegment(String lexeme) {
        int segmentStart = 0;
        int index = 1;
        while (index < lexeme.length()) {
            char currentChar = lexeme.charAt(index);
            if (currentChar == ']' && index + 1 < lexeme.length() && lexeme.charAt(index + 1) == ']') {
                index += 2;
                continue;
            }
            if (currentChar == ']' && index + 2 < lexeme.length() && lexeme.charAt(index + 1) == '.') {
                segmentStart = index + 2;
                index += 3;
                continue;
            }
            index++;
        }
        return lexeme.substring(segmentStart + 1, lexeme.length() - 1).replace("]]", "]");
    }
}

package com.calcbridge.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class FormulaLexer {
    /** 同前缀关键字按长度优先排列，ELSEIF 必须先于 ELSE 尝试 */
    private static final List<String> KEYWORDS = List.of(
            "ELSEIF", "ELSE", "END",
            "EXCLUDE", "INCLUDE", "FIXED",
            "FALSE", "TRUE", "THEN", "WHEN", "CASE", "NULL",
            "AND", "NOT", "OR", "IF");

    /** 双字符运算符先于单字符运算符 */
    private static final List<String> OPERATORS = List.of(
            "<=", ">=", "<>", "!=", "==",
            "+", "-", "*", "/", "%", "^", "=", "<", ">");

    private static final String PARAMETERS_QUALIFIER = "Parameters";

    /**
     * 将公式文本切分为词法 token 序列，末尾追加 EOF。
     */
    public List<LexToken> tokenize(String formula) {
        if (formula == null) {
            throw new FormulaLexException("公式不能为空", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        Deque<Integer> openBraces = new ArrayDeque<>();
        int index = 0;
        while (index < formula.length()) {
            char currentChar = formula.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            // 容器模式优先：引号、方括号与日期内部的任何字符都不参与切分
            if (currentChar == '"' || currentChar == '\'') {
                index = readString(formula, index, tokens);
                continue;
            }
            if (currentChar == '[') {
                index = readReference(formula, index, tokens);
                continue;
            }
            if (currentChar == '#') {
                index = readDate(formula, index, tokens);
                continue;
            }

            if (formula.startsWith("//", index)) {
                index = skipLineComment(formula, index);
                continue;
            }

            if (currentChar == '{') {
                openBraces.push(index);
                tokens.add(new LexToken(TokenKind.LBRACE, "{", index));
                index++;
                continue;
            }
            if (currentChar == '}') {
                if (!openBraces.isEmpty()) {
                    openBraces.pop();
                }
                tokens.add(new LexToken(TokenKind.RBRACE, "}", index));
                index++;
                continue;
            }
            if (currentChar == '(') {
                tokens.add(new LexToken(TokenKind.LPAREN, "(", index));
                index++;
                continue;
            }
            if (currentChar == ')') {
                tokens.add(new LexToken(TokenKind.RPAREN, ")", index));
                index++;
                continue;
            }
            if (currentChar == ',') {
                tokens.add(new LexToken(TokenKind.COMMA, ",", index));
                index++;
                continue;
            }
            if (currentChar == ':') {
                tokens.add(new LexToken(TokenKind.COLON, ":", index));
                index++;
                continue;
            }

            if (isNumberStart(formula, index)) {
                index = readNumber(formula, index, tokens);
                continue;
            }

            String operator = matchOperator(formula, index);
            if (operator != null) {
                tokens.add(new LexToken(TokenKind.OPERATOR, operator, index));
                index += operator.length();
                continue;
            }

            String keyword = matchKeyword(formula, index);
            if (keyword != null) {
                tokens.add(new LexToken(TokenKind.KEYWORD, formula.substring(index, index + keyword.length()), index));
                index += keyword.length();
                continue;
            }

            if (isIdentifierStart(currentChar)) {
                int tokenStart = index;
                while (index < formula.length() && isIdentifierPart(formula.charAt(index))) {
                    index++;
                }
                tokens.add(new LexToken(TokenKind.IDENTIFIER, formula.substring(tokenStart, index), tokenStart));
                continue;
            }

            throw new FormulaLexException("无法识别字符: " + currentChar, index, formula);
        }

        if (!openBraces.isEmpty()) {
            throw new FormulaLexException("未闭合花括号", openBraces.peek(), formula);
        }

        tokens.add(new LexToken(TokenKind.EOF, "", formula.length()));
        return List.copyOf(tokens);
    }

    /**
     * 读取单引号或双引号字符串，连续两个引号表示引号本身。
     */
    private int readString(String formula, int quoteIndex, List<LexToken> tokens) {
        char quote = formula.charAt(quoteIndex);
        int index = quoteIndex + 1;
        while (index < formula.length()) {
            if (formula.charAt(index) == quote) {
                if (index + 1 < formula.length() && formula.charAt(index + 1) == quote) {
                    index += 2;
                    continue;
                }
                tokens.add(new LexToken(TokenKind.STRING, formula.substring(quoteIndex, index + 1), quoteIndex));
                return index + 1;
            }
            index++;
        }
        throw new FormulaLexException("未闭合字符串", quoteIndex, formula);
    }

    /**
     * 读取方括号引用，支持 [a].[b] 限定名与 [Parameters].[x] 参数引用。
     */
    private int readReference(String formula, int startIndex, List<LexToken> tokens) {
        int index = readBracketSegment(formula, startIndex);
        int segments = 1;
        String firstSegment = formula.substring(startIndex + 1, index - 1);
        while (index + 1 < formula.length() && formula.charAt(index) == '.' && formula.charAt(index + 1) == '[') {
            index = readBracketSegment(formula, index + 1);
            segments++;
        }

        TokenKind kind = segments > 1 && PARAMETERS_QUALIFIER.equalsIgnoreCase(firstSegment)
                ? TokenKind.PARAMETER
                : TokenKind.FIELD;
        tokens.add(new LexToken(kind, formula.substring(startIndex, index), startIndex));
        return index;
    }

    /**
     * 读取单个 [..] 片段并返回右括号之后的位置，]] 表示字面量 ]。
     */
    private int readBracketSegment(String formula, int bracketIndex) {
        int index = bracketIndex + 1;
        while (index < formula.length()) {
            if (formula.charAt(index) == ']') {
                if (index + 1 < formula.length() && formula.charAt(index + 1) == ']') {
                    index += 2;
                    continue;
                }
                return index + 1;
            }
            index++;
        }
        throw new FormulaLexException("未闭合方括号", bracketIndex, formula);
    }

    private int readDate(String formula, int hashIndex, List<LexToken> tokens) {
        int closing = formula.indexOf('#', hashIndex + 1);
        if (closing < 0) {
            throw new FormulaLexException("未闭合日期字面量", hashIndex, formula);
        }
        tokens.add(new LexToken(TokenKind.DATE, formula.substring(hashIndex, closing + 1), hashIndex));
        return closing + 1;
    }

    private int skipLineComment(String formula, int index) {
        int lineEnd = formula.indexOf('\n', index);
        return lineEnd < 0 ? formula.length() : lineEnd + 1;
    }

    /**
     * 读取数字字面量，出现小数点或指数时为 REAL，否则为 INTEGER。
     */
    private int readNumber(String formula, int startIndex, List<LexToken> tokens) {
        int index = startIndex;
        boolean real = false;
        while (index < formula.length() && Character.isDigit(formula.charAt(index))) {
            index++;
        }
        if (index < formula.length() && formula.charAt(index) == '.') {
            real = true;
            index++;
            while (index < formula.length() && Character.isDigit(formula.charAt(index))) {
                index++;
            }
        }
        if (index < formula.length() && (formula.charAt(index) == 'e' || formula.charAt(index) == 'E')) {
            int exponentStart = index + 1;
            if (exponentStart < formula.length()
                    && (formula.charAt(exponentStart) == '+' || formula.charAt(exponentStart) == '-')) {
                exponentStart++;
            }
            if (exponentStart < formula.length() && Character.isDigit(formula.charAt(exponentStart))) {
                real = true;
                index = exponentStart;
                while (index < formula.length() && Character.isDigit(formula.charAt(index))) {
                    index++;
                }
            }
        }
        if (index < formula.length() && isIdentifierStart(formula.charAt(index))) {
            throw new FormulaLexException("数字后紧跟非法字符: " + formula.charAt(index), index, formula);
        }
        tokens.add(new LexToken(real ? TokenKind.REAL : TokenKind.INTEGER, formula.substring(startIndex, index), startIndex));
        return index;
    }

    private boolean isNumberStart(String formula, int index) {
        char currentChar = formula.charAt(index);
        if (Character.isDigit(currentChar)) {
            return true;
        }
        return currentChar == '.' && index + 1 < formula.length() && Character.isDigit(formula.charAt(index + 1));
    }

    private String matchOperator(String formula, int index) {
        for (String operator : OPERATORS) {
            if (formula.startsWith(operator, index)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * 按表顺序匹配关键字，要求关键字之后处于单词边界。
     */
    private String matchKeyword(String formula, int index) {
        for (String keyword : KEYWORDS) {
            int end = index + keyword.length();
            if (formula.regionMatches(true, index, keyword, 0, keyword.length())
                    && (end >= formula.length() || !isIdentifierPart(formula.charAt(end)))) {
                return keyword;
            }
        }
        return null;
    }

    private boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }
}

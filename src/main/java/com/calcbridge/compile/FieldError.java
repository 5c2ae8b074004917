package com.calcbridge.compile;

/**
 * 单个字段的编译错误，offset 为公式中的字符位置，没有位置信息时为 -1。
 */
public record FieldError(Kind kind, String message, int offset) {

    public enum Kind {
        LEX,
        SYNTAX,
        UNRESOLVED_REFERENCE,
        UNSUPPORTED_CONSTRUCT,
        /** 编译器自身的缺陷 */
        INTERNAL
    }

    public FieldError(Kind kind, String message) {
        this(kind, message, -1);
    }
}

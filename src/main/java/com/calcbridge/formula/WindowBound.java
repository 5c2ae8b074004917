package com.calcbridge.formula;

/**
 * 窗口边界：分区首行、分区末行或相对当前行的偏移，FIRST()+n 形式的偏移记录在 offset 中。
 */
public record WindowBound(Anchor anchor, int offset) {

    public enum Anchor {
        FIRST,
        LAST,
        CURRENT
    }

    public static WindowBound first() {
        return new WindowBound(Anchor.FIRST, 0);
    }

    public static WindowBound last() {
        return new WindowBound(Anchor.LAST, 0);
    }

    public static WindowBound relative(int offset) {
        return new WindowBound(Anchor.CURRENT, offset);
    }
}

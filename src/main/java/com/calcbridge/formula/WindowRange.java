package com.calcbridge.formula;

/**
 * 窗口帧范围，LOOKUP 的偏移量以 start 与 end 相同的范围表示。
 */
public record WindowRange(WindowBound start, WindowBound end) {

    public static WindowRange single(WindowBound bound) {
        return new WindowRange(bound, bound);
    }
}

package com.calcbridge.render;

import com.calcbridge.formula.FormulaException;

/**
 * 可识别但无法映射到目标端的函数、LOD 或窗口函数变体。
 */
public class UnsupportedConstructException extends FormulaException {
    private final String construct;

    public UnsupportedConstructException(String construct, String reason) {
        super(construct + ": " + reason);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}

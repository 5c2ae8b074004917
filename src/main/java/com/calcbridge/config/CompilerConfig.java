package com.calcbridge.config;

/**
 * 编译器运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class CompilerConfig {
    private int maxNestingDepth = Constants.MAX_NESTING_DEPTH;
    private int complexityWarningDepth = Constants.COMPLEXITY_WARNING_DEPTH;
    private boolean permissive = true;
    private boolean failOnUnsupported = false;
    private String tableContext = Constants.DEFAULT_TABLE_CONTEXT;
    private int compileThreads = Constants.DEFAULT_COMPILE_THREADS;

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getComplexityWarningDepth() {
        return complexityWarningDepth;
    }

    public void setComplexityWarningDepth(int complexityWarningDepth) {
        this.complexityWarningDepth = complexityWarningDepth;
    }

    /**
     * 宽松模式下未知函数解析为 Unsupported 节点，否则报告语法错误。
     */
    public boolean isPermissive() {
        return permissive;
    }

    public void setPermissive(boolean permissive) {
        this.permissive = permissive;
    }

    /**
     * 为 true 时渲染阶段遇到无法映射的构造直接失败，而不是输出占位符。
     */
    public boolean isFailOnUnsupported() {
        return failOnUnsupported;
    }

    public void setFailOnUnsupported(boolean failOnUnsupported) {
        this.failOnUnsupported = failOnUnsupported;
    }

    public String getTableContext() {
        return tableContext;
    }

    public void setTableContext(String tableContext) {
        this.tableContext = tableContext;
    }

    public int getCompileThreads() {
        return compileThreads;
    }

    public void setCompileThreads(int compileThreads) {
        this.compileThreads = compileThreads;
    }

    /**
     * 使用默认配置创建实例
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }
}

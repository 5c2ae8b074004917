package com.calcbridge.config;

/**
 * 全局常量定义
 * 
 * 包含解析限制、渲染默认值与批量编译线程参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 解析参数 ====================
    /** 公式最大嵌套深度，超过后报告语法错误而不是耗尽调用栈 */
    public static final int MAX_NESTING_DEPTH = 200;
    /** 公式文本长度上限 */
    public static final int MAX_FORMULA_LENGTH = 64 * 1024;

    // ==================== 分析参数 ====================
    /** 语法树深度超过此值时提示公式可能过于复杂 */
    public static final int COMPLEXITY_WARNING_DEPTH = 32;

    // ==================== 渲染参数 ====================
    /** LookML 字段引用使用的表上下文，渲染为 ${TABLE}.field */
    public static final String DEFAULT_TABLE_CONTEXT = "TABLE";
    /** 内置函数映射表资源 */
    public static final String FUNCTION_TABLE_RESOURCE = "/function-table.json";

    // ==================== 线程参数 ====================
    /** 默认编译工作线程数 */
    public static final int DEFAULT_COMPILE_THREADS = Runtime.getRuntime().availableProcessors();
    /** 编译线程数安全上限 */
    public static final int MAX_COMPILE_THREADS = 32;
}

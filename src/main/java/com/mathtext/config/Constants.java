package com.mathtext.config;

/**
 * 全局常量定义
 *
 * 包含占位符清理参数、纯文本导出长度与命令行输入上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 占位符参数 ====================
    /** 泄漏占位符的替换标记 */
    public static final String DEFAULT_PLACEHOLDER_MARKER = "[formula]";
    /** 上游缓存替换留下的占位符，两到三个下划线包裹 */
    public static final String PLACEHOLDER_REGEX = "_{2,3}LATEX_BLOCK_\\d+_{2,3}";
    /** 占位符固定中缀，用于快速跳过无占位符的文本 */
    public static final String PLACEHOLDER_INFIX = "LATEX_BLOCK_";

    // ==================== 纯文本导出参数 ====================
    /** 分享题干的最大长度 */
    public static final int QUESTION_SHARE_MAX_LENGTH = 200;
    /** 分享单个解题步骤的最大长度 */
    public static final int STEP_SHARE_MAX_LENGTH = 150;
    /** 截断后追加的省略号 */
    public static final String ELLIPSIS = "...";
    /** 不限制导出长度 */
    public static final int UNLIMITED_LENGTH = 0;

    // ==================== 命令行参数 ====================
    /** 单次命令行输入的最大字符数 */
    public static final int MAX_INPUT_LENGTH = 1_000_000;
    /** 从标准输入读取内容的参数值 */
    public static final String STDIN_ARGUMENT = "-";
}

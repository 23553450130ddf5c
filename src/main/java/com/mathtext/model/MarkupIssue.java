package com.mathtext.model;

/**
 * 流水线在输入中发现并已修复（或降级处理）的问题类别。
 *
 * 这些类别只用于报告，流水线本身从不因它们抛出异常。
 */
public enum MarkupIssue {
    /** 缺失或多余的数学定界符 */
    MALFORMED_DELIMITER,
    /** 丢失前导反斜杠的命令 */
    TRUNCATED_COMMAND,
    /** 花括号不配对 */
    UNBALANCED_BRACES,
    /** 转换表中没有对应规则的命令 */
    UNKNOWN_COMMAND,
    /** 泄漏到正文中的缓存占位符 */
    PLACEHOLDER_LEAK
}

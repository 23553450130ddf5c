package com.mathtext.convert;

/**
 * 单条符号规则：token 为带反斜杠的命令，replacement 为替换文本。
 */
public record ConversionRule(String token, String replacement, ConversionCategory category) {
}

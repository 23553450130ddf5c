package com.mathtext.convert;

/**
 * 符号规则所属的表。
 */
public enum ConversionCategory {
    GREEK,
    OPERATOR,
    BIG_OPERATOR,
    FUNCTION,
    SPACING
}

package com.mathtext.normalize;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * 命名的修复规则：detector 为快速预检，命中后才执行 repair。
 */
public record NormalizationRule(
    String name,
    RuleCategory category,
    Predicate<String> detector,
    UnaryOperator<String> repair
) {

    public String apply(String content) {
        if (!detector.test(content)) {
            return content;
        }
        return repair.apply(content);
    }
}

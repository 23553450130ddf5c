package com.mathtext.normalize;

import com.mathtext.model.MarkupIssue;

/**
 * 修复规则类别，每个类别对应它修复后报告的问题类型（可能为空）。
 */
public enum RuleCategory {
    CONTROL_ESCAPE_REPAIR(MarkupIssue.TRUNCATED_COMMAND),
    DELIMITER_STRIP(MarkupIssue.MALFORMED_DELIMITER),
    BRACE_BALANCE(MarkupIssue.UNBALANCED_BRACES),
    COMMAND_REPAIR(MarkupIssue.TRUNCATED_COMMAND),
    CHEMISTRY_NOTATION(null),
    EMPTY_GROUP_REMOVAL(null),
    WHITESPACE_CLEANUP(null);

    private final MarkupIssue issue;

    RuleCategory(MarkupIssue issue) {
        this.issue = issue;
    }

    public MarkupIssue issue() {
        return issue;
    }
}

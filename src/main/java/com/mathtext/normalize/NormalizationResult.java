package com.mathtext.normalize;

import com.mathtext.model.MarkupIssue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record NormalizationResult(String content, Set<MarkupIssue> issues) {

    public NormalizationResult {
        content = content == null ? "" : content;
        issues = issues == null || issues.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(MarkupIssue.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    }

    public boolean changed(String original) {
        return !content.equals(original);
    }
}

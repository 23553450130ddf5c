package com.mathtext.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mathtext.model.MarkupIssue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record PipelineReport(
    String input,
    String cleanedInput,
    List<RenderableSegment> segments,
    String plainText,
    Set<MarkupIssue> issues
) {

    public PipelineReport {
        segments = segments == null ? List.of() : List.copyOf(segments);
        issues = issues == null || issues.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(MarkupIssue.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    }

    @JsonIgnore
    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}

package com.mathtext.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Segment(
    String content,
    @JsonProperty("isLatex") boolean isLatex,
    @JsonProperty("isDisplayMode") boolean isDisplayMode
) {

    public Segment {
        content = content == null ? "" : content;
        if (!isLatex) {
            isDisplayMode = false;
        }
    }

    /**
     * 创建纯文本片段。
     */
    public static Segment plain(String content) {
        return new Segment(content, false, false);
    }

    /**
     * 创建数学片段，displayMode 决定块级或行内排版。
     */
    public static Segment latex(String content, boolean displayMode) {
        return new Segment(content, true, displayMode);
    }
}

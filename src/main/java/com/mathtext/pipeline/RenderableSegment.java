package com.mathtext.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mathtext.model.Segment;

/**
 * 交给渲染方的片段：原始片段、规范化内容、是否可排版以及纯文本近似。
 *
 * 纯文本片段的 normalizedContent 是原文，plainText 是去掉 {@code \$} 转义后的原文，valid 恒为 true。
 */
public record RenderableSegment(Segment segment, String normalizedContent, boolean valid, String plainText) {

    @JsonIgnore
    public boolean isLatex() {
        return segment.isLatex();
    }

    @JsonIgnore
    public boolean isDisplayMode() {
        return segment.isDisplayMode();
    }
}

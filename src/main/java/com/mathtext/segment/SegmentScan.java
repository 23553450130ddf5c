package com.mathtext.segment;

import com.mathtext.model.Segment;

import java.util.List;

/**
 * 一次分段扫描的结果，malformed 表示扫描中遇到未闭合或多余的定界符。
 */
public record SegmentScan(List<Segment> segments, boolean malformed) {

    public SegmentScan {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public long latexCount() {
        return segments.stream().filter(Segment::isLatex).count();
    }
}

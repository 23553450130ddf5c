package com.mathtext.pipeline;

import com.mathtext.config.Constants;
import com.mathtext.config.PipelineConfig;
import com.mathtext.convert.LatexToTextConverter;
import com.mathtext.model.MarkupIssue;
import com.mathtext.model.Segment;
import com.mathtext.normalize.LatexNormalizer;
import com.mathtext.normalize.NormalizationResult;
import com.mathtext.placeholder.PlaceholderCleaner;
import com.mathtext.segment.SegmentScan;
import com.mathtext.segment.Segmenter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 数学文本流水线门面：占位符清理 → 分段 → 规范化 → 转换。
 *
 * 实例不可变，可被渲染与分享两条路径共享。
 */
public class MathTextPipeline {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final String ESCAPED_DOLLAR = "\\$";

    private final PlaceholderCleaner cleaner;
    private final Segmenter segmenter;
    private final LatexNormalizer normalizer;
    private final LatexToTextConverter converter;
    private final int defaultMaxLength;

    public MathTextPipeline() {
        this(PipelineConfig.defaults());
    }

    public MathTextPipeline(PipelineConfig config) {
        PipelineConfig effective = config == null ? PipelineConfig.defaults() : config;
        this.cleaner = new PlaceholderCleaner(effective.getPlaceholderMarker());
        this.segmenter = new Segmenter(
            effective.isLenientDollar(), effective.isMergeAdjacentMath(), effective.isFoldNewlinesInMath());
        this.normalizer = new LatexNormalizer();
        this.converter = new LatexToTextConverter();
        this.defaultMaxLength = effective.getPlainTextMaxLength();
    }

    public PlaceholderCleaner cleaner() {
        return cleaner;
    }

    public Segmenter segmenter() {
        return segmenter;
    }

    public LatexNormalizer normalizer() {
        return normalizer;
    }

    public LatexToTextConverter converter() {
        return converter;
    }

    /**
     * 清理占位符后分段。
     */
    public List<Segment> segments(String raw) {
        return segmenter.parse(cleaner.clean(raw));
    }

    /**
     * 返回可直接渲染的片段列表，数学片段已规范化、校验并转换。
     */
    public List<RenderableSegment> render(String raw) {
        List<RenderableSegment> rendered = new ArrayList<>();
        for (Segment segment : segments(raw)) {
            rendered.add(toRenderable(segment, null));
        }
        return List.copyOf(rendered);
    }

    /**
     * 纯文本近似，使用配置中的默认长度上限。
     */
    public String toPlainText(String raw) {
        return toPlainText(raw, defaultMaxLength);
    }

    /**
     * 纯文本近似；maxLength 大于 0 时超长部分截断并追加省略号。
     */
    public String toPlainText(String raw, int maxLength) {
        return truncate(joinPlainText(render(raw)), maxLength);
    }

    /** 分享题目时的纯文本 */
    public String shareQuestion(String raw) {
        return toPlainText(raw, Constants.QUESTION_SHARE_MAX_LENGTH);
    }

    /** 分享解题步骤时的纯文本 */
    public String shareStep(String raw) {
        return toPlainText(raw, Constants.STEP_SHARE_MAX_LENGTH);
    }

    /**
     * 完整分析一次输入，汇总发现的问题。
     */
    public PipelineReport analyze(String raw) {
        String input = raw == null ? "" : raw;
        Set<MarkupIssue> issues = EnumSet.noneOf(MarkupIssue.class);
        if (cleaner.hasLeaks(input)) {
            issues.add(MarkupIssue.PLACEHOLDER_LEAK);
        }

        String cleaned = cleaner.clean(input);
        SegmentScan scan = segmenter.scan(cleaned);
        if (scan.malformed()) {
            issues.add(MarkupIssue.MALFORMED_DELIMITER);
        }

        List<RenderableSegment> rendered = new ArrayList<>();
        for (Segment segment : scan.segments()) {
            rendered.add(toRenderable(segment, issues));
        }
        return new PipelineReport(input, cleaned, rendered, joinPlainText(rendered), issues);
    }

    /**
     * 按长度上限截断，上限不大于 0 表示不限制。
     */
    static String truncate(String text, int maxLength) {
        if (maxLength <= Constants.UNLIMITED_LENGTH || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= Constants.ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - Constants.ELLIPSIS.length()) + Constants.ELLIPSIS;
    }

    private RenderableSegment toRenderable(Segment segment, Set<MarkupIssue> issues) {
        if (!segment.isLatex()) {
            String text = segment.content().replace(ESCAPED_DOLLAR, "$");
            return new RenderableSegment(segment, segment.content(), true, text);
        }

        NormalizationResult result = normalizer.repair(segment.content());
        String normalized = result.content();
        boolean valid = normalizer.isLikelyValid(normalized);
        if (issues != null) {
            issues.addAll(result.issues());
            if (!converter.unknownCommands(normalized).isEmpty()) {
                issues.add(MarkupIssue.UNKNOWN_COMMAND);
            }
        }
        String plainText = padded(segment.content(), converter.convert(normalized));
        return new RenderableSegment(segment, normalized, valid, plainText);
    }

    /**
     * 数学内容首尾的空白在转换时被去掉，这里各补回一个空格，避免与相邻文本粘连。
     */
    private static String padded(String source, String converted) {
        if (converted.isEmpty()) {
            return converted;
        }
        boolean leading = Character.isWhitespace(source.charAt(0));
        boolean trailing = Character.isWhitespace(source.charAt(source.length() - 1));
        if (!leading && !trailing) {
            return converted;
        }
        return (leading ? " " : "") + converted + (trailing ? " " : "");
    }

    private String joinPlainText(List<RenderableSegment> rendered) {
        StringBuilder builder = new StringBuilder();
        for (RenderableSegment segment : rendered) {
            builder.append(segment.plainText());
        }
        return WHITESPACE_RUN.matcher(builder).replaceAll(" ").trim();
    }
}

package com.mathtext.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mathtext.config.PipelineConfig;
import com.mathtext.model.MarkupIssue;
import com.mathtext.model.Segment;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MathTextPipelineTest {

    private final MathTextPipeline pipeline = new MathTextPipeline();

    @Test
    @DisplayName("MathTextPipeline: 离子符号与电荷合并后按顺序输出")
    void testRenderIonExample() {
        List<RenderableSegment> rendered = pipeline.render("\\(\\mathrm{Cr}\\)\\(^{2+}\\)\\) has 4 unpaired electrons");

        assertEquals(2, rendered.size());
        RenderableSegment math = rendered.get(0);
        assertTrue(math.isLatex());
        assertFalse(math.isDisplayMode());
        assertTrue(math.valid());
        assertEquals("Cr ²⁺", math.plainText());
        assertEquals(" has 4 unpaired electrons", rendered.get(1).plainText());

        String plain = pipeline.toPlainText("\\(\\mathrm{Cr}\\)\\(^{2+}\\)\\) has 4 unpaired electrons");
        assertTrue(plain.indexOf("Cr") < plain.indexOf("²⁺"));
        assertEquals("Cr ²⁺ has 4 unpaired electrons", plain);
    }

    @Test
    void testPlainTextOfMixedContent() {
        assertEquals("The area is π r²", pipeline.toPlainText("The area is \\(\\pi r^2\\)"));
        assertEquals("half is (1/2)", pipeline.toPlainText("half is $\\frac{1}{2}$"));
        assertEquals("", pipeline.toPlainText(null));
    }

    @Test
    void testRenderRepairsTruncatedMath() {
        List<RenderableSegment> rendered = pipeline.render("\\(rac{1}{2\\)");

        assertEquals(1, rendered.size());
        assertEquals("\\frac{1}{2}", rendered.get(0).normalizedContent());
        assertEquals("(1/2)", rendered.get(0).plainText());
        assertTrue(rendered.get(0).valid());
    }

    @Test
    void testEmptyMathIsNotValid() {
        RenderableSegment empty = pipeline.render("\\(\\)").get(0);

        assertTrue(empty.isLatex());
        assertFalse(empty.valid());
        assertEquals("", empty.plainText());
    }

    @Test
    void testPlainSegmentsKeptVerbatim() {
        RenderableSegment text = pipeline.render("costs \\$5").get(0);

        assertEquals(Segment.plain("costs \\$5"), text.segment());
        assertEquals("costs \\$5", text.normalizedContent());
        assertEquals("costs $5", text.plainText());
        assertTrue(text.valid());
    }

    @Test
    @DisplayName("MathTextPipeline: 纯文本中的转义美元符号还原为 $")
    void testEscapedDollarUnescapedInPlainText() {
        assertEquals("costs $5 and x", pipeline.toPlainText("costs \\$5 and $x$"));
    }

    @Test
    @DisplayName("MathTextPipeline: 数学片段与文本交界处保留空格")
    void testBoundarySpaceKept() {
        assertEquals("Price 5 and 10", pipeline.toPlainText("Price $5 and $10"));
        assertEquals("a x b", pipeline.toPlainText("a$ x $b"));
        assertEquals("ab", pipeline.toPlainText("a$b$"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "abcdefghij|8|abcde...",
        "abcdefghij|10|abcdefghij",
        "abcdefghij|0|abcdefghij",
        "abcdefghij|-1|abcdefghij",
        "abcdefghij|3|abc",
        "abcdefghij|2|ab"
    })
    void testTruncate(String text, int maxLength, String expected) {
        assertEquals(expected, MathTextPipeline.truncate(text, maxLength));
    }

    @Test
    void testConfiguredMaxLengthApplies() {
        PipelineConfig config = PipelineConfig.defaults();
        config.setPlainTextMaxLength(8);
        MathTextPipeline limited = new MathTextPipeline(config);

        assertEquals("abcde...", limited.toPlainText("abcdefghij"));
        assertEquals("abcdefghij", limited.toPlainText("abcdefghij", 0));
        assertEquals("abcdefghij", pipeline.toPlainText("abcdefghij"));
    }

    @Test
    void testShareLimits() {
        String question = "q".repeat(300);
        String step = "s".repeat(300);

        assertEquals(200, pipeline.shareQuestion(question).length());
        assertTrue(pipeline.shareQuestion(question).endsWith("..."));
        assertEquals(150, pipeline.shareStep(step).length());
        assertEquals("x²", pipeline.shareStep("\\(x^2\\)"));
    }

    @Test
    void testCustomMarker() {
        PipelineConfig config = PipelineConfig.defaults();
        config.setPlaceholderMarker("<?>");

        assertEquals("a <?> b", new MathTextPipeline(config).toPlainText("a __LATEX_BLOCK_3__ b"));
    }

    @Test
    @DisplayName("MathTextPipeline: 分析报告汇总各阶段问题")
    void testAnalyzeCollectsIssues() {
        PipelineReport report = pipeline.analyze("__LATEX_BLOCK_0__ and \\(rac{1}{2\\)");

        assertEquals("[formula] and \\(rac{1}{2\\)", report.cleanedInput());
        assertEquals("[formula] and (1/2)", report.plainText());
        assertEquals(Set.of(MarkupIssue.PLACEHOLDER_LEAK, MarkupIssue.TRUNCATED_COMMAND,
            MarkupIssue.UNBALANCED_BRACES), report.issues());
        assertTrue(report.hasIssues());
    }

    @Test
    void testAnalyzeUnknownAndMalformed() {
        assertTrue(pipeline.analyze("\\(\\foo x\\)").issues().contains(MarkupIssue.UNKNOWN_COMMAND));
        assertEquals(Set.of(MarkupIssue.MALFORMED_DELIMITER), pipeline.analyze("x \\) y").issues());

        PipelineReport clean = pipeline.analyze("Let \\(x = 1\\)");
        assertFalse(clean.hasIssues());
        assertEquals("Let x = 1", clean.plainText());
    }

    @Test
    void testReportIsImmutable() {
        PipelineReport report = pipeline.analyze("x \\) y");

        assertThrows(UnsupportedOperationException.class, () -> report.issues().add(MarkupIssue.UNKNOWN_COMMAND));
        assertThrows(UnsupportedOperationException.class, () -> report.segments().clear());
        assertEquals("", pipeline.analyze(null).input());
    }
}

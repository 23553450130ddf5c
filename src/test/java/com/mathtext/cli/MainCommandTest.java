package com.mathtext.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathtext.config.PipelineConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void redirectStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallPrintsBanner() {
        assertEquals(0, new MainCommand().call());
        assertTrue(output().contains("数学文本处理流水线"));
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--lenient-dollar", "--marker", "?", "plain", "x");

        assertNotNull(parseResult.subcommand());
        assertEquals("plain", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testParseTextFormat() {
        assertEquals(0, execute("parse", "Let \\(x\\) and $$y$$"));

        String output = output();
        assertTrue(output.contains("1. [text] Let "));
        assertTrue(output.contains("2. [math/inline] x"));
        assertTrue(output.contains("4. [math/display] y"));
        assertTrue(output.contains("共 4 个片段"));
    }

    @Test
    void testParseEmptyInput() {
        assertEquals(0, execute("parse", ""));
        assertTrue(output().contains("没有片段"));
    }

    @Test
    void testParseJsonFormat() throws Exception {
        assertEquals(0, execute("parse", "-f", "json", "a $b$"));

        JsonNode segments = new ObjectMapper().readTree(output());
        assertEquals(2, segments.size());
        assertFalse(segments.get(0).get("isLatex").booleanValue());
        assertTrue(segments.get(1).get("isLatex").booleanValue());
        assertEquals("b", segments.get(1).get("content").textValue());
    }

    @Test
    void testNormalizeSubcommand() {
        assertEquals(0, execute("normalize", "rac{1}{2"));

        String output = output();
        assertTrue(output.startsWith("\\frac{1}{2}"));
        assertTrue(output.contains("可排版"));
        assertTrue(output.contains("TRUNCATED_COMMAND"));
    }

    @Test
    void testNormalizeReportsInvalidContent() {
        assertEquals(0, execute("normalize", "   "));
        assertTrue(output().contains("内容可能无效"));
    }

    @Test
    void testConvertSubcommand() {
        assertEquals(0, execute("convert", "\\alpha^{2} + \\frac{1}{2}"));
        assertEquals("α² + (1/2)", output().trim());
    }

    @Test
    void testPlainSubcommandWithMaxLength() {
        assertEquals(0, execute("plain", "--max-length", "8", "abcdefghij"));
        assertEquals("abcde...", output().trim());
    }

    @Test
    void testCleanSubcommandWithMarker() {
        assertEquals(0, execute("--marker", "<?>", "clean", "a __LATEX_BLOCK_9__ b"));
        assertEquals("a <?> b", output().trim());
    }

    @Test
    void testLenientDollarOption() {
        assertEquals(0, execute("--lenient-dollar", "plain", "The price is $50"));
        assertEquals("The price is $50", output().trim());
    }

    @Test
    void testConfigFileIsLoaded() throws Exception {
        Path configFile = tempDir.resolve("mtp.properties");
        Files.writeString(configFile, PipelineConfig.KEY_PLAIN_MAX_LENGTH + "=5\n", StandardCharsets.UTF_8);

        assertEquals(0, execute("--config", configFile.toString(), "plain", "abcdefghij"));
        assertEquals("ab...", output().trim());
    }

    @Test
    void testInvalidConfigReturnsOne() throws Exception {
        Path configFile = tempDir.resolve("bad.properties");
        Files.writeString(configFile, PipelineConfig.KEY_LENIENT_DOLLAR + "=maybe\n", StandardCharsets.UTF_8);

        assertEquals(1, execute("--config", configFile.toString(), "plain", "x"));
        assertTrue(errorBuffer.toString(StandardCharsets.UTF_8).contains(PipelineConfig.KEY_LENIENT_DOLLAR));
    }

    @Test
    void testSanitizeJsonSubcommand() throws Exception {
        Path jsonFile = tempDir.resolve("answer.json");
        Files.writeString(jsonFile,
            "{\"question\":\"x __LATEX_BLOCK_1__\",\"id\":\"__LATEX_BLOCK_2__\"}", StandardCharsets.UTF_8);

        assertEquals(0, execute("sanitize-json", "--field", "question", jsonFile.toString()));

        JsonNode sanitized = new ObjectMapper().readTree(output());
        assertEquals("x [formula]", sanitized.get("question").textValue());
        assertEquals("__LATEX_BLOCK_2__", sanitized.get("id").textValue());
    }

    @Test
    void testSanitizeJsonMissingFileReturnsOne() {
        assertEquals(1, execute("sanitize-json", tempDir.resolve("missing.json").toString()));
        assertTrue(errorBuffer.toString(StandardCharsets.UTF_8).contains("JSON 清理失败"));
    }

    @Test
    void testInspectSubcommand() throws Exception {
        assertEquals(0, execute("inspect", "__LATEX_BLOCK_0__ \\(\\pi\\)"));

        JsonNode report = new ObjectMapper().readTree(output());
        assertEquals("[formula] π", report.get("plainText").textValue());
        assertEquals("PLACEHOLDER_LEAK", report.get("issues").get(0).textValue());
        assertEquals("\\pi", report.get("segments").get(1).get("normalizedContent").textValue());
        assertFalse(report.has("hasIssues"));
    }

    private int execute(String... args) {
        return new CommandLine(new MainCommand()).execute(args);
    }

    private String output() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }
}

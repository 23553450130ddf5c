package com.mathtext.lex;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LatexLexerTest {

    private final LatexLexer lexer = new LatexLexer();

    @Test
    @DisplayName("LatexLexer: 命令与花括号")
    void testCommandAndBraces() {
        List<LexToken> tokens = lexer.tokenize("\\frac{1}{2}");

        assertEquals(7, tokens.size());
        assertToken(tokens.get(0), TokenType.COMMAND, "\\frac", 0);
        assertToken(tokens.get(1), TokenType.OPEN_BRACE, "{", 5);
        assertToken(tokens.get(2), TokenType.TEXT, "1", 6);
        assertToken(tokens.get(3), TokenType.CLOSE_BRACE, "}", 7);
        assertEquals("frac", tokens.get(0).commandName());
        assertEquals("", tokens.get(2).commandName());
    }

    @Test
    @DisplayName("LatexLexer: 换行、转义与末尾反斜杠")
    void testBackslashVariants() {
        List<LexToken> tokens = lexer.tokenize("a\\\\b\\{c\\");

        assertToken(tokens.get(0), TokenType.TEXT, "a", 0);
        assertToken(tokens.get(1), TokenType.LINE_BREAK, "\\\\", 1);
        assertToken(tokens.get(2), TokenType.TEXT, "b", 3);
        assertToken(tokens.get(3), TokenType.ESCAPED_SYMBOL, "\\{", 4);
        assertToken(tokens.get(4), TokenType.TEXT, "c", 6);
        assertToken(tokens.get(5), TokenType.DANGLING_BACKSLASH, "\\", 7);
        assertTrue(tokens.get(3).isEscaped('{'));
        assertFalse(tokens.get(3).isEscaped('}'));
    }

    @Test
    void testEmptyInput() {
        assertTrue(lexer.tokenize("").isEmpty());
        assertTrue(lexer.tokenize(null).isEmpty());
    }

    @Test
    void testCommandStopsAtNonLetter() {
        List<LexToken> tokens = lexer.tokenize("\\alpha2\\beta");

        assertEquals(3, tokens.size());
        assertEquals("\\alpha", tokens.get(0).value());
        assertEquals("2", tokens.get(1).value());
        assertEquals("beta", tokens.get(2).commandName());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "\\frac{1}{2}",
        "x^{2} + y_1",
        "\\\\\\",
        "\\(\\)\\[\\]",
        "{{}}}{",
        "中文 \\text{混合}",
        "𝑥 + \\𝑦",
        "\\"
    })
    @DisplayName("LatexLexer: 拼接 token 还原原文")
    void testJoinRestoresInput(String input) {
        assertEquals(input, LatexLexer.join(lexer.tokenize(input)));
    }

    @Test
    void testBraceGroupsFindClosing() {
        assertEquals(6, BraceGroups.findClosing("{a{b}c}", 0));
        assertEquals(5, BraceGroups.findClosing("{a\\}b}", 0));
        assertEquals(-1, BraceGroups.findClosing("{ab", 0));
    }

    @Test
    void testBraceGroupsReadArgument() {
        BraceGroups.Argument braced = BraceGroups.readArgument("  {xy}z", 0);
        assertEquals("xy", braced.content());
        assertEquals(6, braced.end());
        assertTrue(braced.braced());

        BraceGroups.Argument first = BraceGroups.readArgument("\\frac12", 5);
        assertEquals("1", first.content());
        BraceGroups.Argument second = BraceGroups.readArgument("\\frac12", first.end());
        assertEquals("2", second.content());
        assertFalse(second.braced());

        BraceGroups.Argument command = BraceGroups.readArgument("\\alpha+", 0);
        assertEquals("\\alpha", command.content());
        assertEquals(6, command.end());

        BraceGroups.Argument unclosed = BraceGroups.readArgument("{abc", 0);
        assertEquals("abc", unclosed.content());
        assertEquals(4, unclosed.end());

        assertNull(BraceGroups.readArgument("}", 0));
        assertNull(BraceGroups.readArgument("", 0));
        assertNull(BraceGroups.readArgument("\\", 0));
    }

    @Test
    void testBraceGroupsReadOptionalArgument() {
        BraceGroups.Argument index = BraceGroups.readOptionalArgument("[3]{x}", 0);
        assertEquals("3", index.content());
        assertEquals(3, index.end());

        assertNull(BraceGroups.readOptionalArgument("{x}", 0));
        assertNull(BraceGroups.readOptionalArgument("[3", 0));
    }

    private void assertToken(LexToken token, TokenType type, String value, int position) {
        assertEquals(type, token.type());
        assertEquals(value, token.value());
        assertEquals(position, token.position());
    }
}

package com.mathtext.lex;

import java.util.ArrayList;
import java.util.List;

public class LatexLexer {

    /**
     * 将数学内容切分为词法 token 序列，按顺序拼接全部 token 的值可还原原文。
     */
    public List<LexToken> tokenize(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < content.length()) {
            char currentChar = content.charAt(index);
            if (currentChar == '\\') {
                index = readBackslashToken(content, index, tokens);
                continue;
            }
            if (currentChar == '{') {
                tokens.add(new LexToken(TokenType.OPEN_BRACE, "{", index));
                index++;
                continue;
            }
            if (currentChar == '}') {
                tokens.add(new LexToken(TokenType.CLOSE_BRACE, "}", index));
                index++;
                continue;
            }

            int width = Character.charCount(content.codePointAt(index));
            tokens.add(new LexToken(TokenType.TEXT, content.substring(index, index + width), index));
            index += width;
        }
        return List.copyOf(tokens);
    }

    /**
     * 按顺序拼接 token 值。
     */
    public static String join(List<LexToken> tokens) {
        StringBuilder builder = new StringBuilder();
        for (LexToken token : tokens) {
            builder.append(token.value());
        }
        return builder.toString();
    }

    /**
     * 判断字符是否为 ASCII 字母，命令名只由 ASCII 字母组成。
     */
    public static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    /**
     * 读取以反斜杠开头的 token，返回下一个待读位置。
     */
    private int readBackslashToken(String content, int start, List<LexToken> tokens) {
        if (start + 1 >= content.length()) {
            tokens.add(new LexToken(TokenType.DANGLING_BACKSLASH, "\\", start));
            return start + 1;
        }

        char next = content.charAt(start + 1);
        if (next == '\\') {
            tokens.add(new LexToken(TokenType.LINE_BREAK, "\\\\", start));
            return start + 2;
        }
        if (isAsciiLetter(next)) {
            int end = start + 1;
            while (end < content.length() && isAsciiLetter(content.charAt(end))) {
                end++;
            }
            tokens.add(new LexToken(TokenType.COMMAND, content.substring(start, end), start));
            return end;
        }

        int end = start + 1 + Character.charCount(content.codePointAt(start + 1));
        tokens.add(new LexToken(TokenType.ESCAPED_SYMBOL, content.substring(start, end), start));
        return end;
    }
}

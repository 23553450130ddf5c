package com.mathtext.lex;

/**
 * 花括号分组与命令参数读取工具。
 *
 * 所有方法都按转义规则跳过 {@code \{}、{@code \}} 与 {@code \\}，缺失的右括号视为延伸到输入末尾。
 */
public final class BraceGroups {

    private BraceGroups() {
        // 工具类，禁止实例化
    }

    /**
     * 命令参数：内容、参数结束后的下一个位置、是否由花括号包裹。
     */
    public record Argument(String content, int end, boolean braced) {
    }

    /**
     * 返回与 openIndex 处 '{' 匹配的 '}' 下标，找不到时返回 -1。
     */
    public static int findClosing(String text, int openIndex) {
        int depth = 0;
        int index = openIndex;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar == '\\') {
                index += escapeWidth(text, index);
                continue;
            }
            if (currentChar == '{') {
                depth++;
            } else if (currentChar == '}') {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
            index++;
        }
        return -1;
    }

    /**
     * 从 from 开始读取一个命令参数：花括号分组、单个命令或单个字符；没有可读参数时返回 null。
     */
    public static Argument readArgument(String text, int from) {
        int index = skipWhitespace(text, from);
        if (index >= text.length()) {
            return null;
        }

        char currentChar = text.charAt(index);
        if (currentChar == '{') {
            int closing = findClosing(text, index);
            if (closing < 0) {
                return new Argument(text.substring(index + 1), text.length(), true);
            }
            return new Argument(text.substring(index + 1, closing), closing + 1, true);
        }
        if (currentChar == '}') {
            return null;
        }
        if (currentChar == '\\') {
            if (index + 1 >= text.length()) {
                return null;
            }
            int end = index + 1;
            if (LatexLexer.isAsciiLetter(text.charAt(end))) {
                while (end < text.length() && LatexLexer.isAsciiLetter(text.charAt(end))) {
                    end++;
                }
            } else {
                end = index + escapeWidth(text, index);
            }
            return new Argument(text.substring(index, end), end, false);
        }

        int end = index + Character.charCount(text.codePointAt(index));
        return new Argument(text.substring(index, end), end, false);
    }

    /**
     * 读取方括号可选参数，例如 {@code \sqrt[3]} 中的 3；不存在或未闭合时返回 null。
     */
    public static Argument readOptionalArgument(String text, int from) {
        int index = skipWhitespace(text, from);
        if (index >= text.length() || text.charAt(index) != '[') {
            return null;
        }

        int depth = 0;
        int cursor = index + 1;
        while (cursor < text.length()) {
            char currentChar = text.charAt(cursor);
            if (currentChar == '\\') {
                cursor += escapeWidth(text, cursor);
                continue;
            }
            if (currentChar == '{') {
                depth++;
            } else if (currentChar == '}') {
                depth--;
            } else if (currentChar == ']' && depth <= 0) {
                return new Argument(text.substring(index + 1, cursor), cursor + 1, false);
            }
            cursor++;
        }
        return null;
    }

    /**
     * 返回 index 处反斜杠转义单元的宽度：末尾孤立反斜杠为 1，其余为反斜杠加一个码点。
     */
    public static int escapeWidth(String text, int index) {
        if (index + 1 >= text.length()) {
            return 1;
        }
        return 1 + Character.charCount(text.codePointAt(index + 1));
    }

    private static int skipWhitespace(String text, int from) {
        int index = from;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}

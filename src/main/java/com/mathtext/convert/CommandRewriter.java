package com.mathtext.convert;

import com.mathtext.lex.BraceGroups;
import com.mathtext.lex.LatexLexer;

import java.util.function.Predicate;

/**
 * 扫描文本中的完整命令 token，把选中的命令交给处理器改写；转义单元与其他文本原样复制。
 */
final class CommandRewriter {

    /** 命令改写结果：替换文本与原文中下一个待读位置 */
    record Replacement(String text, int end) {
    }

    @FunctionalInterface
    interface Handler {
        /**
         * 返回 null 表示保留原命令。
         */
        Replacement handle(String text, String name, int afterName);
    }

    private CommandRewriter() {
        // 工具类，禁止实例化
    }

    static String rewrite(String text, Predicate<String> selector, Handler handler) {
        if (text.indexOf('\\') < 0) {
            return text;
        }

        StringBuilder builder = new StringBuilder(text.length());
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar != '\\') {
                builder.append(currentChar);
                index++;
                continue;
            }

            int nameEnd = index + 1;
            while (nameEnd < text.length() && LatexLexer.isAsciiLetter(text.charAt(nameEnd))) {
                nameEnd++;
            }
            if (nameEnd == index + 1) {
                int width = BraceGroups.escapeWidth(text, index);
                builder.append(text, index, index + width);
                index += width;
                continue;
            }

            String name = text.substring(index + 1, nameEnd);
            Replacement replacement = selector.test(name) ? handler.handle(text, name, nameEnd) : null;
            if (replacement == null) {
                builder.append(text, index, nameEnd);
                index = nameEnd;
            } else {
                builder.append(replacement.text());
                index = replacement.end();
            }
        }
        return builder.toString();
    }
}

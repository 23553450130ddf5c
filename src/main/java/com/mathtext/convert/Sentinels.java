package com.mathtext.convert;

/**
 * 转换过程中代替字面字符的私有区字符，避免被后续阶段再次处理，最后一步还原。
 */
final class Sentinels {
    static final char OPEN_BRACE = '\uE000';
    static final char CLOSE_BRACE = '\uE001';
    static final char CARET = '\uE002';

    private Sentinels() {
        // 工具类，禁止实例化
    }

    static boolean isSentinel(char ch) {
        return ch == OPEN_BRACE || ch == CLOSE_BRACE || ch == CARET;
    }

    /**
     * 去掉输入中已有的哨兵字符。
     */
    static String strip(String text) {
        StringBuilder builder = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (isSentinel(ch)) {
                if (builder == null) {
                    builder = new StringBuilder(text.length());
                    builder.append(text, 0, i);
                }
                continue;
            }
            if (builder != null) {
                builder.append(ch);
            }
        }
        return builder == null ? text : builder.toString();
    }

    static char restore(char ch) {
        return switch (ch) {
            case OPEN_BRACE -> '{';
            case CLOSE_BRACE -> '}';
            case CARET -> '^';
            default -> ch;
        };
    }
}

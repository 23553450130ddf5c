package com.mathtext.segment;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 数学定界符对，按优先级匹配：双字符标记先于同字符的单字符标记。
 */
public enum DelimiterPair {
    DISPLAY_DOLLAR("$$", "$$", true, Family.DOLLAR, 0),
    DISPLAY_BRACKET("\\[", "\\]", true, Family.BRACKET, 1),
    INLINE_PAREN("\\(", "\\)", false, Family.PAREN, 2),
    INLINE_DOLLAR("$", "$", false, Family.DOLLAR, 3);

    /** 定界符族，同族的下一个开标记视为未闭合区域的边界 */
    public enum Family {
        DOLLAR,
        BRACKET,
        PAREN
    }

    private static final List<DelimiterPair> BY_PRIORITY = Arrays.stream(values())
        .sorted(Comparator.comparingInt(DelimiterPair::priority))
        .toList();

    private final String open;
    private final String close;
    private final boolean displayMode;
    private final Family family;
    private final int priority;

    DelimiterPair(String open, String close, boolean displayMode, Family family, int priority) {
        this.open = open;
        this.close = close;
        this.displayMode = displayMode;
        this.family = family;
        this.priority = priority;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public boolean displayMode() {
        return displayMode;
    }

    public Family family() {
        return family;
    }

    public int priority() {
        return priority;
    }

    /**
     * 返回在 index 处开始的最高优先级开标记，没有时返回 null。
     */
    public static DelimiterPair matchOpen(String text, int index) {
        for (DelimiterPair pair : BY_PRIORITY) {
            if (text.startsWith(pair.open, index)) {
                return pair;
            }
        }
        return null;
    }

    /**
     * 返回以 index 处反斜杠开头的闭标记对应的定界符对，没有时返回 null。
     */
    public static DelimiterPair matchEscapedClose(String text, int index) {
        if (text.startsWith(INLINE_PAREN.close, index)) {
            return INLINE_PAREN;
        }
        if (text.startsWith(DISPLAY_BRACKET.close, index)) {
            return DISPLAY_BRACKET;
        }
        return null;
    }
}

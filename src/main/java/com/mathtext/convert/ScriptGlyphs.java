package com.mathtext.convert;

import java.util.Map;

/**
 * Unicode 上标与下标字符表。
 */
public final class ScriptGlyphs {

    private ScriptGlyphs() {
        // 工具类，禁止实例化
    }

    private static final Map<Character, Character> SUPERSCRIPTS = Map.ofEntries(
        Map.entry('0', '⁰'), Map.entry('1', '¹'), Map.entry('2', '²'), Map.entry('3', '³'),
        Map.entry('4', '⁴'), Map.entry('5', '⁵'), Map.entry('6', '⁶'), Map.entry('7', '⁷'),
        Map.entry('8', '⁸'), Map.entry('9', '⁹'),
        Map.entry('+', '⁺'), Map.entry('-', '⁻'), Map.entry('−', '⁻'), Map.entry('=', '⁼'),
        Map.entry('(', '⁽'), Map.entry(')', '⁾'),
        Map.entry('a', 'ᵃ'), Map.entry('b', 'ᵇ'), Map.entry('c', 'ᶜ'), Map.entry('d', 'ᵈ'),
        Map.entry('e', 'ᵉ'), Map.entry('f', 'ᶠ'), Map.entry('g', 'ᵍ'), Map.entry('h', 'ʰ'),
        Map.entry('i', 'ⁱ'), Map.entry('j', 'ʲ'), Map.entry('k', 'ᵏ'), Map.entry('l', 'ˡ'),
        Map.entry('m', 'ᵐ'), Map.entry('n', 'ⁿ'), Map.entry('o', 'ᵒ'), Map.entry('p', 'ᵖ'),
        Map.entry('r', 'ʳ'), Map.entry('s', 'ˢ'), Map.entry('t', 'ᵗ'), Map.entry('u', 'ᵘ'),
        Map.entry('v', 'ᵛ'), Map.entry('w', 'ʷ'), Map.entry('x', 'ˣ'), Map.entry('y', 'ʸ'),
        Map.entry('z', 'ᶻ')
    );

    private static final Map<Character, Character> SUBSCRIPTS = Map.ofEntries(
        Map.entry('0', '₀'), Map.entry('1', '₁'), Map.entry('2', '₂'), Map.entry('3', '₃'),
        Map.entry('4', '₄'), Map.entry('5', '₅'), Map.entry('6', '₆'), Map.entry('7', '₇'),
        Map.entry('8', '₈'), Map.entry('9', '₉'),
        Map.entry('+', '₊'), Map.entry('-', '₋'), Map.entry('−', '₋'), Map.entry('=', '₌'),
        Map.entry('(', '₍'), Map.entry(')', '₎'),
        Map.entry('a', 'ₐ'), Map.entry('e', 'ₑ'), Map.entry('h', 'ₕ'), Map.entry('i', 'ᵢ'),
        Map.entry('j', 'ⱼ'), Map.entry('k', 'ₖ'), Map.entry('l', 'ₗ'), Map.entry('m', 'ₘ'),
        Map.entry('n', 'ₙ'), Map.entry('o', 'ₒ'), Map.entry('p', 'ₚ'), Map.entry('r', 'ᵣ'),
        Map.entry('s', 'ₛ'), Map.entry('t', 'ₜ'), Map.entry('u', 'ᵤ'), Map.entry('v', 'ᵥ'),
        Map.entry('x', 'ₓ')
    );

    /**
     * 全部字符都有上标字形时返回上标串，否则返回 null。
     */
    public static String toSuperscript(String content) {
        return map(content, SUPERSCRIPTS);
    }

    /**
     * 全部字符都有下标字形时返回下标串，否则返回 null。
     */
    public static String toSubscript(String content) {
        return map(content, SUBSCRIPTS);
    }

    private static String map(String content, Map<Character, Character> glyphs) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        StringBuilder builder = new StringBuilder(content.length());
        for (int i = 0; i < content.length(); i++) {
            Character glyph = glyphs.get(content.charAt(i));
            if (glyph == null) {
                return null;
            }
            builder.append(glyph.charValue());
        }
        return builder.toString();
    }
}

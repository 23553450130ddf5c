package com.mathtext.normalize;

import com.mathtext.lex.BraceGroups;
import com.mathtext.lex.LatexLexer;

import java.util.List;
import java.util.Map;

/**
 * 将 mhchem 的 {@code \ce{...}} 改写为标准标记：元素进 {@code \mathrm{}}，原子数变下标，电荷变上标。
 */
final class ChemistryNotation {
    private static final String CE_COMMAND = "\\ce";

    /** 反应箭头，长的在前 */
    private static final List<Map.Entry<String, String>> ARROWS = List.of(
        Map.entry("<=>", "\\rightleftharpoons"),
        Map.entry("<->", "\\leftrightarrow"),
        Map.entry("->", "\\rightarrow"),
        Map.entry("<-", "\\leftarrow")
    );

    private ChemistryNotation() {
        // 工具类，禁止实例化
    }

    static boolean containsChemistry(String content) {
        return content.contains(CE_COMMAND);
    }

    /**
     * 改写所有带花括号参数的 {@code \ce}；没有参数的 {@code \ce} 原样保留。
     */
    static String rewrite(String content) {
        StringBuilder builder = new StringBuilder(content.length());
        int index = 0;
        while (index < content.length()) {
            int found = content.indexOf(CE_COMMAND, index);
            if (found < 0) {
                builder.append(content, index, content.length());
                break;
            }
            int afterName = found + CE_COMMAND.length();
            boolean wholeCommand = !precededByEscape(content, found)
                && (afterName >= content.length() || !LatexLexer.isAsciiLetter(content.charAt(afterName)));
            BraceGroups.Argument argument = wholeCommand ? BraceGroups.readArgument(content, afterName) : null;
            if (argument == null || !argument.braced()) {
                builder.append(content, index, afterName);
                index = afterName;
                continue;
            }
            String formula = argument.content();
            if (containsChemistry(formula)) {
                // 嵌套的 \ce 先改写
                formula = rewrite(formula);
            }
            builder.append(content, index, found);
            builder.append(formatFormula(formula));
            index = argument.end();
        }
        return builder.toString();
    }

    /**
     * 转换单个化学式内容。
     */
    static String formatFormula(String formula) {
        StringBuilder builder = new StringBuilder(formula.length() * 2);
        boolean afterSpecies = false;
        int index = 0;
        while (index < formula.length()) {
            String arrow = arrowAt(formula, index);
            if (arrow != null) {
                builder.append(' ').append(replacementOf(arrow)).append(' ');
                index += arrow.length();
                afterSpecies = false;
                continue;
            }

            char currentChar = formula.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                builder.append(' ');
                index++;
                afterSpecies = false;
            } else if (currentChar == '\\') {
                int end = commandEnd(formula, index);
                builder.append(formula, index, end);
                index = end;
                afterSpecies = false;
            } else if (currentChar == '^' || currentChar == '_') {
                BraceGroups.Argument script = BraceGroups.readArgument(formula, index + 1);
                if (script == null) {
                    builder.append(currentChar);
                    index++;
                } else {
                    builder.append(currentChar).append('{').append(script.content()).append('}');
                    index = script.end();
                }
                afterSpecies = false;
            } else if (currentChar == '{') {
                int closing = BraceGroups.findClosing(formula, index);
                int end = closing < 0 ? formula.length() : closing + 1;
                builder.append(formula, index, end);
                index = end;
                afterSpecies = false;
            } else if (Character.isUpperCase(currentChar)) {
                int end = index + 1;
                if (end < formula.length() && Character.isLowerCase(formula.charAt(end))) {
                    end++;
                }
                builder.append("\\mathrm{").append(formula, index, end).append('}');
                index = end;
                afterSpecies = true;
            } else if (Character.isLowerCase(currentChar)) {
                int end = index;
                while (end < formula.length() && Character.isLowerCase(formula.charAt(end))) {
                    end++;
                }
                builder.append("\\mathrm{").append(formula, index, end).append('}');
                index = end;
                afterSpecies = false;
            } else if (Character.isDigit(currentChar)) {
                int end = index;
                while (end < formula.length() && Character.isDigit(formula.charAt(end))) {
                    end++;
                }
                String digits = formula.substring(index, end);
                if (afterSpecies && isChargeSign(formula, end)) {
                    builder.append("^{").append(digits).append(formula.charAt(end)).append('}');
                    index = end + 1;
                } else if (afterSpecies) {
                    builder.append("_{").append(digits).append('}');
                    index = end;
                } else {
                    builder.append(digits);
                    index = end;
                }
            } else if (afterSpecies && isChargeSign(formula, index)) {
                builder.append("^{").append(currentChar).append('}');
                index++;
                afterSpecies = false;
            } else {
                builder.append(currentChar);
                afterSpecies = currentChar == ')' || currentChar == ']';
                index++;
            }
        }
        return builder.toString();
    }

    private static String arrowAt(String formula, int index) {
        for (Map.Entry<String, String> arrow : ARROWS) {
            if (formula.startsWith(arrow.getKey(), index)) {
                return arrow.getKey();
            }
        }
        return null;
    }

    private static String replacementOf(String arrow) {
        for (Map.Entry<String, String> entry : ARROWS) {
            if (entry.getKey().equals(arrow)) {
                return entry.getValue();
            }
        }
        return arrow;
    }

    /**
     * 判断 index 处是否为结尾电荷符号：其后为结尾、空白、右括号或逗号。
     */
    private static boolean isChargeSign(String formula, int index) {
        if (index >= formula.length()) {
            return false;
        }
        char sign = formula.charAt(index);
        if (sign != '+' && sign != '-') {
            return false;
        }
        if (index + 1 >= formula.length()) {
            return true;
        }
        char next = formula.charAt(index + 1);
        return Character.isWhitespace(next) || next == ')' || next == ',';
    }

    private static int commandEnd(String formula, int index) {
        int end = index + 1;
        if (end < formula.length() && LatexLexer.isAsciiLetter(formula.charAt(end))) {
            while (end < formula.length() && LatexLexer.isAsciiLetter(formula.charAt(end))) {
                end++;
            }
            return end;
        }
        return index + BraceGroups.escapeWidth(formula, index);
    }

    private static boolean precededByEscape(String content, int index) {
        int backslashes = 0;
        int cursor = index - 1;
        while (cursor >= 0 && content.charAt(cursor) == '\\') {
            backslashes++;
            cursor--;
        }
        return backslashes % 2 == 1;
    }
}

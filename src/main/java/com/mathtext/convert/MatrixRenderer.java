package com.mathtext.convert;

import com.mathtext.lex.BraceGroups;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 把 {@code \begin{env}...\end{env}} 环境渲染为单行文本网格。
 */
final class MatrixRenderer {
    private static final Set<String> BRACKET_ENVIRONMENTS = Set.of("matrix", "pmatrix", "bmatrix", "Bmatrix", "smallmatrix");
    private static final Set<String> BAR_ENVIRONMENTS = Set.of("vmatrix", "Vmatrix");
    private static final Set<String> COLUMN_SPEC_ENVIRONMENTS = Set.of("array", "tabular");

    private MatrixRenderer() {
        // 工具类，禁止实例化
    }

    static String render(String text) {
        return CommandRewriter.rewrite(text, name -> "begin".equals(name) || "end".equals(name),
            MatrixRenderer::renderEnvironment);
    }

    private static CommandRewriter.Replacement renderEnvironment(String text, String name, int afterName) {
        BraceGroups.Argument argument = BraceGroups.readArgument(text, afterName);
        if (argument == null || !argument.braced()) {
            return new CommandRewriter.Replacement("", afterName);
        }
        if ("end".equals(name)) {
            return new CommandRewriter.Replacement("", argument.end());
        }

        String environment = argument.content().trim();
        int bodyStart = argument.end();
        int[] bounds = findEnd(text, bodyStart, environment);
        String body = text.substring(bodyStart, bounds[0]);
        if (COLUMN_SPEC_ENVIRONMENTS.contains(environment)) {
            BraceGroups.Argument columnSpec = BraceGroups.readArgument(body, 0);
            if (columnSpec != null && columnSpec.braced()) {
                body = body.substring(columnSpec.end());
            }
        }

        List<List<String>> rows = splitRows(render(body));
        return new CommandRewriter.Replacement(format(environment, rows), bounds[1]);
    }

    /**
     * 返回 {主体结束位置, 结束标记之后的位置}，处理同名嵌套；缺少结束标记时主体延伸到输入末尾。
     */
    private static int[] findEnd(String text, int from, String environment) {
        String beginMarker = "\\begin{" + environment + "}";
        String endMarker = "\\end{" + environment + "}";
        int depth = 1;
        int cursor = from;
        while (cursor < text.length()) {
            int nextBegin = text.indexOf(beginMarker, cursor);
            int nextEnd = text.indexOf(endMarker, cursor);
            if (nextEnd < 0) {
                break;
            }
            if (nextBegin >= 0 && nextBegin < nextEnd) {
                depth++;
                cursor = nextBegin + beginMarker.length();
                continue;
            }
            depth--;
            if (depth == 0) {
                return new int[] {nextEnd, nextEnd + endMarker.length()};
            }
            cursor = nextEnd + endMarker.length();
        }
        return new int[] {text.length(), text.length()};
    }

    /**
     * 在花括号深度为零处按 \\ 分行、按 & 分列。
     */
    private static List<List<String>> splitRows(String body) {
        List<List<String>> rows = new ArrayList<>();
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        int depth = 0;
        int index = 0;
        while (index < body.length()) {
            char currentChar = body.charAt(index);
            if (currentChar == '\\') {
                if (depth == 0 && index + 1 < body.length() && body.charAt(index + 1) == '\\') {
                    cells.add(cell.toString().trim());
                    cell.setLength(0);
                    addRow(rows, cells);
                    cells = new ArrayList<>();
                    index += 2;
                    continue;
                }
                int width = BraceGroups.escapeWidth(body, index);
                cell.append(body, index, index + width);
                index += width;
                continue;
            }
            if (currentChar == '{') {
                depth++;
            } else if (currentChar == '}') {
                depth--;
            } else if (currentChar == '&' && depth <= 0) {
                cells.add(cell.toString().trim());
                cell.setLength(0);
                index++;
                continue;
            }
            cell.append(currentChar);
            index++;
        }
        cells.add(cell.toString().trim());
        addRow(rows, cells);
        return rows;
    }

    private static void addRow(List<List<String>> rows, List<String> cells) {
        boolean blank = cells.stream().allMatch(String::isEmpty);
        if (!blank) {
            rows.add(cells);
        }
    }

    private static String format(String environment, List<List<String>> rows) {
        if ("cases".equals(environment)) {
            return Sentinels.OPEN_BRACE + joinRows(rows, ", ") + Sentinels.CLOSE_BRACE;
        }
        if (BRACKET_ENVIRONMENTS.contains(environment)) {
            return "[" + joinRows(rows, " ") + "]";
        }
        if (BAR_ENVIRONMENTS.contains(environment)) {
            return "|" + joinRows(rows, " ") + "|";
        }
        return joinRows(rows, " ");
    }

    private static String joinRows(List<List<String>> rows, String cellSeparator) {
        return rows.stream()
            .map(cells -> cells.stream().filter(cell -> !cell.isEmpty()).collect(Collectors.joining(cellSeparator)))
            .collect(Collectors.joining("; "));
    }
}

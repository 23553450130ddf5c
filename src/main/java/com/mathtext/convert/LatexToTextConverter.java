package com.mathtext.convert;

import com.mathtext.lex.BraceGroups;
import com.mathtext.lex.LatexLexer;
import com.mathtext.lex.LexToken;
import com.mathtext.lex.TokenType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * 把规范化后的数学内容转换为 Unicode 纯文本近似。
 *
 * 各阶段顺序固定且互相依赖：定界符、包装命令、分数、根号、上下标、希腊字母、运算符、矩阵、兜底清理、空白整理。
 * 转换器无状态，可被多个线程共享。
 */
public class LatexToTextConverter {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    /** 无需再加括号的分子分母：单个词、数字或命令 */
    private static final Pattern ATOMIC_OPERAND = Pattern.compile("[\\p{L}\\p{N}.]+|\\\\[A-Za-z]+");

    /** 无法识别的转义符号默认输出其字符本身 */
    private static final Map<Character, String> ESCAPED_SYMBOLS = Map.ofEntries(
        Map.entry('{', String.valueOf(Sentinels.OPEN_BRACE)),
        Map.entry('}', String.valueOf(Sentinels.CLOSE_BRACE)),
        Map.entry(',', " "),
        Map.entry(':', " "),
        Map.entry(';', " "),
        Map.entry('>', " "),
        Map.entry(' ', " "),
        Map.entry('!', ""),
        Map.entry('|', "‖")
    );

    private final LatexLexer lexer = new LatexLexer();

    private final List<UnaryOperator<String>> stages = List.of(
        this::stripDelimiters,
        LatexToTextConverter::unwrapWrappers,
        LatexToTextConverter::resolveFractions,
        LatexToTextConverter::resolveRoots,
        LatexToTextConverter::resolveScripts,
        LatexToTextConverter::replaceGreek,
        LatexToTextConverter::replaceOperators,
        MatrixRenderer::render,
        this::catchAll,
        LatexToTextConverter::cleanup
    );

    /**
     * 转换数学内容，null 或空内容返回空串。
     */
    public String convert(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String current = Sentinels.strip(content);
        for (UnaryOperator<String> stage : stages) {
            current = stage.apply(current);
        }
        return current;
    }

    /**
     * 返回内容中不在任何转换表中的命令名，按出现顺序。
     */
    public Set<String> unknownCommands(String content) {
        Set<String> unknown = new LinkedHashSet<>();
        for (LexToken token : lexer.tokenize(content)) {
            if (token.type() == TokenType.COMMAND && !SymbolTables.isKnownCommand(token.commandName())) {
                unknown.add(token.commandName());
            }
        }
        return unknown;
    }

    // ==================== 1. 定界符 ====================
    private String stripDelimiters(String text) {
        if (text.indexOf('\\') < 0 && text.indexOf('$') < 0) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (LexToken token : lexer.tokenize(text)) {
            boolean delimiter = token.isEscaped('(') || token.isEscaped(')')
                || token.isEscaped('[') || token.isEscaped(']')
                || (token.type() == TokenType.TEXT && "$".equals(token.value()));
            if (!delimiter) {
                builder.append(token.value());
            }
        }
        return builder.toString();
    }

    // ==================== 2. 包装命令与重音 ====================
    private static String unwrapWrappers(String text) {
        return CommandRewriter.rewrite(text,
            name -> SymbolTables.TEXT_WRAPPERS.contains(name)
                || SymbolTables.ACCENTS.containsKey(name)
                || "mathbb".equals(name),
            (source, name, afterName) -> {
                BraceGroups.Argument argument = BraceGroups.readArgument(source, afterName);
                if (argument == null) {
                    return new CommandRewriter.Replacement("", afterName);
                }
                String inner = unwrapWrappers(argument.content());
                if ("mathbb".equals(name)) {
                    return new CommandRewriter.Replacement(doubleStruck(inner), argument.end());
                }
                String accent = SymbolTables.ACCENTS.get(name);
                if (accent != null) {
                    return new CommandRewriter.Replacement(inner.isEmpty() ? "" : inner + accent, argument.end());
                }
                return new CommandRewriter.Replacement(inner, argument.end());
            });
    }

    private static String doubleStruck(String content) {
        StringBuilder builder = new StringBuilder(content.length());
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            builder.append(SymbolTables.DOUBLE_STRUCK.getOrDefault(ch, String.valueOf(ch)));
        }
        return builder.toString();
    }

    // ==================== 3. 分数与组合数 ====================
    private static String resolveFractions(String text) {
        return CommandRewriter.rewrite(text,
            name -> SymbolTables.FRACTIONS.contains(name) || "binom".equals(name),
            (source, name, afterName) -> {
                BraceGroups.Argument first = BraceGroups.readArgument(source, afterName);
                if (first == null) {
                    return new CommandRewriter.Replacement("", afterName);
                }
                BraceGroups.Argument second = BraceGroups.readArgument(source, first.end());
                String upper = resolveFractions(first.content()).trim();
                String lower = second == null ? "" : resolveFractions(second.content()).trim();
                int end = second == null ? first.end() : second.end();
                if ("binom".equals(name)) {
                    return new CommandRewriter.Replacement("C(" + upper + "," + lower + ")", end);
                }
                if (second == null) {
                    return new CommandRewriter.Replacement(upper, end);
                }
                return new CommandRewriter.Replacement("(" + group(upper) + "/" + group(lower) + ")", end);
            });
    }

    /**
     * 复合的分子分母加括号，保证 a+b 作分子时读作 (a+b)/c。
     */
    private static String group(String operand) {
        if (operand.isEmpty() || ATOMIC_OPERAND.matcher(operand).matches() || isParenthesized(operand)) {
            return operand;
        }
        return "(" + operand + ")";
    }

    private static boolean isParenthesized(String operand) {
        if (operand.charAt(0) != '(' || operand.charAt(operand.length() - 1) != ')') {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < operand.length(); i++) {
            char ch = operand.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0 && i < operand.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    // ==================== 4. 根号 ====================
    private static String resolveRoots(String text) {
        return CommandRewriter.rewrite(text, "sqrt"::equals, (source, name, afterName) -> {
            BraceGroups.Argument index = BraceGroups.readOptionalArgument(source, afterName);
            int radicandFrom = index == null ? afterName : index.end();
            BraceGroups.Argument radicand = BraceGroups.readArgument(source, radicandFrom);
            if (radicand == null) {
                return new CommandRewriter.Replacement("√", radicandFrom);
            }
            String inner = resolveRoots(radicand.content()).trim();
            String degree = index == null ? "" : index.content().trim();
            return new CommandRewriter.Replacement(formatRoot(degree, inner), radicand.end());
        });
    }

    private static String formatRoot(String degree, String inner) {
        if (degree.isEmpty() || "2".equals(degree)) {
            return "√(" + inner + ")";
        }
        if ("3".equals(degree)) {
            return "∛(" + inner + ")";
        }
        if ("4".equals(degree)) {
            return "∜(" + inner + ")";
        }
        String superscript = ScriptGlyphs.toSuperscript(degree);
        if (superscript != null) {
            return superscript + "√(" + inner + ")";
        }
        return "(" + inner + ")" + Sentinels.CARET + "(1/" + degree + ")";
    }

    // ==================== 5. 上下标 ====================
    private static String resolveScripts(String text) {
        if (text.indexOf('^') < 0 && text.indexOf('_') < 0) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length());
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar == '\\') {
                int width = BraceGroups.escapeWidth(text, index);
                builder.append(text, index, index + width);
                index += width;
                continue;
            }
            if (currentChar != '^' && currentChar != '_') {
                builder.append(currentChar);
                index++;
                continue;
            }

            BraceGroups.Argument argument = BraceGroups.readArgument(text, index + 1);
            if (argument == null) {
                builder.append(currentChar);
                index++;
                continue;
            }
            builder.append(formatScript(currentChar == '^', argument));
            index = argument.end();
        }
        return builder.toString();
    }

    private static String formatScript(boolean superscript, BraceGroups.Argument argument) {
        String compact = WHITESPACE_RUN.matcher(argument.content()).replaceAll("");
        if (superscript && ("\\circ".equals(compact) || "\\degree".equals(compact))) {
            return "°";
        }
        if (superscript && "\\prime".equals(compact)) {
            return "′";
        }
        if (compact.isEmpty()) {
            return "";
        }

        String glyphs = superscript ? ScriptGlyphs.toSuperscript(compact) : ScriptGlyphs.toSubscript(compact);
        if (glyphs != null) {
            return glyphs;
        }
        String marker = superscript ? "^" : "_";
        String inner = resolveScripts(argument.content().trim());
        if (argument.braced() && inner.codePointCount(0, inner.length()) > 1) {
            return marker + "(" + inner + ")";
        }
        return marker + inner;
    }

    // ==================== 6. 希腊字母 ====================
    private static String replaceGreek(String text) {
        return CommandRewriter.rewrite(text, SymbolTables.GREEK::containsKey,
            (source, name, afterName) -> new CommandRewriter.Replacement(
                SymbolTables.GREEK.get(name).replacement(), afterName));
    }

    // ==================== 7. 运算符、函数名与间距 ====================
    private static String replaceOperators(String text) {
        return CommandRewriter.rewrite(text,
            name -> SymbolTables.lookup(name) != null || "not".equals(name),
            (source, name, afterName) -> {
                if ("not".equals(name)) {
                    boolean negatesEquals = afterName < source.length() && source.charAt(afterName) == '=';
                    return negatesEquals
                        ? new CommandRewriter.Replacement("≠", afterName + 1)
                        : new CommandRewriter.Replacement("", afterName);
                }
                ConversionRule rule = SymbolTables.lookup(name);
                if (("left".equals(name) || "right".equals(name) || name.startsWith("big") || name.startsWith("Big"))
                    && afterName < source.length() && source.charAt(afterName) == '.') {
                    return new CommandRewriter.Replacement("", afterName + 1);
                }
                if (rule.category() == ConversionCategory.FUNCTION
                    && afterName < source.length() && Character.isLetter(source.charAt(afterName))) {
                    return new CommandRewriter.Replacement(rule.replacement() + " ", afterName);
                }
                return new CommandRewriter.Replacement(rule.replacement(), afterName);
            });
    }

    // ==================== 9. 兜底清理 ====================
    private String catchAll(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (LexToken token : lexer.tokenize(text)) {
            switch (token.type()) {
                case COMMAND, DANGLING_BACKSLASH -> {
                    // 未知命令只保留其参数
                }
                case LINE_BREAK -> builder.append(' ');
                case ESCAPED_SYMBOL -> {
                    char symbol = token.value().charAt(1);
                    builder.append(ESCAPED_SYMBOLS.getOrDefault(symbol, token.value().substring(1)));
                }
                case TEXT -> {
                    String value = token.value();
                    builder.append("&".equals(value) || "~".equals(value) ? " " : value);
                }
                default -> builder.append(token.value());
            }
        }
        return builder.toString();
    }

    // ==================== 10. 整理 ====================
    private static String cleanup(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '{' || ch == '}') {
                continue;
            }
            builder.append(Sentinels.restore(ch));
        }
        return WHITESPACE_RUN.matcher(builder).replaceAll(" ").trim();
    }
}

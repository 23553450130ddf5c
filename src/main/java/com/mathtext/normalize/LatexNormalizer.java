package com.mathtext.normalize;

import com.mathtext.lex.LatexLexer;
import com.mathtext.lex.LexToken;
import com.mathtext.lex.TokenType;
import com.mathtext.model.MarkupIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 修复单个数学片段内容的规范化器。
 *
 * 规则按固定顺序执行并重复到结果稳定，因此对任意输入都满足 normalize(normalize(x)) == normalize(x)。
 */
public class LatexNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(LatexNormalizer.class);

    /** 规则链重复执行的上限 */
    private static final int MAX_ROUNDS = 8;

    /** 已知会丢失反斜杠的命令 */
    private static final Set<String> COMMAND_CATALOGUE = Set.of(
        "frac", "dfrac", "tfrac", "sqrt", "mathrm", "mathbf", "mathit", "mathbb", "mathcal", "mathsf",
        "text", "textbf", "textit", "textrm", "operatorname", "vec", "hat", "bar", "overline", "underline",
        "tilde", "dot", "ddot", "ce", "boxed", "overrightarrow"
    );

    /** 命令首字母也丢失后剩下的词干 */
    private static final Map<String, String> COMMAND_STEMS = Map.of(
        "rac", "frac",
        "ext", "text",
        "extbf", "textbf",
        "extit", "textit",
        "extrm", "textrm",
        "ilde", "tilde",
        "athrm", "mathrm",
        "oxed", "boxed"
    );

    private static final Pattern BARE_COMMAND = Pattern.compile("(?<![\\\\A-Za-z])([A-Za-z]+)(?=[{\\[])");

    /** JSON 解码把 \f \b \t \r 变成控制字符后残留的命令词干 */
    private static final List<Map.Entry<Pattern, String>> CONTROL_ESCAPES = List.of(
        Map.entry(Pattern.compile("\f(rac|orall)(?![A-Za-z])"), "\\\\f$1"),
        Map.entry(Pattern.compile("\b(eta|ar|egin|oxed|inom)(?![A-Za-z])"), "\\\\b$1"),
        Map.entry(Pattern.compile("\t(extbf|ext|imes|heta|an|au|ilde|frac|riangle)(?![A-Za-z])"), "\\\\t$1"),
        Map.entry(Pattern.compile("\r(ightarrow|ho|ight)(?![A-Za-z])"), "\\\\r$1")
    );

    private static final Pattern EMPTY_GROUP = Pattern.compile("(?<!\\\\)[_^]\\{[\\s\\p{Cntrl}]*\\}");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\p{Cntrl}]+");
    private static final Pattern OPEN_ARGUMENT_AT_END = Pattern.compile("\\\\[A-Za-z]+\\s*\\{\\s*$");

    private static final List<NormalizationRule> RULES = List.of(
        new NormalizationRule("control-escape", RuleCategory.CONTROL_ESCAPE_REPAIR,
            LatexNormalizer::containsControl, LatexNormalizer::repairControlEscapes),
        new NormalizationRule("truncated-command", RuleCategory.COMMAND_REPAIR,
            content -> content.indexOf('{') >= 0 || content.indexOf('[') >= 0, LatexNormalizer::repairCommands),
        new NormalizationRule("chemistry", RuleCategory.CHEMISTRY_NOTATION,
            ChemistryNotation::containsChemistry, ChemistryNotation::rewrite),
        new NormalizationRule("delimiter-strip", RuleCategory.DELIMITER_STRIP,
            content -> content.indexOf('\\') >= 0, LatexNormalizer::stripDelimiters),
        new NormalizationRule("brace-balance", RuleCategory.BRACE_BALANCE,
            content -> content.indexOf('{') >= 0 || content.indexOf('}') >= 0, LatexNormalizer::balanceBraces),
        new NormalizationRule("empty-group", RuleCategory.EMPTY_GROUP_REMOVAL,
            content -> content.indexOf('_') >= 0 || content.indexOf('^') >= 0, LatexNormalizer::removeEmptyGroups),
        new NormalizationRule("whitespace", RuleCategory.WHITESPACE_CLEANUP,
            content -> !content.isEmpty(), LatexNormalizer::cleanWhitespace)
    );

    private final LatexLexer lexer = new LatexLexer();

    /**
     * 返回规范化后的内容。
     */
    public String normalize(String content) {
        return repair(content).content();
    }

    /**
     * 规范化并报告修复过的问题类别。
     */
    public NormalizationResult repair(String content) {
        if (content == null || content.isEmpty()) {
            return new NormalizationResult("", Set.of());
        }

        Set<MarkupIssue> issues = EnumSet.noneOf(MarkupIssue.class);
        String current = content;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            String before = current;
            for (NormalizationRule rule : RULES) {
                String repaired = rule.apply(current);
                if (!repaired.equals(current)) {
                    MarkupIssue issue = rule.category().issue();
                    if (issue != null) {
                        issues.add(issue);
                    }
                    logger.debug("规则 {} 修改了内容: {} -> {}", rule.name(), current, repaired);
                    current = repaired;
                }
            }
            if (current.equals(before)) {
                break;
            }
        }
        return new NormalizationResult(current, issues);
    }

    /**
     * 粗略判断内容能否交给排版组件：空白、括号不配对、三个连续反斜杠或结尾处未填参数的命令都视为无效。
     */
    public boolean isLikelyValid(String content) {
        if (content == null || content.isBlank()) {
            return false;
        }
        if (content.contains("\\\\\\")) {
            return false;
        }
        if (OPEN_ARGUMENT_AT_END.matcher(content).find()) {
            return false;
        }

        int depth = 0;
        for (LexToken token : lexer.tokenize(content)) {
            if (token.type() == TokenType.OPEN_BRACE) {
                depth++;
            } else if (token.type() == TokenType.CLOSE_BRACE) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    public static List<NormalizationRule> rules() {
        return RULES;
    }

    /**
     * 所有词干与完整命令名，供测试与转换器参考。
     */
    public static Set<String> repairableNames() {
        return Stream.concat(COMMAND_CATALOGUE.stream(), COMMAND_STEMS.keySet().stream())
            .collect(Collectors.toUnmodifiableSet());
    }

    private static boolean containsControl(String content) {
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            if (ch == '\f' || ch == '\b' || ch == '\t' || ch == '\r') {
                return true;
            }
        }
        return false;
    }

    private static String repairControlEscapes(String content) {
        String result = content;
        for (Map.Entry<Pattern, String> escape : CONTROL_ESCAPES) {
            result = escape.getKey().matcher(result).replaceAll(escape.getValue());
        }
        return result;
    }

    /**
     * 去掉内容中多余的 \( \) \[ \] 以及末尾孤立的反斜杠。
     */
    private static String stripDelimiters(String content) {
        List<LexToken> tokens = new LatexLexer().tokenize(content);
        StringBuilder builder = new StringBuilder(content.length());
        for (LexToken token : tokens) {
            boolean delimiter = token.isEscaped('(') || token.isEscaped(')')
                || token.isEscaped('[') || token.isEscaped(']');
            if (delimiter || token.type() == TokenType.DANGLING_BACKSLASH) {
                continue;
            }
            builder.append(token.value());
        }
        return builder.toString();
    }

    /**
     * 丢弃深度为零时出现的右括号，并在末尾补齐缺失的右括号。
     */
    private static String balanceBraces(String content) {
        List<LexToken> tokens = new LatexLexer().tokenize(content);
        StringBuilder builder = new StringBuilder(content.length() + 4);
        int depth = 0;
        int dropped = 0;
        for (LexToken token : tokens) {
            if (token.type() == TokenType.OPEN_BRACE) {
                depth++;
            } else if (token.type() == TokenType.CLOSE_BRACE) {
                if (depth == 0) {
                    dropped++;
                    continue;
                }
                depth--;
            }
            builder.append(token.value());
        }
        if (dropped > 0 || depth > 0) {
            logger.debug("花括号修复: 丢弃{}个多余右括号, 补齐{}个右括号", dropped, depth);
        }
        builder.append("}".repeat(depth));
        return builder.toString();
    }

    /**
     * 仅在名字紧跟 '{'（sqrt 也可跟 '['）且前面不是反斜杠或字母时补回反斜杠。
     */
    private static String repairCommands(String content) {
        Matcher matcher = BARE_COMMAND.matcher(content);
        StringBuilder builder = new StringBuilder(content.length() + 8);
        while (matcher.find()) {
            String name = matcher.group(1);
            String command = COMMAND_STEMS.getOrDefault(name, COMMAND_CATALOGUE.contains(name) ? name : null);
            char next = content.charAt(matcher.end());
            if (command == null || (next == '[' && !"sqrt".equals(command))) {
                matcher.appendReplacement(builder, Matcher.quoteReplacement(name));
                continue;
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement("\\" + command));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String removeEmptyGroups(String content) {
        String current = content;
        String previous;
        do {
            previous = current;
            current = EMPTY_GROUP.matcher(current).replaceAll("");
        } while (!current.equals(previous));
        return current;
    }

    /**
     * 合并空白与控制字符，去掉首尾空白；末尾的转义空格保留。
     */
    private static String cleanWhitespace(String content) {
        String collapsed = WHITESPACE_RUN.matcher(content).replaceAll(" ");
        int start = 0;
        while (start < collapsed.length() && collapsed.charAt(start) == ' ') {
            start++;
        }
        int end = collapsed.length();
        while (end > start && collapsed.charAt(end - 1) == ' ') {
            end--;
        }
        String trimmed = collapsed.substring(start, end);
        if (end < collapsed.length() && endsWithOddBackslashes(trimmed)) {
            return trimmed + " ";
        }
        return trimmed;
    }

    private static boolean endsWithOddBackslashes(String text) {
        int count = 0;
        int index = text.length() - 1;
        while (index >= 0 && text.charAt(index) == '\\') {
            count++;
            index--;
        }
        return count % 2 == 1;
    }
}

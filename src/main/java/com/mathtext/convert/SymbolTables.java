package com.mathtext.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 渲染与分享共用的符号表。
 *
 * 所有表在类初始化时构建，之后只读。
 */
public final class SymbolTables {

    private SymbolTables() {
        // 工具类，禁止实例化
    }

    // ==================== 希腊字母 ====================
    public static final Map<String, ConversionRule> GREEK = table(ConversionCategory.GREEK,
        "alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ", "epsilon", "ε", "varepsilon", "ε",
        "zeta", "ζ", "eta", "η", "theta", "θ", "vartheta", "ϑ", "iota", "ι", "kappa", "κ",
        "lambda", "λ", "mu", "μ", "nu", "ν", "xi", "ξ", "omicron", "ο", "pi", "π", "varpi", "ϖ",
        "rho", "ρ", "varrho", "ϱ", "sigma", "σ", "varsigma", "ς", "tau", "τ", "upsilon", "υ",
        "phi", "φ", "varphi", "φ", "chi", "χ", "psi", "ψ", "omega", "ω",
        "Gamma", "Γ", "Delta", "Δ", "Theta", "Θ", "Lambda", "Λ", "Xi", "Ξ", "Pi", "Π",
        "Sigma", "Σ", "Upsilon", "Υ", "Phi", "Φ", "Psi", "Ψ", "Omega", "Ω"
    );

    // ==================== 运算符与关系 ====================
    public static final Map<String, ConversionRule> OPERATORS = table(ConversionCategory.OPERATOR,
        "times", "×", "div", "÷", "pm", "±", "mp", "∓", "cdot", "·", "ast", "∗", "star", "⋆",
        "circ", "∘", "bullet", "•", "oplus", "⊕", "otimes", "⊗",
        "leq", "≤", "le", "≤", "geq", "≥", "ge", "≥", "neq", "≠", "ne", "≠", "approx", "≈",
        "equiv", "≡", "sim", "∼", "simeq", "≃", "cong", "≅", "propto", "∝", "ll", "≪", "gg", "≫",
        "infty", "∞", "partial", "∂", "nabla", "∇", "degree", "°", "angle", "∠", "perp", "⊥",
        "parallel", "∥", "triangle", "△", "prime", "′", "hbar", "ℏ", "ell", "ℓ",
        "to", "→", "rightarrow", "→", "leftarrow", "←", "leftrightarrow", "↔",
        "Rightarrow", "⇒", "Leftarrow", "⇐", "Leftrightarrow", "⇔", "implies", "⇒", "iff", "⇔",
        "longrightarrow", "⟶", "longleftarrow", "⟵", "mapsto", "↦", "uparrow", "↑", "downarrow", "↓",
        "rightleftharpoons", "⇌", "leftrightarrows", "⇄",
        "in", "∈", "notin", "∉", "ni", "∋", "subset", "⊂", "supset", "⊃", "subseteq", "⊆",
        "supseteq", "⊇", "cup", "∪", "cap", "∩", "emptyset", "∅", "varnothing", "∅", "setminus", "∖",
        "forall", "∀", "exists", "∃", "neg", "¬", "lnot", "¬", "land", "∧", "wedge", "∧",
        "lor", "∨", "vee", "∨", "therefore", "∴", "because", "∵",
        "ldots", "…", "cdots", "⋯", "dots", "…", "vdots", "⋮", "ddots", "⋱",
        "langle", "⟨", "rangle", "⟩", "lfloor", "⌊", "rfloor", "⌋", "lceil", "⌈", "rceil", "⌉",
        "vert", "|", "mid", "|", "Vert", "‖"
    );

    // ==================== 大型运算符 ====================
    public static final Map<String, ConversionRule> BIG_OPERATORS = table(ConversionCategory.BIG_OPERATOR,
        "sum", "Σ", "prod", "Π", "coprod", "∐", "int", "∫", "iint", "∬", "iiint", "∭", "oint", "∮",
        "bigcup", "⋃", "bigcap", "⋂"
    );

    // ==================== 函数名 ====================
    public static final Map<String, ConversionRule> FUNCTION_NAMES = table(ConversionCategory.FUNCTION,
        "sin", "sin", "cos", "cos", "tan", "tan", "cot", "cot", "sec", "sec", "csc", "csc",
        "arcsin", "arcsin", "arccos", "arccos", "arctan", "arctan", "sinh", "sinh", "cosh", "cosh",
        "tanh", "tanh", "log", "log", "ln", "ln", "lg", "lg", "exp", "exp", "lim", "lim",
        "max", "max", "min", "min", "sup", "sup", "inf", "inf", "det", "det", "gcd", "gcd",
        "deg", "deg", "dim", "dim", "ker", "ker", "arg", "arg", "mod", "mod", "bmod", "mod"
    );

    // ==================== 间距与排版指令 ====================
    public static final Map<String, ConversionRule> SPACING = table(ConversionCategory.SPACING,
        "quad", " ", "qquad", " ", "enspace", " ", "thinspace", " ", "space", " ",
        "left", "", "right", "", "displaystyle", "", "textstyle", "", "scriptstyle", "",
        "limits", "", "nolimits", "", "big", "", "Big", "", "bigg", "", "Bigg", "",
        "bigl", "", "bigr", "", "Bigl", "", "Bigr", "", "biggl", "", "biggr", "", "middle", "",
        "centering", "", "nonumber", "", "notag", ""
    );

    // ==================== 结构性命令 ====================
    public static final Set<String> TEXT_WRAPPERS = Set.of(
        "text", "mathrm", "textrm", "textbf", "textit", "mathbf", "mathit", "mathsf", "mathtt",
        "operatorname", "mbox", "boldsymbol", "mathcal", "textsf", "texttt", "emph", "boxed", "underline"
    );

    /** 重音命令及其追加的组合字符 */
    public static final Map<String, String> ACCENTS = Map.of(
        "vec", "\u20D7",
        "overrightarrow", "\u20D7",
        "hat", "\u0302",
        "widehat", "\u0302",
        "bar", "\u0304",
        "overline", "\u0305",
        "dot", "\u0307",
        "ddot", "\u0308",
        "tilde", "\u0303",
        "widetilde", "\u0303"
    );

    public static final Map<Character, String> DOUBLE_STRUCK = Map.of(
        'R', "ℝ", 'N', "ℕ", 'Z', "ℤ", 'Q', "ℚ", 'C', "ℂ", 'P', "ℙ", 'H', "ℍ"
    );

    public static final Set<String> FRACTIONS = Set.of("frac", "dfrac", "tfrac", "cfrac");

    public static final Set<String> STRUCTURAL = Set.of(
        "mathbb", "binom", "sqrt", "begin", "end", "not"
    );

    private static final Map<String, ConversionRule> SYMBOLS = merge(
        List.of(GREEK, OPERATORS, BIG_OPERATORS, FUNCTION_NAMES, SPACING));

    /**
     * 按命令名（不含反斜杠）查找符号规则，没有时返回 null。
     */
    public static ConversionRule lookup(String commandName) {
        return SYMBOLS.get(commandName);
    }

    /**
     * 命令是否在任一转换表或结构性命令集中。
     */
    public static boolean isKnownCommand(String commandName) {
        return SYMBOLS.containsKey(commandName)
            || TEXT_WRAPPERS.contains(commandName)
            || ACCENTS.containsKey(commandName)
            || FRACTIONS.contains(commandName)
            || STRUCTURAL.contains(commandName);
    }

    private static Map<String, ConversionRule> table(ConversionCategory category, String... pairs) {
        Map<String, ConversionRule> rules = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            rules.put(pairs[i], new ConversionRule("\\" + pairs[i], pairs[i + 1], category));
        }
        return Collections.unmodifiableMap(rules);
    }

    private static Map<String, ConversionRule> merge(List<Map<String, ConversionRule>> tables) {
        Map<String, ConversionRule> merged = new LinkedHashMap<>();
        for (Map<String, ConversionRule> table : tables) {
            for (Map.Entry<String, ConversionRule> entry : table.entrySet()) {
                merged.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(merged);
    }
}

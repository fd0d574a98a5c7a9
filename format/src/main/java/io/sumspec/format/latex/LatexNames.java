// file: format/src/main/java/io/sumspec/format/latex/LatexNames.java
package io.sumspec.format.latex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of identifiers and symbolic sizes to LaTeX math.
 * <p>
 * Underscores become math subscripts outside {@code \textsf{}}, single
 * letters stay in math mode, words go into {@code \text{}}.
 */
final class LatexNames {

    private static final Pattern SINGLE_LETTER_SUB = Pattern.compile("[A-Z]_[a-z0-9]+");
    private static final Pattern QUALIFIED = Pattern.compile("([^(]+)\\((.+)\\)");
    private static final Pattern TRAILING_SUB = Pattern.compile("(.+?)_([a-z0-9])");
    private static final Pattern WORD_SUB = Pattern.compile("([a-z]+)_([a-z0-9])");
    private static final Pattern PARAM = Pattern.compile("([A-Za-z])_([a-z0-9]+)");
    private static final Pattern PARAM_IN_TEXT = Pattern.compile("([A-Za-z])_([a-z][a-z0-9]*)");
    private static final Pattern SUPERSCRIPT = Pattern.compile("(.+)\\^(\\(.+\\))");
    private static final Pattern LABEL_PARAM = Pattern.compile("([A-Z])_([a-z][a-z0-9]*)");
    private static final Pattern LOG2 = Pattern.compile("log2\\(([^)]+)\\)");
    private static final Pattern MULTI_DIGIT_EXP = Pattern.compile("\\^(\\d{2,})");

    private static final String[][] UNICODE = {
            {"γ", "\\gamma "},
            {"τ", "\\tau "},
            {"·", "\\cdot "},
            {"∪", "\\cup "},
            {"∈", "\\in "},
            {"Σ", "\\sum"},
            {"Π", "\\prod"},
    };

    private LatexNames() {
        // utility
    }

    /** {@code Ra_j} → {@code \textsf{Ra}_{j}}, {@code OpFlags(Load)} → {@code \textsf{OpFlags}(\text{Load})}. */
    static String poly(String name) {
        if (SINGLE_LETTER_SUB.matcher(name).matches()) return name;
        Matcher q = QUALIFIED.matcher(name);
        if (q.matches()) {
            return base(q.group(1)) + "(" + qualifier(q.group(2)) + ")";
        }
        return base(name);
    }

    /** {@code eq} → {@code \widetilde{\text{eq}}}; {@code X_tilde} → {@code \widetilde{X}}. */
    static String verifier(String name) {
        if (name.equals("eq")) return "\\widetilde{\\text{eq}}";
        if (name.startsWith("eq_")) return "\\widetilde{\\text{eq}}_{" + name.substring(3) + "}";
        if (name.endsWith("_tilde")) {
            return "\\widetilde{" + poly(name.substring(0, name.length() - "_tilde".length())) + "}";
        }
        return poly(name);
    }

    /** {@code K_ram} → {@code K_{\text{ram}}}, {@code d_v} → {@code d_v}. */
    static String param(String s) {
        Matcher m = PARAM.matcher(s);
        if (!m.matches()) return s;
        String sub = m.group(2);
        return sub.length() == 1 ? m.group(1) + "_" + sub : m.group(1) + "_{\\text{" + sub + "}}";
    }

    /** Challenge label: {@code K_instr^(i)} → {@code K_{\text{instr}}^{(i)}}, {@code cycle} → {@code \text{cycle}}. */
    static String challengeLabel(String label) {
        String sup = "";
        Matcher s = SUPERSCRIPT.matcher(label);
        if (s.matches()) {
            label = s.group(1);
            sup = "^{" + s.group(2) + "}";
        }
        Matcher p = LABEL_PARAM.matcher(label);
        if (p.matches()) {
            String sub = p.group(2);
            return (sub.length() == 1 ? p.group(1) + "_" + sub : p.group(1) + "_{\\text{" + sub + "}}") + sup;
        }
        if (label.matches("[A-Z]")) return label + sup;
        Matcher w = WORD_SUB.matcher(label);
        if (w.matches()) return "\\text{" + w.group(1) + "}_{" + w.group(2) + "}" + sup;
        return "\\text{" + escape(label) + "}" + sup;
    }

    /** Round/size expression: {@code log2(T) + log2(K_ram)} → {@code \log_2 T + \log_2 K_{\text{ram}}}. */
    static String dimension(String s) {
        Matcher m = LOG2.matcher(s);
        var out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement("\\log_2 " + param(m.group(1))));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Range note: {@code i=0..d_ram-1} → {@code i=0,\ldots,d_{\text{ram}}-1}. */
    static String range(String clause) {
        Matcher m = PARAM_IN_TEXT.matcher(clause.replace("..", ",\\ldots,"));
        var out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(param(m.group())));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Symbolic constant: Unicode operators to commands, multi-digit exponents braced. */
    static String constant(String value) {
        String s = value;
        for (String[] r : UNICODE) {
            s = s.replace(r[0], r[1]);
        }
        s = s.replace("\\gamma ^", "\\gamma^").replace("\\gamma _", "\\gamma_")
                .replace("\\tau _", "\\tau_").replace("\\tau ^", "\\tau^");
        return MULTI_DIGIT_EXP.matcher(s).replaceAll("^{$1}").strip();
    }

    /** Escape LaTeX specials in running text. */
    static String escape(String text) {
        var out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\textbackslash{}");
                case '&', '%', '$', '#', '_', '{', '}' -> out.append('\\').append(c);
                case '~' -> out.append("\\textasciitilde{}");
                case '^' -> out.append("\\textasciicircum{}");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    // ---------- helpers ----------

    private static String base(String name) {
        Matcher m = TRAILING_SUB.matcher(name);
        if (m.matches()) return "\\textsf{" + m.group(1) + "}_{" + m.group(2) + "}";
        return "\\textsf{" + name.replace("_", "\\_") + "}";
    }

    private static String qualifier(String q) {
        if (q.matches("[a-z]")) return q;
        Matcher m = WORD_SUB.matcher(q);
        if (m.matches()) return "\\text{" + m.group(1) + "}_{" + m.group(2) + "}";
        return "\\text{" + q + "}";
    }
}

// file: format/src/main/java/io/sumspec/format/html/HtmlFormat.java
package io.sumspec.format.html;

import io.sumspec.format.Binder;
import io.sumspec.format.Fragment;
import io.sumspec.format.InfixFormat;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structured HTML: polynomials are {@code <span class="poly cp|vp|vr">},
 * variables {@code <var>}, indices {@code <sub>}/{@code <sup>}. All input
 * text is escaped, so fragments can be embedded in any element body.
 */
public final class HtmlFormat extends InfixFormat {

    public static final HtmlFormat INSTANCE = new HtmlFormat();

    private static final Pattern BRACED_EXP = Pattern.compile("\\^\\{([^}]*)\\}");
    private static final Pattern PLAIN_EXP = Pattern.compile("\\^([A-Za-z0-9]+)");
    private static final Pattern BRACED_SUB = Pattern.compile("_\\{([^}]*)\\}");
    private static final Pattern PLAIN_SUB = Pattern.compile("_([A-Za-z0-9]+)");

    @Override
    public String name() {
        return "html";
    }

    @Override
    public Fragment constant(String value) {
        return constantFragment(Html.tag("span", "const", scripts(Html.escape(value))), value);
    }

    @Override
    public Fragment variable(String name) {
        return Fragment.atom(identifier(name));
    }

    @Override
    public Fragment challenge(int stage, String label) {
        return Fragment.atom("<var>r</var><sub>" + Html.escape(label) + "</sub><sup>(" + stage + ")</sup>");
    }

    @Override
    public Fragment opening(List<Fragment> components) {
        if (components.isEmpty()) return Fragment.atom("");
        return Fragment.atom(components.stream().map(Fragment::text).collect(Collectors.joining(", ", "(", ")")));
    }

    @Override
    public Fragment committed(String name, Fragment point) {
        return Fragment.atom(poly("cp", name) + point.text());
    }

    @Override
    public Fragment virtual(String name, Fragment point) {
        return Fragment.atom(poly("vp", name) + point.text());
    }

    @Override
    public Fragment verifier(String name, Fragment point) {
        return Fragment.atom(poly("vr", name) + point.text());
    }

    @Override
    public Fragment sum(Binder binder, Fragment body) {
        return Fragment.binder("&Sigma;<sub>" + identifier(binder.name()) + "</sub> " + body.text());
    }

    @Override
    public Fragment multiSum(List<Binder> binders, Fragment body) {
        String vars = binders.stream().map(b -> identifier(b.name())).collect(Collectors.joining(", "));
        return Fragment.binder("&Sigma;<sub>" + vars + "</sub> " + body.text());
    }

    @Override
    public Fragment finiteSum(String index, String bound, Fragment body) {
        return Fragment.binder("&Sigma;" + range(index, bound) + " " + body.text());
    }

    @Override
    public Fragment prod(String index, String bound, Fragment body) {
        return Fragment.binder("&Pi;" + range(index, bound) + " " + body.text());
    }

    static String poly(String kindClass, String name) {
        return Html.tag("span", "poly " + kindClass, Html.escape(name));
    }

    // ---------- tokens ----------

    @Override
    protected String group(String text) {
        return "(" + text + ")";
    }

    @Override
    protected String plus() {
        return " + ";
    }

    @Override
    protected String minus() {
        return " &minus; ";
    }

    @Override
    protected String times() {
        return " &middot; ";
    }

    @Override
    protected String negate(String operand) {
        return "&minus;" + operand;
    }

    @Override
    protected String power(String base, int exponent) {
        return base + "<sup>" + exponent + "</sup>";
    }

    // ---------- helpers ----------

    /** {@code X_t} → {@code <var>X</var><sub>t</sub>}. */
    private static String identifier(String name) {
        int us = name.indexOf('_');
        if (us <= 0 || us == name.length() - 1) return "<var>" + Html.escape(name) + "</var>";
        return "<var>" + Html.escape(name.substring(0, us)) + "</var><sub>" + Html.escape(name.substring(us + 1)) + "</sub>";
    }

    private static String range(String index, String bound) {
        return "<sub>" + Html.escape(index) + "=0</sub><sup>" + Html.escape(upperIndex(bound)) + "</sup>";
    }

    /** Turns {@code ^{..}}, {@code ^x}, {@code _{..}} and {@code _x} in escaped text into sup/sub. */
    private static String scripts(String escaped) {
        String s = replace(BRACED_EXP, escaped, "<sup>", "</sup>");
        s = replace(PLAIN_EXP, s, "<sup>", "</sup>");
        s = replace(BRACED_SUB, s, "<sub>", "</sub>");
        return replace(PLAIN_SUB, s, "<sub>", "</sub>");
    }

    private static String replace(Pattern p, String s, String open, String close) {
        Matcher m = p.matcher(s);
        var out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(open + m.group(1) + close));
        }
        m.appendTail(out);
        return out.toString();
    }
}

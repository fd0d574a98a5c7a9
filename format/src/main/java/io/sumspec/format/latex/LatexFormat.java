// file: format/src/main/java/io/sumspec/format/latex/LatexFormat.java
package io.sumspec.format.latex;

import io.sumspec.format.Binder;
import io.sumspec.format.Fragment;
import io.sumspec.format.InfixFormat;

import java.util.List;
import java.util.stream.Collectors;

/**
 * LaTeX math mode, for {@code .tex} documents and KaTeX/MathJax.
 * <p>
 * Committed polynomials are coloured {@code ForestGreen}, virtual ones
 * {@code BurntOrange} (both from {@code xcolor[dvipsnames]}); verifier
 * polynomials are set as tilded functions.
 */
public final class LatexFormat extends InfixFormat {

    public static final LatexFormat INSTANCE = new LatexFormat();

    static final String COMMITTED_COLOUR = "ForestGreen";
    static final String VIRTUAL_COLOUR = "BurntOrange";

    @Override
    public String name() {
        return "latex";
    }

    @Override
    public Fragment constant(String value) {
        return constantFragment(LatexNames.constant(value), value);
    }

    @Override
    public Fragment variable(String name) {
        return Fragment.atom(name);
    }

    @Override
    public Fragment challenge(int stage, String label) {
        return Fragment.atom("r_{" + LatexNames.challengeLabel(label) + "}^{(" + stage + ")}");
    }

    @Override
    public Fragment opening(List<Fragment> components) {
        if (components.isEmpty()) return Fragment.atom("");
        return Fragment.atom(components.stream().map(Fragment::text).collect(Collectors.joining(", ", "(", ")")));
    }

    @Override
    public Fragment committed(String name, Fragment point) {
        return Fragment.atom(coloured(COMMITTED_COLOUR, LatexNames.poly(name)) + point.text());
    }

    @Override
    public Fragment virtual(String name, Fragment point) {
        return Fragment.atom(coloured(VIRTUAL_COLOUR, LatexNames.poly(name)) + point.text());
    }

    @Override
    public Fragment verifier(String name, Fragment point) {
        return Fragment.atom(LatexNames.verifier(name) + point.text());
    }

    @Override
    public Fragment sum(Binder binder, Fragment body) {
        return Fragment.binder("\\sum_{" + cube(binder) + "} " + body.text());
    }

    @Override
    public Fragment multiSum(List<Binder> binders, Fragment body) {
        String under = binders.stream().map(LatexFormat::cube).collect(Collectors.joining(" \\\\ "));
        return Fragment.binder("\\sum_{\\substack{" + under + "}} " + body.text());
    }

    @Override
    public Fragment finiteSum(String index, String bound, Fragment body) {
        return Fragment.binder("\\sum_{" + index + "=0}^{" + LatexNames.range(upperIndex(bound)) + "} " + body.text());
    }

    @Override
    public Fragment prod(String index, String bound, Fragment body) {
        return Fragment.binder("\\prod_{" + index + "=0}^{" + LatexNames.range(upperIndex(bound)) + "} " + body.text());
    }

    static String coloured(String colour, String text) {
        return "\\textcolor{" + colour + "}{" + text + "}";
    }

    private static String cube(Binder b) {
        return b.name() + " \\in \\{0,1\\}^{" + LatexNames.dimension(b.logSize()) + "}";
    }

    // ---------- tokens ----------

    @Override
    protected String group(String text) {
        return "\\left(" + text + "\\right)";
    }

    @Override
    protected String plus() {
        return " + ";
    }

    @Override
    protected String minus() {
        return " - ";
    }

    @Override
    protected String times() {
        return " \\cdot ";
    }

    @Override
    protected String negate(String operand) {
        return "-" + operand;
    }

    @Override
    protected String power(String base, int exponent) {
        return base + "^{" + exponent + "}";
    }
}

// file: format/src/main/java/io/sumspec/format/text/TextFormat.java
package io.sumspec.format.text;

import io.sumspec.format.Binder;
import io.sumspec.format.Fragment;
import io.sumspec.format.InfixFormat;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain Unicode text, as printed on a terminal:
 * {@code Σ_{X_t} eq(r_cycle^(1), X_t) · vp:Product(X_t)}.
 */
public final class TextFormat extends InfixFormat {

    public static final TextFormat INSTANCE = new TextFormat();

    @Override
    public String name() {
        return "text";
    }

    @Override
    public Fragment constant(String value) {
        return constantFragment(value, value);
    }

    @Override
    public Fragment variable(String name) {
        return Fragment.atom(name);
    }

    @Override
    public Fragment challenge(int stage, String label) {
        return Fragment.atom("r_" + label + "^(" + stage + ")");
    }

    @Override
    public Fragment opening(List<Fragment> components) {
        if (components.isEmpty()) return Fragment.atom("");
        return Fragment.atom(components.stream().map(Fragment::text).collect(Collectors.joining(", ", "(", ")")));
    }

    @Override
    public Fragment committed(String name, Fragment point) {
        return Fragment.atom("cp:" + name + point.text());
    }

    @Override
    public Fragment virtual(String name, Fragment point) {
        return Fragment.atom("vp:" + name + point.text());
    }

    @Override
    public Fragment verifier(String name, Fragment point) {
        return Fragment.atom(name + point.text());
    }

    @Override
    public Fragment sum(Binder binder, Fragment body) {
        return Fragment.binder("Σ_{" + binder.name() + "} " + body.text());
    }

    @Override
    public Fragment multiSum(List<Binder> binders, Fragment body) {
        String vars = binders.stream().map(Binder::name).collect(Collectors.joining(", "));
        return Fragment.binder("Σ_{" + vars + "} " + body.text());
    }

    @Override
    public Fragment finiteSum(String index, String bound, Fragment body) {
        return Fragment.binder("Σ_{" + index + "=0}^{" + upperIndex(bound) + "} " + body.text());
    }

    @Override
    public Fragment prod(String index, String bound, Fragment body) {
        return Fragment.binder("Π_{" + index + "=0}^{" + upperIndex(bound) + "} " + body.text());
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
        return " - ";
    }

    @Override
    protected String times() {
        return " · ";
    }

    @Override
    protected String negate(String operand) {
        return "-" + operand;
    }

    @Override
    protected String power(String base, int exponent) {
        return base + "^" + exponent;
    }
}

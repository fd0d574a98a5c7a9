// file: format/src/main/java/io/sumspec/format/InfixFormat.java
package io.sumspec.format;

import static io.sumspec.format.Fragment.Slot.BASE;
import static io.sumspec.format.Fragment.Slot.LEFT_FACTOR;
import static io.sumspec.format.Fragment.Slot.LEFT_TERM;
import static io.sumspec.format.Fragment.Slot.NEGATED;
import static io.sumspec.format.Fragment.Slot.RIGHT_FACTOR;
import static io.sumspec.format.Fragment.Slot.RIGHT_TERM;
import static io.sumspec.format.Fragment.Slot.SUBTRAHEND;

/**
 * Shared arithmetic for formats that write operators infix.
 * <p>
 * Subclasses supply the tokens and the grouping syntax; operand placement,
 * grouping decisions and subtraction detection are the same everywhere.
 */
public abstract class InfixFormat implements Format {

    /** Wrap {@code text} in this format's grouping syntax. */
    protected abstract String group(String text);

    protected abstract String plus();

    protected abstract String minus();

    protected abstract String times();

    protected abstract String negate(String operand);

    protected abstract String power(String base, int exponent);

    @Override
    public Fragment add(Fragment left, Fragment right) {
        String l = left.in(LEFT_TERM, this::group);
        if (right.isNegation()) {
            Fragment subtrahend = right.negatedOperand();
            return Fragment.of(l + minus() + subtrahend.in(SUBTRAHEND, this::group),
                    Precedence.SUM, subtrahend.openRightIn(SUBTRAHEND));
        }
        return Fragment.of(l + plus() + right.in(RIGHT_TERM, this::group),
                Precedence.SUM, right.openRightIn(RIGHT_TERM));
    }

    @Override
    public Fragment mul(Fragment left, Fragment right) {
        return Fragment.of(left.in(LEFT_FACTOR, this::group) + times() + right.in(RIGHT_FACTOR, this::group),
                Precedence.PRODUCT, right.openRightIn(RIGHT_FACTOR));
    }

    @Override
    public Fragment neg(Fragment operand) {
        return Fragment.negation(negate(operand.in(NEGATED, this::group)), operand);
    }

    @Override
    public Fragment pow(Fragment base, int exponent) {
        return Fragment.of(power(base.in(BASE, this::group), exponent), Precedence.POWER, false);
    }

    /**
     * Fragment for a symbolic constant. Constants that are themselves an
     * aggregate ({@code Σ_{j∈ram} γ^{3j}}) are open to the right like any
     * binder; everything else is atomic.
     */
    protected static Fragment constantFragment(String rendered, String value) {
        if (value.startsWith("Σ") || value.startsWith("Π")) return Fragment.binder(rendered);
        return Fragment.atom(rendered);
    }

    /**
     * Inclusive upper index for a bound: {@code 16} gives {@code 15},
     * {@code d_ram} gives {@code d_ram-1}.
     */
    protected static String upperIndex(String bound) {
        if (bound.matches("\\d{1,9}")) {
            return Integer.toString(Integer.parseInt(bound) - 1);
        }
        return bound + "-1";
    }
}

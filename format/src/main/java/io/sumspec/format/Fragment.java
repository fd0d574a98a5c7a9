// file: format/src/main/java/io/sumspec/format/Fragment.java
package io.sumspec.format;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Rendered text of a sub-expression plus what an enclosing operator needs to
 * know to decide whether to group it.
 * <p>
 * Design:
 *  - {@code precedence} is how loosely the text binds.
 *  - {@code openRight} is true when the text ends in a binder body that
 *    would swallow anything written after it ({@code Σ_{X} a}).
 *  - {@code negatedOperand} is set on negations only, so an addition can
 *    render {@code a + (-b)} as {@code a - b}.
 * <p>
 * Grouping rules live in {@link Slot} and are the same for every format;
 * formats only choose the grouping syntax.
 */
public record Fragment(String text, Precedence precedence, boolean openRight, Fragment negatedOperand) {

    public Fragment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(precedence, "precedence");
    }

    public static Fragment atom(String text) {
        return new Fragment(text, Precedence.ATOM, false, null);
    }

    public static Fragment of(String text, Precedence precedence, boolean openRight) {
        return new Fragment(text, precedence, openRight, null);
    }

    /** A binder fragment; always open to the right. */
    public static Fragment binder(String text) {
        return new Fragment(text, Precedence.BINDER, true, null);
    }

    public static Fragment negation(String text, Fragment operand) {
        return new Fragment(text, Precedence.NEGATION, operand.openRightIn(Slot.NEGATED), operand);
    }

    public boolean isNegation() {
        return negatedOperand != null;
    }

    /** Text of this fragment placed in {@code slot}, grouped with {@code parens} if the slot requires it. */
    public String in(Slot slot, UnaryOperator<String> parens) {
        return slot.groups(this) ? parens.apply(text) : text;
    }

    /** Whether this fragment, placed rightmost in {@code slot}, leaves its parent open to the right. */
    public boolean openRightIn(Slot slot) {
        return openRight && !slot.groups(this);
    }

    /** Operand positions with their grouping rule. */
    public enum Slot {
        LEFT_TERM,
        RIGHT_TERM,
        SUBTRAHEND,
        LEFT_FACTOR,
        RIGHT_FACTOR,
        NEGATED,
        BASE;

        public boolean groups(Fragment f) {
            Precedence p = f.precedence();
            return switch (this) {
                case LEFT_TERM -> f.openRight();
                case RIGHT_TERM -> false;
                case SUBTRAHEND, RIGHT_FACTOR, NEGATED -> p == Precedence.SUM || p == Precedence.NEGATION;
                case LEFT_FACTOR -> p == Precedence.SUM || p == Precedence.NEGATION || f.openRight();
                case BASE -> p != Precedence.ATOM;
            };
        }
    }
}

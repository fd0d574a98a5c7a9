// file: format/src/test/java/io/sumspec/format/FragmentTest.java
package io.sumspec.format;

import org.junit.jupiter.api.Test;

import static io.sumspec.format.Fragment.Slot.*;
import static org.junit.jupiter.api.Assertions.*;

class FragmentTest {

    private static final Fragment ATOM = Fragment.atom("a");
    private static final Fragment SUM = Fragment.of("a + b", Precedence.SUM, false);
    private static final Fragment PRODUCT = Fragment.of("a · b", Precedence.PRODUCT, false);
    private static final Fragment BINDER = Fragment.binder("Σ_{X} a");
    private static final Fragment NEGATION = Fragment.negation("-a", ATOM);

    @Test
    void grouping_table() {
        assertFalse(LEFT_TERM.groups(SUM));
        assertTrue(LEFT_TERM.groups(BINDER));
        assertFalse(RIGHT_TERM.groups(BINDER));
        assertTrue(SUBTRAHEND.groups(SUM));
        assertTrue(SUBTRAHEND.groups(NEGATION));
        assertFalse(SUBTRAHEND.groups(PRODUCT));
        assertTrue(LEFT_FACTOR.groups(BINDER));
        assertTrue(LEFT_FACTOR.groups(SUM));
        assertFalse(LEFT_FACTOR.groups(PRODUCT));
        assertFalse(RIGHT_FACTOR.groups(BINDER));
        assertTrue(NEGATED.groups(NEGATION));
        assertFalse(NEGATED.groups(PRODUCT));
        assertFalse(BASE.groups(ATOM));
        assertTrue(BASE.groups(PRODUCT));
    }

    @Test
    void open_right_survives_only_when_ungrouped() {
        assertTrue(BINDER.openRightIn(RIGHT_TERM));
        assertFalse(BINDER.openRightIn(LEFT_FACTOR));
        assertFalse(SUM.openRightIn(RIGHT_TERM));
    }

    @Test
    void negation_remembers_its_operand() {
        assertTrue(NEGATION.isNegation());
        assertSame(ATOM, NEGATION.negatedOperand());
        assertFalse(ATOM.isNegation());
        assertTrue(Fragment.negation("-Σ_{X} a", BINDER).openRight());
    }

    @Test
    void in_applies_the_supplied_grouping() {
        assertEquals("[a + b]", SUM.in(LEFT_FACTOR, s -> "[" + s + "]"));
        assertEquals("a", ATOM.in(LEFT_FACTOR, s -> "[" + s + "]"));
    }
}

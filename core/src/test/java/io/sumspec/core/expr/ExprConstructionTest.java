// file: core/src/test/java/io/sumspec/core/expr/ExprConstructionTest.java
package io.sumspec.core.expr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExprConstructionTest {

    private static final Dimension CYCLE = new Dimension("T", "cycle", "cycle/timestep");

    @Test
    void blank_leaves_are_malformed() {
        assertThrows(MalformedExpressionException.class, () -> new Const(" "));
        assertThrows(MalformedExpressionException.class, () -> Var.index(""));
        assertThrows(MalformedExpressionException.class, () -> new Challenge(1, ""));
        assertThrows(MalformedExpressionException.class, () -> new VirtualPoly("", Opening.of()));
    }

    @Test
    void challenge_stage_starts_at_one() {
        var ex = assertThrows(MalformedExpressionException.class, () -> new Challenge(0, "cycle"));
        assertTrue(ex.getMessage().contains("0"));
        assertEquals("r_cycle^(2)", new Challenge(2, "cycle").toString());
    }

    @Test
    void polynomial_requires_a_point() {
        assertThrows(MalformedExpressionException.class, () -> new CommittedPoly("RdInc", null));
    }

    @Test
    void opening_accepts_only_coordinates() {
        var x = new Var("X_t", CYCLE);
        assertDoesNotThrow(() -> Opening.of(x, Const.ZERO, new Challenge(1, "cycle")));
        assertThrows(MalformedExpressionException.class,
                () -> Opening.of(new Add(x, Const.ONE)));
    }

    @Test
    void pow_exponent_must_be_positive() {
        assertThrows(MalformedExpressionException.class, () -> new Pow(Const.ONE, 0));
    }

    @Test
    void hypercube_sums_need_dimensioned_variables() {
        var body = new VirtualPoly("H", Opening.of(new Var("X_t", CYCLE)));
        assertThrows(MalformedExpressionException.class, () -> new Sum(Var.index("j"), body));
        assertThrows(MalformedExpressionException.class, () -> new MultiSum(List.of(), body));
        var x = new Var("X_t", CYCLE);
        var ex = assertThrows(MalformedExpressionException.class, () -> new MultiSum(List.of(x, x), body));
        assertTrue(ex.getMessage().contains("X_t"));
    }

    @Test
    void finite_binders_need_index_and_bound() {
        assertThrows(MalformedExpressionException.class, () -> new FiniteSum("", "d", Const.ONE));
        assertThrows(MalformedExpressionException.class, () -> new Prod("i", " ", Const.ONE));
        assertEquals(16, new Prod("i", "16", Const.ONE).numericBound().getAsInt());
        assertTrue(new FiniteSum("j", "d_ram", Const.ONE).numericBound().isEmpty());
    }

    @Test
    void opening_copies_its_components() {
        var list = new java.util.ArrayList<Expr>(List.of(Const.ZERO));
        var point = new Opening(list);
        list.add(Const.ONE);
        assertEquals(1, point.components().size());
    }

    @Test
    void poly_ref_of_builds_the_requested_kind() {
        assertInstanceOf(CommittedPoly.class, PolyRef.of(PolyKind.COMMITTED, "RdInc", Opening.of()));
        assertInstanceOf(VerifierPoly.class, PolyRef.of(PolyKind.VERIFIER, "eq", Opening.of()));
        assertEquals(PolyKind.VIRTUAL, PolyRef.of(PolyKind.VIRTUAL, "H", Opening.of()).kind());
    }

    @Test
    void blank_dimension_is_malformed() {
        assertThrows(MalformedExpressionException.class, () -> new Dimension(" ", "cycle", ""));
        assertThrows(MalformedExpressionException.class, () -> new Dimension("T", "", ""));
    }

    @Test
    void dimension_log_size() {
        assertEquals("log2(T)", CYCLE.logSize());
        assertEquals("1", new Dimension("2", "b", "").logSize());
        assertEquals("6", new Dimension("64", "k", "").logSize());
        assertEquals("log2(10)", new Dimension("10", "k", "").logSize());
    }
}

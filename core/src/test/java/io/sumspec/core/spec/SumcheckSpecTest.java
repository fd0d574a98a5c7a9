// file: core/src/test/java/io/sumspec/core/spec/SumcheckSpecTest.java
package io.sumspec.core.spec;

import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.Const;
import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.Expressions;
import io.sumspec.core.expr.MalformedExpressionException;
import io.sumspec.core.expr.Opening;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.expr.Sum;
import io.sumspec.core.expr.Var;
import io.sumspec.core.expr.VerifierPoly;
import io.sumspec.core.expr.VirtualPoly;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SumcheckSpecTest {

    private static final Var XT = new Var("X_t", new Dimension("T", "cycle", "cycle/timestep"));

    private static SumcheckSpec.Builder booleanity(int stage) {
        var h = new VirtualPoly("H", Opening.of(XT));
        var eq = new VerifierPoly("eq", Opening.of(new Challenge(1, "cycle"), XT));
        return SumcheckSpec.builder("RamHammingBooleanity", stage)
                .summedOver(List.of(XT))
                .rounds("log2(T)")
                .lhs(new Sum(XT, Expressions.mul(eq, Expressions.sub(Expressions.pow(h, 2), h))))
                .rhs(Const.ZERO);
    }

    @Test
    void inferred_degree_peels_outer_sums() {
        var spec = booleanity(6).build();
        assertEquals(3, spec.inferredDegree());
        assertFalse(spec.integrand() instanceof Sum);
        assertEquals("", spec.degree());
    }

    @Test
    void required_fields_are_checked() {
        assertThrows(IllegalArgumentException.class, () -> SumcheckSpec.builder("X", 0).build());
        assertThrows(NullPointerException.class,
                () -> SumcheckSpec.builder("X", 1).summedOver(List.of(XT)).build());
        assertThrows(IllegalArgumentException.class,
                () -> SumcheckSpec.builder("X", 1).lhs(Const.ONE).build());
    }

    @Test
    void unbound_index_in_lhs_is_malformed() {
        var ra = new VirtualPoly("Ra", Opening.of(Var.index("i"), XT));
        var ex = assertThrows(MalformedExpressionException.class,
                () -> booleanity(6).lhs(new Sum(XT, ra)).build());
        assertTrue(ex.getMessage().contains("RamHammingBooleanity"));
    }

    @Test
    void produced_claim_cannot_use_a_later_challenge() {
        var late = Claim.of("H", PolyKind.VIRTUAL, new Challenge(7, "cycle"));
        assertThrows(IllegalArgumentException.class, () -> booleanity(6).produce(late).build());
        assertDoesNotThrow(() -> booleanity(7).produce(late).build());
    }

    @Test
    void consumed_claim_must_be_drawn_before_the_stage() {
        var same = Claim.of("H", PolyKind.VIRTUAL, new Challenge(6, "cycle"));
        var ex = assertThrows(IllegalArgumentException.class, () -> booleanity(6).consume(same).build());
        assertTrue(ex.getMessage().contains("vp:H(r_cycle^(6))"));
        assertDoesNotThrow(() -> booleanity(7).consume(same).build());
    }

    @Test
    void with_copies_leave_the_original_untouched() {
        var spec = booleanity(6).build();
        var produced = Claim.of("H", PolyKind.VIRTUAL, new Challenge(6, "cycle"));
        var copy = spec.withProduces(List.of(new ProducedClaim(produced, null)));
        assertTrue(spec.produces().isEmpty());
        assertEquals(List.of(produced), copy.producedClaims());
        assertEquals(spec.lhs(), copy.lhs());
    }
}

// file: core/src/test/java/io/sumspec/core/spec/PipelineTest.java
package io.sumspec.core.spec;

import io.sumspec.core.expr.Const;
import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.Var;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    private static final Var XT = new Var("X_t", new Dimension("T", "cycle", ""));

    private static SumcheckSpec spec(String name, int stage) {
        return SumcheckSpec.builder(name, stage).summedOver(List.of(XT)).lhs(Const.ONE).build();
    }

    private static Pipeline threeStages() {
        return new Pipeline("demo", List.of(
                new Stage(1, "one", List.of(spec("A", 1))),
                new Stage(2, "two", List.of(spec("B", 2), spec("C", 2))),
                new Stage(3, "three", List.of(spec("D", 3)))));
    }

    @Test
    void sumchecks_are_in_stage_then_declaration_order() {
        assertEquals(List.of("A", "B", "C", "D"),
                threeStages().sumchecks().stream().map(SumcheckSpec::name).toList());
    }

    @Test
    void stage_indices_must_be_contiguous_from_one() {
        assertThrows(IllegalArgumentException.class, () -> new Pipeline("gap", List.of(
                new Stage(1, "one", List.of()), new Stage(3, "three", List.of()))));
        assertThrows(IllegalArgumentException.class, () -> new Pipeline("empty", List.of()));
    }

    @Test
    void stage_rejects_specs_of_another_stage() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> new Stage(2, "two", List.of(spec("A", 1))));
        assertTrue(ex.getMessage().contains("A"));
    }

    @Test
    void sumcheck_names_are_unique_across_stages() {
        var ex = assertThrows(IllegalArgumentException.class, () -> new Pipeline("dup", List.of(
                new Stage(1, "one", List.of(spec("A", 1))),
                new Stage(2, "two", List.of(spec("A", 2))))));
        assertTrue(ex.getMessage().contains("A"));
    }

    @Test
    void select_keeps_pipeline_order_and_empty_means_all() {
        var p = threeStages();
        assertEquals(List.of(1, 3), p.select(Set.of(3, 1)).stream().map(Stage::index).toList());
        assertEquals(3, p.select(Set.of()).size());
        assertTrue(p.select(Set.of(9)).isEmpty());
    }

    @Test
    void lookups_fail_loudly() {
        var p = threeStages();
        assertEquals("two", p.stage(2).title());
        assertThrows(IllegalArgumentException.class, () -> p.stage(4));
        assertThrows(IllegalArgumentException.class, () -> p.sumcheck("Z"));
    }

    @Test
    void replace_swaps_one_sumcheck() {
        var p = threeStages();
        var updated = SumcheckSpec.builder("C", 2).summedOver(List.of(XT)).lhs(Const.ZERO).build();
        var q = p.replace(updated);
        assertEquals(Const.ZERO, q.sumcheck("C").lhs());
        assertEquals(Const.ONE, p.sumcheck("C").lhs());
        assertThrows(IllegalArgumentException.class,
                () -> p.replace(SumcheckSpec.builder("Z", 2).summedOver(List.of(XT)).lhs(Const.ONE).build()));
    }
}

// file: format/src/test/java/io/sumspec/format/text/TextReportTest.java
package io.sumspec.format.text;

import io.sumspec.core.json.PipelineLoader;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.SumcheckSpec;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextReportTest {

    private final Pipeline pipeline = PipelineLoader.reference();

    @Test
    void report_lists_every_sumcheck_in_order() {
        String report = TextReport.render(pipeline.title(), pipeline.stages());

        int last = -1;
        for (SumcheckSpec spec : pipeline.sumchecks()) {
            int at = report.indexOf("\n  " + spec.name() + "\n");
            assertTrue(at > last, spec.name() + " missing or out of order");
            last = at;
        }
        assertTrue(report.contains("║  Stage 1: "));
        assertTrue(report.contains("║  Stage 7: "));
    }

    @Test
    void stage_selection_limits_the_report() {
        String report = TextReport.render(pipeline.title(), pipeline.select(Set.of(5)));

        assertTrue(report.contains("Stage 5: "));
        assertFalse(report.contains("Stage 4: "));
        assertFalse(report.contains("\n  SpartanOuter\n"));
    }

    @Test
    void sumcheck_block_carries_metadata_tables_and_openings() {
        String block = TextReport.sumcheck(pipeline.sumcheck("SpartanOuter"));

        assertTrue(block.contains("  Degree : 3\n"));
        assertTrue(block.contains("  Σ over : X_t ∈ {0,1}^log2(T), X_b ∈ {0,1}^1"));
        assertTrue(block.contains("  Opening: (r_cycle^(1))"));
        assertTrue(block.contains("  Integrand:"));
        assertTrue(block.contains("Az (guard)"));
        assertTrue(block.contains("RamAddrZeroIfNotLoadStore"));
        assertTrue(block.contains("  Openings produced:\n    vp:LeftInstructionInput(r_cycle^(1))"));
        assertFalse(block.contains("Claims consumed"));
    }

    @Test
    void consumed_claims_are_listed() {
        String block = TextReport.sumcheck(pipeline.sumcheck("SpartanProductVirtualization"));

        assertTrue(block.contains("  Claims consumed:\n    vp:Product(r_cycle^(1))"));
    }

    @Test
    void report_is_deterministic() {
        assertEquals(TextReport.render("t", pipeline.stages()), TextReport.render("t", pipeline.stages()));
    }
}

// file: resolve/src/test/java/io/sumspec/resolve/ClaimGraphTest.java
package io.sumspec.resolve;

import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.spec.Claim;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClaimGraphTest {

    private static final Claim V = Claim.of("V", PolyKind.VIRTUAL, new Challenge(1, "cycle"));

    @Test
    void sink_is_first_and_nodes_follow_stage_order() {
        var graph = ClaimGraph.builder(2)
                .node("B", 2)
                .node("A", 1)
                .build();

        assertEquals(ClaimGraph.SINK_ID, graph.nodes().get(0).id());
        assertEquals("A", graph.nodes().get(1).id());
        assertEquals("B", graph.nodes().get(2).id());
        assertTrue(graph.sink().isSink());
        assertEquals(2, graph.stageCount());
    }

    @Test
    void backward_edge_is_not_monotone() {
        var forward = ClaimGraph.builder(2).node("A", 1).node("B", 2)
                .edge(new ClaimEdge("A", "B", V, EdgeStatus.RESOLVED))
                .build();
        var backward = ClaimGraph.builder(2).node("A", 1).node("B", 2)
                .edge(new ClaimEdge("B", "A", V, EdgeStatus.RESOLVED))
                .build();
        var sameStage = ClaimGraph.builder(1).node("A", 1).node("B", 1)
                .edge(new ClaimEdge("A", "B", V, EdgeStatus.RESOLVED))
                .build();

        assertTrue(forward.isStageMonotone());
        assertFalse(backward.isStageMonotone());
        assertFalse(sameStage.isStageMonotone());
    }

    @Test
    void node_outside_stage_range_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ClaimGraph.builder(2).node("X", 3));
        assertThrows(IllegalArgumentException.class, () -> ClaimGraph.builder(2).node("X", 0));
    }
}

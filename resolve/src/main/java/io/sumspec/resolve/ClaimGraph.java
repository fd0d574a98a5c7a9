// file: resolve/src/main/java/io/sumspec/resolve/ClaimGraph.java
package io.sumspec.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed claim-flow graph: sumchecks as nodes, one edge per claim
 * hand-off, plus a synthetic sink standing for the commitment check.
 * <p>
 * Design:
 *  - Nodes are kept in an array indexed by stage (slot 0 holds the sink).
 *    Claims only flow from lower to strictly higher stages, so the stage
 *    index is already a topological order and no general graph structure
 *    is needed.
 *  - Immutable once built; node and edge order is the order of the walk
 *    that produced them, which makes exports deterministic.
 */
public final class ClaimGraph {

    public static final String SINK_ID = "PCS";
    public static final String SINK_NAME = "PCS / commitment check";

    // nodesByStage[s] = sumchecks of stage s in declaration order; [0] = sink.
    private final List<List<GraphNode>> nodesByStage;
    private final Map<String, GraphNode> byId;
    private final List<ClaimEdge> edges;

    private ClaimGraph(List<List<GraphNode>> nodesByStage, List<ClaimEdge> edges) {
        var frozen = new ArrayList<List<GraphNode>>(nodesByStage.size());
        var ids = new HashMap<String, GraphNode>();
        for (List<GraphNode> slot : nodesByStage) {
            frozen.add(List.copyOf(slot));
            slot.forEach(n -> ids.put(n.id(), n));
        }
        this.nodesByStage = List.copyOf(frozen);
        this.byId = Map.copyOf(ids);
        this.edges = List.copyOf(edges);
    }

    static Builder builder(int stageCount) {
        return new Builder(stageCount);
    }

    /** All nodes: the sink first, then stage by stage. */
    public List<GraphNode> nodes() {
        return nodesByStage.stream().flatMap(List::stream).toList();
    }

    public List<GraphNode> nodesAt(int stage) {
        if (stage < 0 || stage >= nodesByStage.size()) return List.of();
        return nodesByStage.get(stage);
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public GraphNode sink() {
        return byId.get(SINK_ID);
    }

    /** Highest stage index present. */
    public int stageCount() {
        return nodesByStage.size() - 1;
    }

    public List<ClaimEdge> edges() {
        return edges;
    }

    public List<ClaimEdge> edgesFrom(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<ClaimEdge> edgesTo(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).toList();
    }

    public long count(EdgeStatus status) {
        return edges.stream().filter(e -> e.status() == status).count();
    }

    /**
     * True if every edge between sumchecks goes from a lower to a strictly
     * higher stage. Such a graph cannot contain a cycle.
     */
    public boolean isStageMonotone() {
        for (ClaimEdge e : edges) {
            GraphNode from = byId.get(e.from());
            GraphNode to = byId.get(e.to());
            if (from == null || to == null) return false;
            if (to.isSink()) continue;
            if (from.isSink() || from.stage() >= to.stage()) return false;
        }
        return true;
    }

    static final class Builder {
        private final List<List<GraphNode>> nodesByStage = new ArrayList<>();
        private final List<ClaimEdge> edges = new ArrayList<>();

        private Builder(int stageCount) {
            for (int s = 0; s <= stageCount; s++) {
                nodesByStage.add(new ArrayList<>());
            }
            nodesByStage.get(0).add(new GraphNode(SINK_ID, 0, SINK_NAME));
        }

        Builder node(String name, int stage) {
            if (stage < 1 || stage >= nodesByStage.size()) {
                throw new IllegalArgumentException("stage " + stage + " out of range for " + name);
            }
            nodesByStage.get(stage).add(new GraphNode(name, stage, name));
            return this;
        }

        Builder edge(ClaimEdge edge) {
            edges.add(edge);
            return this;
        }

        ClaimGraph build() {
            return new ClaimGraph(nodesByStage, edges);
        }
    }
}

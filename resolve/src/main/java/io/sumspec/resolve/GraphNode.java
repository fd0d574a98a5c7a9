// file: resolve/src/main/java/io/sumspec/resolve/GraphNode.java
package io.sumspec.resolve;

import java.util.Objects;

/**
 * Node of the claim graph: a sumcheck, or the synthetic commitment sink
 * (stage 0).
 */
public record GraphNode(String id, int stage, String name) {

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        if (stage < 0) throw new IllegalArgumentException("stage must be >= 0");
    }

    public boolean isSink() {
        return stage == 0;
    }
}

// file: resolve/src/main/java/io/sumspec/resolve/ClaimEdge.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;

import java.util.Objects;

/** Claim {@code claim} flowing from node {@code from} to node {@code to}. */
public record ClaimEdge(String from, String to, Claim claim, EdgeStatus status) {

    public ClaimEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(claim, "claim");
        Objects.requireNonNull(status, "status");
    }
}

// file: resolve/src/main/java/io/sumspec/resolve/UnresolvedVirtualClaim.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;

import java.util.Objects;

/**
 * Completeness finding: a virtual claim nobody consumed by the end of the pipeline.
 */
public record UnresolvedVirtualClaim(Claim claim, String producer, int producerStage) {

    public UnresolvedVirtualClaim {
        Objects.requireNonNull(claim, "claim");
        Objects.requireNonNull(producer, "producer");
    }

    @Override
    public String toString() {
        return claim + " from S" + producerStage + " " + producer;
    }
}

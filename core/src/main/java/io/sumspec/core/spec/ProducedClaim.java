// file: core/src/main/java/io/sumspec/core/spec/ProducedClaim.java
package io.sumspec.core.spec;

import java.util.Objects;
import java.util.Optional;

/**
 * A claim a sumcheck produces, optionally annotated with the parametric
 * range it stands for (e.g. {@code for i=0..d_ram-1}).
 */
public record ProducedClaim(Claim claim, String range) {

    public ProducedClaim {
        Objects.requireNonNull(claim, "claim");
        if (range != null && range.isBlank()) range = null;
    }

    public static ProducedClaim of(Claim claim) {
        return new ProducedClaim(claim, null);
    }

    public Optional<String> rangeNote() {
        return Optional.ofNullable(range);
    }
}

// file: core/src/main/java/io/sumspec/core/spec/Claim.java
package io.sumspec.core.spec;

import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.Opening;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.expr.PolyRef;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Opening claim: polynomial {@code name} of kind {@code kind} evaluated at
 * the challenge point {@code point}.
 * <p>
 * This is the identity the resolution tracker keys on. Two claims are the
 * same claim iff name, kind and the stage-tagged challenges are equal.
 * Free variables never belong to a claim point.
 */
public record Claim(String name, PolyKind kind, List<Challenge> point) {

    public Claim {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(point, "point");
        if (name.isBlank()) throw new IllegalArgumentException("claim name must not be blank");
        point = List.copyOf(point);
    }

    public static Claim of(String name, PolyKind kind, Challenge... point) {
        return new Claim(name, kind, List.of(point));
    }

    /** The claim a polynomial leaf makes once its variables are bound to challenges. */
    public static Claim of(PolyRef leaf) {
        return new Claim(leaf.name(), leaf.kind(), leaf.point().challenges());
    }

    /** Latest stage any coordinate of the point was drawn at, 0 for an empty point. */
    public int latestStage() {
        return point.stream().mapToInt(Challenge::stage).max().orElse(0);
    }

    /** The point as an AST opening. */
    public Opening opening() {
        return new Opening(List.copyOf(point));
    }

    /** Plain-text identity, e.g. {@code vp:RamRa(r_K_ram^(2), r_cycle^(5))}. */
    @Override
    public String toString() {
        String args = point.stream().map(Challenge::toString).collect(Collectors.joining(", "));
        return kind.prefix() + ":" + name + "(" + args + ")";
    }
}

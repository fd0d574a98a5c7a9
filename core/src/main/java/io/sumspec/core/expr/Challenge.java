// file: core/src/main/java/io/sumspec/core/expr/Challenge.java
package io.sumspec.core.expr;

import java.util.Objects;

/**
 * A verifier challenge drawn at a given stage: {@code r_cycle^(2)}.
 * <p>
 * Challenges are the concrete coordinates of opening points; two claims on
 * the same polynomial are the same claim only if their challenges match
 * label and stage.
 */
public record Challenge(int stage, String label) implements Expr {

    public Challenge {
        Objects.requireNonNull(label, "label");
        if (stage < 1) throw new MalformedExpressionException("challenge stage must be >= 1, got " + stage);
        if (label.isBlank()) throw new MalformedExpressionException("challenge label must not be blank");
    }

    /** Plain-text name, e.g. {@code r_cycle^(2)}. */
    @Override
    public String toString() {
        return "r_" + label + "^(" + stage + ")";
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitChallenge(this);
    }
}

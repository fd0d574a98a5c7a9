// file: core/src/main/java/io/sumspec/core/expr/Var.java
package io.sumspec.core.expr;

import java.util.Objects;
import java.util.Optional;

/**
 * Formal variable.
 * <p>
 * A variable declared with a {@link Dimension} ranges over that dimension's
 * hypercube and is a global dimension variable ({@code X_t}, {@code X_k}).
 * A variable without one is an index variable ({@code i}, {@code j}) and must
 * be bound by an enclosing {@link FiniteSum} or {@link Prod}.
 */
public record Var(String name, Dimension dimension) implements Expr {

    public Var {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new MalformedExpressionException("variable name must not be blank");
    }

    /** Index variable with no dimension. */
    public static Var index(String name) {
        return new Var(name, null);
    }

    public boolean isIndex() {
        return dimension == null;
    }

    public Optional<Dimension> dimensionIfDeclared() {
        return Optional.ofNullable(dimension);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVar(this);
    }
}

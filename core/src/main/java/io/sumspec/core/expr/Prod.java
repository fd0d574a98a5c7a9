// file: core/src/main/java/io/sumspec/core/expr/Prod.java
package io.sumspec.core.expr;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Finite product {@code Π_{index=0}^{bound-1} body}.
 * Binds the index variable {@code index} inside {@code body}; the bound is
 * either an integer literal or a symbolic parameter such as {@code d_ram}.
 */
public record Prod(String index, String bound, Expr body) implements Expr {

    public Prod {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(bound, "bound");
        if (index.isBlank()) throw new MalformedExpressionException("product index must not be blank");
        if (bound.isBlank()) throw new MalformedExpressionException("product bound must not be blank");
        if (body == null) throw new MalformedExpressionException("product needs a body");
    }

    /** Integer bound if the bound is a literal. */
    public OptionalInt numericBound() {
        return bound.matches("\\d{1,9}")
                ? OptionalInt.of(Integer.parseInt(bound))
                : OptionalInt.empty();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitProd(this);
    }
}

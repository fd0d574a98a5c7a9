// file: core/src/main/java/io/sumspec/core/expr/Const.java
package io.sumspec.core.expr;

import java.util.Objects;

/**
 * Literal or symbolic constant: "0", "2^64", "γ", "τ_c".
 * Values are kept as text; nothing is ever evaluated.
 */
public record Const(String value) implements Expr {

    public static final Const ZERO = new Const("0");
    public static final Const ONE = new Const("1");

    public Const {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new MalformedExpressionException("constant must not be blank");
    }

    public static Const of(long value) {
        return new Const(Long.toString(value));
    }

    /** True when the value is a plain (optionally negative) integer literal. */
    public boolean isInteger() {
        return value.matches("-?\\d+");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConst(this);
    }
}

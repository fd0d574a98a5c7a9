// file: core/src/main/java/io/sumspec/core/expr/Pow.java
package io.sumspec.core.expr;

/** {@code base^exponent} with a positive integer exponent. */
public record Pow(Expr base, int exponent) implements Expr {

    public Pow {
        if (base == null) throw new MalformedExpressionException("pow needs a base");
        if (exponent < 1) throw new MalformedExpressionException("exponent must be >= 1, got " + exponent);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPow(this);
    }
}

// file: core/src/main/java/io/sumspec/core/expr/Mul.java
package io.sumspec.core.expr;

/** {@code left · right}. */
public record Mul(Expr left, Expr right) implements Expr {

    public Mul {
        if (left == null || right == null) throw new MalformedExpressionException("mul needs two operands");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMul(this);
    }
}

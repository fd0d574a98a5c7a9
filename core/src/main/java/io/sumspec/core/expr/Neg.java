// file: core/src/main/java/io/sumspec/core/expr/Neg.java
package io.sumspec.core.expr;

/** {@code -operand}. */
public record Neg(Expr operand) implements Expr {

    public Neg {
        if (operand == null) throw new MalformedExpressionException("neg needs an operand");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNeg(this);
    }
}

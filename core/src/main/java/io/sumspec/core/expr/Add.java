// file: core/src/main/java/io/sumspec/core/expr/Add.java
package io.sumspec.core.expr;

/** {@code left + right}. Subtraction is {@code Add(a, Neg(b))}. */
public record Add(Expr left, Expr right) implements Expr {

    public Add {
        if (left == null || right == null) throw new MalformedExpressionException("add needs two operands");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAdd(this);
    }
}

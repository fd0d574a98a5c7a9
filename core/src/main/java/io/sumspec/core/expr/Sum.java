// file: core/src/main/java/io/sumspec/core/expr/Sum.java
package io.sumspec.core.expr;

/**
 * Hypercube sum {@code Σ_{X ∈ {0,1}^n} body} over one dimensioned variable.
 */
public record Sum(Var variable, Expr body) implements Expr {

    public Sum {
        if (variable == null || body == null) throw new MalformedExpressionException("sum needs a variable and a body");
        if (variable.isIndex()) {
            throw new MalformedExpressionException(
                    "sum variable " + variable.name() + " must declare the dimension it ranges over");
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSum(this);
    }
}

// file: core/src/main/java/io/sumspec/core/expr/MultiSum.java
package io.sumspec.core.expr;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Sum over several dimensioned variables at once,
 * e.g. {@code Σ_{X_t, X_b, X_c} body} for the Spartan outer sumcheck.
 */
public record MultiSum(List<Var> variables, Expr body) implements Expr {

    public MultiSum {
        Objects.requireNonNull(variables, "variables");
        variables = List.copyOf(variables);
        if (variables.isEmpty()) throw new MalformedExpressionException("multi-sum needs at least one variable");
        if (body == null) throw new MalformedExpressionException("multi-sum needs a body");
        var seen = new HashSet<String>();
        for (Var v : variables) {
            if (v.isIndex()) {
                throw new MalformedExpressionException(
                        "multi-sum variable " + v.name() + " must declare the dimension it ranges over");
            }
            if (!seen.add(v.name())) {
                throw new MalformedExpressionException("multi-sum binds " + v.name() + " twice");
            }
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMultiSum(this);
    }
}

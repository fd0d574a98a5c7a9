// file: core/src/main/java/io/sumspec/core/expr/Opening.java
package io.sumspec.core.expr;

import java.util.List;
import java.util.Objects;

/**
 * Evaluation point of a polynomial reference. Components are variables,
 * constants or challenges; an empty point denotes a polynomial with no
 * variables (e.g. advice commitments).
 */
public record Opening(List<Expr> components) implements Expr {

    public Opening {
        Objects.requireNonNull(components, "components");
        components = List.copyOf(components);
        for (Expr c : components) {
            if (!(c instanceof Var || c instanceof Const || c instanceof Challenge)) {
                throw new MalformedExpressionException(
                        "opening components must be variables, constants or challenges, got "
                                + c.getClass().getSimpleName());
            }
        }
    }

    public static Opening of(Expr... components) {
        return new Opening(List.of(components));
    }

    /** The challenge coordinates of this point, in order. */
    public List<Challenge> challenges() {
        return components.stream()
                .filter(Challenge.class::isInstance)
                .map(Challenge.class::cast)
                .toList();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOpening(this);
    }
}

// file: core/src/main/java/io/sumspec/core/expr/CommittedPoly.java
package io.sumspec.core.expr;

/** Reference to a committed polynomial, e.g. {@code RamInc(X_t)}. */
public record CommittedPoly(String name, Opening point) implements PolyRef {

    public CommittedPoly {
        PolyRef.check(name, point);
    }

    public static CommittedPoly of(String name, Expr... components) {
        return new CommittedPoly(name, Opening.of(components));
    }

    @Override
    public PolyKind kind() {
        return PolyKind.COMMITTED;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCommitted(this);
    }
}

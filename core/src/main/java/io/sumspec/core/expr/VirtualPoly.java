// file: core/src/main/java/io/sumspec/core/expr/VirtualPoly.java
package io.sumspec.core.expr;

/** Reference to a virtual polynomial, e.g. {@code LookupOutput(r_cycle^(1))}. */
public record VirtualPoly(String name, Opening point) implements PolyRef {

    public VirtualPoly {
        PolyRef.check(name, point);
    }

    public static VirtualPoly of(String name, Expr... components) {
        return new VirtualPoly(name, Opening.of(components));
    }

    @Override
    public PolyKind kind() {
        return PolyKind.VIRTUAL;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVirtual(this);
    }
}

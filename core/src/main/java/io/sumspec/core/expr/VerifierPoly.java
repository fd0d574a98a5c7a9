// file: core/src/main/java/io/sumspec/core/expr/VerifierPoly.java
package io.sumspec.core.expr;

/** Reference to a verifier-computable polynomial such as {@code eq} or {@code LT_tilde}. */
public record VerifierPoly(String name, Opening point) implements PolyRef {

    public VerifierPoly {
        PolyRef.check(name, point);
    }

    public static VerifierPoly of(String name, Expr... components) {
        return new VerifierPoly(name, Opening.of(components));
    }

    @Override
    public PolyKind kind() {
        return PolyKind.VERIFIER;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVerifier(this);
    }
}

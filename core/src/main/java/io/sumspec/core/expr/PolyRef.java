// file: core/src/main/java/io/sumspec/core/expr/PolyRef.java
package io.sumspec.core.expr;

/**
 * A named polynomial evaluated at an opening point.
 * The three implementations are mutually exclusive kinds.
 */
public sealed interface PolyRef extends Expr permits CommittedPoly, VirtualPoly, VerifierPoly {

    String name();

    Opening point();

    PolyKind kind();

    static PolyRef of(PolyKind kind, String name, Opening point) {
        return switch (kind) {
            case COMMITTED -> new CommittedPoly(name, point);
            case VIRTUAL -> new VirtualPoly(name, point);
            case VERIFIER -> new VerifierPoly(name, point);
        };
    }

    static void check(String name, Opening point) {
        if (name == null || name.isBlank()) {
            throw new MalformedExpressionException("polynomial name must not be blank");
        }
        if (point == null) {
            throw new MalformedExpressionException("polynomial " + name + " has no opening point");
        }
    }
}

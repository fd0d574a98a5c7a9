// file: core/src/main/java/io/sumspec/core/expr/PolyKind.java
package io.sumspec.core.expr;

/**
 * Trust class of a named polynomial.
 *
 *  - COMMITTED: bound by the polynomial commitment scheme; openings are checked there.
 *  - VIRTUAL:   no commitment of its own; openings must be reduced by a later sumcheck.
 *  - VERIFIER:  computable by the verifier from public data; never an open claim.
 */
public enum PolyKind {
    COMMITTED("cp"),
    VIRTUAL("vp"),
    VERIFIER("vr");

    private final String prefix;

    PolyKind(String prefix) {
        this.prefix = prefix;
    }

    /** Short tag used in plain-text output: cp, vp, vr. */
    public String prefix() {
        return prefix;
    }

    /** Committed and verifier-computable openings end the claim flow. */
    public boolean isTerminal() {
        return this != VIRTUAL;
    }
}

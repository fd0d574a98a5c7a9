// file: resolve/src/main/java/io/sumspec/resolve/EdgeStatus.java
package io.sumspec.resolve;

/** Why an edge exists in the claim graph. */
public enum EdgeStatus {
    /** Consumed by a later sumcheck. */
    RESOLVED,
    /** Committed or verifier-computable claim ending at the commitment check. */
    TERMINAL,
    /** Virtual claim still open after the last stage. */
    UNRESOLVED
}

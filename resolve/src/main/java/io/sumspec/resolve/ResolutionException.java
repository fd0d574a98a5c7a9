// file: resolve/src/main/java/io/sumspec/resolve/ResolutionException.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;

/**
 * Claim flow is broken badly enough that the graph cannot be trusted.
 * The walk stops at the first such error.
 */
public abstract class ResolutionException extends IllegalStateException {

    private final Claim claim;

    protected ResolutionException(String message, Claim claim) {
        super(message);
        this.claim = claim;
    }

    public Claim claim() {
        return claim;
    }
}

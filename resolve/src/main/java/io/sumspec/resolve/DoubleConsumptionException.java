// file: resolve/src/main/java/io/sumspec/resolve/DoubleConsumptionException.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;

/**
 * A claim already consumed by one sumcheck is consumed again.
 */
public class DoubleConsumptionException extends ResolutionException {

    private final String firstConsumer;
    private final String secondConsumer;

    public DoubleConsumptionException(Claim claim, String firstConsumer, String secondConsumer) {
        super("%s is consumed by %s but was already consumed by %s"
                .formatted(claim, secondConsumer, firstConsumer), claim);
        this.firstConsumer = firstConsumer;
        this.secondConsumer = secondConsumer;
    }

    public String firstConsumer() {
        return firstConsumer;
    }

    public String secondConsumer() {
        return secondConsumer;
    }
}

// file: resolve/src/main/java/io/sumspec/resolve/DanglingConsumptionException.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;

/**
 * A sumcheck consumes a claim that no earlier stage produced.
 */
public class DanglingConsumptionException extends ResolutionException {

    private final String consumer;
    private final int consumerStage;

    public DanglingConsumptionException(Claim claim, String consumer, int consumerStage) {
        super("%s (stage %d) consumes %s, which no earlier stage produces"
                .formatted(consumer, consumerStage, claim), claim);
        this.consumer = consumer;
        this.consumerStage = consumerStage;
    }

    public String consumer() {
        return consumer;
    }

    public int consumerStage() {
        return consumerStage;
    }
}

// file: resolve/src/main/java/io/sumspec/resolve/ResolutionReport.java
package io.sumspec.resolve;

import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.ProducedClaim;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one resolution walk: what each sumcheck consumed and produced,
 * the findings left at the end, aggregate counts and the claim graph.
 */
public record ResolutionReport(
        List<StageResolution> stages,
        List<UnresolvedVirtualClaim> unresolved,
        List<ShadowedProduction> shadowed,
        Summary summary,
        ClaimGraph graph
) {
    public ResolutionReport {
        stages = List.copyOf(stages);
        unresolved = List.copyOf(unresolved);
        shadowed = List.copyOf(shadowed);
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(graph, "graph");
    }

    /** No virtual claim was left open. */
    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    public SpecResolution sumcheck(String name) {
        return stages.stream()
                .flatMap(s -> s.sumchecks().stream())
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no sumcheck named " + name));
    }

    /**
     * Aggregate counts.
     *
     * @param produced total produced entries, shadowed ones included
     * @param shadowed productions replaced by a later one in the same stage
     * @param resolved consumption edges
     * @param terminal committed or verifier claims never consumed
     * @param open     virtual claims never consumed
     */
    public record Summary(int produced, int shadowed, int resolved, int terminal, int open) {
    }

    public record StageResolution(int index, String title, List<SpecResolution> sumchecks) {
        public StageResolution {
            sumchecks = List.copyOf(sumchecks);
        }
    }

    public record SpecResolution(String name, int stage, List<Consumption> consumed, List<ProducedClaim> produced) {
        public SpecResolution {
            consumed = List.copyOf(consumed);
            produced = List.copyOf(produced);
        }
    }

    /** A consumed claim with the sumcheck of record that produced it. */
    public record Consumption(Claim claim, String producer, int producerStage) {
    }

    /** Same-stage production that a later declaration replaced as producer of record. */
    public record ShadowedProduction(Claim claim, String shadowedProducer, String producer, int stage) {
    }
}

// file: resolve/src/main/java/io/sumspec/resolve/ResolutionTracker.java
package io.sumspec.resolve;

import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.ProducedClaim;
import io.sumspec.core.spec.Stage;
import io.sumspec.core.spec.SumcheckSpec;
import io.sumspec.resolve.ResolutionReport.Consumption;
import io.sumspec.resolve.ResolutionReport.ShadowedProduction;
import io.sumspec.resolve.ResolutionReport.SpecResolution;
import io.sumspec.resolve.ResolutionReport.StageResolution;
import io.sumspec.resolve.ResolutionReport.Summary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks a pipeline stage by stage and matches every consumed claim with the
 * sumcheck that produced it.
 * <p>
 * Responsibilities:
 *  - keep the producer of record for every claim produced so far;
 *  - fail fast on a consumption with no earlier producer, or on a claim
 *    consumed twice;
 *  - at the end, report virtual claims nobody consumed, and route
 *    committed/verifier claims nobody consumed to the commitment sink.
 * <p>
 * Invariants:
 *  - productions of stage s become visible only once stage s is complete,
 *    so a claim produced and consumed in the same stage is dangling;
 *  - within one stage a later production of the same claim replaces the
 *    earlier one as producer of record; the replaced one is kept as a
 *    {@link ShadowedProduction};
 *  - committed and verifier claims stay consumable; they only become
 *    terminal if nothing consumes them.
 * <p>
 * A tracker holds no state between walks; one instance may be reused.
 */
public final class ResolutionTracker {
    private static final Logger log = Logger.getLogger(ResolutionTracker.class.getName());

    public ResolutionReport track(Pipeline pipeline) {
        return new Walk(pipeline).run();
    }

    private record Production(Claim claim, String producer, int stage) {
    }

    /** State of one walk. */
    private static final class Walk {
        private final Pipeline pipeline;
        private final ClaimGraph.Builder graph;

        private final Map<Claim, Production> producers = new HashMap<>();
        private final Map<Claim, String> consumedBy = new HashMap<>();
        // unconsumed productions, in publication order
        private final Map<Claim, Production> open = new LinkedHashMap<>();
        private final Map<Claim, Production> terminal = new LinkedHashMap<>();

        private final List<StageResolution> stages = new ArrayList<>();
        private final List<ShadowedProduction> shadowed = new ArrayList<>();
        private int produced;
        private int resolved;

        Walk(Pipeline pipeline) {
            this.pipeline = pipeline;
            this.graph = ClaimGraph.builder(pipeline.stages().size());
            for (SumcheckSpec spec : pipeline.sumchecks()) {
                graph.node(spec.name(), spec.stage());
            }
        }

        ResolutionReport run() {
            for (Stage stage : pipeline.stages()) {
                walkStage(stage);
            }

            for (Production p : terminal.values()) {
                graph.edge(new ClaimEdge(p.producer(), ClaimGraph.SINK_ID, p.claim(), EdgeStatus.TERMINAL));
            }
            var unresolved = new ArrayList<UnresolvedVirtualClaim>();
            for (Production p : open.values()) {
                graph.edge(new ClaimEdge(p.producer(), ClaimGraph.SINK_ID, p.claim(), EdgeStatus.UNRESOLVED));
                unresolved.add(new UnresolvedVirtualClaim(p.claim(), p.producer(), p.stage()));
                log.log(Level.WARNING, String.format(
                        "Unresolved virtual claim %s (produced by %s, stage %d)", p.claim(), p.producer(), p.stage()));
            }

            var summary = new Summary(produced, shadowed.size(), resolved, terminal.size(), open.size());
            log.log(Level.INFO, String.format(
                    "Resolved '%s': %d produced (%d shadowed), %d consumed, %d terminal, %d open",
                    pipeline.title(), summary.produced(), summary.shadowed(), summary.resolved(),
                    summary.terminal(), summary.open()));
            return new ResolutionReport(stages, unresolved, shadowed, summary, graph.build());
        }

        private void walkStage(Stage stage) {
            Map<Claim, Production> pending = new LinkedHashMap<>();
            var specs = new ArrayList<SpecResolution>(stage.sumchecks().size());

            for (SumcheckSpec spec : stage.sumchecks()) {
                var consumed = new ArrayList<Consumption>(spec.consumes().size());
                for (Claim claim : spec.consumes()) {
                    consumed.add(consume(claim, spec));
                }
                for (ProducedClaim pc : spec.produces()) {
                    var production = new Production(pc.claim(), spec.name(), stage.index());
                    Production previous = pending.put(pc.claim(), production);
                    produced++;
                    if (previous != null) {
                        shadowed.add(new ShadowedProduction(pc.claim(), previous.producer(), spec.name(), stage.index()));
                        log.log(Level.FINE, String.format(
                                "%s replaces %s as producer of %s", spec.name(), previous.producer(), pc.claim()));
                    } else {
                        log.log(Level.FINE, String.format("%s produces %s", spec.name(), pc.claim()));
                    }
                }
                specs.add(new SpecResolution(spec.name(), spec.stage(), consumed, spec.produces()));
            }

            // publish
            for (Production p : pending.values()) {
                producers.put(p.claim(), p);
                if (p.claim().kind() == PolyKind.VIRTUAL) {
                    open.put(p.claim(), p);
                } else {
                    terminal.put(p.claim(), p);
                }
            }
            stages.add(new StageResolution(stage.index(), stage.title(), specs));
        }

        private Consumption consume(Claim claim, SumcheckSpec consumer) {
            String first = consumedBy.get(claim);
            if (first != null) {
                throw new DoubleConsumptionException(claim, first, consumer.name());
            }
            Production p = producers.get(claim);
            if (p == null) {
                throw new DanglingConsumptionException(claim, consumer.name(), consumer.stage());
            }
            consumedBy.put(claim, consumer.name());
            open.remove(claim);
            terminal.remove(claim);
            resolved++;
            graph.edge(new ClaimEdge(p.producer(), consumer.name(), claim, EdgeStatus.RESOLVED));
            log.log(Level.FINE, String.format(
                    "%s consumes %s from %s (stage %d)", consumer.name(), claim, p.producer(), p.stage()));
            return new Consumption(claim, p.producer(), p.stage());
        }
    }
}

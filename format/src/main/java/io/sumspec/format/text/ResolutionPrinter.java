// file: format/src/main/java/io/sumspec/format/text/ResolutionPrinter.java
package io.sumspec.format.text;

import io.sumspec.core.spec.ProducedClaim;
import io.sumspec.resolve.ResolutionReport;
import io.sumspec.resolve.ResolutionReport.Consumption;
import io.sumspec.resolve.ResolutionReport.ShadowedProduction;
import io.sumspec.resolve.ResolutionReport.SpecResolution;
import io.sumspec.resolve.ResolutionReport.StageResolution;
import io.sumspec.resolve.UnresolvedVirtualClaim;

/**
 * Plain-text view of a {@link ResolutionReport}.
 * <pre>
 *   ✓ claim ← S2 Producer      consumed, with provenance
 *   ● claim → PCS              committed, checked by the commitment scheme
 *   ◆ claim → verifier         computed by the verifier
 *   ○ claim → open             virtual, awaiting a later stage
 * </pre>
 */
public final class ResolutionPrinter {

    private ResolutionPrinter() {
        // utility
    }

    public static String render(ResolutionReport report) {
        var out = new StringBuilder();
        for (StageResolution stage : report.stages()) {
            out.append('\n').append("── Stage ").append(stage.index()).append(": ").append(stage.title()).append(" ──\n");
            for (SpecResolution spec : stage.sumchecks()) {
                out.append('\n').append("  ").append(spec.name()).append('\n');
                for (Consumption c : spec.consumed()) {
                    out.append("    ✓ ").append(c.claim())
                            .append(" ← S").append(c.producerStage()).append(' ').append(c.producer()).append('\n');
                }
                for (ProducedClaim p : spec.produced()) {
                    out.append("    ").append(produced(p)).append('\n');
                }
            }
        }

        var s = report.summary();
        out.append('\n').append("Summary\n");
        out.append("  produced : ").append(s.produced());
        if (s.shadowed() > 0) out.append(" (").append(s.shadowed()).append(" shadowed)");
        out.append('\n');
        out.append("  resolved : ").append(s.resolved()).append('\n');
        out.append("  terminal : ").append(s.terminal()).append('\n');
        out.append("  open     : ").append(s.open()).append('\n');

        if (!report.shadowed().isEmpty()) {
            out.append('\n').append("Shadowed productions (later declaration wins)\n");
            for (ShadowedProduction sp : report.shadowed()) {
                out.append("  S").append(sp.stage()).append(' ').append(sp.claim())
                        .append(": ").append(sp.producer()).append(" over ").append(sp.shadowedProducer()).append('\n');
            }
        }
        if (!report.isComplete()) {
            out.append('\n').append("Unresolved virtual claims\n");
            for (UnresolvedVirtualClaim u : report.unresolved()) {
                out.append("  ○ ").append(u).append('\n');
            }
        }
        return out.toString();
    }

    private static String produced(ProducedClaim p) {
        String claim = p.claim().toString();
        String range = p.rangeNote().map(r -> "  [" + r + "]").orElse("");
        return switch (p.claim().kind()) {
            case COMMITTED -> "● " + claim + " → PCS" + range;
            case VERIFIER -> "◆ " + claim + " → verifier" + range;
            case VIRTUAL -> "○ " + claim + " → open" + range;
        };
    }
}

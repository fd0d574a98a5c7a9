// file: format/src/main/java/io/sumspec/format/text/RegistryPrinter.java
package io.sumspec.format.text;

import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.registry.CatalogEntry;
import io.sumspec.core.registry.Parameter;
import io.sumspec.core.registry.PolynomialCatalog;
import io.sumspec.core.registry.PolynomialRegistry;
import io.sumspec.core.registry.RegistryEntry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plain-text listing of the polynomial registry.
 * <p>
 * One section per kind, entries in first-registration order grouped by
 * their catalog category; catalog domain and description are shown when the
 * catalog knows the polynomial. The parameter table closes the listing.
 */
public final class RegistryPrinter {

    private static final int RULE = 60;

    private RegistryPrinter() {
        // utility
    }

    /**
     * @param kinds kinds to list; empty or {@code null} lists every kind
     */
    public static String render(PolynomialRegistry registry, Set<PolyKind> kinds, PolynomialCatalog catalog) {
        Set<PolyKind> shown = kinds == null || kinds.isEmpty() ? EnumSet.allOf(PolyKind.class) : EnumSet.copyOf(kinds);
        var out = new StringBuilder();

        for (PolyKind kind : PolyKind.values()) {
            if (!shown.contains(kind)) continue;
            header(out, heading(kind) + " (" + registry.count(kind) + ")");

            Map<String, List<RegistryEntry>> byCategory = new LinkedHashMap<>();
            for (RegistryEntry e : registry.filter(kind)) {
                String category = catalog.lookup(e.name(), kind).map(CatalogEntry::category).orElse("");
                byCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(e);
            }
            for (var group : byCategory.entrySet()) {
                if (!group.getKey().isEmpty()) {
                    out.append('\n').append("  -- ").append(group.getKey()).append(" --\n");
                }
                for (RegistryEntry e : group.getValue()) {
                    entry(out, e, catalog.lookup(e.name(), kind));
                }
            }
        }

        if (!catalog.parameters().isEmpty()) {
            header(out, "PARAMETERS");
            for (Parameter p : catalog.parameters()) {
                String code = p.codeName().isEmpty() ? "" : " (" + p.codeName() + ")";
                String formula = p.formula().isEmpty() ? "" : " = " + p.formula();
                out.append("    ").append(p.symbol()).append(code).append(formula).append('\n');
                if (!p.description().isEmpty()) {
                    out.append("      ").append(p.description()).append('\n');
                }
            }
        }
        return out.toString();
    }

    static String heading(PolyKind kind) {
        return switch (kind) {
            case COMMITTED -> "COMMITTED (cp:)";
            case VIRTUAL -> "VIRTUAL (vp:)";
            case VERIFIER -> "VERIFIER-COMPUTABLE";
        };
    }

    // ---------- helpers ----------

    private static void entry(StringBuilder out, RegistryEntry e, Optional<CatalogEntry> known) {
        out.append("    ").append(e.name());
        known.filter(c -> !c.domain().isEmpty()).ifPresent(c -> out.append(" : ").append(domain(c.domain())));
        out.append('\n');
        known.filter(c -> !c.description().isEmpty())
                .ifPresent(c -> out.append("      ").append(c.description()).append('\n'));
    }

    private static String domain(List<Dimension> dims) {
        String cubes = dims.stream()
                .map(d -> "{0,1}^" + d.logSize())
                .collect(Collectors.joining(" × "));
        String labels = dims.stream()
                .map(d -> d.description().isEmpty() ? d.label() : d.description())
                .collect(Collectors.joining(" × "));
        return cubes + " → F   [" + labels + "]";
    }

    private static void header(StringBuilder out, String title) {
        out.append('\n')
                .append("=".repeat(RULE)).append('\n')
                .append("  ").append(title).append('\n')
                .append("=".repeat(RULE)).append('\n');
    }
}

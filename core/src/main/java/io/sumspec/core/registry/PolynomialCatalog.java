// file: core/src/main/java/io/sumspec/core/registry/PolynomialCatalog.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.PolyKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptions, domains and categories for polynomials, plus the system
 * parameters they are sized by.
 * <p>
 * Keyed by (name, kind): the catalog documents concepts, so a name may be
 * listed once as a committed chunk and once as the virtual product of
 * those chunks. Kind exclusivity is enforced by {@link PolynomialRegistry},
 * not here.
 */
public final class PolynomialCatalog {

    private final Map<String, CatalogEntry> entries = new LinkedHashMap<>();
    private final List<Parameter> parameters;

    public PolynomialCatalog(List<CatalogEntry> entries, List<Parameter> parameters) {
        for (CatalogEntry e : entries) {
            if (this.entries.putIfAbsent(key(e.name(), e.kind()), e) != null) {
                throw new IllegalArgumentException("duplicate catalog entry " + e.kind() + " " + e.name());
            }
        }
        this.parameters = List.copyOf(parameters);
    }

    public static PolynomialCatalog empty() {
        return new PolynomialCatalog(List.of(), List.of());
    }

    public Optional<CatalogEntry> lookup(String name, PolyKind kind) {
        return Optional.ofNullable(entries.get(key(name, kind)));
    }

    public List<CatalogEntry> entries() {
        return List.copyOf(entries.values());
    }

    public List<CatalogEntry> entries(PolyKind kind) {
        return entries.values().stream().filter(e -> e.kind() == kind).toList();
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    private static String key(String name, PolyKind kind) {
        return kind.name() + "\u0000" + name;
    }
}

// file: core/src/main/java/io/sumspec/core/registry/CatalogEntry.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.PolyKind;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive record for one polynomial: what it is, which hypercube
 * it lives on, and the display category it belongs to.
 */
public record CatalogEntry(
        String name,
        PolyKind kind,
        String category,
        String description,
        List<Dimension> domain
) {
    public CatalogEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        category = category == null ? "" : category;
        description = description == null ? "" : description;
        domain = domain == null ? List.of() : List.copyOf(domain);
    }
}

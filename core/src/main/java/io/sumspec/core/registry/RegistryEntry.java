// file: core/src/main/java/io/sumspec/core/registry/RegistryEntry.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.PolyKind;

import java.util.Objects;

/** One registered polynomial: its name and the single kind it has. */
public record RegistryEntry(String name, PolyKind kind) {

    public RegistryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    }
}

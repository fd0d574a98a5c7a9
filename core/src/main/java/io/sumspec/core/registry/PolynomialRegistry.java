// file: core/src/main/java/io/sumspec/core/registry/PolynomialRegistry.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.Expressions;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.expr.PolyRef;
import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.ConstraintRow;
import io.sumspec.core.spec.ConstraintTable;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.SumcheckSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flat catalog of polynomial names and their kinds.
 * <p>
 * Responsibilities:
 *  - Record each (name, kind) pair once, in first-registration order.
 *  - Reject a name that shows up under a second kind.
 *  - List entries, optionally restricted to one kind.
 * <p>
 * Design:
 *  - An explicit value built once (usually via {@link #fromPipeline}) and
 *    passed to whoever needs it; there is no process-wide instance.
 *  - Not thread safe while being built; read-only use afterwards is safe.
 */
public final class PolynomialRegistry {

    // Insertion order is the listing order.
    private final Map<String, RegistryEntry> byName = new LinkedHashMap<>();

    public PolynomialRegistry() {
    }

    /**
     * Registry of every polynomial the pipeline mentions: produced claims,
     * consumed claims, then polynomial leaves of lhs, rhs and table cells,
     * stage by stage.
     */
    public static PolynomialRegistry fromPipeline(Pipeline pipeline) {
        var registry = new PolynomialRegistry();
        for (SumcheckSpec spec : pipeline.sumchecks()) {
            spec.producedClaims().forEach(registry::register);
            spec.consumes().forEach(registry::register);
            registry.registerLeaves(spec.lhs());
            spec.rhs().ifPresent(registry::registerLeaves);
            for (ConstraintTable t : spec.tables()) {
                for (ConstraintRow row : t.rows()) {
                    row.cells().forEach(registry::registerLeaves);
                }
            }
        }
        return registry;
    }

    public RegistryEntry register(Claim claim) {
        return register(claim.name(), claim.kind());
    }

    /**
     * Idempotently record {@code (name, kind)}.
     *
     * @return the entry now held for {@code name}
     * @throws KindConflictException if {@code name} is registered under another kind
     */
    public RegistryEntry register(String name, PolyKind kind) {
        RegistryEntry existing = byName.get(name);
        if (existing == null) {
            var entry = new RegistryEntry(name, kind);
            byName.put(name, entry);
            return entry;
        }
        if (existing.kind() != kind) {
            throw new KindConflictException(name, existing.kind(), kind);
        }
        return existing;
    }

    /**
     * Entries of the given kind ({@code null} for all) in first-registration
     * order. The returned iterable is lazy and can be iterated any number of
     * times; each iteration sees the registry as it is at that moment.
     */
    public Iterable<RegistryEntry> filter(PolyKind kind) {
        return () -> stream(kind).iterator();
    }

    public Stream<RegistryEntry> stream(PolyKind kind) {
        Stream<RegistryEntry> all = byName.values().stream();
        return kind == null ? all : all.filter(e -> e.kind() == kind);
    }

    public Optional<PolyKind> kindOf(String name) {
        return Optional.ofNullable(byName.get(name)).map(RegistryEntry::kind);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public int size() {
        return byName.size();
    }

    public long count(PolyKind kind) {
        return stream(kind).count();
    }

    // ---------- helpers ----------

    private void registerLeaves(Expr e) {
        for (PolyRef leaf : Expressions.polynomials(e)) {
            register(leaf.name(), leaf.kind());
        }
    }
}

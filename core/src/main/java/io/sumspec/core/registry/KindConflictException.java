// file: core/src/main/java/io/sumspec/core/registry/KindConflictException.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.PolyKind;

/**
 * A polynomial name was registered under a second kind.
 */
public class KindConflictException extends IllegalStateException {

    private final String name;
    private final PolyKind registered;
    private final PolyKind attempted;

    public KindConflictException(String name, PolyKind registered, PolyKind attempted) {
        super("polynomial %s is already registered as %s, cannot register it as %s"
                .formatted(name, registered, attempted));
        this.name = name;
        this.registered = registered;
        this.attempted = attempted;
    }

    public String name() {
        return name;
    }

    public PolyKind registered() {
        return registered;
    }

    public PolyKind attempted() {
        return attempted;
    }
}

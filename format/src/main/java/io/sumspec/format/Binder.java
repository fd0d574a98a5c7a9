// file: format/src/main/java/io/sumspec/format/Binder.java
package io.sumspec.format;

import io.sumspec.core.expr.Var;

import java.util.Objects;

/**
 * What a format is told about a hypercube-bound variable: its name and the
 * number of boolean variables it ranges over ({@code "log2(T)"}, {@code "1"}).
 */
public record Binder(String name, String logSize) {

    public Binder {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(logSize, "logSize");
    }

    static Binder of(Var v) {
        return new Binder(v.name(), v.dimensionIfDeclared()
                .map(d -> d.logSize())
                .orElseThrow(() -> new IllegalArgumentException("binder " + v.name() + " has no dimension")));
    }
}

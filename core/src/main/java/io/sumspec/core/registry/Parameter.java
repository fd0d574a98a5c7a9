// file: core/src/main/java/io/sumspec/core/registry/Parameter.java
package io.sumspec.core.registry;

import java.util.Objects;

/**
 * System parameter such as {@code T} or {@code d_ram}.
 *
 * @param symbol      display symbol
 * @param codeName    name used in the prover code, empty if none
 * @param description one-line description
 * @param formula     derivation, empty if the parameter is primitive
 */
public record Parameter(String symbol, String codeName, String description, String formula) {

    public Parameter {
        Objects.requireNonNull(symbol, "symbol");
        codeName = codeName == null ? "" : codeName;
        description = description == null ? "" : description;
        formula = formula == null ? "" : formula;
    }
}

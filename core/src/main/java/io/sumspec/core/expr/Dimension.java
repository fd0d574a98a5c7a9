// file: core/src/main/java/io/sumspec/core/expr/Dimension.java
package io.sumspec.core.expr;

import java.util.Objects;

/**
 * One factor of a polynomial's hypercube domain.
 *
 * @param size        symbolic or numeric domain size, e.g. "T", "K_ram", "2"
 * @param label       short label used for challenge names, e.g. "cycle"
 * @param description human readable name, e.g. "RAM address"
 */
public record Dimension(String size, String label, String description) {

    public Dimension {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(label, "label");
        if (size.isBlank()) throw new MalformedExpressionException("dimension size must not be blank");
        if (label.isBlank()) throw new MalformedExpressionException("dimension label must not be blank");
        description = description == null ? "" : description;
    }

    /**
     * Number of boolean variables this dimension contributes, as text.
     * Numeric powers of two collapse to their exponent ("2" gives "1");
     * anything else stays symbolic ("T" gives "log2(T)").
     */
    public String logSize() {
        if (size.matches("\\d{1,18}")) {
            long n = Long.parseLong(size);
            if (n > 0 && Long.bitCount(n) == 1) {
                return Integer.toString(Long.numberOfTrailingZeros(n));
            }
        }
        return "log2(" + size + ")";
    }
}

// file: format/src/main/java/io/sumspec/format/Precedence.java
package io.sumspec.format;

/**
 * Binding strength of a rendered fragment, tightest first.
 */
public enum Precedence {
    /** Leaves, polynomial references, parenthesized text. */
    ATOM,
    POWER,
    NEGATION,
    PRODUCT,
    SUM,
    /** Σ / Π: the body extends as far right as possible. */
    BINDER
}

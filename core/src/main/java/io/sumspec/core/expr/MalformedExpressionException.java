// file: core/src/main/java/io/sumspec/core/expr/MalformedExpressionException.java
package io.sumspec.core.expr;

/**
 * Raised when an expression node is built with children or parameters
 * that violate its arity, kind or binding constraints.
 */
public class MalformedExpressionException extends IllegalArgumentException {

    public MalformedExpressionException(String message) {
        super(message);
    }
}

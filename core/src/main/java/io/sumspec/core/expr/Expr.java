// file: core/src/main/java/io/sumspec/core/expr/Expr.java
package io.sumspec.core.expr;

/**
 * Node of an algebraic expression over named polynomials.
 * <p>
 * The variant set is closed: every node is one of the records permitted
 * below, and {@link ExprVisitor} has exactly one method per variant, so a
 * visitor that compiles handles every node that can ever be built.
 * <p>
 * Design:
 *  - Immutable: every variant is a record whose list components are copied.
 *  - Tree shaped: children are owned by value; identical sub-expressions may
 *    be shared because nothing can mutate them.
 *  - Validated: constructors reject arity/kind violations with
 *    {@link MalformedExpressionException}.
 */
public sealed interface Expr
        permits Const, Var, Challenge, Opening, PolyRef,
                Add, Mul, Neg, Pow,
                Sum, MultiSum, FiniteSum, Prod {

    <R> R accept(ExprVisitor<R> visitor);
}

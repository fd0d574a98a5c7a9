// file: core/src/main/java/io/sumspec/core/expr/ExprVisitor.java
package io.sumspec.core.expr;

/**
 * One callback per expression variant.
 * Implementations decide traversal order themselves; {@link Expr#accept}
 * only dispatches on the node it is called on.
 */
public interface ExprVisitor<R> {

    R visitConst(Const node);

    R visitVar(Var node);

    R visitChallenge(Challenge node);

    R visitOpening(Opening node);

    R visitCommitted(CommittedPoly node);

    R visitVirtual(VirtualPoly node);

    R visitVerifier(VerifierPoly node);

    R visitAdd(Add node);

    R visitMul(Mul node);

    R visitNeg(Neg node);

    R visitPow(Pow node);

    R visitSum(Sum node);

    R visitMultiSum(MultiSum node);

    R visitFiniteSum(FiniteSum node);

    R visitProd(Prod node);
}

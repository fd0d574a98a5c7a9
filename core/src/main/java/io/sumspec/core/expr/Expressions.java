// file: core/src/main/java/io/sumspec/core/expr/Expressions.java
package io.sumspec.core.expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builders and structural queries over {@link Expr} trees.
 * <p>
 * Everything here is a pure function of its arguments.
 */
public final class Expressions {

    private Expressions() {
        // utility
    }

    // ---------- builders ----------

    /** Left-folded sum: {@code add(a, b, c) == Add(Add(a, b), c)}. */
    public static Expr add(Expr first, Expr... rest) {
        Expr acc = first;
        for (Expr e : rest) {
            acc = new Add(acc, e);
        }
        return acc;
    }

    /** {@code a - b}, represented as {@code Add(a, Neg(b))}. */
    public static Expr sub(Expr a, Expr b) {
        return new Add(a, new Neg(b));
    }

    /** Left-folded product. */
    public static Expr mul(Expr first, Expr... rest) {
        Expr acc = first;
        for (Expr e : rest) {
            acc = new Mul(acc, e);
        }
        return acc;
    }

    public static Expr neg(Expr e) {
        return new Neg(e);
    }

    public static Expr pow(Expr base, int exponent) {
        return new Pow(base, exponent);
    }

    public static Const constant(String value) {
        return new Const(value);
    }

    // ---------- structure ----------

    /** Direct children in left-to-right order. */
    public static List<Expr> children(Expr e) {
        return e.accept(CHILDREN);
    }

    /**
     * Names of index variables used in {@code e} but not bound by any
     * enclosing binder, in first-occurrence order. Dimensioned variables are
     * global and never reported.
     */
    public static Set<String> freeIndexVariables(Expr e) {
        var free = new LinkedHashSet<String>();
        collectFree(e, new ArrayDeque<>(), free);
        return free;
    }

    /**
     * Fail with {@link MalformedExpressionException} if {@code e} uses an
     * index variable outside the binder that introduces it.
     *
     * @param context what the expression is part of, for the message
     */
    public static void requireBound(Expr e, String context) {
        Set<String> free = freeIndexVariables(e);
        if (!free.isEmpty()) {
            throw new MalformedExpressionException(
                    "unbound index variable " + String.join(", ", free) + " in " + context);
        }
    }

    /**
     * Distinct polynomial leaves of {@code e} in first-occurrence order.
     * Leaves are compared structurally, so the same polynomial at two
     * different points is reported twice.
     */
    public static List<PolyRef> polynomials(Expr e) {
        var out = new LinkedHashSet<PolyRef>();
        collectPolys(e, out);
        return List.copyOf(out);
    }

    /**
     * Degree of the univariate round polynomial induced by {@code e}.
     * Every polynomial leaf is multilinear (degree 1); constants are degree 0;
     * products add, sums take the maximum, powers scale. A product over a
     * symbolic bound cannot be expanded and contributes its body's degree.
     */
    public static int degree(Expr e) {
        return e.accept(DEGREE);
    }

    // ---------- helpers ----------

    private static void collectFree(Expr e, Deque<String> scope, Set<String> free) {
        if (e instanceof Var v) {
            if (v.isIndex() && !scope.contains(v.name())) {
                free.add(v.name());
            }
            return;
        }
        List<String> bound = boundNames(e);
        bound.forEach(scope::push);
        for (Expr child : children(e)) {
            collectFree(child, scope, free);
        }
        bound.forEach(n -> scope.pop());
    }

    private static List<String> boundNames(Expr e) {
        if (e instanceof Sum s) return List.of(s.variable().name());
        if (e instanceof MultiSum m) return m.variables().stream().map(Var::name).toList();
        if (e instanceof FiniteSum f) return List.of(f.index());
        if (e instanceof Prod p) return List.of(p.index());
        return List.of();
    }

    private static void collectPolys(Expr e, Set<PolyRef> out) {
        if (e instanceof PolyRef p) {
            out.add(p);
            return;
        }
        for (Expr child : children(e)) {
            collectPolys(child, out);
        }
    }

    private static final ExprVisitor<List<Expr>> CHILDREN = new ExprVisitor<>() {
        @Override public List<Expr> visitConst(Const node) { return List.of(); }
        @Override public List<Expr> visitVar(Var node) { return List.of(); }
        @Override public List<Expr> visitChallenge(Challenge node) { return List.of(); }
        @Override public List<Expr> visitOpening(Opening node) { return node.components(); }
        @Override public List<Expr> visitCommitted(CommittedPoly node) { return List.of(node.point()); }
        @Override public List<Expr> visitVirtual(VirtualPoly node) { return List.of(node.point()); }
        @Override public List<Expr> visitVerifier(VerifierPoly node) { return List.of(node.point()); }
        @Override public List<Expr> visitAdd(Add node) { return List.of(node.left(), node.right()); }
        @Override public List<Expr> visitMul(Mul node) { return List.of(node.left(), node.right()); }
        @Override public List<Expr> visitNeg(Neg node) { return List.of(node.operand()); }
        @Override public List<Expr> visitPow(Pow node) { return List.of(node.base()); }
        @Override public List<Expr> visitSum(Sum node) { return List.of(node.body()); }
        @Override public List<Expr> visitMultiSum(MultiSum node) { return List.of(node.body()); }
        @Override public List<Expr> visitFiniteSum(FiniteSum node) { return List.of(node.body()); }
        @Override public List<Expr> visitProd(Prod node) { return List.of(node.body()); }
    };

    private static final ExprVisitor<Integer> DEGREE = new ExprVisitor<>() {
        @Override public Integer visitConst(Const node) { return 0; }
        @Override public Integer visitVar(Var node) { return 1; }
        @Override public Integer visitChallenge(Challenge node) { return 0; }
        @Override public Integer visitOpening(Opening node) { return 0; }
        @Override public Integer visitCommitted(CommittedPoly node) { return 1; }
        @Override public Integer visitVirtual(VirtualPoly node) { return 1; }
        @Override public Integer visitVerifier(VerifierPoly node) { return 1; }
        @Override public Integer visitAdd(Add node) {
            return Math.max(node.left().accept(this), node.right().accept(this));
        }
        @Override public Integer visitMul(Mul node) {
            return node.left().accept(this) + node.right().accept(this);
        }
        @Override public Integer visitNeg(Neg node) { return node.operand().accept(this); }
        @Override public Integer visitPow(Pow node) { return node.exponent() * node.base().accept(this); }
        @Override public Integer visitSum(Sum node) { return node.body().accept(this); }
        @Override public Integer visitMultiSum(MultiSum node) { return node.body().accept(this); }
        @Override public Integer visitFiniteSum(FiniteSum node) { return node.body().accept(this); }
        @Override public Integer visitProd(Prod node) {
            int body = node.body().accept(this);
            return node.numericBound().isPresent() ? node.numericBound().getAsInt() * body : body;
        }
    };
}

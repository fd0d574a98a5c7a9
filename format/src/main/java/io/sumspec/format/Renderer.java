// file: format/src/main/java/io/sumspec/format/Renderer.java
package io.sumspec.format;

import io.sumspec.core.expr.Add;
import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.CommittedPoly;
import io.sumspec.core.expr.Const;
import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.ExprVisitor;
import io.sumspec.core.expr.Expressions;
import io.sumspec.core.expr.FiniteSum;
import io.sumspec.core.expr.Mul;
import io.sumspec.core.expr.MultiSum;
import io.sumspec.core.expr.Neg;
import io.sumspec.core.expr.Opening;
import io.sumspec.core.expr.Pow;
import io.sumspec.core.expr.Prod;
import io.sumspec.core.expr.Sum;
import io.sumspec.core.expr.Var;
import io.sumspec.core.expr.VerifierPoly;
import io.sumspec.core.expr.VirtualPoly;

import java.util.List;

/**
 * The one traversal shared by every {@link Format}: post-order, children
 * left to right, then the node itself.
 * <p>
 * Pure: the same expression and format always give the same text.
 * An index variable used outside the binder that introduces it is rejected
 * with {@link io.sumspec.core.expr.MalformedExpressionException} before any
 * backend method runs.
 */
public final class Renderer {

    private Renderer() {
        // utility
    }

    public static String render(Expr expr, Format format) {
        return renderFragment(expr, format).text();
    }

    public static Fragment renderFragment(Expr expr, Format format) {
        Expressions.requireBound(expr, "expression rendered as " + format.name());
        return expr.accept(new Walk(format));
    }

    private static final class Walk implements ExprVisitor<Fragment> {
        private final Format format;

        Walk(Format format) {
            this.format = format;
        }

        private Fragment child(Expr e) {
            return e.accept(this);
        }

        private Fragment checked(Fragment f, String variant) {
            if (f == null) throw new UnsupportedNodeException(variant, format.name());
            return f;
        }

        @Override
        public Fragment visitConst(Const node) {
            return checked(format.constant(node.value()), "Const");
        }

        @Override
        public Fragment visitVar(Var node) {
            return checked(format.variable(node.name()), "Var");
        }

        @Override
        public Fragment visitChallenge(Challenge node) {
            return checked(format.challenge(node.stage(), node.label()), "Challenge");
        }

        @Override
        public Fragment visitOpening(Opening node) {
            List<Fragment> components = node.components().stream().map(this::child).toList();
            return checked(format.opening(components), "Opening");
        }

        @Override
        public Fragment visitCommitted(CommittedPoly node) {
            return checked(format.committed(node.name(), child(node.point())), "CommittedPoly");
        }

        @Override
        public Fragment visitVirtual(VirtualPoly node) {
            return checked(format.virtual(node.name(), child(node.point())), "VirtualPoly");
        }

        @Override
        public Fragment visitVerifier(VerifierPoly node) {
            return checked(format.verifier(node.name(), child(node.point())), "VerifierPoly");
        }

        @Override
        public Fragment visitAdd(Add node) {
            Fragment left = child(node.left());
            return checked(format.add(left, child(node.right())), "Add");
        }

        @Override
        public Fragment visitMul(Mul node) {
            Fragment left = child(node.left());
            return checked(format.mul(left, child(node.right())), "Mul");
        }

        @Override
        public Fragment visitNeg(Neg node) {
            return checked(format.neg(child(node.operand())), "Neg");
        }

        @Override
        public Fragment visitPow(Pow node) {
            return checked(format.pow(child(node.base()), node.exponent()), "Pow");
        }

        @Override
        public Fragment visitSum(Sum node) {
            Fragment body = child(node.body());
            return checked(format.sum(Binder.of(node.variable()), body), "Sum");
        }

        @Override
        public Fragment visitMultiSum(MultiSum node) {
            Fragment body = child(node.body());
            List<Binder> binders = node.variables().stream().map(Binder::of).toList();
            return checked(format.multiSum(binders, body), "MultiSum");
        }

        @Override
        public Fragment visitFiniteSum(FiniteSum node) {
            Fragment body = child(node.body());
            return checked(format.finiteSum(node.index(), node.bound(), body), "FiniteSum");
        }

        @Override
        public Fragment visitProd(Prod node) {
            Fragment body = child(node.body());
            return checked(format.prod(node.index(), node.bound(), body), "Prod");
        }
    }
}

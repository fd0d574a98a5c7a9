// file: core/src/main/java/io/sumspec/core/spec/SumcheckSpec.java
package io.sumspec.core.spec;

import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.Expressions;
import io.sumspec.core.expr.MultiSum;
import io.sumspec.core.expr.Sum;
import io.sumspec.core.expr.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One sumcheck of the pipeline.
 * <p>
 * Responsibilities:
 *  - Hold the summed identity: {@code lhs} (the sum over {@code summedOver}
 *    of the integrand) and the optional claimed value {@code rhs}.
 *  - Declare the claims it consumes from earlier stages and the claims its
 *    final opening point produces.
 *  - Carry descriptive metadata: rounds, stated degree, constraint tables.
 * <p>
 * Invariants (checked at construction):
 *  - index variables in lhs, rhs and table cells are bound;
 *  - no produced claim uses a challenge drawn after this stage;
 *  - every consumed claim was drawn strictly before this stage.
 */
public final class SumcheckSpec {

    private final String name;
    private final int stage;
    private final List<Var> summedOver;
    private final List<Challenge> openingPoint;
    private final String rounds;
    private final String degree;
    private final Expr lhs;
    private final Expr rhs; // nullable: implicit claimed value
    private final List<ConstraintTable> tables;
    private final List<ProducedClaim> produces;
    private final List<Claim> consumes;

    private SumcheckSpec(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("sumcheck name must not be blank");
        if (b.stage < 1) throw new IllegalArgumentException(name + ": stage must be >= 1, got " + b.stage);
        this.stage = b.stage;
        this.lhs = Objects.requireNonNull(b.lhs, name + ": lhs");
        this.rhs = b.rhs;
        this.summedOver = List.copyOf(b.summedOver);
        if (summedOver.isEmpty()) throw new IllegalArgumentException(name + ": summedOver must not be empty");
        this.openingPoint = List.copyOf(b.openingPoint);
        this.rounds = b.rounds == null ? "" : b.rounds;
        this.degree = b.degree == null ? "" : b.degree;
        this.tables = List.copyOf(b.tables);
        this.produces = List.copyOf(b.produces);
        this.consumes = List.copyOf(b.consumes);

        Expressions.requireBound(lhs, name + " lhs");
        if (rhs != null) Expressions.requireBound(rhs, name + " rhs");
        for (ConstraintTable t : tables) {
            for (ConstraintRow row : t.rows()) {
                for (Expr cell : row.cells()) {
                    Expressions.requireBound(cell, name + " table row " + row.label());
                }
            }
        }
        for (ProducedClaim p : produces) {
            if (p.claim().latestStage() > stage) {
                throw new IllegalArgumentException(
                        "%s (stage %d) produces %s at a challenge drawn later".formatted(name, stage, p.claim()));
            }
        }
        for (Claim c : consumes) {
            if (c.latestStage() >= stage) {
                throw new IllegalArgumentException(
                        "%s (stage %d) consumes %s, which is not drawn before this stage"
                                .formatted(name, stage, c));
            }
        }
    }

    public static Builder builder(String name, int stage) {
        return new Builder(name, stage);
    }

    /** Builder pre-filled with this spec's fields. */
    public Builder toBuilder() {
        return new Builder(name, stage)
                .summedOver(summedOver)
                .openingPoint(openingPoint)
                .rounds(rounds)
                .degree(degree)
                .lhs(lhs)
                .rhs(rhs)
                .tables(tables)
                .produces(produces)
                .consumes(consumes);
    }

    public SumcheckSpec withProduces(List<ProducedClaim> produces) {
        return toBuilder().produces(produces).build();
    }

    public SumcheckSpec withConsumes(List<Claim> consumes) {
        return toBuilder().consumes(consumes).build();
    }

    public String name() {
        return name;
    }

    public int stage() {
        return stage;
    }

    public List<Var> summedOver() {
        return summedOver;
    }

    public List<Challenge> openingPoint() {
        return openingPoint;
    }

    public String rounds() {
        return rounds;
    }

    /** Stated degree, possibly symbolic ("d_bc + 1"). */
    public String degree() {
        return degree;
    }

    public Expr lhs() {
        return lhs;
    }

    public Optional<Expr> rhs() {
        return Optional.ofNullable(rhs);
    }

    public List<ConstraintTable> tables() {
        return tables;
    }

    public List<ProducedClaim> produces() {
        return produces;
    }

    public List<Claim> producedClaims() {
        return produces.stream().map(ProducedClaim::claim).toList();
    }

    public List<Claim> consumes() {
        return consumes;
    }

    /** The lhs with its outermost hypercube sums peeled off. */
    public Expr integrand() {
        Expr e = lhs;
        while (true) {
            if (e instanceof Sum s) {
                e = s.body();
            } else if (e instanceof MultiSum m) {
                e = m.body();
            } else {
                return e;
            }
        }
    }

    /** Degree computed from the integrand's structure. */
    public int inferredDegree() {
        return Expressions.degree(integrand());
    }

    @Override
    public String toString() {
        return "SumcheckSpec[" + name + ", stage " + stage + "]";
    }

    public static final class Builder {
        private final String name;
        private final int stage;
        private List<Var> summedOver = List.of();
        private List<Challenge> openingPoint = List.of();
        private String rounds;
        private String degree;
        private Expr lhs;
        private Expr rhs;
        private List<ConstraintTable> tables = List.of();
        private List<ProducedClaim> produces = new ArrayList<>();
        private List<Claim> consumes = new ArrayList<>();

        private Builder(String name, int stage) {
            this.name = name;
            this.stage = stage;
        }

        public Builder summedOver(List<Var> vars) {
            this.summedOver = vars;
            return this;
        }

        public Builder openingPoint(List<Challenge> point) {
            this.openingPoint = point;
            return this;
        }

        public Builder rounds(String rounds) {
            this.rounds = rounds;
            return this;
        }

        public Builder degree(String degree) {
            this.degree = degree;
            return this;
        }

        public Builder lhs(Expr lhs) {
            this.lhs = lhs;
            return this;
        }

        public Builder rhs(Expr rhs) {
            this.rhs = rhs;
            return this;
        }

        public Builder tables(List<ConstraintTable> tables) {
            this.tables = tables;
            return this;
        }

        public Builder produces(List<ProducedClaim> produces) {
            this.produces = new ArrayList<>(produces);
            return this;
        }

        public Builder produce(Claim claim) {
            this.produces.add(ProducedClaim.of(claim));
            return this;
        }

        public Builder consumes(List<Claim> consumes) {
            this.consumes = new ArrayList<>(consumes);
            return this;
        }

        public Builder consume(Claim claim) {
            this.consumes.add(claim);
            return this;
        }

        public SumcheckSpec build() {
            return new SumcheckSpec(this);
        }
    }
}

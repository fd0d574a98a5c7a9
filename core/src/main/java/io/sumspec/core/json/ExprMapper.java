// file: core/src/main/java/io/sumspec/core/json/ExprMapper.java
package io.sumspec.core.json;

import io.sumspec.core.expr.Add;
import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.CommittedPoly;
import io.sumspec.core.expr.Const;
import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.FiniteSum;
import io.sumspec.core.expr.MalformedExpressionException;
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
import io.sumspec.core.json.dto.JsonExpr;

import java.util.List;
import java.util.Map;

/**
 * Maps the flat {@link JsonExpr} wire form onto AST records, resolving
 * variable dimensions through the pipeline's dimension table.
 */
final class ExprMapper {

    private final Map<String, Dimension> dimensions;

    ExprMapper(Map<String, Dimension> dimensions) {
        this.dimensions = Map.copyOf(dimensions);
    }

    Expr map(JsonExpr j) {
        if (j == null) throw new MalformedExpressionException("missing expression");
        if (j.type == null) throw new MalformedExpressionException("expression without a type");
        return switch (j.type) {
            case "const" -> new Const(require(j.value, "const value"));
            case "var" -> var(j);
            case "challenge" -> challenge(j);
            case "opening" -> opening(j);
            case "committed" -> new CommittedPoly(require(j.name, "committed name"), point(j));
            case "virtual" -> new VirtualPoly(require(j.name, "virtual name"), point(j));
            case "verifier" -> new VerifierPoly(require(j.name, "verifier name"), point(j));
            case "add" -> new Add(map(j.left), map(j.right));
            case "mul" -> new Mul(map(j.left), map(j.right));
            case "neg" -> new Neg(map(j.operand));
            case "pow" -> new Pow(map(j.base), require(j.exponent, "pow exponent"));
            case "sum" -> new Sum(var(j.variable), map(j.body));
            case "multiSum" -> new MultiSum(vars(j.variables), map(j.body));
            case "finiteSum" -> new FiniteSum(
                    require(j.index, "finiteSum index"), require(j.bound, "finiteSum bound"), map(j.body));
            case "prod" -> new Prod(
                    require(j.index, "prod index"), require(j.bound, "prod bound"), map(j.body));
            default -> throw new MalformedExpressionException("unknown expression type " + j.type);
        };
    }

    Var var(JsonExpr j) {
        if (j == null || !"var".equals(j.type)) {
            throw new MalformedExpressionException("expected a var, got " + (j == null ? "nothing" : j.type));
        }
        String name = require(j.name, "var name");
        if (j.dimension == null) return Var.index(name);
        Dimension d = dimensions.get(j.dimension);
        if (d == null) {
            throw new MalformedExpressionException("variable " + name + " uses unknown dimension " + j.dimension);
        }
        return new Var(name, d);
    }

    List<Var> vars(List<JsonExpr> list) {
        if (list == null) return List.of();
        return list.stream().map(this::var).toList();
    }

    Challenge challenge(JsonExpr j) {
        if (j == null || !"challenge".equals(j.type)) {
            throw new MalformedExpressionException("expected a challenge, got " + (j == null ? "nothing" : j.type));
        }
        return new Challenge(require(j.stage, "challenge stage"), require(j.label, "challenge label"));
    }

    List<Challenge> challenges(List<JsonExpr> list) {
        if (list == null) return List.of();
        return list.stream().map(this::challenge).toList();
    }

    private Opening opening(JsonExpr j) {
        if (j.components == null) return new Opening(List.of());
        return new Opening(j.components.stream().map(this::map).toList());
    }

    private Opening point(JsonExpr j) {
        if (j.point == null) return new Opening(List.of());
        Expr p = map(j.point);
        if (!(p instanceof Opening o)) {
            throw new MalformedExpressionException("point of " + j.name + " must be an opening");
        }
        return o;
    }

    private static <T> T require(T value, String what) {
        if (value == null) throw new MalformedExpressionException("missing " + what);
        return value;
    }
}

// file: format/src/main/java/io/sumspec/format/text/TextReport.java
package io.sumspec.format.text;

import io.sumspec.core.expr.Challenge;
import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.PolyRef;
import io.sumspec.core.expr.Var;
import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.ConstraintRow;
import io.sumspec.core.spec.ConstraintTable;
import io.sumspec.core.spec.ProducedClaim;
import io.sumspec.core.spec.Stage;
import io.sumspec.core.spec.SumcheckSpec;
import io.sumspec.format.Renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminal report of a pipeline: a boxed header per stage and one block per
 * sumcheck.
 * <p>
 * Output is a pure function of the input; no timestamps, no map iteration.
 */
public final class TextReport {

    private static final int RULE = 72;
    private static final int BOX = 62;

    private TextReport() {
        // utility
    }

    public static String render(String title, List<Stage> stages) {
        var out = new StringBuilder();
        box(out, title);
        for (Stage stage : stages) {
            box(out, "Stage " + stage.index() + ": " + stage.title());
            for (SumcheckSpec spec : stage.sumchecks()) {
                out.append(sumcheck(spec));
            }
        }
        return out.toString();
    }

    /** The block for one sumcheck, ending with a blank line. */
    public static String sumcheck(SumcheckSpec spec) {
        var out = new StringBuilder();
        line(out, "=".repeat(RULE));
        line(out, "  " + spec.name());
        line(out, "=".repeat(RULE));
        String degree = spec.degree().isEmpty() ? Integer.toString(spec.inferredDegree()) : spec.degree();
        line(out, "  Degree : " + degree);
        if (!spec.rounds().isEmpty()) line(out, "  Rounds : " + spec.rounds());
        line(out, "");
        line(out, "  Σ over : " + spec.summedOver().stream()
                .map(TextReport::cube)
                .collect(Collectors.joining(", ")));
        if (!spec.openingPoint().isEmpty()) {
            line(out, "  Opening: " + point(spec.openingPoint()));
        }
        line(out, "");
        spec.rhs().ifPresent(rhs -> {
            line(out, "  RHS (input claim):");
            line(out, "    " + text(rhs));
            line(out, "");
        });
        line(out, "  Integrand:");
        line(out, "    " + text(spec.integrand()));
        line(out, "");

        for (ConstraintTable table : spec.tables()) {
            table(out, table);
        }
        if (!spec.produces().isEmpty()) {
            line(out, "  Openings produced:");
            for (ProducedClaim p : spec.produces()) {
                line(out, "    " + claim(p.claim()) + p.rangeNote().map(r -> "  " + r).orElse(""));
            }
            line(out, "");
        }
        if (!spec.consumes().isEmpty()) {
            line(out, "  Claims consumed:");
            for (Claim c : spec.consumes()) {
                line(out, "    " + claim(c));
            }
            line(out, "");
        }
        return out.toString();
    }

    /** Plain-text form of a claim, e.g. {@code vp:RamVal(r_K_ram^(2), r_cycle^(2))}. */
    public static String claim(Claim claim) {
        return text(PolyRef.of(claim.kind(), claim.name(), claim.opening()));
    }

    // ---------- helpers ----------

    private static String text(Expr e) {
        return Renderer.render(e, TextFormat.INSTANCE);
    }

    private static String cube(Var v) {
        return v.name() + " ∈ {0,1}^" + v.dimensionIfDeclared().map(d -> d.logSize()).orElse("?");
    }

    private static String point(List<Challenge> point) {
        return point.stream().map(Challenge::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    private static void table(StringBuilder out, ConstraintTable table) {
        line(out, "  ── " + table.title() + " ──");
        line(out, "");

        List<String> header = new ArrayList<>();
        header.add("#");
        header.add("label");
        header.addAll(table.columns());

        List<List<String>> rows = new ArrayList<>();
        for (ConstraintRow row : table.rows()) {
            List<String> cells = new ArrayList<>();
            cells.add(Integer.toString(row.index()));
            cells.add(row.label());
            row.cells().forEach(c -> cells.add(text(c)));
            rows.add(cells);
        }

        int[] width = new int[header.size()];
        for (int i = 0; i < width.length; i++) {
            width[i] = length(header.get(i));
            for (List<String> r : rows) width[i] = Math.max(width[i], length(r.get(i)));
        }

        line(out, "  " + joinRow(header, width));
        List<String> rules = new ArrayList<>();
        for (int w : width) rules.add("─".repeat(w));
        line(out, "  " + joinRow(rules, width));
        for (List<String> r : rows) {
            line(out, "  " + joinRow(r, width));
        }
        line(out, "");
    }

    private static String joinRow(List<String> cells, int[] width) {
        var sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            boolean last = i == cells.size() - 1;
            if (i > 0) sb.append("  ");
            if (i == 0) {
                sb.append(" ".repeat(width[i] - length(cell))).append(cell);
            } else {
                sb.append(cell);
                if (!last) sb.append(" ".repeat(width[i] - length(cell)));
            }
        }
        return sb.toString();
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    private static void box(StringBuilder out, String title) {
        String shown = length(title) > BOX - 4 ? title.substring(0, BOX - 4) : title;
        line(out, "");
        line(out, "╔" + "═".repeat(BOX) + "╗");
        line(out, "║  " + shown + " ".repeat(BOX - 2 - length(shown)) + "║");
        line(out, "╚" + "═".repeat(BOX) + "╝");
        line(out, "");
    }

    private static void line(StringBuilder out, String s) {
        out.append(s).append('\n');
    }
}

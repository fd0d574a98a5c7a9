// file: format/src/main/java/io/sumspec/format/latex/LatexDocument.java
package io.sumspec.format.latex;

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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Stand-alone {@code .tex} document for a list of stages: one section per
 * stage, one subsection per sumcheck.
 * <p>
 * Needs {@code amsmath}, {@code xcolor[dvipsnames]}, {@code booktabs},
 * {@code array} and {@code adjustbox}, all loaded by the preamble.
 */
public final class LatexDocument {

    private static final String PREAMBLE = """
            \\documentclass[11pt]{article}
            \\usepackage[utf8]{inputenc}
            \\usepackage[T1]{fontenc}
            \\usepackage{amsmath, amssymb}
            \\usepackage[dvipsnames]{xcolor}
            \\usepackage{booktabs}
            \\usepackage{array}
            \\usepackage[margin=1in]{geometry}
            \\usepackage{hyperref}
            \\usepackage{adjustbox}

            \\hypersetup{colorlinks=true, linkcolor=blue, urlcolor=blue}

            """;

    private LatexDocument() {
        // utility
    }

    public static String render(String title, List<Stage> stages) {
        var out = new StringBuilder(PREAMBLE);
        out.append("\\title{").append(LatexNames.escape(title)).append("}\n");
        out.append("\\date{}\n\n");
        out.append("\\begin{document}\n\\maketitle\n\\tableofcontents\n\\newpage\n");
        for (Stage stage : stages) {
            out.append("\n\\section{Stage ").append(stage.index())
                    .append(" --- ").append(LatexNames.escape(stage.title())).append("}\n\n");
            for (SumcheckSpec spec : stage.sumchecks()) {
                out.append(sumcheck(spec)).append('\n');
            }
        }
        out.append("\n\\end{document}\n");
        return out.toString();
    }

    /** The subsection for one sumcheck. */
    public static String sumcheck(SumcheckSpec spec) {
        var out = new StringBuilder();
        out.append("\\subsection{").append(LatexNames.escape(spec.name())).append("}\n\n");
        out.append("\\begin{description}\n");
        String degree = spec.degree().isEmpty() ? Integer.toString(spec.inferredDegree()) : spec.degree();
        out.append("  \\item[Degree] ").append(LatexNames.escape(degree)).append('\n');
        if (!spec.rounds().isEmpty()) {
            out.append("  \\item[Rounds] $").append(LatexNames.dimension(spec.rounds())).append("$\n");
        }
        out.append("  \\item[Sum over] $").append(spec.summedOver().stream()
                .map(LatexDocument::cube)
                .collect(Collectors.joining(", "))).append("$\n");
        if (!spec.openingPoint().isEmpty()) {
            out.append("  \\item[Opening point] $").append(point(spec.openingPoint())).append("$\n");
        }
        out.append("\\end{description}\n\n");

        spec.rhs().ifPresent(rhs -> display(out, "RHS (input claim)", rhs));
        display(out, "Integrand", spec.integrand());

        for (ConstraintTable table : spec.tables()) {
            table(out, table);
        }
        if (!spec.produces().isEmpty()) {
            out.append("\\paragraph{Openings produced}\n\\begin{itemize}\n");
            for (ProducedClaim p : spec.produces()) {
                out.append("  \\item $").append(claim(p.claim()));
                p.rangeNote().ifPresent(r -> out.append(rangeNote(r)));
                out.append("$\n");
            }
            out.append("\\end{itemize}\n");
        }
        if (!spec.consumes().isEmpty()) {
            out.append("\\paragraph{Claims consumed}\n\\begin{itemize}\n");
            for (Claim c : spec.consumes()) {
                out.append("  \\item $").append(claim(c)).append("$\n");
            }
            out.append("\\end{itemize}\n");
        }
        return out.toString();
    }

    // ---------- helpers ----------

    private static String math(Expr e) {
        return Renderer.render(e, LatexFormat.INSTANCE);
    }

    private static String claim(Claim c) {
        return math(PolyRef.of(c.kind(), c.name(), c.opening()));
    }

    private static String rangeNote(String note) {
        if (note.startsWith("for ")) {
            return " \\text{ for } " + LatexNames.range(note.substring(4));
        }
        return " \\quad " + LatexNames.range(note);
    }

    private static String cube(Var v) {
        String log = v.dimensionIfDeclared().map(d -> LatexNames.dimension(d.logSize())).orElse("?");
        return v.name() + " \\in \\{0,1\\}^{" + log + "}";
    }

    private static String point(List<Challenge> point) {
        return point.stream().map(LatexDocument::math).collect(Collectors.joining(", ", "(", ")"));
    }

    private static void display(StringBuilder out, String heading, Expr e) {
        out.append("\\paragraph{").append(heading).append("}\n\\[\n  ").append(math(e)).append("\n\\]\n\n");
    }

    private static void table(StringBuilder out, ConstraintTable table) {
        out.append("\\paragraph{").append(LatexNames.escape(table.title())).append("}\n");
        out.append("\\begin{center}\n\\adjustbox{max width=\\textwidth}{\n\\small\n");
        out.append("\\begin{tabular}{cl").append(">{$}l<{$}".repeat(table.columns().size())).append("}\n");
        out.append("\\toprule\n$c$ & Label");
        for (String col : table.columns()) {
            out.append(" & \\multicolumn{1}{c}{").append(LatexNames.escape(col)).append("}");
        }
        out.append(" \\\\\n\\midrule\n");
        for (ConstraintRow row : table.rows()) {
            out.append('$').append(row.index()).append("$ & \\texttt{").append(LatexNames.escape(row.label())).append('}');
            for (Expr cell : row.cells()) {
                out.append(" & ").append(math(cell));
            }
            out.append(" \\\\\n");
        }
        out.append("\\bottomrule\n\\end{tabular}\n}\n\\end{center}\n\n");
    }
}

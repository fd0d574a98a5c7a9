// file: format/src/main/java/io/sumspec/format/html/HtmlSite.java
package io.sumspec.format.html;

import io.sumspec.core.expr.Expr;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.expr.PolyRef;
import io.sumspec.core.expr.Var;
import io.sumspec.core.registry.CatalogEntry;
import io.sumspec.core.registry.Parameter;
import io.sumspec.core.registry.PolynomialCatalog;
import io.sumspec.core.registry.PolynomialRegistry;
import io.sumspec.core.registry.RegistryEntry;
import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.ConstraintRow;
import io.sumspec.core.spec.ConstraintTable;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.ProducedClaim;
import io.sumspec.core.spec.Stage;
import io.sumspec.core.spec.SumcheckSpec;
import io.sumspec.format.Renderer;
import io.sumspec.resolve.GraphExport;
import io.sumspec.resolve.ResolutionReport;
import io.sumspec.resolve.ResolutionReport.Consumption;
import io.sumspec.resolve.ResolutionReport.ShadowedProduction;
import io.sumspec.resolve.ResolutionReport.SpecResolution;
import io.sumspec.resolve.ResolutionReport.StageResolution;
import io.sumspec.resolve.UnresolvedVirtualClaim;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Small static site for a pipeline: overview, one page per stage, an
 * openings index, the polynomial registry and the resolution report.
 * <p>
 * Design:
 *  - Pages are returned as an ordered map from file name to content; writing
 *    them is the caller's business.
 *  - Every page is self-contained: inline CSS, no scripts, no external
 *    resources. The claim graph is embedded as inert JSON.
 *  - Deterministic: page order and content depend on the input only.
 */
public final class HtmlSite {

    public static final String INDEX = "index.html";
    public static final String OPENINGS = "openings.html";
    public static final String POLYNOMIALS = "polynomials.html";
    public static final String RESOLVE = "resolve.html";

    private static final String CSS = """
            body { font-family: system-ui, sans-serif; margin: 0; color: #222; background: #fafafa; }
            nav { background: #263238; padding: .5rem 1rem; }
            nav a { color: #cfd8dc; margin-right: 1rem; text-decoration: none; }
            nav a.active { color: #fff; font-weight: bold; }
            main { max-width: 1100px; margin: 0 auto; padding: 1rem; }
            .card { background: #fff; border: 1px solid #ddd; border-radius: 6px; padding: 1rem; margin: 1rem 0; }
            .meta { color: #555; }
            .math { font-family: "STIX Two Math", "Cambria Math", serif; overflow-x: auto; }
            table { border-collapse: collapse; margin: .5rem 0; }
            th, td { border-bottom: 1px solid #eee; padding: .25rem .5rem; text-align: left; vertical-align: top; }
            .poly.cp { color: #2e7d32; }
            .poly.vp { color: #ef6c00; }
            .poly.vr { color: #1565c0; }
            .status-open { color: #c62828; }
            """;

    private HtmlSite() {
        // utility
    }

    /**
     * @param selected stage indices to give a page; empty or {@code null} means all
     */
    public static Map<String, String> render(Pipeline pipeline,
                                             Set<Integer> selected,
                                             PolynomialRegistry registry,
                                             PolynomialCatalog catalog,
                                             ResolutionReport report) {
        List<Stage> stages = pipeline.select(selected);
        Set<Integer> shown = stages.stream().map(Stage::index).collect(Collectors.toCollection(TreeSet::new));
        var site = new Site(pipeline.title(), stages, shown);

        var pages = new LinkedHashMap<String, String>();
        pages.put(INDEX, site.page("Overview", INDEX, site.index(report)));
        for (Stage stage : stages) {
            String file = stageFile(stage.index());
            pages.put(file, site.page("Stage " + stage.index() + ": " + stage.title(), file, site.stage(stage)));
        }
        pages.put(OPENINGS, site.page("Openings", OPENINGS, site.openings()));
        pages.put(POLYNOMIALS, site.page("Polynomials", POLYNOMIALS, polynomials(registry, catalog)));
        pages.put(RESOLVE, site.page("Claim resolution", RESOLVE, site.resolve(report)));
        return Collections.unmodifiableMap(pages);
    }

    static String stageFile(int index) {
        return "stage" + index + ".html";
    }

    /** Inline HTML for an expression. */
    static String math(Expr e) {
        return Renderer.render(e, HtmlFormat.INSTANCE);
    }

    static String claim(Claim c) {
        return math(PolyRef.of(c.kind(), c.name(), c.opening()));
    }

    // ---------- pages ----------

    private record Site(String title, List<Stage> stages, Set<Integer> shown) {

        String page(String heading, String file, String body) {
            var out = new StringBuilder();
            out.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n");
            out.append("<title>").append(Html.escape(heading)).append(" · ").append(Html.escape(title)).append("</title>\n");
            out.append("<style>\n").append(CSS).append("</style>\n</head>\n<body>\n");
            out.append(nav(file));
            out.append("<main>\n<h1>").append(Html.escape(heading)).append("</h1>\n");
            out.append(body);
            out.append("</main>\n</body>\n</html>\n");
            return out.toString();
        }

        private String nav(String active) {
            var out = new StringBuilder("<nav>\n");
            navLink(out, INDEX, "Overview", active);
            for (Stage s : stages) {
                navLink(out, stageFile(s.index()), "Stage " + s.index(), active);
            }
            navLink(out, OPENINGS, "Openings", active);
            navLink(out, POLYNOMIALS, "Polynomials", active);
            navLink(out, RESOLVE, "Resolution", active);
            return out.append("</nav>\n").toString();
        }

        String index(ResolutionReport report) {
            var out = new StringBuilder();
            out.append("<p class=\"meta\">").append(Html.escape(title)).append("</p>\n");
            for (Stage s : stages) {
                out.append("<div class=\"card\">\n<h3><a href=\"").append(stageFile(s.index())).append("\">Stage ")
                        .append(s.index()).append(": ").append(Html.escape(s.title())).append("</a></h3>\n");
                int n = s.sumchecks().size();
                out.append("<p class=\"meta\">").append(n).append(n == 1 ? " sumcheck" : " sumchecks").append("</p>\n<ul>\n");
                for (SumcheckSpec spec : s.sumchecks()) {
                    out.append("<li>").append(specLink(spec.name(), s.index())).append("</li>\n");
                }
                out.append("</ul>\n</div>\n");
            }
            var sum = report.summary();
            out.append("<p class=\"meta\">").append(sum.resolved()).append(" claims resolved, ")
                    .append(sum.terminal()).append(" terminal, ").append(sum.open()).append(" open.</p>\n");
            return out.toString();
        }

        String stage(Stage stage) {
            var out = new StringBuilder();
            for (SumcheckSpec spec : stage.sumchecks()) {
                out.append(sumcheck(spec));
            }
            return out.toString();
        }

        String openings() {
            var out = new StringBuilder();
            for (Stage s : stages) {
                out.append("<div class=\"card\">\n<h3>Stage ").append(s.index()).append(": ")
                        .append(Html.escape(s.title())).append("</h3>\n<table>\n");
                out.append("<tr><th>Claim</th><th>Kind</th><th>Produced by</th></tr>\n");
                for (SumcheckSpec spec : s.sumchecks()) {
                    for (ProducedClaim p : spec.produces()) {
                        out.append("<tr><td class=\"math\">").append(claim(p.claim()));
                        p.rangeNote().ifPresent(r -> out.append(" <span class=\"meta\">").append(Html.escape(r)).append("</span>"));
                        out.append("</td><td>").append(p.claim().kind().prefix()).append("</td><td>")
                                .append(specLink(spec.name(), s.index())).append("</td></tr>\n");
                    }
                }
                out.append("</table>\n</div>\n");
            }
            return out.toString();
        }

        String resolve(ResolutionReport report) {
            var out = new StringBuilder();
            var sum = report.summary();
            out.append("<table>\n");
            row(out, "Produced", Integer.toString(sum.produced()));
            row(out, "Shadowed", Integer.toString(sum.shadowed()));
            row(out, "Resolved", Integer.toString(sum.resolved()));
            row(out, "Terminal", Integer.toString(sum.terminal()));
            row(out, "Open", Integer.toString(sum.open()));
            out.append("</table>\n");

            for (StageResolution s : report.stages()) {
                if (!shown.contains(s.index())) continue;
                out.append("<div class=\"card\">\n<h3>Stage ").append(s.index()).append(": ")
                        .append(Html.escape(s.title())).append("</h3>\n<table>\n");
                out.append("<tr><th>Consumer</th><th>Claim</th><th>Producer</th></tr>\n");
                for (SpecResolution spec : s.sumchecks()) {
                    for (Consumption c : spec.consumed()) {
                        out.append("<tr><td>").append(specLink(spec.name(), spec.stage()))
                                .append("</td><td class=\"math\">").append(claim(c.claim()))
                                .append("</td><td>S").append(c.producerStage()).append(' ')
                                .append(specLink(c.producer(), c.producerStage())).append("</td></tr>\n");
                    }
                }
                out.append("</table>\n</div>\n");
            }

            if (!report.shadowed().isEmpty()) {
                out.append("<h2>Shadowed productions</h2>\n<ul>\n");
                for (ShadowedProduction sp : report.shadowed()) {
                    out.append("<li><span class=\"math\">").append(claim(sp.claim())).append("</span>: ")
                            .append(Html.escape(sp.producer())).append(" over ")
                            .append(Html.escape(sp.shadowedProducer())).append("</li>\n");
                }
                out.append("</ul>\n");
            }
            if (!report.isComplete()) {
                out.append("<h2 class=\"status-open\">Unresolved virtual claims</h2>\n<ul>\n");
                for (UnresolvedVirtualClaim u : report.unresolved()) {
                    out.append("<li><span class=\"math\">").append(claim(u.claim())).append("</span> from S")
                            .append(u.producerStage()).append(' ').append(specLink(u.producer(), u.producerStage()))
                            .append("</li>\n");
                }
                out.append("</ul>\n");
            }

            out.append("<h2>Claim graph</h2>\n");
            out.append("<script type=\"application/json\" id=\"claim-graph\">\n")
                    .append(GraphExport.toJson(report.graph()).replace("</", "<\\/"))
                    .append("\n</script>\n");
            return out.toString();
        }

        /** Link to a sumcheck's card, or its plain name if its stage has no page. */
        private String specLink(String name, int stage) {
            if (!shown.contains(stage)) return Html.escape(name);
            return "<a href=\"" + stageFile(stage) + "#" + Html.escape(name) + "\">" + Html.escape(name) + "</a>";
        }
    }

    private static String sumcheck(SumcheckSpec spec) {
        var out = new StringBuilder();
        out.append("<section class=\"card\" id=\"").append(Html.escape(spec.name())).append("\">\n");
        out.append("<h3>").append(Html.escape(spec.name())).append("</h3>\n<table class=\"meta\">\n");
        String degree = spec.degree().isEmpty() ? Integer.toString(spec.inferredDegree()) : spec.degree();
        row(out, "Degree", Html.escape(degree));
        if (!spec.rounds().isEmpty()) row(out, "Rounds", Html.escape(spec.rounds()));
        row(out, "Sum over", spec.summedOver().stream().map(HtmlSite::cube).collect(Collectors.joining(", ")));
        if (!spec.openingPoint().isEmpty()) {
            row(out, "Opening point", spec.openingPoint().stream().map(HtmlSite::math)
                    .collect(Collectors.joining(", ", "(", ")")));
        }
        out.append("</table>\n");

        spec.rhs().ifPresent(rhs -> block(out, "RHS (input claim)", math(rhs)));
        block(out, "Integrand", math(spec.integrand()));

        for (ConstraintTable t : spec.tables()) {
            out.append("<h4>").append(Html.escape(t.title())).append("</h4>\n<table>\n<tr><th>c</th><th>Label</th>");
            for (String col : t.columns()) {
                out.append("<th>").append(Html.escape(col)).append("</th>");
            }
            out.append("</tr>\n");
            for (ConstraintRow r : t.rows()) {
                out.append("<tr><td>").append(r.index()).append("</td><td><code>").append(Html.escape(r.label()))
                        .append("</code></td>");
                for (Expr cell : r.cells()) {
                    out.append("<td class=\"math\">").append(math(cell)).append("</td>");
                }
                out.append("</tr>\n");
            }
            out.append("</table>\n");
        }

        if (!spec.produces().isEmpty()) {
            out.append("<h4>Openings produced</h4>\n<ul>\n");
            for (ProducedClaim p : spec.produces()) {
                out.append("<li class=\"math\">").append(claim(p.claim()));
                p.rangeNote().ifPresent(r -> out.append(" <span class=\"meta\">").append(Html.escape(r)).append("</span>"));
                out.append("</li>\n");
            }
            out.append("</ul>\n");
        }
        if (!spec.consumes().isEmpty()) {
            out.append("<h4>Claims consumed</h4>\n<ul>\n");
            for (Claim c : spec.consumes()) {
                out.append("<li class=\"math\">").append(claim(c)).append("</li>\n");
            }
            out.append("</ul>\n");
        }
        return out.append("</section>\n").toString();
    }

    private static String polynomials(PolynomialRegistry registry, PolynomialCatalog catalog) {
        var out = new StringBuilder();
        for (PolyKind kind : PolyKind.values()) {
            out.append("<h2>").append(heading(kind)).append(" (").append(registry.count(kind)).append(")</h2>\n");
            out.append("<table>\n<tr><th>Name</th><th>Category</th><th>Domain</th><th>Description</th></tr>\n");
            for (RegistryEntry e : registry.filter(kind)) {
                var known = catalog.lookup(e.name(), kind);
                out.append("<tr><td>").append(HtmlFormat.poly(kind.prefix(), e.name())).append("</td><td>")
                        .append(Html.escape(known.map(CatalogEntry::category).orElse(""))).append("</td><td>")
                        .append(Html.escape(known.map(c -> c.domain().stream()
                                .map(d -> "{0,1}^" + d.logSize())
                                .collect(Collectors.joining(" × "))).orElse(""))).append("</td><td>")
                        .append(Html.escape(known.map(CatalogEntry::description).orElse(""))).append("</td></tr>\n");
            }
            out.append("</table>\n");
        }
        if (!catalog.parameters().isEmpty()) {
            out.append("<h2>Parameters</h2>\n<table>\n<tr><th>Symbol</th><th>Code</th><th>Formula</th><th>Description</th></tr>\n");
            for (Parameter p : catalog.parameters()) {
                out.append("<tr><td>").append(Html.escape(p.symbol())).append("</td><td><code>")
                        .append(Html.escape(p.codeName())).append("</code></td><td>")
                        .append(Html.escape(p.formula())).append("</td><td>")
                        .append(Html.escape(p.description())).append("</td></tr>\n");
            }
            out.append("</table>\n");
        }
        return out.toString();
    }

    // ---------- helpers ----------

    private static String heading(PolyKind kind) {
        return switch (kind) {
            case COMMITTED -> "Committed";
            case VIRTUAL -> "Virtual";
            case VERIFIER -> "Verifier-computable";
        };
    }

    private static String cube(Var v) {
        String log = v.dimensionIfDeclared().map(d -> d.logSize()).orElse("?");
        return math(v) + " &isin; {0,1}<sup>" + Html.escape(log) + "</sup>";
    }

    private static void navLink(StringBuilder out, String file, String label, String active) {
        out.append("<a href=\"").append(file).append('"');
        if (file.equals(active)) out.append(" class=\"active\"");
        out.append('>').append(Html.escape(label)).append("</a>\n");
    }

    private static void row(StringBuilder out, String label, String valueHtml) {
        out.append("<tr><th>").append(Html.escape(label)).append("</th><td>").append(valueHtml).append("</td></tr>\n");
    }

    private static void block(StringBuilder out, String heading, String html) {
        out.append("<h4>").append(Html.escape(heading)).append("</h4>\n<div class=\"math\">").append(html).append("</div>\n");
    }
}

// file: format/src/test/java/io/sumspec/format/html/HtmlSiteTest.java
package io.sumspec.format.html;

import io.sumspec.core.json.CatalogLoader;
import io.sumspec.core.json.PipelineLoader;
import io.sumspec.core.registry.PolynomialRegistry;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.resolve.ResolutionReport;
import io.sumspec.resolve.ResolutionTracker;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HtmlSiteTest {

    private final Pipeline pipeline = PipelineLoader.reference();
    private final ResolutionReport report = new ResolutionTracker().track(pipeline);

    private Map<String, String> site(Set<Integer> stages) {
        return HtmlSite.render(pipeline, stages, PolynomialRegistry.fromPipeline(pipeline), CatalogLoader.reference(), report);
    }

    @Test
    void full_site_has_every_page_in_order() {
        var pages = site(Set.of());

        assertEquals(List.of("index.html", "stage1.html", "stage2.html", "stage3.html", "stage4.html",
                        "stage5.html", "stage6.html", "stage7.html", "openings.html", "polynomials.html", "resolve.html"),
                List.copyOf(pages.keySet()));
        for (String page : pages.values()) {
            assertTrue(page.startsWith("<!DOCTYPE html>"));
            assertTrue(page.endsWith("</html>\n"));
            assertFalse(page.contains("http://") || page.contains("https://"), "no external resources");
        }
    }

    @Test
    void stage_page_has_a_card_per_sumcheck() {
        String stage2 = site(Set.of()).get("stage2.html");

        assertTrue(stage2.contains("<section class=\"card\" id=\"SpartanProductVirtualization\">"));
        assertTrue(stage2.contains("<section class=\"card\" id=\"RamOutputCheck\">"));
        assertTrue(stage2.contains("<a href=\"stage2.html\" class=\"active\">Stage 2</a>"));
        assertTrue(stage2.contains("<span class=\"poly vp\">Product</span>"));
    }

    @Test
    void resolve_page_embeds_graph_json() {
        String resolve = site(Set.of()).get("resolve.html");

        assertTrue(resolve.contains("<script type=\"application/json\" id=\"claim-graph\">"));
        assertTrue(resolve.contains("\"status\" : \"TERMINAL\""));
        assertTrue(resolve.contains("<a href=\"stage1.html#SpartanOuter\">SpartanOuter</a>"));
    }

    @Test
    void selection_drops_unselected_stage_pages_and_links() {
        var pages = site(Set.of(2));

        assertTrue(pages.containsKey("stage2.html"));
        assertFalse(pages.containsKey("stage1.html"));
        assertFalse(pages.get("resolve.html").contains("href=\"stage1.html"));
    }

    @Test
    void site_is_deterministic() {
        assertEquals(site(Set.of()), site(Set.of()));
    }
}

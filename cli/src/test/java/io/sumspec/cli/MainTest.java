// file: cli/src/test/java/io/sumspec/cli/MainTest.java
package io.sumspec.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new Main(CliConfig.fromArgs(args), out).run();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void text_prints_only_the_selected_stage() {
        assertEquals(Main.EXIT_OK, run("text", "--stage", "7"));
        assertTrue(output().contains("HammingWeightClaimReduction"));
        assertFalse(output().contains("SpartanOuter"));
    }

    @Test
    void registry_prints_the_requested_kind() {
        assertEquals(Main.EXIT_OK, run("registry", "--cp"));
        assertTrue(output().contains("COMMITTED (cp:) (7)"));
        assertFalse(output().contains("VIRTUAL (vp:)"));
    }

    @Test
    void resolve_on_reference_pipeline_is_complete_and_writes_graph() throws Exception {
        Path graph = tmp.resolve("graph/claims.json");
        assertEquals(Main.EXIT_OK, run("resolve", "--graph", graph.toString()));
        assertTrue(output().contains("Summary"));
        assertTrue(Files.readString(graph).contains("\"edges\""));
    }

    @Test
    void resolve_reports_open_claims_with_exit_code_3() throws Exception {
        Path pipeline = tmp.resolve("open.json");
        Files.writeString(pipeline, """
                {
                  "title": "Open claim",
                  "dimensions": {"cycle": {"size": "T", "label": "cycle", "description": "trace"}},
                  "stages": [{
                    "index": 1,
                    "title": "Only",
                    "sumchecks": [{
                      "name": "Booleanity",
                      "summedOver": [{"type": "var", "name": "X_t", "dimension": "cycle"}],
                      "openingPoint": [],
                      "rounds": "log2(T)",
                      "degree": "1",
                      "lhs": {"type": "virtual", "name": "H", "point": {"type": "opening",
                              "components": [{"type": "var", "name": "X_t", "dimension": "cycle"}]}},
                      "rhs": {"type": "const", "value": "0"},
                      "consumes": [],
                      "produces": [{"claim": {"name": "H", "kind": "VIRTUAL",
                                    "point": [{"type": "challenge", "stage": 1, "label": "cycle"}]}}]
                    }]
                  }]
                }
                """);
        assertEquals(Main.EXIT_UNRESOLVED, run("--pipeline", pipeline.toString(), "resolve"));
        assertTrue(output().contains("Unresolved virtual claims"));
    }

    @Test
    void html_writes_one_page_per_selected_stage_plus_shared_pages() throws Exception {
        Path dir = tmp.resolve("docs");
        assertEquals(Main.EXIT_OK, run("html", "--out", dir.toString(), "-s", "2", "-s", "3"));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(6, files.count());
        }
        assertTrue(Files.exists(dir.resolve("stage3.html")));
        assertFalse(Files.exists(dir.resolve("stage1.html")));
    }

    @Test
    void latex_writes_a_complete_document() throws Exception {
        Path tex = tmp.resolve("specs.tex");
        assertEquals(Main.EXIT_OK, run("latex", "--out", tex.toString()));
        String doc = Files.readString(tex);
        assertTrue(doc.startsWith("\\documentclass"));
        assertTrue(doc.contains("\\section{Stage 7"));
        assertTrue(doc.endsWith("\\end{document}\n"));
    }

    @Test
    void graph_without_out_prints_json() {
        assertEquals(Main.EXIT_OK, run("graph"));
        assertTrue(output().trim().startsWith("{"));
        assertTrue(output().contains("\"PCS\""));
    }

    @Test
    void graph_with_out_writes_the_export_file() throws Exception {
        Path file = tmp.resolve("out/claims.json");
        assertEquals(Main.EXIT_OK, run("graph", "--out", file.toString()));
        assertEquals("", output());
        assertTrue(Files.readString(file).contains("\"claim_identity\""));
    }

    @Test
    void selecting_a_missing_stage_is_a_usage_error() {
        assertThrows(Main.CliException.class, () -> run("latex", "--out", tmp.resolve("x.tex").toString(), "-s", "9"));
    }

    @Test
    void html_rejects_a_missing_stage_before_writing() {
        Path dir = tmp.resolve("site");
        assertThrows(Main.CliException.class, () -> run("html", "--out", dir.toString(), "-s", "8"));
        assertFalse(Files.exists(dir));
    }
}

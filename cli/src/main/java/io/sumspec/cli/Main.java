// file: cli/src/main/java/io/sumspec/cli/Main.java
package io.sumspec.cli;

import io.sumspec.core.json.CatalogLoader;
import io.sumspec.core.json.PipelineLoader;
import io.sumspec.core.registry.PolynomialCatalog;
import io.sumspec.core.registry.PolynomialRegistry;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.Stage;
import io.sumspec.format.html.HtmlSite;
import io.sumspec.format.latex.LatexDocument;
import io.sumspec.format.text.RegistryPrinter;
import io.sumspec.format.text.ResolutionPrinter;
import io.sumspec.format.text.TextReport;
import io.sumspec.resolve.GraphExport;
import io.sumspec.resolve.ResolutionReport;
import io.sumspec.resolve.ResolutionTracker;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line front end for sumcheck pipeline specifications.
 *
 * Usage:
 *   sumspec [--pipeline file.json] [text] [--stage n]...
 *   sumspec registry [--committed|--cp] [--virtual|--vp] [--verifier|--vr]
 *   sumspec resolve [--graph file.json]
 *   sumspec html [--out dir] [--stage n]...
 *   sumspec latex [--out file.tex] [--stage n]...
 *   sumspec graph [--out file.json]
 *
 * Exit codes: 0 ok, 1 usage error, 2 unexpected failure, 3 unresolved claims.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;
    static final int EXIT_UNRESOLVED = 3;

    private static final String USAGE = """
            Usage:
              sumspec [--pipeline file.json] [--catalog file.json] <command> [options]

            Commands:
              text      [--stage n]...          print every sumcheck (default)
              registry  [--cp] [--vp] [--vr]    print the polynomial registry
              resolve   [--graph file.json]     walk the pipeline and print claim provenance
              html      [--out dir] [--stage n]...     write the HTML site (default: docs)
              latex     [--out file] [--stage n]...    write the LaTeX document (default: sumcheck_specs.tex)
              graph     [--out file.json]       print or write the claim graph as JSON
            """;

    private final CliConfig config;
    private final PrintStream out;

    Main(CliConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        int code;
        try {
            installLogging();
            CliConfig config = CliConfig.fromArgs(args);
            if (config.help()) {
                System.out.print(USAGE);
                code = EXIT_OK;
            } else {
                code = new Main(config, System.out).run();
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.err.print(USAGE);
            code = EXIT_USAGE;
        } catch (Exception e) {
            log.log(Level.SEVERE, "sumspec failed: " + e.getMessage(), e);
            e.printStackTrace(System.err);
            code = EXIT_FAILURE;
        }
        System.exit(code);
    }

    /** Runs the configured command and returns the process exit code. */
    int run() {
        Pipeline pipeline = config.pipeline() == null
                ? PipelineLoader.reference()
                : PipelineLoader.fromJsonFile(config.pipeline());

        switch (config.command()) {
            case "text" -> out.print(TextReport.render(pipeline.title(), selectedStages(pipeline)));
            case "registry" -> out.print(RegistryPrinter.render(
                    PolynomialRegistry.fromPipeline(pipeline), config.kinds(), catalog()));
            case "resolve" -> {
                ResolutionReport report = new ResolutionTracker().track(pipeline);
                out.print(ResolutionPrinter.render(report));
                if (config.graph() != null) {
                    GraphExport.write(report.graph(), config.graph());
                }
                return report.isComplete() ? EXIT_OK : EXIT_UNRESOLVED;
            }
            case "html" -> {
                requireStagesExist(pipeline);
                var pages = HtmlSite.render(pipeline, config.stages(),
                        PolynomialRegistry.fromPipeline(pipeline), catalog(),
                        new ResolutionTracker().track(pipeline));
                ArtifactWriter.writeAll(config.outOrDefault(), pages);
            }
            case "latex" -> ArtifactWriter.write(config.outOrDefault(),
                    LatexDocument.render(pipeline.title(), selectedStages(pipeline)));
            case "graph" -> {
                var graph = new ResolutionTracker().track(pipeline).graph();
                if (config.out() == null) {
                    out.println(GraphExport.toJson(graph));
                } else {
                    GraphExport.write(graph, config.out());
                }
            }
            default -> throw new CliException("unknown command: " + config.command());
        }
        return EXIT_OK;
    }

    // ---------- helpers ----------

    private List<Stage> selectedStages(Pipeline pipeline) {
        requireStagesExist(pipeline);
        return pipeline.select(config.stages());
    }

    private void requireStagesExist(Pipeline pipeline) {
        for (int index : config.stages()) {
            if (index > pipeline.stages().size()) {
                throw new CliException(String.format(
                        "no stage %d (pipeline has %d)", index, pipeline.stages().size()));
            }
        }
    }

    private PolynomialCatalog catalog() {
        return config.catalog() == null
                ? CatalogLoader.reference()
                : CatalogLoader.fromJsonFile(config.catalog());
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read logging.properties", e);
        }
    }

    static final class CliException extends RuntimeException {
        CliException(String message) {
            super(message);
        }
    }
}

// file: cli/src/main/java/io/sumspec/cli/CliConfig.java
package io.sumspec.cli;

import io.sumspec.core.expr.PolyKind;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed command line for {@link Main}.
 *
 * Flags may appear before or after the command word; the first
 * non-flag argument is the command. Flags that make no sense for the
 * chosen command are rejected rather than ignored.
 *
 * @param command  one of {@link #COMMANDS}
 * @param pipeline pipeline JSON file, or null for the bundled reference pipeline
 * @param catalog  catalog JSON file, or null for the bundled reference catalog
 * @param stages   selected stage indices; empty means all
 * @param kinds    registry kinds to print; empty means all
 * @param out      output file or directory, or null for the command's default
 * @param graph    where {@code resolve} also writes the graph export, or null
 * @param help     true when usage was requested
 */
public record CliConfig(
        String command,
        Path pipeline,
        Path catalog,
        Set<Integer> stages,
        Set<PolyKind> kinds,
        Path out,
        Path graph,
        boolean help
) {
    public static final List<String> COMMANDS = List.of("text", "registry", "resolve", "html", "latex", "graph");

    public static final Path DEFAULT_HTML_DIR = Path.of("docs");
    public static final Path DEFAULT_LATEX_FILE = Path.of("sumcheck_specs.tex");

    public CliConfig {
        Objects.requireNonNull(command, "command");
        stages = Collections.unmodifiableSet(new TreeSet<>(stages));
        kinds = kinds.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public static CliConfig fromArgs(String[] args) {
        String command = null;
        Path pipeline = null;
        Path catalog = null;
        Set<Integer> stages = new TreeSet<>();
        Set<PolyKind> kinds = EnumSet.noneOf(PolyKind.class);
        Path out = null;
        Path graph = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--pipeline", "-p" -> {
                    ensureValue(args, i);
                    pipeline = Path.of(args[++i]);
                }

                case "--catalog" -> {
                    ensureValue(args, i);
                    catalog = Path.of(args[++i]);
                }

                case "--stage", "-s" -> {
                    ensureValue(args, i);
                    stages.add(parseStage(args[++i]));
                }

                case "--out", "-o" -> {
                    ensureValue(args, i);
                    out = Path.of(args[++i]);
                }

                case "--graph" -> {
                    ensureValue(args, i);
                    graph = Path.of(args[++i]);
                }

                case "--committed", "--cp" -> kinds.add(PolyKind.COMMITTED);
                case "--virtual", "--vp" -> kinds.add(PolyKind.VIRTUAL);
                case "--verifier", "--vr" -> kinds.add(PolyKind.VERIFIER);

                default -> {
                    String arg = args[i];
                    if (arg.startsWith("-")) {
                        throw new Main.CliException("unknown option: " + arg);
                    }
                    if (command != null) {
                        throw new Main.CliException("unexpected argument: " + arg);
                    }
                    if (!COMMANDS.contains(arg)) {
                        throw new Main.CliException("unknown command: " + arg);
                    }
                    command = arg;
                }
            }
        }

        if (command == null) command = "text";
        if (!help) {
            validate(command, stages, kinds, out, graph);
        }
        return new CliConfig(command, pipeline, catalog, stages, kinds, out, graph, help);
    }

    /** Output location, falling back to the command's default. */
    public Path outOrDefault() {
        if (out != null) return out;
        return switch (command) {
            case "html" -> DEFAULT_HTML_DIR;
            case "latex" -> DEFAULT_LATEX_FILE;
            default -> null;
        };
    }

    // ---------- helpers ----------

    private static void validate(String command, Set<Integer> stages, Set<PolyKind> kinds, Path out, Path graph) {
        boolean staged = command.equals("text") || command.equals("html") || command.equals("latex");
        if (!stages.isEmpty() && !staged) {
            throw new Main.CliException("--stage is not valid for " + command);
        }
        if (!kinds.isEmpty() && !command.equals("registry")) {
            throw new Main.CliException("kind flags are only valid for registry");
        }
        if (graph != null && !command.equals("resolve")) {
            throw new Main.CliException("--graph is only valid for resolve");
        }
        boolean writes = command.equals("html") || command.equals("latex") || command.equals("graph");
        if (out != null && !writes) {
            throw new Main.CliException("--out is not valid for " + command);
        }
    }

    private static int parseStage(String raw) {
        try {
            int stage = Integer.parseInt(raw);
            if (stage < 1) {
                throw new Main.CliException("invalid stage: " + raw);
            }
            return stage;
        } catch (NumberFormatException e) {
            throw new Main.CliException("invalid stage: " + raw);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new Main.CliException("missing value for " + args[i]);
        }
    }
}

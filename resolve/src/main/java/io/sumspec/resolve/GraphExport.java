// file: resolve/src/main/java/io/sumspec/resolve/GraphExport.java
package io.sumspec.resolve;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes a {@link ClaimGraph} as JSON:
 * <pre>
 * {"nodes":[{"id","stage","name"}], "edges":[{"from","to","claim_identity","status"}]}
 * </pre>
 * Claims are written in their plain-text identity form. Output order follows
 * the graph's own order, so equal graphs give byte-identical output.
 */
public final class GraphExport {
    private static final Logger log = Logger.getLogger(GraphExport.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphExport() {
        // utility
    }

    public static String toJson(ClaimGraph graph) {
        try {
            return MAPPER.writeValueAsString(toDto(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize claim graph", e);
        }
    }

    /** Writes {@link #toJson} to {@code target} as UTF-8, creating parent directories. */
    public static Path write(ClaimGraph graph, Path target) {
        String json = toJson(graph);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(target, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write claim graph to " + target, e);
        }
        log.log(Level.INFO, String.format("wrote claim graph %s (%d nodes, %d edges)",
                target, graph.nodes().size(), graph.edges().size()));
        return target;
    }

    static JsonGraph toDto(ClaimGraph graph) {
        var nodes = graph.nodes().stream()
                .map(n -> new JsonNode(n.id(), n.stage(), n.name()))
                .toList();
        var edges = graph.edges().stream()
                .map(e -> new JsonEdge(e.from(), e.to(), e.claim().toString(), e.status().name()))
                .toList();
        return new JsonGraph(nodes, edges);
    }

    // ---------- wire shapes ----------

    public record JsonGraph(List<JsonNode> nodes, List<JsonEdge> edges) {
    }

    public record JsonNode(String id, int stage, String name) {
    }

    public record JsonEdge(String from,
                           String to,
                           @JsonProperty("claim_identity") String claim,
                           String status) {
    }
}

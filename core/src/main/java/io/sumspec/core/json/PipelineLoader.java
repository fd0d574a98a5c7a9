// file: core/src/main/java/io/sumspec/core/json/PipelineLoader.java
package io.sumspec.core.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sumspec.core.expr.Dimension;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.json.dto.JsonClaim;
import io.sumspec.core.json.dto.JsonDimension;
import io.sumspec.core.json.dto.JsonPipeline;
import io.sumspec.core.json.dto.JsonProducedClaim;
import io.sumspec.core.json.dto.JsonRow;
import io.sumspec.core.json.dto.JsonStage;
import io.sumspec.core.json.dto.JsonSumcheck;
import io.sumspec.core.json.dto.JsonTable;
import io.sumspec.core.spec.Claim;
import io.sumspec.core.spec.ConstraintRow;
import io.sumspec.core.spec.ConstraintTable;
import io.sumspec.core.spec.Pipeline;
import io.sumspec.core.spec.ProducedClaim;
import io.sumspec.core.spec.Stage;
import io.sumspec.core.spec.SumcheckSpec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a {@link Pipeline} from JSON.
 * <p>
 * The JSON is bound onto plain DTOs first and then mapped into the
 * immutable model, so every model invariant is checked by the model's own
 * constructors. Jackson/IO failures surface as {@link PipelineLoadException};
 * model violations surface as the model's own exceptions.
 */
public final class PipelineLoader {
    private static final Logger log = Logger.getLogger(PipelineLoader.class.getName());

    /** Classpath location of the bundled reference pipeline. */
    public static final String REFERENCE_RESOURCE = "/io/sumspec/core/jolt-pipeline.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PipelineLoader() {
        // utility
    }

    /** The bundled 7-stage reference pipeline. */
    public static Pipeline reference() {
        return fromResource(REFERENCE_RESOURCE);
    }

    public static Pipeline fromJsonFile(Path path) {
        try {
            JsonPipeline json = MAPPER.readValue(path.toFile(), JsonPipeline.class);
            return logged(toPipeline(json), path.toString());
        } catch (IOException e) {
            throw new PipelineLoadException("Failed to load pipeline from " + path, e);
        }
    }

    public static Pipeline fromResource(String resource) {
        try (InputStream in = PipelineLoader.class.getResourceAsStream(resource)) {
            if (in == null) throw new PipelineLoadException("Pipeline resource not found: " + resource);
            JsonPipeline json = MAPPER.readValue(in, JsonPipeline.class);
            return logged(toPipeline(json), "classpath:" + resource);
        } catch (IOException e) {
            throw new PipelineLoadException("Failed to load pipeline from classpath:" + resource, e);
        }
    }

    public static Pipeline fromJson(String json) {
        try {
            return toPipeline(MAPPER.readValue(json, JsonPipeline.class));
        } catch (IOException e) {
            throw new PipelineLoadException("Failed to parse pipeline JSON", e);
        }
    }

    // ---------- mapping ----------

    static Pipeline toPipeline(JsonPipeline json) {
        if (json.stages == null) throw new PipelineLoadException("pipeline JSON has no stages");
        var exprs = new ExprMapper(dimensions(json));
        List<Stage> stages = json.stages.stream().map(s -> toStage(s, exprs)).toList();
        return new Pipeline(json.title == null ? "" : json.title, stages);
    }

    static Map<String, Dimension> dimensions(JsonPipeline json) {
        var dims = new LinkedHashMap<String, Dimension>();
        if (json.dimensions != null) json.dimensions.forEach((k, d) -> dims.put(k, toDimension(d)));
        return dims;
    }

    static Dimension toDimension(JsonDimension d) {
        return new Dimension(required(d.size, "dimension size"), required(d.label, "dimension label"), d.description);
    }

    private static Stage toStage(JsonStage s, ExprMapper exprs) {
        List<SumcheckSpec> specs = s.sumchecks == null
                ? List.of()
                : s.sumchecks.stream().map(sc -> toSumcheck(sc, s.index, exprs)).toList();
        return new Stage(s.index, s.title == null ? "" : s.title, specs);
    }

    private static SumcheckSpec toSumcheck(JsonSumcheck j, int stage, ExprMapper exprs) {
        var b = SumcheckSpec.builder(required(j.name, "sumcheck name in stage " + stage), stage)
                .summedOver(exprs.vars(j.summedOver))
                .openingPoint(exprs.challenges(j.openingPoint))
                .rounds(j.rounds)
                .degree(j.degree)
                .lhs(exprs.map(j.lhs))
                .rhs(j.rhs == null ? null : exprs.map(j.rhs));
        if (j.tables != null) {
            b.tables(j.tables.stream().map(t -> toTable(t, exprs)).toList());
        }
        if (j.consumes != null) {
            b.consumes(j.consumes.stream().map(c -> toClaim(c, exprs)).toList());
        }
        if (j.produces != null) {
            b.produces(j.produces.stream().map(p -> toProduced(p, exprs)).toList());
        }
        return b.build();
    }

    private static ConstraintTable toTable(JsonTable t, ExprMapper exprs) {
        List<ConstraintRow> rows = t.rows == null ? List.of() : t.rows.stream()
                .map((JsonRow r) -> new ConstraintRow(r.index, required(r.label, "row label in table " + t.title),
                        r.cells == null ? List.of() : r.cells.stream().map(exprs::map).toList()))
                .toList();
        return new ConstraintTable(required(t.title, "table title"), t.columns == null ? List.of() : t.columns, rows);
    }

    private static Claim toClaim(JsonClaim c, ExprMapper exprs) {
        required(c.name, "claim name");
        if (c.kind == null) throw new PipelineLoadException("claim " + c.name + " has no kind");
        PolyKind kind;
        try {
            kind = PolyKind.valueOf(c.kind);
        } catch (IllegalArgumentException e) {
            throw new PipelineLoadException("claim " + c.name + " has unknown kind " + c.kind, e);
        }
        return new Claim(c.name, kind, exprs.challenges(c.point));
    }

    private static ProducedClaim toProduced(JsonProducedClaim p, ExprMapper exprs) {
        if (p.claim == null) throw new PipelineLoadException("produced entry without a claim");
        return new ProducedClaim(toClaim(p.claim, exprs), p.range);
    }

    /** Fails with a load error naming {@code what} when a required JSON field is absent. */
    static String required(String value, String what) {
        if (value == null) throw new PipelineLoadException("missing " + what);
        return value;
    }

    private static Pipeline logged(Pipeline p, String source) {
        log.log(Level.INFO, String.format(
                "Loaded pipeline '%s' from %s: %d stages, %d sumchecks",
                p.title(), source, p.stages().size(), p.sumchecks().size()));
        return p;
    }
}

// file: core/src/main/java/io/sumspec/core/json/CatalogLoader.java
package io.sumspec.core.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.json.dto.JsonCatalog;
import io.sumspec.core.json.dto.JsonParameter;
import io.sumspec.core.json.dto.JsonPolynomial;
import io.sumspec.core.registry.CatalogEntry;
import io.sumspec.core.registry.Parameter;
import io.sumspec.core.registry.PolynomialCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a {@link PolynomialCatalog} from JSON.
 */
public final class CatalogLoader {

    public static final String REFERENCE_RESOURCE = "/io/sumspec/core/jolt-catalog.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CatalogLoader() {
        // utility
    }

    public static PolynomialCatalog reference() {
        try (InputStream in = CatalogLoader.class.getResourceAsStream(REFERENCE_RESOURCE)) {
            if (in == null) throw new PipelineLoadException("Catalog resource not found: " + REFERENCE_RESOURCE);
            return toCatalog(MAPPER.readValue(in, JsonCatalog.class));
        } catch (IOException e) {
            throw new PipelineLoadException("Failed to load catalog from classpath:" + REFERENCE_RESOURCE, e);
        }
    }

    public static PolynomialCatalog fromJsonFile(Path path) {
        try {
            return toCatalog(MAPPER.readValue(path.toFile(), JsonCatalog.class));
        } catch (IOException e) {
            throw new PipelineLoadException("Failed to load catalog from " + path, e);
        }
    }

    private static PolynomialCatalog toCatalog(JsonCatalog json) {
        List<CatalogEntry> entries = json.polynomials == null ? List.of() : json.polynomials.stream()
                .map(CatalogLoader::toEntry)
                .toList();
        List<Parameter> params = json.parameters == null ? List.of() : json.parameters.stream()
                .map(CatalogLoader::toParameter)
                .toList();
        return new PolynomialCatalog(entries, params);
    }

    private static CatalogEntry toEntry(JsonPolynomial p) {
        PipelineLoader.required(p.name, "catalog entry name");
        if (p.kind == null) throw new PipelineLoadException("catalog entry " + p.name + " has no kind");
        return new CatalogEntry(
                p.name,
                PolyKind.valueOf(p.kind),
                p.category,
                p.description,
                p.domain == null ? List.of() : p.domain.stream().map(PipelineLoader::toDimension).toList()
        );
    }

    private static Parameter toParameter(JsonParameter p) {
        return new Parameter(PipelineLoader.required(p.symbol, "parameter symbol"), p.codeName, p.description, p.formula);
    }
}

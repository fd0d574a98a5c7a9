// file: core/src/main/java/io/sumspec/core/json/dto/JsonPipeline.java
package io.sumspec.core.json.dto;

import java.util.List;
import java.util.Map;

public class JsonPipeline {
    public String title;
    public Map<String, JsonDimension> dimensions;
    public List<JsonStage> stages;
}

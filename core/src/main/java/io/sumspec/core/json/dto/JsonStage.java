// file: core/src/main/java/io/sumspec/core/json/dto/JsonStage.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonStage {
    public int index;
    public String title;
    public List<JsonSumcheck> sumchecks;
}

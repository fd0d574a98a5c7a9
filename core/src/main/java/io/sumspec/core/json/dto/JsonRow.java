// file: core/src/main/java/io/sumspec/core/json/dto/JsonRow.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonRow {
    public int index;
    public String label;
    public List<JsonExpr> cells;
}

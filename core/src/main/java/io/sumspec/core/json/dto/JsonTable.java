// file: core/src/main/java/io/sumspec/core/json/dto/JsonTable.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonTable {
    public String title;
    public List<String> columns;
    public List<JsonRow> rows;
}

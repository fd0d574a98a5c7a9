// file: core/src/main/java/io/sumspec/core/json/dto/JsonParameter.java
package io.sumspec.core.json.dto;

public class JsonParameter {
    public String symbol;
    public String codeName;
    public String description;
    public String formula;
}

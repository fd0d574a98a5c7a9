// file: core/src/main/java/io/sumspec/core/json/dto/JsonDimension.java
package io.sumspec.core.json.dto;

public class JsonDimension {
    public String size;
    public String label;
    public String description;
}

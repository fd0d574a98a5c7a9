// file: core/src/main/java/io/sumspec/core/json/dto/JsonPolynomial.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonPolynomial {
    public String name;
    public String kind;
    public String category;
    public String description;
    public List<JsonDimension> domain;
}

// file: core/src/main/java/io/sumspec/core/json/dto/JsonCatalog.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonCatalog {
    public List<JsonParameter> parameters;
    public List<JsonPolynomial> polynomials;
}

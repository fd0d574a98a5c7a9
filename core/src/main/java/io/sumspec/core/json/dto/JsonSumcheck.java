// file: core/src/main/java/io/sumspec/core/json/dto/JsonSumcheck.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonSumcheck {
    public String name;
    public List<JsonExpr> summedOver;
    public List<JsonExpr> openingPoint;
    public String rounds;
    public String degree;
    public JsonExpr lhs;
    public JsonExpr rhs;
    public List<JsonTable> tables;
    public List<JsonClaim> consumes;
    public List<JsonProducedClaim> produces;
}

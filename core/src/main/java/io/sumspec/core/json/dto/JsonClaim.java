// file: core/src/main/java/io/sumspec/core/json/dto/JsonClaim.java
package io.sumspec.core.json.dto;

import java.util.List;

public class JsonClaim {
    public String name;
    public String kind;       // COMMITTED | VIRTUAL | VERIFIER
    public List<JsonExpr> point;
}

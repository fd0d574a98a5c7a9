// file: core/src/main/java/io/sumspec/core/json/dto/JsonProducedClaim.java
package io.sumspec.core.json.dto;

public class JsonProducedClaim {
    public JsonClaim claim;
    public String range;      // optional, e.g. "for i=0..d_ram-1"
}

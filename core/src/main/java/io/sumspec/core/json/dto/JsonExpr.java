// file: core/src/main/java/io/sumspec/core/json/dto/JsonExpr.java
package io.sumspec.core.json.dto;

import java.util.List;

/**
 * Flat wire form of an expression node. {@code type} selects the variant;
 * only the fields that variant uses are set.
 */
public class JsonExpr {
    public String type;

    // const
    public String value;

    // var, committed, virtual, verifier
    public String name;
    public String dimension;  // key into the pipeline's dimension table

    // challenge
    public Integer stage;
    public String label;

    // opening
    public List<JsonExpr> components;

    // committed, virtual, verifier
    public JsonExpr point;

    // add, mul
    public JsonExpr left;
    public JsonExpr right;

    // neg
    public JsonExpr operand;

    // pow
    public JsonExpr base;
    public Integer exponent;

    // sum, multiSum, finiteSum, prod
    public JsonExpr variable;
    public List<JsonExpr> variables;
    public String index;
    public String bound;
    public JsonExpr body;
}

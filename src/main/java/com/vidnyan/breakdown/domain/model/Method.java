package com.vidnyan.breakdown.domain.model;

import java.util.List;

/**
 * Method of a class with its body reconstructed as ordered statements.
 */
public record Method(
    String name,
    List<Parameter> parameters,
    String returnType,
    Shape shape,
    List<StatementRecord> statements
) {

    public static final String UNIT = "Unit";
    public static final String EXPRESSION = "expression";

    /**
     * Body shape; a closed set.
     */
    public enum Shape {
        BLOCK,
        EXPRESSION,
        REFERENCE
    }

    public record Parameter(String name, String type) {}

    public Method {
        parameters = List.copyOf(parameters);
        statements = List.copyOf(statements);
    }

    /**
     * Zero-statement placeholder for a member that could not be read.
     */
    public static Method malformed(String name) {
        return new Method(name, List.of(), UNIT, Shape.REFERENCE, List.of());
    }

    /**
     * Build signature string (e.g., "save(item: Item)").
     */
    public String signature() {
        String params = parameters.stream()
                .map(p -> p.name() + ": " + p.type())
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
        return name + "(" + params + ")";
    }
}

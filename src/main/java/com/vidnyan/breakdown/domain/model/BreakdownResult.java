package com.vidnyan.breakdown.domain.model;

import com.vidnyan.breakdown.domain.graph.UINodeDigraph;

import java.util.List;
import java.util.Map;

/**
 * Everything one session produced for one file.
 * Maps are keyed by class name and keep declaration order.
 */
public record BreakdownResult(
    String path,
    Map<String, ClassBreakdown> classBreakdowns,
    Map<String, List<UINode>> detectedUIControls,
    Map<String, UINodeDigraph> viewNodeGraphs,
    Map<String, String> viewImports,
    List<String> independentFunctions
) {

    /**
     * Get class breakdown by name.
     */
    public java.util.Optional<ClassBreakdown> getClassBreakdown(String className) {
        return java.util.Optional.ofNullable(classBreakdowns.get(className));
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                classBreakdowns.size(),
                classBreakdowns.values().stream().mapToInt(c -> c.methods().size()).sum(),
                classBreakdowns.values().stream().mapToInt(c -> c.properties().size()).sum(),
                detectedUIControls.values().stream().mapToInt(List::size).sum(),
                independentFunctions.size()
        );
    }

    public record Stats(
        int classCount,
        int methodCount,
        int propertyCount,
        int controlCount,
        int independentFunctionCount
    ) {}
}

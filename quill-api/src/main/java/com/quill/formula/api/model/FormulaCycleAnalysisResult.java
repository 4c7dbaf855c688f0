/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Cycle analysis over the calculated fields of one entity.
 *
 * @param hasCycle           whether at least one cycle exists
 * @param cycles             every distinct cycle, sorted by path
 * @param analyzedFieldCount number of calculated fields analyzed
 * @param edges              dependency edges between calculated fields, sorted
 * @param evaluationOrder    calculated fields, dependencies first; empty when cyclic
 */
public record FormulaCycleAnalysisResult(
        @JsonProperty("has_cycle") boolean hasCycle,
        @JsonProperty("cycles") List<CycleReport> cycles,
        @JsonProperty("analyzed_field_count") int analyzedFieldCount,
        @JsonProperty("edges") List<DependencyEdge> edges,
        @JsonProperty("evaluation_order") List<String> evaluationOrder
) implements Serializable {

    public FormulaCycleAnalysisResult {
        cycles = List.copyOf(cycles);
        edges = List.copyOf(edges);
        evaluationOrder = List.copyOf(evaluationOrder);
        if (hasCycle == cycles.isEmpty()) {
            throw new IllegalArgumentException("hasCycle must agree with cycles");
        }
    }

    public List<String> cyclePaths() {
        return cycles.stream().map(CycleReport::cyclePath).toList();
    }
}

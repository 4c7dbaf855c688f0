/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Design-time analysis of control-rule chains in one entity.
 *
 * @param hasCycle           whether source/target edges form a cycle
 * @param cycles             every distinct cycle, sorted by path
 * @param longestChainLength hops in the longest acyclic chain
 * @param maxDepth           configured run-time bound
 * @param warnings           human readable warnings
 */
public record ControlChainAnalysisResult(
        @JsonProperty("has_cycle") boolean hasCycle,
        @JsonProperty("cycles") List<CycleReport> cycles,
        @JsonProperty("longest_chain_length") int longestChainLength,
        @JsonProperty("max_depth") int maxDepth,
        @JsonProperty("warnings") List<String> warnings
) implements Serializable {

    public ControlChainAnalysisResult {
        cycles = List.copyOf(cycles);
        warnings = List.copyOf(warnings);
    }

    public boolean exceedsMaxDepth() {
        return longestChainLength > maxDepth;
    }
}

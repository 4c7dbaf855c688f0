/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.model.ControlChainAnalysisResult;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.CycleReport;
import com.quill.formula.api.model.DependencyEdge;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Design-time analysis of chains formed by control rules, where one rule's
 * target is another rule's source.
 *
 * <p>Disabled rules take no part in chains. At run time chains are bounded
 * by depth alone; this analysis lets an editor warn before that bound is hit.
 */
public final class ControlChainAnalyzer {

    private final CycleDetector cycleDetector;
    private final int maxDepth;

    public ControlChainAnalyzer(CycleDetector cycleDetector, int maxDepth) {
        this.cycleDetector = cycleDetector;
        this.maxDepth = maxDepth;
    }

    public ControlChainAnalysisResult analyze(List<ControlRule> rules) {
        TreeSet<DependencyEdge> edges = new TreeSet<>();
        for (ControlRule rule : rules) {
            if (rule.enabled()) {
                edges.add(rule.chainEdge());
            }
        }
        DependencyGraph graph = DependencyGraph.fromEdges(edges);
        List<CycleReport> cycles = cycleDetector.findCycles(graph);

        List<String> warnings = new ArrayList<>();
        int longest = 0;
        if (cycles.isEmpty()) {
            longest = graph.longestPathLength();
            if (longest > maxDepth) {
                warnings.add("Longest control chain has " + longest + " hops, more than the run-time limit of "
                        + maxDepth + "; rules past the limit will fail");
            }
        } else {
            for (CycleReport cycle : cycles) {
                warnings.add("Control rules form a cycle: " + cycle.cyclePath());
            }
        }
        return new ControlChainAnalysisResult(!cycles.isEmpty(), cycles, longest, maxDepth, warnings);
    }
}

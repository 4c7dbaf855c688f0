/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.model.CycleReport;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds cycles in a {@link DependencyGraph} by depth-first search.
 *
 * <p>The search keeps the current path on an explicit stack; an edge back to
 * a node still on the path closes a cycle, which is recorded and the search
 * goes on, so one pass reports every cycle it meets. A self-reference is the
 * one-node case of the same rule.
 *
 * <p>Each cycle is rotated to start at its smallest id and duplicates are
 * dropped; reports are sorted by path. The detector keeps no state between
 * calls.
 *
 * <p>Nodes are not revisited once finished, so this reports back edges, not
 * every elementary cycle. For {@code A -> B -> C -> A} plus {@code A -> C}
 * only {@code A -> B -> C -> A} is reported; {@code A -> C -> A} shares its
 * closing edge. Disjoint cycles are always reported separately, and a graph
 * has a cycle exactly when the result is non-empty.
 */
public final class CycleDetector {

    private static final byte UNVISITED = 0;
    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    public List<CycleReport> findCycles(DependencyGraph graph) {
        int n = graph.size();
        byte[] state = new byte[n];
        int[] pathPosition = new int[n];
        int[] nextChild = new int[n];
        IntArrayList path = new IntArrayList();
        Set<List<String>> cycles = new LinkedHashSet<>();

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) {
                continue;
            }
            push(root, path, state, pathPosition, nextChild);
            while (!path.isEmpty()) {
                int node = path.getInt(path.size() - 1);
                IntList successors = graph.successorsOf(node);
                if (nextChild[node] < successors.size()) {
                    int next = successors.getInt(nextChild[node]++);
                    if (state[next] == ON_PATH) {
                        cycles.add(normalize(graph, path.subList(pathPosition[next], path.size())));
                    } else if (state[next] == UNVISITED) {
                        push(next, path, state, pathPosition, nextChild);
                    }
                } else {
                    state[node] = DONE;
                    path.removeInt(path.size() - 1);
                }
            }
        }

        List<CycleReport> reports = new ArrayList<>(cycles.size());
        for (List<String> cycle : cycles) {
            reports.add(CycleReport.of(cycle));
        }
        reports.sort(Comparator.comparing(CycleReport::cyclePath));
        return reports;
    }

    private static void push(int node, IntArrayList path, byte[] state, int[] pathPosition, int[] nextChild) {
        state[node] = ON_PATH;
        pathPosition[node] = path.size();
        nextChild[node] = 0;
        path.add(node);
    }

    // Node indices follow sorted id order, so the smallest index is the smallest id.
    private static List<String> normalize(DependencyGraph graph, IntList members) {
        int start = 0;
        for (int i = 1; i < members.size(); i++) {
            if (members.getInt(i) < members.getInt(start)) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            rotated.add(graph.id(members.getInt((start + i) % members.size())));
        }
        return List.copyOf(rotated);
    }
}

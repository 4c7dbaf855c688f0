/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.model.DependencyEdge;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable directed graph over field ids.
 *
 * <p>Nodes are numbered in sorted id order and every successor list is
 * sorted, so any traversal in index order is deterministic regardless of the
 * iteration order of the input map. Edges to ids that are not nodes are
 * dropped: a formula graph only links calculated fields.
 */
public final class DependencyGraph {

    private final String[] ids;
    private final Object2IntMap<String> indexOf;
    private final IntList[] successors;

    private DependencyGraph(String[] ids, Object2IntMap<String> indexOf, IntList[] successors) {
        this.ids = ids;
        this.indexOf = indexOf;
        this.successors = successors;
    }

    /**
     * Builds a graph whose nodes are the keys of {@code adjacency}.
     *
     * @param adjacency node id to the ids it points at
     */
    public static DependencyGraph of(Map<String, ? extends Collection<String>> adjacency) {
        String[] ids = new TreeSet<>(adjacency.keySet()).toArray(new String[0]);
        Object2IntMap<String> indexOf = new Object2IntOpenHashMap<>(ids.length);
        indexOf.defaultReturnValue(-1);
        for (int i = 0; i < ids.length; i++) {
            indexOf.put(ids[i], i);
        }
        IntList[] successors = new IntList[ids.length];
        for (int i = 0; i < ids.length; i++) {
            SortedSet<String> targets = new TreeSet<>(adjacency.get(ids[i]));
            IntArrayList list = new IntArrayList(targets.size());
            for (String target : targets) {
                int j = indexOf.getInt(target);
                if (j >= 0) {
                    list.add(j);
                }
            }
            successors[i] = list;
        }
        return new DependencyGraph(ids, indexOf, successors);
    }

    /**
     * Builds a graph from edges; every endpoint becomes a node.
     */
    public static DependencyGraph fromEdges(Collection<DependencyEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (DependencyEdge edge : edges) {
            adjacency.computeIfAbsent(edge.fromFieldId(), k -> new ArrayList<>()).add(edge.toFieldId());
            adjacency.computeIfAbsent(edge.toFieldId(), k -> new ArrayList<>());
        }
        return of(adjacency);
    }

    public int size() {
        return ids.length;
    }

    public String id(int index) {
        return ids[index];
    }

    public int indexOf(String id) {
        return indexOf.getInt(id);
    }

    /**
     * Successor indices of a node, ascending.
     */
    public IntList successorsOf(int index) {
        return successors[index];
    }

    public List<String> nodes() {
        return List.of(ids);
    }

    public List<DependencyEdge> edges() {
        List<DependencyEdge> edges = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            for (int j : successors[i]) {
                edges.add(new DependencyEdge(ids[i], ids[j]));
            }
        }
        return edges;
    }

    /**
     * Nodes ordered so that every node comes after the nodes it points at,
     * smallest id first among ready nodes.
     *
     * @return the order, or empty if the graph has a cycle
     */
    public Optional<List<String>> topologicalOrder() {
        int n = ids.length;
        int[] pending = new int[n];
        IntList[] dependents = new IntList[n];
        for (int i = 0; i < n; i++) {
            dependents[i] = new IntArrayList();
        }
        for (int i = 0; i < n; i++) {
            pending[i] = successors[i].size();
            for (int j : successors[i]) {
                dependents[j].add(i);
            }
        }
        IntHeapPriorityQueue ready = new IntHeapPriorityQueue();
        for (int i = 0; i < n; i++) {
            if (pending[i] == 0) {
                ready.enqueue(i);
            }
        }
        List<String> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int node = ready.dequeueInt();
            order.add(ids[node]);
            for (int dependent : dependents[node]) {
                if (--pending[dependent] == 0) {
                    ready.enqueue(dependent);
                }
            }
        }
        return order.size() == n ? Optional.of(order) : Optional.empty();
    }

    /**
     * Number of edges on the longest path.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public int longestPathLength() {
        List<String> order = topologicalOrder()
                .orElseThrow(() -> new IllegalStateException("Longest path is undefined on a cyclic graph"));
        int[] longest = new int[ids.length];
        int max = 0;
        // Successors precede a node in the order, so their values are final.
        for (String id : order) {
            int i = indexOf.getInt(id);
            for (int j : successors[i]) {
                longest[i] = Math.max(longest[i], longest[j] + 1);
            }
            max = Math.max(max, longest[i]);
        }
        return max;
    }
}

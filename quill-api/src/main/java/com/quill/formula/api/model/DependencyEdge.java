/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Directed edge {@code from -> to}: the formula of {@code from} reads
 * {@code to}, or for control chains, a rule on {@code from} affects {@code to}.
 */
public record DependencyEdge(
        @JsonProperty("from_field_id") String fromFieldId,
        @JsonProperty("to_field_id") String toFieldId
) implements Serializable, Comparable<DependencyEdge> {

    private static final Comparator<DependencyEdge> ORDER =
            Comparator.comparing(DependencyEdge::fromFieldId).thenComparing(DependencyEdge::toFieldId);

    public DependencyEdge {
        Objects.requireNonNull(fromFieldId, "fromFieldId must not be null");
        Objects.requireNonNull(toFieldId, "toFieldId must not be null");
    }

    public boolean isSelfLoop() {
        return fromFieldId.equals(toFieldId);
    }

    @Override
    public int compareTo(DependencyEdge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return fromFieldId + " -> " + toFieldId;
    }
}

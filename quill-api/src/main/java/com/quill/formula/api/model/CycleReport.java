/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One dependency cycle, listed from its smallest field id.
 *
 * @param fieldIds  members in cycle order, start not repeated
 * @param cyclePath readable path repeating the start, e.g. {@code "A → B → A"}
 */
public record CycleReport(
        @JsonProperty("field_ids") List<String> fieldIds,
        @JsonProperty("cycle_path") String cyclePath
) implements Serializable {

    public static final String PATH_SEPARATOR = " → ";

    public CycleReport {
        fieldIds = List.copyOf(fieldIds);
        if (fieldIds.isEmpty()) {
            throw new IllegalArgumentException("A cycle has at least one field");
        }
    }

    public static CycleReport of(List<String> fieldIds) {
        return new CycleReport(fieldIds, String.join(PATH_SEPARATOR, fieldIds) + PATH_SEPARATOR + fieldIds.get(0));
    }

    /**
     * Cycles are always errors.
     */
    @JsonProperty("severity")
    public String severity() {
        return "ERROR";
    }

    public boolean isSelfReference() {
        return fieldIds.size() == 1;
    }
}

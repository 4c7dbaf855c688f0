/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control state of every rule target in one entity instance.
 *
 * @param entityId         entity evaluated
 * @param fields           per-target state, sorted by field id
 * @param results          every applied rule's result, in application order
 * @param blockingFailures failed {@code VALUE_SET} rules
 */
public record EntityControlState(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("fields") Map<String, FieldControlState> fields,
        @JsonProperty("results") List<ControlEvaluationResult> results,
        @JsonProperty("blocking_failures") List<ControlEvaluationResult> blockingFailures
) implements Serializable {

    public EntityControlState {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        results = List.copyOf(results);
        blockingFailures = List.copyOf(blockingFailures);
    }

    public boolean hasBlockingFailures() {
        return !blockingFailures.isEmpty();
    }

    /**
     * State of {@code fieldId}; fields without rules have the default state.
     */
    public FieldControlState field(String fieldId) {
        FieldControlState state = fields.get(fieldId);
        return state != null ? state : FieldControlState.defaults(fieldId);
    }
}

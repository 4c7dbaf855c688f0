/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of evaluating every calculated field of one entity instance.
 *
 * @param entityId entity evaluated
 * @param success  whether every calculated field evaluated
 * @param values   computed values in evaluation order; on failure, those computed before it
 * @param failure  first failure (blocking), naming field and formula
 */
public record EntityEvaluationResult(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("success") boolean success,
        @JsonProperty("values") Map<String, FormulaValue> values,
        @JsonProperty("failure") EvaluationFailure failure
) implements Serializable {

    public EntityEvaluationResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        if (success == (failure != null)) {
            throw new IllegalArgumentException("failure must be present exactly when success is false");
        }
    }

    public static EntityEvaluationResult success(String entityId, Map<String, FormulaValue> values) {
        return new EntityEvaluationResult(entityId, true, values, null);
    }

    public static EntityEvaluationResult failure(String entityId, Map<String, FormulaValue> partial,
                                                 EvaluationFailure failure) {
        return new EntityEvaluationResult(entityId, false, partial, failure);
    }

    public FormulaValue valueOf(String fieldId) {
        return values.get(fieldId);
    }
}

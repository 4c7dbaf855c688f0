/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of a single evaluation: the entity instance's current field values
 * and the date {@code today()} resolves to.
 *
 * <p>A context is built per call and discarded afterwards; {@link #withValue}
 * returns a new context instead of mutating this one. Values are kept as the
 * caller supplied them and converted to {@link FormulaValue} when read, so an
 * unsupported Java type surfaces as an evaluation failure of the formula that
 * reads it.
 */
public final class EvaluationContext {

    private final String entityId;
    private final String fieldId;
    private final Map<String, Object> values;
    private final LocalDate referenceDate;

    private EvaluationContext(String entityId, String fieldId, Map<String, Object> values, LocalDate referenceDate) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.fieldId = fieldId;
        this.values = Collections.unmodifiableMap(values);
        this.referenceDate = referenceDate;
    }

    public static Builder builder(String entityId) {
        return new Builder(entityId);
    }

    /**
     * Context over {@code values} with no target field and no reference date.
     */
    public static EvaluationContext of(String entityId, Map<String, ?> values) {
        return builder(entityId).values(values).build();
    }

    public String entityId() {
        return entityId;
    }

    /**
     * Field whose formula is being evaluated, if any.
     */
    public Optional<String> fieldId() {
        return Optional.ofNullable(fieldId);
    }

    public Optional<LocalDate> referenceDate() {
        return Optional.ofNullable(referenceDate);
    }

    public boolean hasValue(String id) {
        return values.containsKey(id);
    }

    /**
     * Reads a field value.
     *
     * @throws IllegalArgumentException if the field is absent or its Java type is unsupported
     */
    public FormulaValue valueOf(String id) {
        if (!values.containsKey(id)) {
            throw new IllegalArgumentException("Field '" + id + "' not found in context");
        }
        return FormulaValue.of(values.get(id));
    }

    public Map<String, Object> values() {
        return values;
    }

    /**
     * Copy of this context with {@code id} set to {@code value}.
     */
    public EvaluationContext withValue(String id, FormulaValue value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(id, value);
        return new EvaluationContext(entityId, fieldId, copy, referenceDate);
    }

    /**
     * Copy of this context targeting {@code targetFieldId}.
     */
    public EvaluationContext forField(String targetFieldId) {
        return new EvaluationContext(entityId, targetFieldId, new LinkedHashMap<>(values), referenceDate);
    }

    @Override
    public String toString() {
        return "EvaluationContext[entityId=" + entityId + ", fieldId=" + fieldId
                + ", fields=" + values.keySet() + ", referenceDate=" + referenceDate + "]";
    }

    public static final class Builder {
        private final String entityId;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private String fieldId;
        private LocalDate referenceDate;

        private Builder(String entityId) {
            this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        }

        public Builder fieldId(String fieldId) {
            this.fieldId = fieldId;
            return this;
        }

        public Builder value(String id, Object value) {
            values.put(Objects.requireNonNull(id, "field id must not be null"), value);
            return this;
        }

        public Builder values(Map<String, ?> snapshot) {
            snapshot.forEach(this::value);
            return this;
        }

        public Builder referenceDate(LocalDate referenceDate) {
            this.referenceDate = referenceDate;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(entityId, fieldId, new LinkedHashMap<>(values), referenceDate);
        }
    }
}

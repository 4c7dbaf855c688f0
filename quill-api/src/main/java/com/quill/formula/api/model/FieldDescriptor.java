/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Declared shape of one field as seen by the formula engine.
 *
 * @param fieldId    field identifier, unique within its entity
 * @param entityId   entity (record type) owning the field
 * @param type       declared value type
 * @param calculated whether the field's value comes from a formula
 */
public record FieldDescriptor(
        @JsonProperty("field_id") String fieldId,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("type") FormulaType type,
        @JsonProperty("calculated") boolean calculated
) implements Serializable {

    public FieldDescriptor {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
        if (type == null) type = FormulaType.UNKNOWN;
    }

    public static FieldDescriptor input(String entityId, String fieldId, FormulaType type) {
        return new FieldDescriptor(fieldId, entityId, type, false);
    }

    public static FieldDescriptor calculated(String entityId, String fieldId, FormulaType type) {
        return new FieldDescriptor(fieldId, entityId, type, true);
    }
}

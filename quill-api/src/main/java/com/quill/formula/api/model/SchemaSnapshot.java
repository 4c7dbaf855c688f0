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
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only, point-in-time view of the fields of one entity.
 *
 * <p>The snapshot may also carry descriptors of fields owned by other
 * entities (for example when the caller hands over a project-wide schema);
 * those are visible to reference resolution only so that a reference to them
 * can be reported as cross-entity rather than unknown.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SchemaSnapshot schema = SchemaSnapshot.builder("invoice")
 *     .input("quantity", FormulaType.NUMBER)
 *     .input("unit_price", FormulaType.NUMBER)
 *     .calculated("total", FormulaType.NUMBER)
 *     .build();
 * }</pre>
 */
public record SchemaSnapshot(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("fields") Map<String, FieldDescriptor> fields
) implements Serializable {

    public SchemaSnapshot {
        Objects.requireNonNull(entityId, "entityId must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields must not be null")));
    }

    public static SchemaSnapshot empty(String entityId) {
        return new SchemaSnapshot(entityId, Map.of());
    }

    public static Builder builder(String entityId) {
        return new Builder(entityId);
    }

    /**
     * Looks up a field of this snapshot's entity.
     */
    public Optional<FieldDescriptor> field(String fieldId) {
        FieldDescriptor descriptor = fields.get(fieldId);
        if (descriptor == null || !entityId.equals(descriptor.entityId())) {
            return Optional.empty();
        }
        return Optional.of(descriptor);
    }

    public boolean contains(String fieldId) {
        return field(fieldId).isPresent();
    }

    /**
     * Whether {@code fieldId} is known, but owned by another entity.
     */
    public boolean isForeign(String fieldId) {
        FieldDescriptor descriptor = fields.get(fieldId);
        return descriptor != null && !entityId.equals(descriptor.entityId());
    }

    public boolean isCalculated(String fieldId) {
        return field(fieldId).map(FieldDescriptor::calculated).orElse(false);
    }

    public FormulaType typeOf(String fieldId) {
        return field(fieldId).map(FieldDescriptor::type).orElse(FormulaType.UNKNOWN);
    }

    /**
     * Calculated fields of this entity, sorted by id.
     */
    public List<String> calculatedFieldIds() {
        return fields.values().stream()
                .filter(f -> f.calculated() && entityId.equals(f.entityId()))
                .map(FieldDescriptor::fieldId)
                .sorted()
                .toList();
    }

    public static final class Builder {
        private final String entityId;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

        private Builder(String entityId) {
            this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        }

        public Builder input(String fieldId, FormulaType type) {
            return field(FieldDescriptor.input(entityId, fieldId, type));
        }

        public Builder calculated(String fieldId, FormulaType type) {
            return field(FieldDescriptor.calculated(entityId, fieldId, type));
        }

        /**
         * Adds a field owned by another entity.
         */
        public Builder foreign(String otherEntityId, String fieldId, FormulaType type) {
            return field(FieldDescriptor.input(otherEntityId, fieldId, type));
        }

        public Builder field(FieldDescriptor descriptor) {
            fields.put(descriptor.fieldId(), descriptor);
            return this;
        }

        public SchemaSnapshot build() {
            return new SchemaSnapshot(entityId, fields);
        }
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Effective control state of one field after its rules were applied.
 *
 * @param fieldId      target field
 * @param visible      effective visibility
 * @param enabled      effective enabled state
 * @param required     effective required state
 * @param value        value set by a {@code VALUE_SET} rule, or null
 * @param fallbackUsed whether any display state came from a failed rule's default
 */
public record FieldControlState(
        @JsonProperty("field_id") String fieldId,
        @JsonProperty("visible") boolean visible,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("required") boolean required,
        @JsonProperty("value") FormulaValue value,
        @JsonProperty("fallback_used") boolean fallbackUsed
) implements Serializable {

    public FieldControlState {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
    }

    /**
     * Visible, enabled, not required, no value.
     */
    public static FieldControlState defaults(String fieldId) {
        return new FieldControlState(fieldId, true, true, false, null, false);
    }

    public boolean hasValue() {
        return value != null;
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quill.formula.api.ast.SourceSpan;

import java.io.Serializable;
import java.util.Objects;

/**
 * A field reference that does not resolve to a field of the formula's own entity.
 */
public record UnresolvedReference(
        @JsonProperty("field_id") String fieldId,
        @JsonProperty("span") SourceSpan span,
        @JsonProperty("reason") Reason reason,
        @JsonProperty("message") String message
) implements Serializable {

    public enum Reason {
        UNKNOWN_FIELD,
        CROSS_ENTITY
    }

    public UnresolvedReference {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}

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
 * Operand or argument type mismatch found by type checking.
 */
public record TypeDiagnostic(
        @JsonProperty("span") SourceSpan span,
        @JsonProperty("expected_type") FormulaType expectedType,
        @JsonProperty("actual_type") FormulaType actualType,
        @JsonProperty("message") String message
) implements Serializable {

    public TypeDiagnostic {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}

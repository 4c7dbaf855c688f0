/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Diagnostic of a failed evaluation.
 *
 * @param reason  failure category
 * @param message human readable detail
 * @param fieldId field whose formula failed (may be null)
 * @param formula formula source (may be null)
 */
public record EvaluationFailure(
        @JsonProperty("reason") FailureReason reason,
        @JsonProperty("message") String message,
        @JsonProperty("field_id") String fieldId,
        @JsonProperty("formula") String formula
) implements Serializable {

    public EvaluationFailure {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static EvaluationFailure of(FailureReason reason, String message) {
        return new EvaluationFailure(reason, message, null, null);
    }

    public EvaluationFailure withField(String newFieldId, String newFormula) {
        return new EvaluationFailure(reason, message, newFieldId, newFormula);
    }

    /**
     * Message naming the field and formula, for blocking consumers.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(reason).append(": ").append(message);
        if (fieldId != null) {
            sb.append(" [field=").append(fieldId);
            if (formula != null) {
                sb.append(", formula=").append(formula);
            }
            sb.append(']');
        } else if (formula != null) {
            sb.append(" [formula=").append(formula).append(']');
        }
        return sb.toString();
    }
}

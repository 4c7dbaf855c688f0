/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quill.formula.api.exceptions.FormulaEvaluationException;

import java.io.Serializable;

/**
 * Typed value or explicit failure of one formula evaluation.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EvaluationResult result = evaluator.evaluate("quantity * unit_price", context);
 * if (result.success()) {
 *     render(result.value());
 * } else {
 *     report(result.failure().describe());
 * }
 *
 * // Blocking consumers (document generation)
 * FormulaValue value = evaluator.evaluateOutputMapping(formula, context).valueOrThrow();
 * }</pre>
 */
public record EvaluationResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("value") FormulaValue value,
        @JsonProperty("failure") EvaluationFailure failure
) implements Serializable {

    public EvaluationResult {
        if (success && (value == null || failure != null)) {
            throw new IllegalArgumentException("A successful result carries a value and no failure");
        }
        if (!success && failure == null) {
            throw new IllegalArgumentException("A failed result carries a failure");
        }
    }

    public static EvaluationResult success(FormulaValue value) {
        return new EvaluationResult(true, value, null);
    }

    public static EvaluationResult failure(EvaluationFailure failure) {
        return new EvaluationResult(false, null, failure);
    }

    public static EvaluationResult failure(FailureReason reason, String message) {
        return failure(EvaluationFailure.of(reason, message));
    }

    public FailureReason failureReason() {
        return failure == null ? null : failure.reason();
    }

    /**
     * Returns the value, or throws the failure for consumers that must block.
     *
     * @throws FormulaEvaluationException if the evaluation failed
     */
    public FormulaValue valueOrThrow() {
        if (!success) {
            throw new FormulaEvaluationException(failure);
        }
        return value;
    }

    public EvaluationResult withField(String fieldId, String formula) {
        return success ? this : failure(failure.withField(fieldId, formula));
    }
}

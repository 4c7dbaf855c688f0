/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of one control rule.
 *
 * <p>Display rules ({@code VISIBILITY}, {@code ENABLED}, {@code REQUIRED})
 * always carry an {@code outcome}; when their formula fails, the outcome is
 * the effect's default state, {@code fallbackUsed} is set and {@code failure}
 * explains why. {@code VALUE_SET} rules carry a {@code value} or a blocking
 * {@code failure}, never a fallback.
 */
public record ControlEvaluationResult(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("target_field_id") String targetFieldId,
        @JsonProperty("effect_type") ControlEffectType effectType,
        @JsonProperty("success") boolean success,
        @JsonProperty("outcome") Boolean outcome,
        @JsonProperty("value") FormulaValue value,
        @JsonProperty("fallback_used") boolean fallbackUsed,
        @JsonProperty("failure") EvaluationFailure failure
) implements Serializable {

    public ControlEvaluationResult {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId must not be null");
        Objects.requireNonNull(effectType, "effectType must not be null");
    }

    public static ControlEvaluationResult displayOutcome(ControlRule rule, boolean outcome) {
        return new ControlEvaluationResult(rule.ruleId(), rule.targetFieldId(), rule.effectType(),
                true, outcome, null, false, null);
    }

    public static ControlEvaluationResult displayFallback(ControlRule rule, EvaluationFailure failure) {
        return new ControlEvaluationResult(rule.ruleId(), rule.targetFieldId(), rule.effectType(),
                false, rule.effectType().defaultState(), null, true, failure);
    }

    public static ControlEvaluationResult valueSet(ControlRule rule, FormulaValue value) {
        return new ControlEvaluationResult(rule.ruleId(), rule.targetFieldId(), rule.effectType(),
                true, null, value, false, null);
    }

    public static ControlEvaluationResult valueSetFailure(ControlRule rule, EvaluationFailure failure) {
        return new ControlEvaluationResult(rule.ruleId(), rule.targetFieldId(), rule.effectType(),
                false, null, null, false, failure);
    }

    /**
     * Whether this failure must stop the consuming operation.
     */
    public boolean isBlocking() {
        return !success && !effectType.isDisplayRule();
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Authored control rule. For display effects the formula is a boolean
 * condition; for {@link ControlEffectType#VALUE_SET} it produces the value
 * written to the target field.
 *
 * @param ruleId        rule identifier
 * @param sourceFieldId field the rule is attached to (the chain predecessor)
 * @param targetFieldId field the effect applies to
 * @param effectType    kind of effect
 * @param formula       condition or value formula
 * @param enabled       disabled rules are skipped at run time
 * @param priority      higher priority rules are applied first
 */
public record ControlRule(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("source_field_id") String sourceFieldId,
        @JsonProperty("target_field_id") String targetFieldId,
        @JsonProperty("effect_type") ControlEffectType effectType,
        @JsonProperty("formula") String formula,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("priority") Integer priority
) implements Serializable {

    public ControlRule {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(sourceFieldId, "sourceFieldId must not be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId must not be null");
        Objects.requireNonNull(effectType, "effectType must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        if (enabled == null) enabled = true;
        if (priority == null) priority = 0;
    }

    public static ControlRule of(String ruleId, String sourceFieldId, String targetFieldId,
                                 ControlEffectType effectType, String formula) {
        return new ControlRule(ruleId, sourceFieldId, targetFieldId, effectType, formula, true, 0);
    }

    public ControlRule withPriority(int newPriority) {
        return new ControlRule(ruleId, sourceFieldId, targetFieldId, effectType, formula, enabled, newPriority);
    }

    public ControlRule disabled() {
        return new ControlRule(ruleId, sourceFieldId, targetFieldId, effectType, formula, false, priority);
    }

    /**
     * Control-chain edge {@code source -> target}.
     */
    public DependencyEdge chainEdge() {
        return new DependencyEdge(sourceFieldId, targetFieldId);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api;

import com.quill.formula.api.model.ControlEvaluationResult;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.EntityControlState;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.FieldControlState;
import com.quill.formula.api.model.SchemaSnapshot;

import java.util.List;

/**
 * Run-time contract for control rules of one entity instance.
 *
 * <p>Display rule failures never escape: the target falls back to its
 * default state and the failure is logged. {@code VALUE_SET} failures are
 * returned as blocking results.
 */
public interface IControlRuleEngine {

    /**
     * Evaluates one rule, first resolving {@code VALUE_SET} rules in
     * {@code rules} that feed its source field.
     *
     * @param rule    rule to evaluate
     * @param rules   every rule of the entity, used for chain resolution
     * @param context field values
     */
    ControlEvaluationResult evaluateRule(ControlRule rule, List<ControlRule> rules, EvaluationContext context);

    /**
     * Evaluates a rule on its own, without chain resolution.
     */
    default ControlEvaluationResult evaluateRule(ControlRule rule, EvaluationContext context) {
        return evaluateRule(rule, List.of(rule), context);
    }

    /**
     * Effective control state of one field.
     */
    FieldControlState evaluateField(String fieldId, List<ControlRule> rules, EvaluationContext context);

    /**
     * Effective control state of every rule target of the entity.
     *
     * @param rules    every rule of the entity
     * @param snapshot declared fields, used to check {@code VALUE_SET} result types
     * @param context  field values
     */
    EntityControlState evaluateEntity(List<ControlRule> rules, SchemaSnapshot snapshot, EvaluationContext context);
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Design-time validation of one control rule.
 *
 * @param ruleId            rule validated
 * @param valid             whether the rule can be saved without errors
 * @param formulaValidation validation of the rule's formula
 * @param errors            rule-level problems (missing fields, wrong result type)
 */
public record ControlRuleValidationResult(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("formula_validation") FormulaValidationResult formulaValidation,
        @JsonProperty("errors") List<String> errors
) implements Serializable {

    public ControlRuleValidationResult {
        errors = List.copyOf(errors);
    }
}

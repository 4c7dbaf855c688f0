/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api;

import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.model.EntityEvaluationResult;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.EvaluationResult;
import com.quill.formula.api.model.SchemaSnapshot;

import java.time.Duration;
import java.util.Map;

/**
 * Run-time contract: compute formula values against a snapshot of field values.
 *
 * <p>Evaluation is a pure AST walk. Failures (division by zero, missing
 * values, domain errors, budget exceeded) come back as failed
 * {@link EvaluationResult}s, never as exceptions. Nothing is cached between
 * calls.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IFormulaEvaluator evaluator = new FormulaEvaluator();
 * EvaluationContext context = EvaluationContext.builder("invoice")
 *     .value("quantity", 3)
 *     .value("unit_price", new BigDecimal("9.90"))
 *     .build();
 *
 * EvaluationResult result = evaluator.evaluate("quantity * unit_price", context);
 * }</pre>
 */
public interface IFormulaEvaluator {

    /**
     * Parses and evaluates a formula under the control-rule budget.
     *
     * @param formula formula source (must not be null)
     * @param context field values (must not be null)
     * @return value or failure
     */
    EvaluationResult evaluate(String formula, EvaluationContext context);

    /**
     * Evaluates an already parsed formula under an explicit budget.
     *
     * @param ast     parsed formula
     * @param context field values
     * @param budget  wall time the evaluation may take
     */
    EvaluationResult evaluate(FormulaNode ast, EvaluationContext context, Duration budget);

    /**
     * Evaluates a formula for document output under the output-mapping budget.
     * A failed result must block the consuming operation.
     */
    EvaluationResult evaluateOutputMapping(String formula, EvaluationContext context);

    /**
     * Evaluates every calculated field of an entity in dependency order.
     *
     * <p>Fails fast if the dependency graph is cyclic, and stops at the first
     * field that fails.
     *
     * @param formulas calculated field id to formula source
     * @param snapshot fields of the entity
     * @param context  input field values
     */
    EntityEvaluationResult evaluateEntity(Map<String, String> formulas, SchemaSnapshot snapshot,
                                          EvaluationContext context);
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api;

import com.quill.formula.api.model.ControlChainAnalysisResult;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.ControlRuleValidationResult;
import com.quill.formula.api.model.FormulaCycleAnalysisResult;
import com.quill.formula.api.model.FormulaDependencyAnalysis;
import com.quill.formula.api.model.FormulaValidationResult;
import com.quill.formula.api.model.ParsedFormula;
import com.quill.formula.api.model.SchemaSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Design-time contract: parse, validate and analyze formulas of one entity.
 *
 * <p>Every method is a pure function of its arguments. Problems are returned
 * as diagnostics inside the result objects; nothing is thrown for a bad
 * formula.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IFormulaCompiler compiler = new FormulaCompiler();
 *
 * FormulaValidationResult validation = compiler.validate("quantity * unit_price", schema);
 *
 * FormulaCycleAnalysisResult cycles = compiler.analyzeCycles(Map.of(
 *     "subtotal", "quantity * unit_price",
 *     "total", "subtotal + tax"), schema);
 * if (cycles.hasCycle()) {
 *     cycles.cyclePaths().forEach(designer::warn);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations hold no per-call state and may be shared between threads.
 */
public interface IFormulaCompiler {

    /**
     * Tokenizes and parses a formula.
     *
     * @param formula formula source (must not be null)
     * @return AST or collected syntax diagnostics
     */
    ParsedFormula parse(String formula);

    /**
     * Validates a formula against a schema snapshot: syntax, references and types.
     *
     * @param formula  formula source (must not be null)
     * @param snapshot fields of the formula's entity (must not be null)
     * @return every diagnostic found, plus the inferred result type
     */
    FormulaValidationResult validate(String formula, SchemaSnapshot snapshot);

    /**
     * Lists the fields a formula reads.
     */
    FormulaDependencyAnalysis analyzeDependencies(String formula, SchemaSnapshot snapshot);

    /**
     * Builds the dependency graph of the entity's calculated fields and
     * reports every cycle in it.
     *
     * @param formulas calculated field id to formula source
     * @param snapshot fields of the entity
     * @return all cycles, or an evaluation order when acyclic
     */
    FormulaCycleAnalysisResult analyzeCycles(Map<String, String> formulas, SchemaSnapshot snapshot);

    /**
     * Order in which calculated fields can be evaluated, dependencies first.
     *
     * @return the order, or an empty list when the graph is cyclic
     */
    default List<String> evaluationOrder(Map<String, String> formulas, SchemaSnapshot snapshot) {
        return analyzeCycles(formulas, snapshot).evaluationOrder();
    }

    /**
     * Validates one control rule's fields and formula.
     */
    ControlRuleValidationResult validateControlRule(ControlRule rule, SchemaSnapshot snapshot);

    /**
     * Reports cycles and over-long chains among control rules.
     */
    ControlChainAnalysisResult analyzeControlChains(List<ControlRule> rules);
}

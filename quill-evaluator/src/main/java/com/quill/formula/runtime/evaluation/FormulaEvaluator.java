/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.IFormulaEvaluator;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.exceptions.FormulaEvaluationException;
import com.quill.formula.api.model.EntityEvaluationResult;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.EvaluationFailure;
import com.quill.formula.api.model.EvaluationResult;
import com.quill.formula.api.model.FailureReason;
import com.quill.formula.api.model.FormulaCycleAnalysisResult;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValidationResult;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.ParsedFormula;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.compiler.FormulaCompiler;
import com.quill.formula.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Evaluates formulas against field value snapshots.
 *
 * <p>Every call parses (or takes) its own AST and walks it against its own
 * context under a wall-time budget; nothing is cached or shared between
 * calls, so one instance may serve concurrent callers.
 *
 * <h2>Budgets</h2>
 * <ul>
 *   <li>{@link #evaluate(String, EvaluationContext)} and each field of
 *       {@link #evaluateEntity}: the control-rule budget (100 ms by default)</li>
 *   <li>{@link #evaluateOutputMapping}: the output-mapping budget (1000 ms by default)</li>
 * </ul>
 */
public class FormulaEvaluator implements IFormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final EngineConfig config;
    private final Tracer tracer;
    private final FormulaCompiler compiler;
    private final LongSupplier nanoClock;
    private final EvaluatorMetrics metrics = new EvaluatorMetrics();

    public FormulaEvaluator() {
        this(EngineConfig.loadDefault());
    }

    public FormulaEvaluator(EngineConfig config) {
        this(config, OpenTelemetry.noop().getTracer("quill-evaluator"));
    }

    public FormulaEvaluator(EngineConfig config, Tracer tracer) {
        this(config, tracer, new FormulaCompiler(config, tracer), System::nanoTime);
    }

    FormulaEvaluator(EngineConfig config, Tracer tracer, FormulaCompiler compiler, LongSupplier nanoClock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        logger.info("Formula evaluator initialized with {}", config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public EvaluatorMetrics getMetrics() {
        return metrics;
    }

    @Override
    public EvaluationResult evaluate(String formula, EvaluationContext context) {
        return evaluateTraced(formula, context, config.controlRuleTimeout());
    }

    @Override
    public EvaluationResult evaluateOutputMapping(String formula, EvaluationContext context) {
        EvaluationResult result = evaluateTraced(formula, context, config.outputMappingTimeout());
        if (!result.success()) {
            logger.debug("Output mapping failed: {}", result.failure().describe());
        }
        return result;
    }

    /**
     * Evaluates under an explicit budget.
     */
    public EvaluationResult evaluate(String formula, EvaluationContext context, Duration budget) {
        return evaluateTraced(formula, context, budget);
    }

    private EvaluationResult evaluateTraced(String formula, EvaluationContext context, Duration budget) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("evaluate-formula").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", context.entityId());
            context.fieldId().ifPresent(fieldId -> span.setAttribute("fieldId", fieldId));
            EvaluationResult result = parseAndEvaluate(formula, context, budget)
                    .withField(context.fieldId().orElse(null), formula);
            span.setAttribute("success", result.success());
            return result;
        } finally {
            span.end();
        }
    }

    private EvaluationResult parseAndEvaluate(String formula, EvaluationContext context, Duration budget) {
        ParsedFormula parsed = compiler.parse(formula);
        if (parsed.hasErrors()) {
            return failed(FailureReason.PARSE_ERROR, parsed.describeFailure());
        }
        if (parsed.isEmpty()) {
            return failed(FailureReason.INVALID_FORMULA, parsed.describeFailure());
        }
        return evaluate(parsed.ast(), context, budget);
    }

    @Override
    public EvaluationResult evaluate(FormulaNode ast, EvaluationContext context, Duration budget) {
        Objects.requireNonNull(ast, "ast must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(budget, "budget must not be null");

        long start = nanoClock.getAsLong();
        EvaluationResult result;
        try {
            TreeEvaluator walk = new TreeEvaluator(context, EvaluationBudget.start(budget, nanoClock));
            result = EvaluationResult.success(walk.evaluate(ast));
        } catch (FormulaEvaluationException e) {
            result = EvaluationResult.failure(e.failure());
        } catch (ArithmeticException e) {
            logger.warn("Arithmetic failure outside a guarded operation: {}", e.getMessage());
            result = EvaluationResult.failure(FailureReason.DOMAIN_ERROR, "Arithmetic failure: " + e.getMessage());
        }
        metrics.recordEvaluation(nanoClock.getAsLong() - start, result.failureReason());
        return result;
    }

    private EvaluationResult failed(FailureReason reason, String message) {
        metrics.recordEvaluation(0, reason);
        return EvaluationResult.failure(reason, message);
    }

    @Override
    public EntityEvaluationResult evaluateEntity(Map<String, String> formulas, SchemaSnapshot snapshot,
                                                 EvaluationContext context) {
        Objects.requireNonNull(formulas, "formulas must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("evaluate-entity").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", snapshot.entityId());
            EntityEvaluationResult result = evaluateInOrder(formulas, snapshot, context);
            span.setAttribute("success", result.success());
            span.setAttribute("fieldCount", result.values().size());
            return result;
        } finally {
            span.end();
        }
    }

    private EntityEvaluationResult evaluateInOrder(Map<String, String> formulas, SchemaSnapshot snapshot,
                                                   EvaluationContext context) {
        String entityId = snapshot.entityId();
        FormulaCycleAnalysisResult analysis = compiler.analyzeCycles(formulas, snapshot);
        if (analysis.hasCycle()) {
            String message = "Dependency graph of entity '" + entityId + "' is cyclic: "
                    + String.join("; ", analysis.cyclePaths());
            logger.debug(message);
            metrics.recordEvaluation(0, FailureReason.CYCLIC_DEPENDENCY);
            return EntityEvaluationResult.failure(entityId, Map.of(),
                    EvaluationFailure.of(FailureReason.CYCLIC_DEPENDENCY, message));
        }

        Map<String, FormulaValue> computed = new LinkedHashMap<>();
        EvaluationContext current = context;
        for (String fieldId : analysis.evaluationOrder()) {
            String formula = formulas.get(fieldId);
            if (formula == null) {
                continue;
            }
            EvaluationResult result = evaluateField(fieldId, formula, snapshot, current.forField(fieldId));
            if (!result.success()) {
                EvaluationFailure failure = result.failure().withField(fieldId, formula);
                logger.debug("Entity {} stopped at field {}: {}", entityId, fieldId, failure.describe());
                return EntityEvaluationResult.failure(entityId, computed, failure);
            }
            computed.put(fieldId, result.value());
            current = current.withValue(fieldId, result.value());
        }
        logger.debug("Entity {} evaluated {} calculated fields", entityId, computed.size());
        return EntityEvaluationResult.success(entityId, computed);
    }

    private EvaluationResult evaluateField(String fieldId, String formula, SchemaSnapshot snapshot,
                                           EvaluationContext context) {
        FormulaValidationResult validation = compiler.validate(formula, snapshot);
        if (!validation.syntaxErrors().isEmpty()) {
            return failed(FailureReason.PARSE_ERROR, validation.syntaxErrors().get(0).toString());
        }
        if (!validation.valid()) {
            return failed(FailureReason.INVALID_FORMULA, validation.allMessages().get(0));
        }
        FormulaType declared = snapshot.typeOf(fieldId);
        FormulaType inferred = validation.inferredType();
        if (declared.isKnown() && inferred.isKnown() && declared != inferred) {
            return failed(FailureReason.TYPE_MISMATCH,
                    "Formula produces " + inferred + " but field '" + fieldId + "' is declared " + declared);
        }

        EvaluationResult result = parseAndEvaluate(formula, context, config.controlRuleTimeout());
        if (result.success() && !result.value().isNull() && declared.isKnown()
                && result.value().type() != declared) {
            return EvaluationResult.failure(FailureReason.TYPE_MISMATCH,
                    "Field '" + fieldId + "' is declared " + declared + " but evaluated to "
                        + result.value().type() + " " + result.value());
        }
        return result;
    }
}

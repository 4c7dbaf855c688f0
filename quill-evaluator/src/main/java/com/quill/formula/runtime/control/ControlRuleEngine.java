/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.control;

import com.quill.formula.api.IControlRuleEngine;
import com.quill.formula.api.model.ControlEffectType;
import com.quill.formula.api.model.ControlEvaluationResult;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.EntityControlState;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.EvaluationFailure;
import com.quill.formula.api.model.EvaluationResult;
import com.quill.formula.api.model.FailureReason;
import com.quill.formula.api.model.FieldControlState;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.config.EngineConfig;
import com.quill.formula.runtime.evaluation.FormulaEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Applies control rules to one entity instance.
 *
 * <h2>Ordering</h2>
 * <p>Disabled rules are skipped. Rules on one target are tried by descending
 * priority, then rule id. For a display effect the first rule that evaluates
 * wins; for {@code VALUE_SET} the first rule decides, success or failure.
 *
 * <h2>Chains</h2>
 * <p>Before a rule runs, the {@code VALUE_SET} rule deciding its source field
 * (if any) is resolved and its value overlays the snapshot. Resolution
 * recurses with an explicit depth; past {@link EngineConfig#maxChainDepth()}
 * hops the rule fails with {@link FailureReason#CHAIN_DEPTH_EXCEEDED}, so a
 * cyclic rule set terminates without a cycle check. Nothing is memoized
 * between top-level rules.
 *
 * <h2>Failures</h2>
 * <p>A display rule that fails yields the effect's default state (visible,
 * enabled, not required) and a warning in the log. A {@code VALUE_SET} rule
 * that fails, or produces a value of a type other than the target's declared
 * type, is a blocking failure.
 */
public class ControlRuleEngine implements IControlRuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(ControlRuleEngine.class);

    static final Comparator<ControlRule> APPLICATION_ORDER =
            Comparator.comparing(ControlRule::priority).reversed().thenComparing(ControlRule::ruleId);

    private final FormulaEvaluator evaluator;
    private final Tracer tracer;
    private final int maxChainDepth;

    public ControlRuleEngine() {
        this(EngineConfig.loadDefault());
    }

    public ControlRuleEngine(EngineConfig config) {
        this(new FormulaEvaluator(config), OpenTelemetry.noop().getTracer("quill-evaluator"));
    }

    public ControlRuleEngine(FormulaEvaluator evaluator, Tracer tracer) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.maxChainDepth = evaluator.getConfig().maxChainDepth();
        logger.info("Control rule engine initialized: maxChainDepth={}, ruleTimeout={}ms",
                maxChainDepth, evaluator.getConfig().controlRuleTimeout().toMillis());
    }

    /**
     * {@inheritDoc}
     *
     * <p>The rule is evaluated even if disabled; the flag is honoured where
     * rules are selected ({@link #evaluateField}, {@link #evaluateEntity} and
     * chain resolution).
     */
    @Override
    public ControlEvaluationResult evaluateRule(ControlRule rule, List<ControlRule> rules, EvaluationContext context) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("evaluate-control-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", context.entityId());
            span.setAttribute("ruleId", rule.ruleId());
            ControlEvaluationResult result = toResult(rule, resolve(rule, rules, context, 0), null);
            span.setAttribute("success", result.success());
            return result;
        } finally {
            span.end();
        }
    }

    @Override
    public FieldControlState evaluateField(String fieldId, List<ControlRule> rules, EvaluationContext context) {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("evaluate-control-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", context.entityId());
            span.setAttribute("fieldId", fieldId);
            return applyToField(fieldId, rules, null, context, new ArrayList<>());
        } finally {
            span.end();
        }
    }

    @Override
    public EntityControlState evaluateEntity(List<ControlRule> rules, SchemaSnapshot snapshot,
                                             EvaluationContext context) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("evaluate-control-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", snapshot.entityId());
            TreeSet<String> targets = new TreeSet<>();
            for (ControlRule rule : rules) {
                if (rule.enabled()) {
                    targets.add(rule.targetFieldId());
                }
            }

            Map<String, FieldControlState> fields = new LinkedHashMap<>();
            List<ControlEvaluationResult> results = new ArrayList<>();
            for (String target : targets) {
                fields.put(target, applyToField(target, rules, snapshot, context, results));
            }
            List<ControlEvaluationResult> blocking = results.stream()
                    .filter(ControlEvaluationResult::isBlocking)
                    .toList();

            span.setAttribute("ruleCount", results.size());
            span.setAttribute("blockingFailures", blocking.size());
            logger.debug("Control rules of entity {}: {} targets, {} rules applied, {} blocking failures",
                    snapshot.entityId(), targets.size(), results.size(), blocking.size());
            return new EntityControlState(snapshot.entityId(), fields, results, blocking);
        } finally {
            span.end();
        }
    }

    private FieldControlState applyToField(String fieldId, List<ControlRule> rules, SchemaSnapshot snapshot,
                                           EvaluationContext context, List<ControlEvaluationResult> results) {
        Map<ControlEffectType, List<ControlRule>> byEffect = new EnumMap<>(ControlEffectType.class);
        rules.stream()
                .filter(rule -> rule.enabled() && rule.targetFieldId().equals(fieldId))
                .sorted(APPLICATION_ORDER)
                .forEach(rule -> byEffect.computeIfAbsent(rule.effectType(), k -> new ArrayList<>()).add(rule));

        Map<ControlEffectType, Boolean> state = new EnumMap<>(ControlEffectType.class);
        boolean fallbackUsed = false;
        for (ControlEffectType effect : ControlEffectType.values()) {
            if (!effect.isDisplayRule() || !byEffect.containsKey(effect)) {
                continue;
            }
            ControlEvaluationResult decided = null;
            for (ControlRule rule : byEffect.get(effect)) {
                ControlEvaluationResult result = toResult(rule, resolve(rule, rules, context, 0), null);
                results.add(result);
                if (result.success()) {
                    decided = result;
                    break;
                }
            }
            if (decided != null) {
                state.put(effect, decided.outcome());
            } else {
                state.put(effect, effect.defaultState());
                fallbackUsed = true;
            }
        }

        FormulaValue value = null;
        List<ControlRule> valueRules = byEffect.get(ControlEffectType.VALUE_SET);
        if (valueRules != null) {
            ControlRule rule = valueRules.get(0);
            ControlEvaluationResult result = toResult(rule, resolve(rule, rules, context, 0), snapshot);
            results.add(result);
            if (result.success()) {
                value = result.value();
            }
        }

        return new FieldControlState(fieldId,
                state.getOrDefault(ControlEffectType.VISIBILITY, ControlEffectType.VISIBILITY.defaultState()),
                state.getOrDefault(ControlEffectType.ENABLED, ControlEffectType.ENABLED.defaultState()),
                state.getOrDefault(ControlEffectType.REQUIRED, ControlEffectType.REQUIRED.defaultState()),
                value, fallbackUsed);
    }

    /**
     * Evaluates {@code rule} after resolving the chain that feeds its source
     * field. {@code depth} counts the hops already taken.
     */
    private EvaluationResult resolve(ControlRule rule, List<ControlRule> rules, EvaluationContext context, int depth) {
        if (depth > maxChainDepth) {
            return EvaluationResult.failure(FailureReason.CHAIN_DEPTH_EXCEEDED,
                    "Control chain through rule '" + rule.ruleId() + "' is longer than " + maxChainDepth + " hops");
        }

        EvaluationContext overlay = context;
        ControlRule feeder = deciderOf(rule.sourceFieldId(), rules);
        if (feeder != null) {
            logger.debug("Rule {} depends on rule {} (depth {})", rule.ruleId(), feeder.ruleId(), depth + 1);
            EvaluationResult fed = resolve(feeder, rules, context, depth + 1);
            if (!fed.success()) {
                EvaluationFailure cause = fed.failure();
                return EvaluationResult.failure(new EvaluationFailure(cause.reason(),
                        "Chained rule '" + feeder.ruleId() + "' failed: " + cause.message(),
                        rule.targetFieldId(), rule.formula()));
            }
            overlay = context.withValue(rule.sourceFieldId(), fed.value());
        }
        return evaluator.evaluate(rule.formula(), overlay.forField(rule.targetFieldId()));
    }

    private static ControlRule deciderOf(String fieldId, List<ControlRule> rules) {
        return rules.stream()
                .filter(r -> r.enabled() && r.effectType() == ControlEffectType.VALUE_SET && r.targetFieldId().equals(fieldId))
                .min(APPLICATION_ORDER)
                .orElse(null);
    }

    private ControlEvaluationResult toResult(ControlRule rule, EvaluationResult evaluation, SchemaSnapshot snapshot) {
        if (!rule.effectType().isDisplayRule()) {
            if (!evaluation.success()) {
                return ControlEvaluationResult.valueSetFailure(rule,
                        evaluation.failure().withField(rule.targetFieldId(), rule.formula()));
            }
            FormulaValue value = evaluation.value();
            FormulaType declared = snapshot != null ? snapshot.typeOf(rule.targetFieldId()) : FormulaType.UNKNOWN;
            if (declared.isKnown() && !value.isNull() && value.type() != declared) {
                return ControlEvaluationResult.valueSetFailure(rule, new EvaluationFailure(FailureReason.TYPE_MISMATCH,
                        "VALUE_SET produced " + value.type() + " but field '" + rule.targetFieldId()
                            + "' is declared " + declared, rule.targetFieldId(), rule.formula()));
            }
            return ControlEvaluationResult.valueSet(rule, value);
        }

        if (evaluation.success() && evaluation.value() instanceof FormulaValue.BooleanValue b) {
            return ControlEvaluationResult.displayOutcome(rule, b.value());
        }
        EvaluationFailure failure = evaluation.success()
                ? new EvaluationFailure(FailureReason.TYPE_MISMATCH,
                    rule.effectType() + " rule must produce a BOOLEAN but produced "
                        + (evaluation.value().isNull() ? "null" : evaluation.value().type() + " " + evaluation.value()),
                    rule.targetFieldId(), rule.formula())
                : evaluation.failure().withField(rule.targetFieldId(), rule.formula());
        logger.warn("Control rule {} ({} on field {}) failed, using default {}: {}",
                rule.ruleId(), rule.effectType(), rule.targetFieldId(), rule.effectType().defaultState(), failure.describe());
        evaluator.getMetrics().recordControlFallback();
        return ControlEvaluationResult.displayFallback(rule, failure);
    }
}

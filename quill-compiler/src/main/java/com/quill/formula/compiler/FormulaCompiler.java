/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler;

import com.quill.formula.api.IFormulaCompiler;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.model.ControlChainAnalysisResult;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.ControlRuleValidationResult;
import com.quill.formula.api.model.CycleReport;
import com.quill.formula.api.model.FieldDependency;
import com.quill.formula.api.model.FormulaCycleAnalysisResult;
import com.quill.formula.api.model.FormulaDependencyAnalysis;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValidationResult;
import com.quill.formula.api.model.ParsedFormula;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.api.model.TypeDiagnostic;
import com.quill.formula.api.model.UnresolvedReference;
import com.quill.formula.compiler.analysis.ControlChainAnalyzer;
import com.quill.formula.compiler.analysis.CycleDetector;
import com.quill.formula.compiler.analysis.DependencyGraph;
import com.quill.formula.compiler.analysis.ReferenceResolver;
import com.quill.formula.compiler.analysis.TypeChecker;
import com.quill.formula.compiler.lexer.FormulaTokenizer;
import com.quill.formula.compiler.parser.FormulaParser;
import com.quill.formula.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Design-time facade: parsing, validation, dependency and cycle analysis.
 *
 * <p>Stateless apart from its immutable configuration; every call starts
 * from scratch, so repeated analysis of the same input returns equal
 * results.
 */
public class FormulaCompiler implements IFormulaCompiler {

    private static final Logger logger = LoggerFactory.getLogger(FormulaCompiler.class);

    static final String EMPTY_FORMULA_INFO = "Formula is empty; result type is UNKNOWN";
    static final String UNKNOWN_TYPE_INFO = "Result type could not be inferred";

    private final EngineConfig config;
    private final Tracer tracer;
    private final FormulaParser parser;
    private final TypeChecker typeChecker = new TypeChecker();
    private final ReferenceResolver referenceResolver = new ReferenceResolver();
    private final CycleDetector cycleDetector = new CycleDetector();
    private final ControlChainAnalyzer controlChainAnalyzer;

    public FormulaCompiler() {
        this(EngineConfig.loadDefault());
    }

    public FormulaCompiler(EngineConfig config) {
        this(config, OpenTelemetry.noop().getTracer("quill-compiler"));
    }

    public FormulaCompiler(EngineConfig config, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.parser = new FormulaParser(new FormulaTokenizer(config.maxFormulaLength()), config.maxNestingDepth());
        this.controlChainAnalyzer = new ControlChainAnalyzer(cycleDetector, config.maxChainDepth());
        logger.info("Formula compiler initialized with {}", config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public ParsedFormula parse(String formula) {
        Objects.requireNonNull(formula, "formula must not be null");
        return parser.parse(formula);
    }

    @Override
    public FormulaValidationResult validate(String formula, SchemaSnapshot snapshot) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Span span = tracer.spanBuilder("validate-formula").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", snapshot.entityId());
            FormulaValidationResult result = validateParsed(parser.parse(formula), snapshot);
            span.setAttribute("valid", result.valid());
            span.setAttribute("errorCount", result.errorCount());
            logger.debug("Validated formula '{}' for entity {}: valid={}, type={}, errors={}",
                    formula, snapshot.entityId(), result.valid(), result.inferredType(), result.errorCount());
            return result;
        } finally {
            span.end();
        }
    }

    private FormulaValidationResult validateParsed(ParsedFormula parsed, SchemaSnapshot snapshot) {
        if (parsed.hasErrors()) {
            return new FormulaValidationResult(false, FormulaType.UNKNOWN, parsed.errors(),
                    List.of(), List.of(), List.of(), List.of());
        }
        if (parsed.isEmpty()) {
            return new FormulaValidationResult(true, FormulaType.UNKNOWN, List.of(),
                    List.of(), List.of(), List.of(), List.of(EMPTY_FORMULA_INFO));
        }
        FormulaNode ast = parsed.ast();
        List<UnresolvedReference> unresolved = referenceResolver.resolve(ast, snapshot);
        TypeChecker.Result typing = typeChecker.check(ast, snapshot);
        List<TypeDiagnostic> typeErrors = typing.errors();
        boolean valid = unresolved.isEmpty() && typeErrors.isEmpty();
        List<String> infos = typing.type().isKnown() ? List.of() : List.of(UNKNOWN_TYPE_INFO);
        return new FormulaValidationResult(valid, typing.type(), List.of(), unresolved, typeErrors,
                List.copyOf(referenceResolver.fieldIds(ast)), infos);
    }

    @Override
    public FormulaDependencyAnalysis analyzeDependencies(String formula, SchemaSnapshot snapshot) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        ParsedFormula parsed = parser.parse(formula);
        if (!parsed.isSuccess()) {
            return new FormulaDependencyAnalysis(List.of(), List.of(), parsed.errors());
        }
        List<FieldDependency> dependencies = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String fieldId : referenceResolver.fieldIds(parsed.ast())) {
            boolean known = snapshot.contains(fieldId);
            dependencies.add(new FieldDependency(fieldId, known, snapshot.typeOf(fieldId)));
            if (!known) {
                unknown.add(fieldId);
            }
        }
        return new FormulaDependencyAnalysis(dependencies, unknown, List.of());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Nodes are the fields in {@code formulas} plus any calculated field of
     * the snapshot without a formula. Formulas that do not parse contribute
     * no edges.
     */
    @Override
    public FormulaCycleAnalysisResult analyzeCycles(Map<String, String> formulas, SchemaSnapshot snapshot) {
        Objects.requireNonNull(formulas, "formulas must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Span span = tracer.spanBuilder("analyze-cycles").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", snapshot.entityId());
            DependencyGraph graph = buildGraph(formulas, snapshot);
            List<CycleReport> cycles = cycleDetector.findCycles(graph);
            List<String> order = cycles.isEmpty() ? graph.topologicalOrder().orElse(List.of()) : List.of();

            span.setAttribute("fieldCount", graph.size());
            span.setAttribute("cycleCount", cycles.size());
            logger.debug("Cycle analysis for entity {}: {} calculated fields, {} edges, {} cycles",
                    snapshot.entityId(), graph.size(), graph.edges().size(), cycles.size());
            return new FormulaCycleAnalysisResult(!cycles.isEmpty(), cycles, graph.size(), graph.edges(), order);
        } finally {
            span.end();
        }
    }

    private DependencyGraph buildGraph(Map<String, String> formulas, SchemaSnapshot snapshot) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (String calculated : snapshot.calculatedFieldIds()) {
            adjacency.put(calculated, Set.of());
        }
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            ParsedFormula parsed = parser.parse(entry.getValue());
            if (parsed.isSuccess()) {
                SortedSet<String> references = referenceResolver.fieldIds(parsed.ast());
                adjacency.put(entry.getKey(), references);
            } else {
                logger.debug("Formula of field {} does not parse, no dependencies recorded: {}",
                        entry.getKey(), parsed.describeFailure());
                adjacency.put(entry.getKey(), Set.of());
            }
        }
        return DependencyGraph.of(adjacency);
    }

    @Override
    public ControlRuleValidationResult validateControlRule(ControlRule rule, SchemaSnapshot snapshot) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        List<String> errors = new ArrayList<>();
        if (!snapshot.contains(rule.sourceFieldId())) {
            errors.add("Source field '" + rule.sourceFieldId() + "' does not exist in entity '" + snapshot.entityId() + "'");
        }
        if (!snapshot.contains(rule.targetFieldId())) {
            errors.add("Target field '" + rule.targetFieldId() + "' does not exist in entity '" + snapshot.entityId() + "'");
        }

        FormulaValidationResult formulaValidation = validate(rule.formula(), snapshot);
        if (rule.formula().isBlank()) {
            errors.add("Rule '" + rule.ruleId() + "' has an empty formula");
        }
        FormulaType produced = formulaValidation.inferredType();
        if (produced.isKnown()) {
            if (rule.effectType().isDisplayRule() && produced != FormulaType.BOOLEAN) {
                errors.add(rule.effectType() + " rule formula must produce BOOLEAN but produces " + produced);
            } else if (!rule.effectType().isDisplayRule()) {
                FormulaType declared = snapshot.typeOf(rule.targetFieldId());
                if (declared.isKnown() && declared != produced) {
                    errors.add("VALUE_SET rule produces " + produced + " but field '" + rule.targetFieldId()
                            + "' is declared " + declared);
                }
            }
        }
        boolean valid = errors.isEmpty() && formulaValidation.valid();
        return new ControlRuleValidationResult(rule.ruleId(), valid, formulaValidation, errors);
    }

    @Override
    public ControlChainAnalysisResult analyzeControlChains(List<ControlRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");

        Span span = tracer.spanBuilder("analyze-control-chains").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ControlChainAnalysisResult result = controlChainAnalyzer.analyze(rules);
            span.setAttribute("ruleCount", rules.size());
            span.setAttribute("cycleCount", result.cycles().size());
            span.setAttribute("longestChain", result.longestChainLength());
            logger.debug("Control chain analysis over {} rules: cycles={}, longest chain={}",
                    rules.size(), result.cycles().size(), result.longestChainLength());
            return result;
        } finally {
            span.end();
        }
    }
}

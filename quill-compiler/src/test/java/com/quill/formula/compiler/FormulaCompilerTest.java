/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler;

import com.quill.formula.api.model.ControlChainAnalysisResult;
import com.quill.formula.api.model.ControlEffectType;
import com.quill.formula.api.model.ControlRule;
import com.quill.formula.api.model.ControlRuleValidationResult;
import com.quill.formula.api.model.FormulaCycleAnalysisResult;
import com.quill.formula.api.model.FormulaDependencyAnalysis;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValidationResult;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.api.model.UnresolvedReference;
import com.quill.formula.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FormulaCompilerTest {

    private static final SchemaSnapshot INVOICE = SchemaSnapshot.builder("invoice")
            .input("quantity", FormulaType.NUMBER)
            .input("unit_price", FormulaType.NUMBER)
            .input("customer_name", FormulaType.TEXT)
            .input("status", FormulaType.TEXT)
            .input("notes", FormulaType.TEXT)
            .calculated("subtotal", FormulaType.NUMBER)
            .calculated("tax", FormulaType.NUMBER)
            .calculated("total", FormulaType.NUMBER)
            .calculated("A", FormulaType.NUMBER)
            .calculated("B", FormulaType.NUMBER)
            .foreign("customer", "credit_limit", FormulaType.NUMBER)
            .build();

    private FormulaCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new FormulaCompiler(EngineConfig.defaults(), OpenTelemetry.noop().getTracer("test"));
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("Should accept a numeric formula and infer NUMBER")
        void shouldAcceptNumericFormula() {
            FormulaValidationResult result = compiler.validate("10 + 5", INVOICE);

            assertThat(result.valid()).isTrue();
            assertThat(result.inferredType()).isEqualTo(FormulaType.NUMBER);
            assertThat(result.errorCount()).isZero();
        }

        @Test
        @DisplayName("Should reject adding TEXT to NUMBER")
        void shouldRejectTextPlusNumber() {
            FormulaValidationResult result = compiler.validate("\"hello\" + 5", INVOICE);

            assertThat(result.valid()).isFalse();
            assertThat(result.typeErrors()).singleElement()
                    .satisfies(error -> assertThat(error.message()).contains("TEXT").contains("NUMBER"));
        }

        @Test
        @DisplayName("Should reject a NUMBER argument to upper")
        void shouldRejectUpperOfNumber() {
            FormulaValidationResult result = compiler.validate("upper(10)", INVOICE);

            assertThat(result.valid()).isFalse();
            assertThat(result.typeErrors()).singleElement().satisfies(error -> {
                assertThat(error.expectedType()).isEqualTo(FormulaType.TEXT);
                assertThat(error.actualType()).isEqualTo(FormulaType.NUMBER);
            });
        }

        @Test
        @DisplayName("Should report syntax errors without type analysis")
        void shouldReportSyntaxErrors() {
            FormulaValidationResult result = compiler.validate("quantity * (unit_price", INVOICE);

            assertThat(result.valid()).isFalse();
            assertThat(result.inferredType()).isEqualTo(FormulaType.UNKNOWN);
            assertThat(result.syntaxErrors()).isNotEmpty();
            assertThat(result.typeErrors()).isEmpty();
            assertThat(result.fieldReferences()).isEmpty();
        }

        @Test
        @DisplayName("Should treat an empty formula as valid with an UNKNOWN type")
        void shouldAcceptEmptyFormula() {
            FormulaValidationResult result = compiler.validate("   ", INVOICE);

            assertThat(result.valid()).isTrue();
            assertThat(result.inferredType()).isEqualTo(FormulaType.UNKNOWN);
            assertThat(result.infos()).containsExactly(FormulaCompiler.EMPTY_FORMULA_INFO);
        }

        @Test
        @DisplayName("Should report unknown and cross-entity references")
        void shouldReportUnresolvedReferences() {
            FormulaValidationResult result = compiler.validate("quantity + discount + credit_limit", INVOICE);

            assertThat(result.valid()).isFalse();
            assertThat(result.unresolvedReferences())
                    .extracting(UnresolvedReference::fieldId, UnresolvedReference::reason)
                    .containsExactly(
                        tuple("discount", UnresolvedReference.Reason.UNKNOWN_FIELD),
                        tuple("credit_limit", UnresolvedReference.Reason.CROSS_ENTITY));
            assertThat(result.fieldReferences()).containsExactly("credit_limit", "discount", "quantity");
        }

        @Test
        @DisplayName("Should return equal results for repeated validation")
        void shouldBeIdempotent() {
            String formula = "if_else(status == 'open', upper(customer_name), 3)";

            assertThat(compiler.validate(formula, INVOICE)).isEqualTo(compiler.validate(formula, INVOICE));
        }
    }

    @Nested
    @DisplayName("analyzeDependencies")
    class AnalyzeDependencies {

        @Test
        @DisplayName("Should list referenced fields with their types")
        void shouldListDependencies() {
            FormulaDependencyAnalysis analysis =
                    compiler.analyzeDependencies("quantity * unit_price + missing", INVOICE);

            assertThat(analysis.fieldIds()).containsExactly("missing", "quantity", "unit_price");
            assertThat(analysis.unknownFieldIds()).containsExactly("missing");
            assertThat(analysis.dependencies().get(1).type()).isEqualTo(FormulaType.NUMBER);
            assertThat(analysis.hasParseError()).isFalse();
        }

        @Test
        @DisplayName("Should report parse errors instead of dependencies")
        void shouldReportParseErrors() {
            FormulaDependencyAnalysis analysis = compiler.analyzeDependencies("quantity +", INVOICE);

            assertThat(analysis.hasParseError()).isTrue();
            assertThat(analysis.dependencies()).isEmpty();
        }
    }

    @Nested
    @DisplayName("analyzeCycles")
    class AnalyzeCycles {

        @Test
        @DisplayName("Should detect a two-field cycle")
        void shouldDetectTwoFieldCycle() {
            FormulaCycleAnalysisResult result = compiler.analyzeCycles(
                    Map.of("A", "B + 1", "B", "A + 1"), INVOICE);

            assertThat(result.hasCycle()).isTrue();
            assertThat(result.cycles()).singleElement().satisfies(cycle -> {
                assertThat(cycle.fieldIds()).containsExactly("A", "B");
                assertThat(cycle.cyclePath()).isEqualTo("A → B → A");
            });
            assertThat(result.evaluationOrder()).isEmpty();
        }

        @Test
        @DisplayName("Should order a linear chain without cycles")
        void shouldOrderLinearChain() {
            Map<String, String> formulas = new LinkedHashMap<>();
            formulas.put("total", "subtotal + tax");
            formulas.put("tax", "subtotal * 0.2");
            formulas.put("subtotal", "quantity * unit_price");

            FormulaCycleAnalysisResult result = compiler.analyzeCycles(formulas, INVOICE);

            assertThat(result.hasCycle()).isFalse();
            assertThat(result.cycles()).isEmpty();
            assertThat(result.evaluationOrder()).containsSubsequence("subtotal", "tax", "total");
            assertThat(compiler.evaluationOrder(formulas, INVOICE)).isEqualTo(result.evaluationOrder());
        }

        @Test
        @DisplayName("Should report a self-referencing field")
        void shouldReportSelfReference() {
            FormulaCycleAnalysisResult result = compiler.analyzeCycles(Map.of("total", "total + 1"), INVOICE);

            assertThat(result.cyclePaths()).containsExactly("total → total");
        }

        @Test
        @DisplayName("Should report one cycle per disjoint cycle")
        void shouldReportDisjointCycles() {
            Map<String, String> formulas = new LinkedHashMap<>();
            List<String> expected = new ArrayList<>();
            for (int k = 0; k < 4; k++) {
                String first = "f" + k + "a";
                String second = "f" + k + "b";
                formulas.put(first, second + " * 2");
                formulas.put(second, first + " - 1");
                expected.add(first + " → " + second + " → " + first);
            }

            FormulaCycleAnalysisResult result = compiler.analyzeCycles(formulas, INVOICE);

            assertThat(result.cyclePaths()).containsExactlyElementsOf(expected);
        }

        @Test
        @DisplayName("Should ignore formulas that do not parse")
        void shouldIgnoreUnparseableFormulas() {
            FormulaCycleAnalysisResult result = compiler.analyzeCycles(
                    Map.of("A", "B +", "B", "A + 1"), INVOICE);

            assertThat(result.hasCycle()).isFalse();
            assertThat(result.edges()).extracting(Object::toString).containsExactly("B -> A");
        }

        @Test
        @DisplayName("Should return equal results for repeated analysis")
        void shouldBeIdempotent() {
            Map<String, String> formulas = Map.of("A", "B + total", "B", "A", "total", "total");

            assertThat(compiler.analyzeCycles(formulas, INVOICE))
                    .isEqualTo(compiler.analyzeCycles(formulas, INVOICE));
        }
    }

    @Nested
    @DisplayName("control rules")
    class ControlRules {

        @Test
        @DisplayName("Should accept a well-formed visibility rule")
        void shouldAcceptVisibilityRule() {
            ControlRule rule = ControlRule.of("r1", "status", "notes", ControlEffectType.VISIBILITY,
                    "status == 'open'");

            ControlRuleValidationResult result = compiler.validateControlRule(rule, INVOICE);

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a display rule that does not produce BOOLEAN")
        void shouldRejectNonBooleanDisplayRule() {
            ControlRule rule = ControlRule.of("r1", "quantity", "notes", ControlEffectType.REQUIRED,
                    "quantity * 2");

            ControlRuleValidationResult result = compiler.validateControlRule(rule, INVOICE);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("REQUIRED rule formula must produce BOOLEAN but produces NUMBER");
        }

        @Test
        @DisplayName("Should reject missing fields and VALUE_SET type mismatches")
        void shouldRejectBadFieldsAndValueTypes() {
            ControlRule missing = ControlRule.of("r2", "ghost", "notes", ControlEffectType.ENABLED, "true");
            ControlRule wrongType = ControlRule.of("r3", "status", "quantity", ControlEffectType.VALUE_SET,
                    "upper(status)");

            assertThat(compiler.validateControlRule(missing, INVOICE).errors())
                    .containsExactly("Source field 'ghost' does not exist in entity 'invoice'");
            assertThat(compiler.validateControlRule(wrongType, INVOICE).errors())
                    .containsExactly("VALUE_SET rule produces TEXT but field 'quantity' is declared NUMBER");
        }

        @Test
        @DisplayName("Should detect control chains that loop")
        void shouldDetectChainCycles() {
            List<ControlRule> rules = List.of(
                    ControlRule.of("r1", "status", "notes", ControlEffectType.VALUE_SET, "status"),
                    ControlRule.of("r2", "notes", "status", ControlEffectType.VALUE_SET, "notes"),
                    ControlRule.of("r3", "quantity", "unit_price", ControlEffectType.VALUE_SET, "quantity").disabled());

            ControlChainAnalysisResult result = compiler.analyzeControlChains(rules);

            assertThat(result.hasCycle()).isTrue();
            assertThat(result.cycles()).singleElement()
                    .satisfies(cycle -> assertThat(cycle.cyclePath()).isEqualTo("notes → status → notes"));
            assertThat(result.warnings()).singleElement().asString().startsWith("Control rules form a cycle");
        }

        @Test
        @DisplayName("Should warn when a chain is longer than the run-time limit")
        void shouldWarnOnLongChains() {
            FormulaCompiler shallow = new FormulaCompiler(EngineConfig.builder().maxChainDepth(2).build());
            List<ControlRule> rules = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                rules.add(ControlRule.of("r" + i, "f" + i, "f" + (i + 1), ControlEffectType.VALUE_SET, "f" + i));
            }

            ControlChainAnalysisResult result = shallow.analyzeControlChains(rules);

            assertThat(result.hasCycle()).isFalse();
            assertThat(result.longestChainLength()).isEqualTo(3);
            assertThat(result.exceedsMaxDepth()).isTrue();
            assertThat(result.warnings()).singleElement().asString().contains("3 hops");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("tracing")
    class Tracing {

        @Mock
        private Tracer tracer;

        @Mock
        private SpanBuilder spanBuilder;

        @Mock
        private Span span;

        @Mock
        private Scope scope;

        @BeforeEach
        void setUpTracer() {
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(span);
            when(span.makeCurrent()).thenReturn(scope);
        }

        @Test
        @DisplayName("Should close a span around validation")
        void shouldTraceValidation() {
            FormulaCompiler traced = new FormulaCompiler(EngineConfig.defaults(), tracer);

            traced.validate("quantity + 1", INVOICE);

            verify(tracer).spanBuilder("validate-formula");
            verify(span).setAttribute("valid", true);
            verify(scope).close();
            verify(span).end();
        }

        @Test
        @DisplayName("Should close a span around cycle analysis")
        void shouldTraceCycleAnalysis() {
            FormulaCompiler traced = new FormulaCompiler(EngineConfig.defaults(), tracer);

            traced.analyzeCycles(Map.of("A", "B", "B", "A"), INVOICE);

            verify(tracer).spanBuilder("analyze-cycles");
            verify(span).setAttribute("cycleCount", 1L);
            verify(span).end();
        }
    }
}

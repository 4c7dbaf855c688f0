/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.ast.SourceSpan;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.api.model.UnresolvedReference;
import com.quill.formula.compiler.lexer.FormulaTokenizer;
import com.quill.formula.compiler.parser.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceResolverTest {

    private final FormulaParser parser = new FormulaParser(new FormulaTokenizer(10_000), 64);
    private final ReferenceResolver resolver = new ReferenceResolver();

    private final SchemaSnapshot schema = SchemaSnapshot.builder("invoice")
            .input("qty", FormulaType.NUMBER)
            .input("price", FormulaType.NUMBER)
            .foreign("customer", "discount", FormulaType.NUMBER)
            .build();

    private FormulaNode parse(String formula) {
        return parser.parse(formula).ast();
    }

    @Test
    @DisplayName("Should collect distinct field ids in sorted order")
    void shouldCollectFieldIds() {
        FormulaNode ast = parse("if_else(qty > 0, price * qty, coalesce(zeta, alpha))");

        assertThat(resolver.fieldIds(ast)).containsExactly("alpha", "price", "qty", "zeta");
        assertThat(resolver.references(ast)).hasSize(5);
    }

    @Test
    @DisplayName("Should resolve fields of the same entity")
    void shouldResolveKnownFields() {
        assertThat(resolver.resolve(parse("qty * price"), schema)).isEmpty();
    }

    @Test
    @DisplayName("Should report unknown fields once, at the first occurrence")
    void shouldReportUnknownFields() {
        List<UnresolvedReference> unresolved = resolver.resolve(parse("qty + ghost + ghost"), schema);

        assertThat(unresolved).singleElement().satisfies(ref -> {
            assertThat(ref.fieldId()).isEqualTo("ghost");
            assertThat(ref.reason()).isEqualTo(UnresolvedReference.Reason.UNKNOWN_FIELD);
            assertThat(ref.span()).isEqualTo(SourceSpan.of(6, 11));
        });
    }

    @Test
    @DisplayName("Should report fields of other entities as cross-entity references")
    void shouldReportCrossEntityFields() {
        List<UnresolvedReference> unresolved = resolver.resolve(parse("price - discount"), schema);

        assertThat(unresolved).singleElement().satisfies(ref -> {
            assertThat(ref.reason()).isEqualTo(UnresolvedReference.Reason.CROSS_ENTITY);
            assertThat(ref.message()).contains("another entity");
        });
    }
}

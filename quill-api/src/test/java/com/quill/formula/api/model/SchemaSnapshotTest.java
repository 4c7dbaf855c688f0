/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaSnapshotTest {

    private final SchemaSnapshot schema = SchemaSnapshot.builder("invoice")
            .calculated("total", FormulaType.NUMBER)
            .input("qty", FormulaType.NUMBER)
            .calculated("label", FormulaType.TEXT)
            .foreign("customer", "credit_limit", FormulaType.NUMBER)
            .build();

    @Test
    @DisplayName("Should only expose fields of its own entity")
    void shouldScopeLookupsToEntity() {
        assertThat(schema.contains("qty")).isTrue();
        assertThat(schema.contains("credit_limit")).isFalse();
        assertThat(schema.isForeign("credit_limit")).isTrue();
        assertThat(schema.isForeign("nothing")).isFalse();
        assertThat(schema.typeOf("credit_limit")).isEqualTo(FormulaType.UNKNOWN);
    }

    @Test
    @DisplayName("Should list calculated fields in id order")
    void shouldListCalculatedFields() {
        assertThat(schema.calculatedFieldIds()).containsExactly("label", "total");
        assertThat(schema.isCalculated("qty")).isFalse();
        assertThat(SchemaSnapshot.empty("x").calculatedFieldIds()).isEmpty();
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaValueTest {

    @Test
    @DisplayName("Should convert supported Java values")
    void shouldConvertJavaValues() {
        assertThat(FormulaValue.of(null)).isSameAs(FormulaValue.NULL);
        assertThat(FormulaValue.of(42)).isEqualTo(FormulaValue.number(42));
        assertThat(FormulaValue.of(7L).type()).isEqualTo(FormulaType.NUMBER);
        assertThat(FormulaValue.of(BigInteger.TEN)).isEqualTo(FormulaValue.number(BigDecimal.TEN));
        assertThat(FormulaValue.of(1.5d)).isEqualTo(FormulaValue.number("1.5"));
        assertThat(FormulaValue.of("abc")).isEqualTo(FormulaValue.text("abc"));
        assertThat(FormulaValue.of(true)).isSameAs(FormulaValue.TRUE);
        assertThat(FormulaValue.of(LocalDate.of(2024, 2, 29)).type()).isEqualTo(FormulaType.DATE);
        assertThat(FormulaValue.of(FormulaValue.FALSE)).isSameAs(FormulaValue.FALSE);
    }

    @Test
    @DisplayName("Should reject unsupported and non-finite values")
    void shouldRejectUnsupportedValues() {
        assertThatThrownBy(() -> FormulaValue.of(List.of(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported value type");
        assertThatThrownBy(() -> FormulaValue.of(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should render values the way formulas write them")
    void shouldRenderValues() {
        assertThat(FormulaValue.number("2.50")).hasToString("2.5");
        assertThat(FormulaValue.text("hi")).hasToString("\"hi\"");
        assertThat(FormulaValue.date(LocalDate.of(2024, 1, 31))).hasToString("#2024-01-31#");
        assertThat(FormulaValue.NULL.isNull()).isTrue();
        assertThat(FormulaValue.NULL.type()).isEqualTo(FormulaType.UNKNOWN);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.exceptions.FormulaEvaluationException;
import com.quill.formula.api.model.FailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationBudgetTest {

    @Test
    @DisplayName("Should pass until the deadline and fail after it")
    void shouldFailAfterDeadline() {
        AtomicLong now = new AtomicLong(1_000);
        EvaluationBudget budget = EvaluationBudget.start(Duration.ofNanos(500), now::get);

        now.set(1_500);
        assertThatCode(budget::check).doesNotThrowAnyException();

        now.set(1_501);
        assertThatThrownBy(budget::check)
                .isInstanceOf(FormulaEvaluationException.class)
                .satisfies(e -> assertThat(((FormulaEvaluationException) e).reason())
                    .isEqualTo(FailureReason.TIMEOUT));
    }

    @Test
    @DisplayName("Should survive nanoTime overflow")
    void shouldHandleClockOverflow() {
        AtomicLong now = new AtomicLong(Long.MAX_VALUE - 10);
        EvaluationBudget budget = EvaluationBudget.start(Duration.ofNanos(100), now::get);

        now.addAndGet(50);
        assertThatCode(budget::check).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a non-positive budget")
    void shouldRejectNonPositiveBudget() {
        assertThatThrownBy(() -> EvaluationBudget.start(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.exceptions.FormulaEvaluationException;
import com.quill.formula.api.model.FailureReason;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Deadline for one evaluation, checked at every AST node.
 */
public final class EvaluationBudget {

    private final LongSupplier nanoClock;
    private final long deadlineNanos;
    private final Duration budget;

    private EvaluationBudget(LongSupplier nanoClock, Duration budget) {
        this.nanoClock = nanoClock;
        this.budget = budget;
        this.deadlineNanos = nanoClock.getAsLong() + budget.toNanos();
    }

    public static EvaluationBudget start(Duration budget) {
        return start(budget, System::nanoTime);
    }

    public static EvaluationBudget start(Duration budget, LongSupplier nanoClock) {
        if (budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("budget must be positive: " + budget);
        }
        return new EvaluationBudget(nanoClock, budget);
    }

    /**
     * @throws FormulaEvaluationException with {@link FailureReason#TIMEOUT} once the deadline has passed
     */
    public void check() {
        if (nanoClock.getAsLong() - deadlineNanos > 0) {
            throw new FormulaEvaluationException(FailureReason.TIMEOUT,
                    "Evaluation exceeded its budget of " + budget.toMillis() + " ms");
        }
    }

    public Duration budget() {
        return budget;
    }
}

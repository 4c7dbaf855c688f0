/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.exceptions;

import com.quill.formula.api.model.EvaluationFailure;
import com.quill.formula.api.model.FailureReason;

/**
 * Evaluation failure as an exception.
 *
 * <p>Used internally to unwind a tree walk, and by
 * {@link com.quill.formula.api.model.EvaluationResult#valueOrThrow()} for
 * consumers that must block on failure.
 */
public class FormulaEvaluationException extends RuntimeException {

    private final transient EvaluationFailure failure;

    public FormulaEvaluationException(EvaluationFailure failure) {
        super(failure.describe());
        this.failure = failure;
    }

    public FormulaEvaluationException(FailureReason reason, String message) {
        this(EvaluationFailure.of(reason, message));
    }

    public FormulaEvaluationException(FailureReason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.failure = EvaluationFailure.of(reason, message);
    }

    public EvaluationFailure failure() {
        return failure;
    }

    public FailureReason reason() {
        return failure.reason();
    }
}

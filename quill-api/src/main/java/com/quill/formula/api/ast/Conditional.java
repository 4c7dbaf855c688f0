/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import java.util.Objects;

/**
 * {@code if_else(condition, then, else)}. Only the taken branch is evaluated.
 */
public record Conditional(
        FormulaNode condition,
        FormulaNode thenBranch,
        FormulaNode elseBranch,
        SourceSpan span
) implements FormulaNode {

    public Conditional {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(thenBranch, "thenBranch must not be null");
        Objects.requireNonNull(elseBranch, "elseBranch must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}

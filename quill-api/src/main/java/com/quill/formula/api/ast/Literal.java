/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValue;

import java.util.Objects;

/**
 * Constant value: NUMBER, TEXT, BOOLEAN or DATE, or the {@code null} keyword.
 */
public record Literal(FormulaValue value, SourceSpan span) implements FormulaNode {

    public Literal {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public FormulaType type() {
        return value.type();
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import java.util.Objects;

public record UnaryOp(UnaryOperator operator, FormulaNode operand, SourceSpan span) implements FormulaNode {

    public UnaryOp {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import java.util.Objects;

public record BinaryOp(
        BinaryOperator operator,
        FormulaNode left,
        FormulaNode right,
        SourceSpan span
) implements FormulaNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}

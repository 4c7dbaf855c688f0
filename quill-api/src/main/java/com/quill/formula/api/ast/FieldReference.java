/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import java.util.Objects;

/**
 * Read of a sibling field in the same entity.
 */
public record FieldReference(String fieldId, SourceSpan span) implements FormulaNode {

    public FieldReference {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitFieldReference(this);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import com.quill.formula.api.function.FormulaFunction;

import java.util.List;
import java.util.Objects;

/**
 * Invocation of a whitelisted function. The parser resolves the name, so a
 * {@code Call} never refers to an unknown function.
 */
public record Call(FormulaFunction function, List<FormulaNode> arguments, SourceSpan span) implements FormulaNode {

    public Call {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(span, "span must not be null");
        arguments = List.copyOf(arguments);
    }

    public String functionName() {
        return function.functionName();
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}

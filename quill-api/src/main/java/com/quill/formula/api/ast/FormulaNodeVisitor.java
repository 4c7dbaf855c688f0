/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

/**
 * Exhaustive dispatch over {@link FormulaNode} kinds.
 *
 * @param <R> result of visiting a node
 */
public interface FormulaNodeVisitor<R> {

    R visitLiteral(Literal literal);

    R visitFieldReference(FieldReference reference);

    R visitBinary(BinaryOp binary);

    R visitUnary(UnaryOp unary);

    R visitCall(Call call);

    R visitConditional(Conditional conditional);
}

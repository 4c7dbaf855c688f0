/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

/**
 * Node of an immutable formula syntax tree.
 *
 * <p>The set of node kinds is closed: {@link Literal}, {@link FieldReference},
 * {@link BinaryOp}, {@link UnaryOp}, {@link Call} and {@link Conditional}.
 * Passes over the tree implement {@link FormulaNodeVisitor}, so adding a kind
 * breaks every pass at compile time instead of silently falling through.
 *
 * <p>A tree is owned by the formula it was parsed from. Nodes hold no
 * mutable state and may be shared freely between threads.
 */
public sealed interface FormulaNode
        permits Literal, FieldReference, BinaryOp, UnaryOp, Call, Conditional {

    /**
     * Source range this node was parsed from.
     */
    SourceSpan span();

    <R> R accept(FormulaNodeVisitor<R> visitor);
}

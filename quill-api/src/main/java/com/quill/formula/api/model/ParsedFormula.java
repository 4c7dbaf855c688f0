/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.quill.formula.api.ast.FormulaNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one formula: an AST, or the collected syntax
 * diagnostics. A blank formula parses to neither.
 */
public record ParsedFormula(
        String source,
        FormulaNode ast,
        List<SyntaxDiagnostic> errors
) {

    public ParsedFormula {
        Objects.requireNonNull(source, "source must not be null");
        errors = List.copyOf(errors);
        if (ast != null && !errors.isEmpty()) {
            throw new IllegalArgumentException("A failed parse yields no AST");
        }
    }

    public static ParsedFormula success(String source, FormulaNode ast) {
        return new ParsedFormula(source, Objects.requireNonNull(ast, "ast must not be null"), List.of());
    }

    public static ParsedFormula failure(String source, List<SyntaxDiagnostic> errors) {
        return new ParsedFormula(source, null, errors);
    }

    public static ParsedFormula empty(String source) {
        return new ParsedFormula(source, null, List.of());
    }

    public boolean isSuccess() {
        return ast != null;
    }

    public boolean isEmpty() {
        return ast == null && errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Optional<FormulaNode> astIfPresent() {
        return Optional.ofNullable(ast);
    }

    /**
     * First diagnostic's message, or a fixed text for blank formulas.
     */
    public String describeFailure() {
        if (errors.isEmpty()) {
            return isEmpty() ? "Formula is empty" : "";
        }
        return errors.get(0).toString();
    }
}

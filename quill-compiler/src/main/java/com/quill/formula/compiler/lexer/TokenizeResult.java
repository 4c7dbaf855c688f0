/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.lexer;

import com.quill.formula.api.model.SyntaxDiagnostic;

import java.util.List;

/**
 * Tokens of a formula, ending with {@link TokenType#EOF}, and any lexical
 * errors. Tokens are produced even when errors exist, but a formula with
 * lexical errors never reaches the parser.
 */
public record TokenizeResult(List<Token> tokens, List<SyntaxDiagnostic> errors) {

    public TokenizeResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

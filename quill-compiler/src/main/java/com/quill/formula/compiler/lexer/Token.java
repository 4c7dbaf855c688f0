/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.lexer;

import com.quill.formula.api.ast.SourceSpan;

import java.util.Objects;

/**
 * One lexeme of a formula.
 *
 * @param type    token kind
 * @param lexeme  exact source text, including quotes and escapes
 * @param offset  start offset in the source
 * @param literal decoded value for literals ({@code BigDecimal}, {@code String},
 *                {@code LocalDate}); null otherwise
 */
public record Token(TokenType type, String lexeme, int offset, Object literal) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(lexeme, "lexeme must not be null");
    }

    public SourceSpan span() {
        return SourceSpan.of(offset, offset + lexeme.length());
    }

    public int end() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * How the token reads in a diagnostic.
     */
    public String describe() {
        return type == TokenType.EOF ? "end of formula" : "'" + lexeme + "'";
    }
}

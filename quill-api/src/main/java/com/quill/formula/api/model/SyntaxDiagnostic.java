/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A lexical or grammatical problem in formula source text.
 *
 * @param kind     whether the tokenizer or the parser found it
 * @param offset   zero-based character offset in the source
 * @param expected what the grammar expected at this point (may be null)
 * @param found    what was actually there (may be null)
 * @param message  human readable description
 */
public record SyntaxDiagnostic(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("offset") int offset,
        @JsonProperty("expected") String expected,
        @JsonProperty("found") String found,
        @JsonProperty("message") String message
) implements Serializable {

    public enum Kind {
        LEXICAL,
        SYNTAX
    }

    public SyntaxDiagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static SyntaxDiagnostic lexical(int offset, String found, String message) {
        return new SyntaxDiagnostic(Kind.LEXICAL, offset, null, found, message);
    }

    public static SyntaxDiagnostic syntax(int offset, String expected, String found, String message) {
        return new SyntaxDiagnostic(Kind.SYNTAX, offset, expected, found, message);
    }

    @Override
    public String toString() {
        return kind + " error at offset " + offset + ": " + message;
    }
}

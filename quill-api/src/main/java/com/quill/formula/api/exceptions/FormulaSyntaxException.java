/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.exceptions;

import com.quill.formula.api.model.SyntaxDiagnostic;

/**
 * Thrown inside the parser to abandon a malformed formula.
 *
 * <p>Unchecked; the compiler catches it and reports the carried
 * {@link SyntaxDiagnostic} as data.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final transient SyntaxDiagnostic diagnostic;

    public FormulaSyntaxException(SyntaxDiagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public FormulaSyntaxException(String message) {
        super(message);
        this.diagnostic = null;
    }

    public FormulaSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostic = null;
    }

    /**
     * The diagnostic, or null when thrown with a bare message.
     */
    public SyntaxDiagnostic diagnostic() {
        return diagnostic;
    }
}

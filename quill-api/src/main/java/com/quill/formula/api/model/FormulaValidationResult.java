/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Design-time validation outcome of one formula.
 *
 * <p>All diagnostics are collected; nothing is short-circuited on the first
 * problem. {@code UNKNOWN} inferred types are informational and do not make a
 * formula invalid on their own.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FormulaValidationResult result = compiler.validate("quantity * unit_price", schema);
 * if (!result.valid()) {
 *     result.allMessages().forEach(editor::showProblem);
 * }
 * }</pre>
 */
public record FormulaValidationResult(
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("inferred_type") FormulaType inferredType,
        @JsonProperty("syntax_errors") List<SyntaxDiagnostic> syntaxErrors,
        @JsonProperty("unresolved_references") List<UnresolvedReference> unresolvedReferences,
        @JsonProperty("type_errors") List<TypeDiagnostic> typeErrors,
        @JsonProperty("field_references") List<String> fieldReferences,
        @JsonProperty("infos") List<String> infos
) implements Serializable {

    public FormulaValidationResult {
        syntaxErrors = List.copyOf(syntaxErrors);
        unresolvedReferences = List.copyOf(unresolvedReferences);
        typeErrors = List.copyOf(typeErrors);
        fieldReferences = List.copyOf(fieldReferences);
        infos = List.copyOf(infos);
        if (inferredType == null) inferredType = FormulaType.UNKNOWN;
    }

    public int errorCount() {
        return syntaxErrors.size() + unresolvedReferences.size() + typeErrors.size();
    }

    /**
     * Every error message in a stable order: syntax, references, types.
     */
    public List<String> allMessages() {
        List<String> messages = new ArrayList<>(errorCount());
        syntaxErrors.forEach(e -> messages.add(e.toString()));
        unresolvedReferences.forEach(e -> messages.add(e.message()));
        typeErrors.forEach(e -> messages.add(e.message()));
        return messages;
    }
}

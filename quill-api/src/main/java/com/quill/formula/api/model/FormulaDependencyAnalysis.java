/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Fields a single formula depends on, sorted by id.
 */
public record FormulaDependencyAnalysis(
        @JsonProperty("dependencies") List<FieldDependency> dependencies,
        @JsonProperty("unknown_field_ids") List<String> unknownFieldIds,
        @JsonProperty("syntax_errors") List<SyntaxDiagnostic> syntaxErrors
) implements Serializable {

    public FormulaDependencyAnalysis {
        dependencies = List.copyOf(dependencies);
        unknownFieldIds = List.copyOf(unknownFieldIds);
        syntaxErrors = List.copyOf(syntaxErrors);
    }

    public boolean hasParseError() {
        return !syntaxErrors.isEmpty();
    }

    public boolean hasUnknownFields() {
        return !unknownFieldIds.isEmpty();
    }

    public List<String> fieldIds() {
        return dependencies.stream().map(FieldDependency::fieldId).toList();
    }
}

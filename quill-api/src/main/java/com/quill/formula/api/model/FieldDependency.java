/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One field a formula reads.
 */
public record FieldDependency(
        @JsonProperty("field_id") String fieldId,
        @JsonProperty("known") boolean known,
        @JsonProperty("type") FormulaType type
) implements Serializable {
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

/**
 * Result type of a formula or declared type of a field.
 *
 * <p>{@link #UNKNOWN} is a legitimate terminal state (empty or invalid
 * formula, {@code null} literal, field of undetermined type), not an error.
 */
public enum FormulaType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Whether values of this type support {@code < <= > >=}.
     */
    public boolean isOrderable() {
        return this == NUMBER || this == TEXT || this == DATE;
    }

    /**
     * Whether a value of type {@code other} may stand where this type is expected.
     * {@code UNKNOWN} on either side is always compatible.
     */
    public boolean isCompatibleWith(FormulaType other) {
        return this == UNKNOWN || other == UNKNOWN || this == other;
    }
}

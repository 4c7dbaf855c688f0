/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

/**
 * What a control rule does to its target field.
 */
public enum ControlEffectType {
    VISIBILITY(true, true),
    ENABLED(true, true),
    REQUIRED(true, false),
    VALUE_SET(false, false);

    private final boolean display;
    private final boolean defaultState;

    ControlEffectType(boolean display, boolean defaultState) {
        this.display = display;
        this.defaultState = defaultState;
    }

    /**
     * Display rules are boolean-valued and fail soft; {@link #VALUE_SET} is
     * value-producing and fails hard.
     */
    public boolean isDisplayRule() {
        return display;
    }

    /**
     * State the target falls back to when a display rule cannot be evaluated:
     * visible, enabled, not required.
     */
    public boolean defaultState() {
        if (!display) {
            throw new UnsupportedOperationException("VALUE_SET has no default state");
        }
        return defaultState;
    }
}

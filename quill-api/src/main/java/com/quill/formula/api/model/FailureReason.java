/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

/**
 * Why an evaluation produced no value.
 */
public enum FailureReason {
    PARSE_ERROR,
    INVALID_FORMULA,
    UNRESOLVED_REFERENCE,
    TYPE_MISMATCH,
    DIVISION_BY_ZERO,
    DOMAIN_ERROR,
    TIMEOUT,
    CHAIN_DEPTH_EXCEEDED,
    CYCLIC_DEPENDENCY
}

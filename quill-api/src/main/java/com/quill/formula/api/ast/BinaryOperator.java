/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

/**
 * Binary operators, grouped by the typing rule that applies to them.
 */
public enum BinaryOperator {
    OR("or", Category.LOGICAL),
    AND("and", Category.LOGICAL),

    EQUAL("==", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    LESS_THAN("<", Category.ORDERING),
    LESS_EQUAL("<=", Category.ORDERING),
    GREATER_THAN(">", Category.ORDERING),
    GREATER_EQUAL(">=", Category.ORDERING),

    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC);

    public enum Category {
        LOGICAL,
        EQUALITY,
        ORDERING,
        ARITHMETIC
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isComparison() {
        return category == Category.EQUALITY || category == Category.ORDERING;
    }
}

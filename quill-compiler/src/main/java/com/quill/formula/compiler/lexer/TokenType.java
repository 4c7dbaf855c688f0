/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.lexer;

/**
 * Kinds of token produced by {@link FormulaTokenizer}.
 */
public enum TokenType {
    IDENTIFIER(Category.IDENTIFIER),

    NUMBER(Category.LITERAL),
    STRING(Category.LITERAL),
    DATE(Category.LITERAL),

    TRUE(Category.KEYWORD),
    FALSE(Category.KEYWORD),
    NULL(Category.KEYWORD),
    AND(Category.KEYWORD),
    OR(Category.KEYWORD),
    NOT(Category.KEYWORD),

    PLUS(Category.OPERATOR),
    MINUS(Category.OPERATOR),
    STAR(Category.OPERATOR),
    SLASH(Category.OPERATOR),
    PERCENT(Category.OPERATOR),
    EQUAL(Category.OPERATOR),
    NOT_EQUAL(Category.OPERATOR),
    LESS(Category.OPERATOR),
    LESS_EQUAL(Category.OPERATOR),
    GREATER(Category.OPERATOR),
    GREATER_EQUAL(Category.OPERATOR),

    LEFT_PAREN(Category.PUNCTUATION),
    RIGHT_PAREN(Category.PUNCTUATION),
    COMMA(Category.PUNCTUATION),

    EOF(Category.END);

    public enum Category {
        IDENTIFIER,
        LITERAL,
        KEYWORD,
        OPERATOR,
        PUNCTUATION,
        END
    }

    private final Category category;

    TokenType(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}

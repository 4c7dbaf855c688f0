/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.lexer;

import com.quill.formula.api.model.SyntaxDiagnostic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaTokenizerTest {

    private final FormulaTokenizer tokenizer = new FormulaTokenizer(10_000);

    private List<TokenType> types(String source) {
        return tokenizer.tokenize(source).tokens().stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Should tokenize arithmetic with offsets and a trailing EOF")
    void shouldTokenizeArithmetic() {
        TokenizeResult result = tokenizer.tokenize("10 + 5.25");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.tokens()).extracting(Token::type)
                .containsExactly(TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.EOF);
        assertThat(result.tokens().get(2).literal()).isEqualTo(new BigDecimal("5.25"));
        assertThat(result.tokens().get(2).offset()).isEqualTo(5);
        assertThat(result.tokens().get(3).offset()).isEqualTo(9);
    }

    @Test
    @DisplayName("Should end a number at a dot not followed by a digit")
    void shouldNotConsumeTrailingDot() {
        TokenizeResult result = tokenizer.tokenize("1.");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.tokens().get(0).lexeme()).isEqualTo("1");
        assertThat(result.errors().get(0).offset()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should read keywords case-insensitively and keep identifiers as written")
    void shouldRecognizeKeywords() {
        assertThat(types("a AND not b Or TRUE and False and NULL"))
                .containsExactly(TokenType.IDENTIFIER, TokenType.AND, TokenType.NOT, TokenType.IDENTIFIER,
                    TokenType.OR, TokenType.TRUE, TokenType.AND, TokenType.FALSE, TokenType.AND, TokenType.NULL,
                    TokenType.EOF);
        assertThat(tokenizer.tokenize("Unit_Price2").tokens().get(0).lexeme()).isEqualTo("Unit_Price2");
    }

    @Test
    @DisplayName("Should decode single and double quoted strings with escapes")
    void shouldDecodeStrings() {
        TokenizeResult result = tokenizer.tokenize("\"say \\\"hi\\\"\" + 'it\\'s'");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.tokens().get(0).literal()).isEqualTo("say \"hi\"");
        assertThat(result.tokens().get(2).literal()).isEqualTo("it's");
    }

    @Test
    @DisplayName("Should parse date literals")
    void shouldParseDates() {
        TokenizeResult result = tokenizer.tokenize("#2024-02-29#");

        assertThat(result.tokens().get(0).type()).isEqualTo(TokenType.DATE);
        assertThat(result.tokens().get(0).literal()).isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    @DisplayName("Should tokenize every comparison operator")
    void shouldTokenizeComparisons() {
        assertThat(types("a == b != c < d <= e > f >= g"))
                .filteredOn(t -> t.category() == TokenType.Category.OPERATOR)
                .containsExactly(TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                    TokenType.GREATER, TokenType.GREATER_EQUAL);
    }

    @Test
    @DisplayName("Should collect every lexical error instead of stopping at the first")
    void shouldCollectAllLexicalErrors() {
        TokenizeResult result = tokenizer.tokenize("a = b @ c ! d");

        assertThat(result.errors()).extracting(SyntaxDiagnostic::offset).containsExactly(2, 6, 10);
        assertThat(result.errors()).allMatch(e -> e.kind() == SyntaxDiagnostic.Kind.LEXICAL);
    }

    @Test
    @DisplayName("Should report unterminated strings and malformed dates")
    void shouldReportBadLiterals() {
        assertThat(tokenizer.tokenize("'abc").errors()).singleElement()
                .satisfies(e -> {
                    assertThat(e.offset()).isZero();
                    assertThat(e.message()).contains("Unterminated string");
                });
        assertThat(tokenizer.tokenize("#2024-13-01#").errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("Invalid date literal"));
    }

    @Test
    @DisplayName("Should reject formulas longer than the configured maximum")
    void shouldRejectTooLongFormula() {
        TokenizeResult result = new FormulaTokenizer(5).tokenize("123456");

        assertThat(result.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("maximum is 5"));
    }

    @Test
    @DisplayName("Should produce the same tokens for the same input")
    void shouldBeRestartable() {
        assertThat(tokenizer.tokenize("if_else(a > 1, 'x', 'y')"))
                .isEqualTo(tokenizer.tokenize("if_else(a > 1, 'x', 'y')"));
    }
}

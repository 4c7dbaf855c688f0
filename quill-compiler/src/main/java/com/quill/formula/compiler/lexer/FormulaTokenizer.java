/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.lexer;

import com.quill.formula.api.model.SyntaxDiagnostic;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lexes formula source text into tokens.
 *
 * <p>Whitespace is insignificant outside string literals. Keywords
 * ({@code and or not true false null}) are case-insensitive. Strings may use
 * single or double quotes; dates are written {@code #2024-01-31#}.
 *
 * <p>A bad character is reported and skipped so that every lexical error of
 * a formula is found in one pass. The tokenizer is stateless; one instance
 * may be shared.
 */
public final class FormulaTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL
    );

    private final int maxLength;

    public FormulaTokenizer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public TokenizeResult tokenize(String source) {
        if (source.length() > maxLength) {
            return new TokenizeResult(
                    List.of(new Token(TokenType.EOF, "", source.length(), null)),
                    List.of(SyntaxDiagnostic.lexical(0, null,
                        "Formula is " + source.length() + " characters long, maximum is " + maxLength)));
        }
        return new Scan(source).run();
    }

    /**
     * Single-use cursor over one source string.
     */
    private static final class Scan {
        private final String source;
        private final List<Token> tokens = new ArrayList<>();
        private final List<SyntaxDiagnostic> errors = new ArrayList<>();
        private int pos;

        Scan(String source) {
            this.source = source;
        }

        TokenizeResult run() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else if (c == '"' || c == '\'') {
                    string(c);
                } else if (c == '#') {
                    date();
                } else {
                    operator(c);
                }
            }
            tokens.add(new Token(TokenType.EOF, "", source.length(), null));
            return new TokenizeResult(tokens, errors);
        }

        private void number() {
            int start = pos;
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
            if (pos + 1 < source.length() && source.charAt(pos) == '.' && isDigit(source.charAt(pos + 1))) {
                pos++;
                while (pos < source.length() && isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
            String text = source.substring(start, pos);
            tokens.add(new Token(TokenType.NUMBER, text, start, new BigDecimal(text)));
        }

        private void identifier() {
            int start = pos;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            String text = source.substring(start, pos);
            TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
            tokens.add(new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start, null));
        }

        private void string(char quote) {
            int start = pos;
            StringBuilder value = new StringBuilder();
            pos++;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == quote) {
                    pos++;
                    tokens.add(new Token(TokenType.STRING, source.substring(start, pos), start, value.toString()));
                    return;
                }
                if (c == '\\' && pos + 1 < source.length()) {
                    value.append(unescape(source.charAt(pos + 1)));
                    pos += 2;
                } else {
                    value.append(c);
                    pos++;
                }
            }
            errors.add(SyntaxDiagnostic.lexical(start, String.valueOf(quote), "Unterminated string literal"));
        }

        private void date() {
            int start = pos;
            int close = source.indexOf('#', start + 1);
            if (close < 0) {
                errors.add(SyntaxDiagnostic.lexical(start, "#", "Unterminated date literal"));
                pos++;
                return;
            }
            String body = source.substring(start + 1, close);
            pos = close + 1;
            try {
                LocalDate date = LocalDate.parse(body.trim());
                tokens.add(new Token(TokenType.DATE, source.substring(start, pos), start, date));
            } catch (DateTimeParseException e) {
                errors.add(SyntaxDiagnostic.lexical(start, source.substring(start, pos),
                        "Invalid date literal '" + body + "', expected YYYY-MM-DD"));
            }
        }

        private void operator(char c) {
            int start = pos;
            char next = pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
            switch (c) {
                case '+' -> single(TokenType.PLUS);
                case '-' -> single(TokenType.MINUS);
                case '*' -> single(TokenType.STAR);
                case '/' -> single(TokenType.SLASH);
                case '%' -> single(TokenType.PERCENT);
                case '(' -> single(TokenType.LEFT_PAREN);
                case ')' -> single(TokenType.RIGHT_PAREN);
                case ',' -> single(TokenType.COMMA);
                case '<' -> {
                    if (next == '=') pair(TokenType.LESS_EQUAL); else single(TokenType.LESS);
                }
                case '>' -> {
                    if (next == '=') pair(TokenType.GREATER_EQUAL); else single(TokenType.GREATER);
                }
                case '=' -> {
                    if (next == '=') {
                        pair(TokenType.EQUAL);
                    } else {
                        errors.add(SyntaxDiagnostic.lexical(start, "=", "Unexpected '=', did you mean '=='?"));
                        pos++;
                    }
                }
                case '!' -> {
                    if (next == '=') {
                        pair(TokenType.NOT_EQUAL);
                    } else {
                        errors.add(SyntaxDiagnostic.lexical(start, "!", "Unexpected '!', use 'not' or '!='"));
                        pos++;
                    }
                }
                default -> {
                    errors.add(SyntaxDiagnostic.lexical(start, String.valueOf(c), "Unexpected character '" + c + "'"));
                    pos++;
                }
            }
        }

        private void single(TokenType type) {
            tokens.add(new Token(type, source.substring(pos, pos + 1), pos, null));
            pos++;
        }

        private void pair(TokenType type) {
            tokens.add(new Token(type, source.substring(pos, pos + 2), pos, null));
            pos += 2;
        }

        private static char unescape(char c) {
            return switch (c) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                default -> c;
            };
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || isDigit(c);
        }
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.parser;

import com.quill.formula.api.ast.BinaryOp;
import com.quill.formula.api.ast.BinaryOperator;
import com.quill.formula.api.ast.Call;
import com.quill.formula.api.ast.Conditional;
import com.quill.formula.api.ast.FieldReference;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.ast.Literal;
import com.quill.formula.api.ast.SourceSpan;
import com.quill.formula.api.ast.UnaryOp;
import com.quill.formula.api.ast.UnaryOperator;
import com.quill.formula.api.exceptions.FormulaSyntaxException;
import com.quill.formula.api.function.FormulaFunction;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.ParsedFormula;
import com.quill.formula.api.model.SyntaxDiagnostic;
import com.quill.formula.compiler.lexer.FormulaTokenizer;
import com.quill.formula.compiler.lexer.Token;
import com.quill.formula.compiler.lexer.TokenType;
import com.quill.formula.compiler.lexer.TokenizeResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser producing an immutable {@link FormulaNode} tree.
 *
 * <p>Precedence, lowest first:
 * <pre>
 * or
 * and
 * not                      (prefix, right-associative)
 * == != &lt; &lt;= &gt; &gt;=        (left-associative)
 * + -
 * * / %
 * unary + -                (prefix, right-associative)
 * primary                  literal, field, call, ( expr ), if_else(c, a, b)
 * </pre>
 *
 * <p>Unknown functions and wrong argument counts are recorded and parsing
 * continues, so that all of them are reported together. Any other grammar
 * error ends the parse. A formula with any error yields no AST.
 */
public final class FormulaParser {

    private static final Map<TokenType, BinaryOperator> COMPARISONS = Map.of(
            TokenType.EQUAL, BinaryOperator.EQUAL,
            TokenType.NOT_EQUAL, BinaryOperator.NOT_EQUAL,
            TokenType.LESS, BinaryOperator.LESS_THAN,
            TokenType.LESS_EQUAL, BinaryOperator.LESS_EQUAL,
            TokenType.GREATER, BinaryOperator.GREATER_THAN,
            TokenType.GREATER_EQUAL, BinaryOperator.GREATER_EQUAL
    );

    private static final Map<TokenType, BinaryOperator> ADDITIVE = Map.of(
            TokenType.PLUS, BinaryOperator.ADD,
            TokenType.MINUS, BinaryOperator.SUBTRACT
    );

    private static final Map<TokenType, BinaryOperator> MULTIPLICATIVE = Map.of(
            TokenType.STAR, BinaryOperator.MULTIPLY,
            TokenType.SLASH, BinaryOperator.DIVIDE,
            TokenType.PERCENT, BinaryOperator.MODULO
    );

    private final FormulaTokenizer tokenizer;
    private final int maxNestingDepth;

    public FormulaParser(FormulaTokenizer tokenizer, int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.tokenizer = tokenizer;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a formula. Never throws for malformed input.
     */
    public ParsedFormula parse(String source) {
        TokenizeResult lexed = tokenizer.tokenize(source);
        if (lexed.hasErrors()) {
            return ParsedFormula.failure(source, lexed.errors());
        }
        if (lexed.tokens().size() == 1) {
            return ParsedFormula.empty(source);
        }
        return new Cursor(source, lexed.tokens()).parseFormula();
    }

    /**
     * Parse state for one token stream.
     */
    private final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private final List<SyntaxDiagnostic> errors = new ArrayList<>();
        private int index;
        private int depth;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        ParsedFormula parseFormula() {
            try {
                FormulaNode root = expression();
                if (!peek().is(TokenType.EOF)) {
                    throw error("end of formula", "Unexpected " + peek().describe() + " after expression");
                }
                if (!errors.isEmpty()) {
                    return ParsedFormula.failure(source, errors);
                }
                return ParsedFormula.success(source, root);
            } catch (FormulaSyntaxException e) {
                errors.add(e.diagnostic());
                return ParsedFormula.failure(source, errors);
            }
        }

        private FormulaNode expression() {
            enter();
            try {
                return or();
            } finally {
                depth--;
            }
        }

        private FormulaNode or() {
            FormulaNode left = and();
            while (match(TokenType.OR)) {
                FormulaNode right = and();
                left = binary(BinaryOperator.OR, left, right);
            }
            return left;
        }

        private FormulaNode and() {
            FormulaNode left = not();
            while (match(TokenType.AND)) {
                FormulaNode right = not();
                left = binary(BinaryOperator.AND, left, right);
            }
            return left;
        }

        private FormulaNode not() {
            if (peek().is(TokenType.NOT)) {
                Token operator = advance();
                enter();
                try {
                    FormulaNode operand = not();
                    return new UnaryOp(UnaryOperator.NOT, operand, operator.span().union(operand.span()));
                } finally {
                    depth--;
                }
            }
            return comparison();
        }

        private FormulaNode comparison() {
            FormulaNode left = additive();
            while (COMPARISONS.containsKey(peek().type())) {
                BinaryOperator operator = COMPARISONS.get(advance().type());
                left = binary(operator, left, additive());
            }
            return left;
        }

        private FormulaNode additive() {
            FormulaNode left = multiplicative();
            while (ADDITIVE.containsKey(peek().type())) {
                BinaryOperator operator = ADDITIVE.get(advance().type());
                left = binary(operator, left, multiplicative());
            }
            return left;
        }

        private FormulaNode multiplicative() {
            FormulaNode left = unary();
            while (MULTIPLICATIVE.containsKey(peek().type())) {
                BinaryOperator operator = MULTIPLICATIVE.get(advance().type());
                left = binary(operator, left, unary());
            }
            return left;
        }

        private FormulaNode unary() {
            if (peek().is(TokenType.MINUS) || peek().is(TokenType.PLUS)) {
                Token operator = advance();
                enter();
                try {
                    FormulaNode operand = unary();
                    UnaryOperator op = operator.is(TokenType.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.PLUS;
                    return new UnaryOp(op, operand, operator.span().union(operand.span()));
                } finally {
                    depth--;
                }
            }
            return primary();
        }

        private FormulaNode primary() {
            Token token = peek();
            switch (token.type()) {
                case NUMBER:
                    advance();
                    return new Literal(FormulaValue.number((BigDecimal) token.literal()), token.span());
                case STRING:
                    advance();
                    return new Literal(FormulaValue.text((String) token.literal()), token.span());
                case DATE:
                    advance();
                    return new Literal(FormulaValue.date((LocalDate) token.literal()), token.span());
                case TRUE:
                    advance();
                    return new Literal(FormulaValue.TRUE, token.span());
                case FALSE:
                    advance();
                    return new Literal(FormulaValue.FALSE, token.span());
                case NULL:
                    advance();
                    return new Literal(FormulaValue.NULL, token.span());
                case IDENTIFIER:
                    advance();
                    if (peek().is(TokenType.LEFT_PAREN)) {
                        return call(token);
                        }
                    return new FieldReference(token.lexeme(), token.span());
                case LEFT_PAREN:
                    advance();
                    FormulaNode inner = expression();
                    expect(TokenType.RIGHT_PAREN, "')'");
                    return inner;
                default:
                    throw error("expression", "Expected an expression but found " + token.describe());
            }
        }

        private FormulaNode call(Token name) {
            Token open = expect(TokenType.LEFT_PAREN, "'('");
            List<FormulaNode> arguments = new ArrayList<>();
            if (!peek().is(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            Token close = expect(TokenType.RIGHT_PAREN, "',' or ')'");
            SourceSpan span = name.span().union(close.span());

            FormulaFunction function = FormulaFunction.byName(name.lexeme()).orElse(null);
            if (function == null) {
                errors.add(SyntaxDiagnostic.syntax(name.offset(), "one of " + FormulaFunction.names(),
                        name.lexeme(), "Unknown function '" + name.lexeme() + "'"));
                return placeholder(span);
            }
            if (!function.acceptsArity(arguments.size())) {
                errors.add(SyntaxDiagnostic.syntax(open.offset(), function.describeArity() + " argument(s)",
                        Integer.toString(arguments.size()),
                        "Function '" + function.functionName() + "' expects " + function.describeArity()
                            + " argument(s) but got " + arguments.size()));
                return placeholder(span);
            }
            if (function == FormulaFunction.IF_ELSE) {
                return new Conditional(arguments.get(0), arguments.get(1), arguments.get(2), span);
            }
            return new Call(function, arguments, span);
        }

        // Stands in for a rejected call so parsing can go on; never returned to callers.
        private FormulaNode placeholder(SourceSpan span) {
            return new Literal(FormulaValue.NULL, span);
        }

        private FormulaNode binary(BinaryOperator operator, FormulaNode left, FormulaNode right) {
            return new BinaryOp(operator, left, right, left.span().union(right.span()));
        }

        private void enter() {
            if (++depth > maxNestingDepth) {
                throw error("shallower expression", "Formula is nested deeper than " + maxNestingDepth + " levels");
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        private boolean match(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String expected) {
            if (!peek().is(type)) {
                throw error(expected, "Expected " + expected + " but found " + peek().describe());
            }
            return advance();
        }

        private FormulaSyntaxException error(String expected, String message) {
            Token found = peek();
            return new FormulaSyntaxException(
                    SyntaxDiagnostic.syntax(found.offset(), expected, found.describe(), message));
        }
    }
}

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
import com.quill.formula.api.function.FormulaFunction;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.ParsedFormula;
import com.quill.formula.api.model.SyntaxDiagnostic;
import com.quill.formula.compiler.lexer.FormulaTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser(new FormulaTokenizer(10_000), 64);

    private FormulaNode parse(String source) {
        ParsedFormula parsed = parser.parse(source);
        assertThat(parsed.errors()).as("errors for %s", source).isEmpty();
        return parsed.ast();
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("Should bind multiplication tighter than addition")
        void multiplicationBeforeAddition() {
            BinaryOp root = (BinaryOp) parse("1 + 2 * 3");

            assertThat(root.operator()).isEqualTo(BinaryOperator.ADD);
            assertThat(((BinaryOp) root.right()).operator()).isEqualTo(BinaryOperator.MULTIPLY);
        }

        @Test
        @DisplayName("Should parse 'or' below 'and' below 'not' below comparison")
        void logicalPrecedence() {
            BinaryOp root = (BinaryOp) parse("not a > 1 and b or c");

            assertThat(root.operator()).isEqualTo(BinaryOperator.OR);
            BinaryOp and = (BinaryOp) root.left();
            assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
            UnaryOp not = (UnaryOp) and.left();
            assertThat(not.operator()).isEqualTo(UnaryOperator.NOT);
            assertThat(((BinaryOp) not.operand()).operator()).isEqualTo(BinaryOperator.GREATER_THAN);
        }

        @Test
        @DisplayName("Should associate binary operators to the left")
        void leftAssociative() {
            BinaryOp root = (BinaryOp) parse("10 - 4 - 3");

            assertThat(root.operator()).isEqualTo(BinaryOperator.SUBTRACT);
            assertThat(root.left()).isInstanceOf(BinaryOp.class);
            assertThat(root.right()).isInstanceOf(Literal.class);
        }

        @Test
        @DisplayName("Should apply unary minus before multiplication and honour parentheses")
        void unaryAndParentheses() {
            BinaryOp product = (BinaryOp) parse("-a * (b + c)");

            assertThat(product.left()).isInstanceOf(UnaryOp.class);
            assertThat(((UnaryOp) product.left()).operator()).isEqualTo(UnaryOperator.NEGATE);
            assertThat(((BinaryOp) product.right()).operator()).isEqualTo(BinaryOperator.ADD);
        }

        @Test
        @DisplayName("Should chain comparisons left to right")
        void chainedComparison() {
            BinaryOp root = (BinaryOp) parse("a < b < c");

            assertThat(root.operator()).isEqualTo(BinaryOperator.LESS_THAN);
            assertThat(root.left()).isInstanceOf(BinaryOp.class);
        }
    }

    @Nested
    @DisplayName("Primaries")
    class Primaries {

        @Test
        @DisplayName("Should parse literals of every type")
        void literals() {
            assertThat(((Literal) parse("'x'")).value()).isEqualTo(FormulaValue.text("x"));
            assertThat(((Literal) parse("true")).value()).isEqualTo(FormulaValue.TRUE);
            assertThat(((Literal) parse("null")).value().isNull()).isTrue();
            assertThat(((Literal) parse("#2024-01-31#")).type().name()).isEqualTo("DATE");
        }

        @Test
        @DisplayName("Should parse field references with their span")
        void fieldReference() {
            FieldReference reference = (FieldReference) parse("  quantity ");

            assertThat(reference.fieldId()).isEqualTo("quantity");
            assertThat(reference.span()).isEqualTo(SourceSpan.of(2, 10));
        }

        @Test
        @DisplayName("Should parse whitelisted calls")
        void call() {
            Call call = (Call) parse("round(price * 1.2, 2)");

            assertThat(call.function()).isEqualTo(FormulaFunction.ROUND);
            assertThat(call.arguments()).hasSize(2);
            assertThat(call.span()).isEqualTo(SourceSpan.of(0, 21));
        }

        @Test
        @DisplayName("Should parse if_else into a conditional node")
        void conditional() {
            FormulaNode node = parse("if_else(a > 1, 'big', 'small')");

            assertThat(node).isInstanceOf(Conditional.class);
            assertThat(((Conditional) node).thenBranch()).isEqualTo(new Literal(FormulaValue.text("big"), SourceSpan.of(15, 20)));
        }

        @Test
        @DisplayName("Should parse zero-argument calls")
        void zeroArguments() {
            assertThat(((Call) parse("today()")).arguments()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should report an unknown function as a parse error")
        void unknownFunction() {
            ParsedFormula parsed = parser.parse("random()");

            assertThat(parsed.isSuccess()).isFalse();
            assertThat(parsed.errors()).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(SyntaxDiagnostic.Kind.SYNTAX);
                assertThat(e.offset()).isZero();
                assertThat(e.message()).isEqualTo("Unknown function 'random'");
            });
        }

        @Test
        @DisplayName("Should match function names case-sensitively")
        void caseSensitiveFunctions() {
            assertThat(parser.parse("UPPER('a')").errors()).singleElement()
                    .satisfies(e -> assertThat(e.message()).contains("Unknown function 'UPPER'"));
        }

        @Test
        @DisplayName("Should collect every unknown function and arity error")
        void collectsCallErrors() {
            ParsedFormula parsed = parser.parse("foo(1) + upper('a', 'b') + bar()");

            assertThat(parsed.errors()).extracting(SyntaxDiagnostic::message)
                    .containsExactly(
                        "Unknown function 'foo'",
                        "Function 'upper' expects 1 argument(s) but got 2",
                        "Unknown function 'bar'");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "1 +            | 3 | expression",
            "(1 + 2         | 6 | ')'",
            "1 2            | 2 | end of formula",
            "max(1,         | 6 | expression",
            "a and or b     | 6 | expression"
        })
        @DisplayName("Should report grammar errors with offset and expectation")
        void grammarErrors(String source, int offset, String expected) {
            ParsedFormula parsed = parser.parse(source.trim());

            assertThat(parsed.ast()).isNull();
            assertThat(parsed.errors()).singleElement().satisfies(e -> {
                assertThat(e.offset()).isEqualTo(offset);
                assertThat(e.expected()).isEqualTo(expected);
            });
        }

        @Test
        @DisplayName("Should stop lexically broken formulas before parsing")
        void lexicalErrorsWin() {
            ParsedFormula parsed = parser.parse("a = 1");

            assertThat(parsed.errors()).singleElement()
                    .satisfies(e -> assertThat(e.kind()).isEqualTo(SyntaxDiagnostic.Kind.LEXICAL));
        }

        @Test
        @DisplayName("Should reject nesting deeper than the limit")
        void nestingLimit() {
            FormulaParser shallow = new FormulaParser(new FormulaTokenizer(10_000), 3);

            assertThat(shallow.parse("((1))").isSuccess()).isTrue();
            assertThat(shallow.parse("(((1)))").errors()).singleElement()
                    .satisfies(e -> assertThat(e.message()).contains("nested deeper than 3"));
        }
    }

    @Test
    @DisplayName("Should treat a blank formula as empty, not as an error")
    void blankFormula() {
        ParsedFormula parsed = parser.parse("   ");

        assertThat(parsed.isEmpty()).isTrue();
        assertThat(parsed.hasErrors()).isFalse();
    }
}

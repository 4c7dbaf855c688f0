/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.ast.BinaryOp;
import com.quill.formula.api.ast.BinaryOperator;
import com.quill.formula.api.ast.Call;
import com.quill.formula.api.ast.Conditional;
import com.quill.formula.api.ast.FieldReference;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.ast.FormulaNodeVisitor;
import com.quill.formula.api.ast.Literal;
import com.quill.formula.api.ast.SourceSpan;
import com.quill.formula.api.ast.UnaryOp;
import com.quill.formula.api.ast.UnaryOperator;
import com.quill.formula.api.function.FormulaFunction;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.api.model.TypeDiagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up type inference over a formula AST.
 *
 * <p>{@link FormulaType#UNKNOWN} operands never cause an error; the other
 * operand decides. After an error, the offending node is typed by its
 * operator's result type and checking continues, so every mismatch in the
 * formula is reported. The checker never evaluates anything.
 */
public final class TypeChecker {

    /**
     * Inferred type of a formula plus every mismatch found.
     */
    public record Result(FormulaType type, List<TypeDiagnostic> errors) {
        public Result {
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    public Result check(FormulaNode ast, SchemaSnapshot snapshot) {
        Inference inference = new Inference(snapshot);
        FormulaType type = ast.accept(inference);
        return new Result(type, inference.errors);
    }

    private static final class Inference implements FormulaNodeVisitor<FormulaType> {
        private final SchemaSnapshot snapshot;
        private final List<TypeDiagnostic> errors = new ArrayList<>();

        Inference(SchemaSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public FormulaType visitLiteral(Literal literal) {
            return literal.type();
        }

        @Override
        public FormulaType visitFieldReference(FieldReference reference) {
            return snapshot.typeOf(reference.fieldId());
        }

        @Override
        public FormulaType visitUnary(UnaryOp unary) {
            FormulaType operand = unary.operand().accept(this);
            FormulaType required = unary.operator() == UnaryOperator.NOT ? FormulaType.BOOLEAN : FormulaType.NUMBER;
            if (operand.isKnown() && operand != required) {
                report(unary.operand().span(), required, operand,
                        "Operator '" + unary.operator().symbol() + "' requires " + required + " but got " + operand);
            }
            return required;
        }

        @Override
        public FormulaType visitBinary(BinaryOp binary) {
            FormulaType left = binary.left().accept(this);
            FormulaType right = binary.right().accept(this);
            BinaryOperator operator = binary.operator();
            return switch (operator.category()) {
                case LOGICAL -> requireBoth(binary, left, right, FormulaType.BOOLEAN);
                case ARITHMETIC -> requireBoth(binary, left, right, FormulaType.NUMBER);
                case EQUALITY -> {
                    requireSameType(binary, left, right);
                    yield FormulaType.BOOLEAN;
                }
                case ORDERING -> {
                    if (requireSameType(binary, left, right)) {
                        FormulaType operand = left.isKnown() ? left : right;
                        if (operand.isKnown() && !operand.isOrderable()) {
                            report(binary.span(), FormulaType.NUMBER, operand,
                                    "Operator '" + operator.symbol() + "' cannot order " + operand + " values");
                        }
                    }
                    yield FormulaType.BOOLEAN;
                }
            };
        }

        @Override
        public FormulaType visitCall(Call call) {
            FormulaFunction function = call.function();
            List<FormulaType> argumentTypes = new ArrayList<>(call.arguments().size());
            for (int i = 0; i < call.arguments().size(); i++) {
                FormulaNode argument = call.arguments().get(i);
                FormulaType actual = argument.accept(this);
                argumentTypes.add(actual);
                FormulaType expected = function.parameterType(i);
                if (expected.isKnown() && actual.isKnown() && actual != expected) {
                    report(argument.span(), expected, actual,
                            "Function '" + function.functionName() + "' expects " + expected
                                + " for argument " + (i + 1) + " but got " + actual);
                }
            }
            if (function.returnType().isKnown()) {
                return function.returnType();
            }
            return commonType(call.span(), function.functionName() + " arguments", argumentTypes);
        }

        @Override
        public FormulaType visitConditional(Conditional conditional) {
            FormulaType condition = conditional.condition().accept(this);
            if (condition.isKnown() && condition != FormulaType.BOOLEAN) {
                report(conditional.condition().span(), FormulaType.BOOLEAN, condition,
                        "Condition of if_else must be BOOLEAN but got " + condition);
            }
            FormulaType thenType = conditional.thenBranch().accept(this);
            FormulaType elseType = conditional.elseBranch().accept(this);
            return commonType(conditional.span(), "if_else branches", List.of(thenType, elseType));
        }

        private FormulaType requireBoth(BinaryOp binary, FormulaType left, FormulaType right, FormulaType required) {
            String symbol = binary.operator().symbol();
            boolean leftBad = left.isKnown() && left != required;
            boolean rightBad = right.isKnown() && right != required;
            if (left.isKnown() && right.isKnown() && (leftBad || rightBad)) {
                report(binary.span(), required, leftBad ? left : right,
                        "Operator '" + symbol + "' requires " + required + " operands but got " + left + " and " + right);
            } else if (leftBad) {
                report(binary.left().span(), required, left,
                        "Operator '" + symbol + "' requires " + required + " operands but got " + left);
            } else if (rightBad) {
                report(binary.right().span(), required, right,
                        "Operator '" + symbol + "' requires " + required + " operands but got " + right);
            }
            return required;
        }

        private boolean requireSameType(BinaryOp binary, FormulaType left, FormulaType right) {
            if (left.isKnown() && right.isKnown() && left != right) {
                report(binary.span(), left, right,
                        "Cannot compare " + left + " and " + right + " with '" + binary.operator().symbol() + "'");
                return false;
            }
            return true;
        }

        private FormulaType commonType(SourceSpan span, String what, List<FormulaType> candidates) {
            FormulaType common = FormulaType.UNKNOWN;
            for (FormulaType candidate : candidates) {
                if (!candidate.isKnown()) {
                    continue;
                }
                if (!common.isKnown()) {
                    common = candidate;
                } else if (candidate != common) {
                    report(span, common, candidate,
                            "Type mismatch in " + what + ": " + common + " and " + candidate);
                    return common;
                }
            }
            return common;
        }

        private void report(SourceSpan span, FormulaType expected, FormulaType actual, String message) {
            errors.add(new TypeDiagnostic(span, expected, actual, message));
        }
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.ast.BinaryOp;
import com.quill.formula.api.ast.BinaryOperator;
import com.quill.formula.api.ast.Call;
import com.quill.formula.api.ast.Conditional;
import com.quill.formula.api.ast.FieldReference;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.ast.FormulaNodeVisitor;
import com.quill.formula.api.ast.Literal;
import com.quill.formula.api.ast.UnaryOp;
import com.quill.formula.api.exceptions.FormulaEvaluationException;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.FailureReason;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.FormulaValue.BooleanValue;
import com.quill.formula.api.model.FormulaValue.DateValue;
import com.quill.formula.api.model.FormulaValue.NumberValue;
import com.quill.formula.api.model.FormulaValue.TextValue;

import java.math.BigDecimal;

/**
 * One walk of one AST against one context. Not reusable and not shared.
 *
 * <p>Failures unwind as {@link FormulaEvaluationException}; the caller turns
 * them into result values. No value is coerced: an operand of the wrong type
 * is a {@link FailureReason#TYPE_MISMATCH}.
 */
final class TreeEvaluator implements FormulaNodeVisitor<FormulaValue> {

    private final EvaluationContext context;
    private final EvaluationBudget budget;

    TreeEvaluator(EvaluationContext context, EvaluationBudget budget) {
        this.context = context;
        this.budget = budget;
    }

    FormulaValue evaluate(FormulaNode node) {
        budget.check();
        return node.accept(this);
    }

    @Override
    public FormulaValue visitLiteral(Literal literal) {
        return literal.value();
    }

    @Override
    public FormulaValue visitFieldReference(FieldReference reference) {
        String fieldId = reference.fieldId();
        if (!context.hasValue(fieldId)) {
            throw new FormulaEvaluationException(FailureReason.UNRESOLVED_REFERENCE,
                    "Field '" + fieldId + "' has no value in entity '" + context.entityId() + "'");
        }
        try {
            return context.valueOf(fieldId);
        } catch (IllegalArgumentException e) {
            throw new FormulaEvaluationException(FailureReason.TYPE_MISMATCH,
                    "Field '" + fieldId + "' holds a value of unsupported type", e);
        }
    }

    @Override
    public FormulaValue visitUnary(UnaryOp unary) {
        FormulaValue operand = evaluate(unary.operand());
        return switch (unary.operator()) {
            case NOT -> FormulaValue.bool(!bool(operand, "not"));
            case NEGATE -> FormulaValue.number(number(operand, "-").negate());
            case PLUS -> FormulaValue.number(number(operand, "+"));
        };
    }

    @Override
    public FormulaValue visitBinary(BinaryOp binary) {
        BinaryOperator operator = binary.operator();
        if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
            boolean left = bool(evaluate(binary.left()), operator.symbol());
            if (operator == BinaryOperator.AND ? !left : left) {
                return FormulaValue.bool(left);
            }
            return FormulaValue.bool(bool(evaluate(binary.right()), operator.symbol()));
        }

        FormulaValue left = evaluate(binary.left());
        FormulaValue right = evaluate(binary.right());
        return switch (operator.category()) {
            case EQUALITY -> {
                boolean equal = areEqual(left, right, operator);
                yield FormulaValue.bool(operator == BinaryOperator.EQUAL ? equal : !equal);
            }
            case ORDERING -> FormulaValue.bool(order(operator, compare(left, right, operator)));
            case ARITHMETIC -> FormulaValue.number(arithmetic(operator,
                    number(left, operator.symbol()), number(right, operator.symbol())));
            case LOGICAL -> throw new IllegalStateException("Logical operators are handled above");
        };
    }

    @Override
    public FormulaValue visitCall(Call call) {
        return FunctionLibrary.apply(call, this::evaluate, context);
    }

    @Override
    public FormulaValue visitConditional(Conditional conditional) {
        boolean condition = bool(evaluate(conditional.condition()), "if_else");
        return evaluate(condition ? conditional.thenBranch() : conditional.elseBranch());
    }

    private static boolean areEqual(FormulaValue left, FormulaValue right, BinaryOperator operator) {
        if (left.isNull() || right.isNull()) {
            return left.isNull() && right.isNull();
        }
        requireSameType(left, right, operator);
        if (left instanceof NumberValue l && right instanceof NumberValue r) {
            return l.value().compareTo(r.value()) == 0;
        }
        return left.equals(right);
    }

    private static int compare(FormulaValue left, FormulaValue right, BinaryOperator operator) {
        if (left.isNull() || right.isNull()) {
            throw mismatch("Operator '" + operator.symbol() + "' cannot order null");
        }
        requireSameType(left, right, operator);
        if (left instanceof NumberValue l && right instanceof NumberValue r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof TextValue l && right instanceof TextValue r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof DateValue l && right instanceof DateValue r) {
            return l.value().compareTo(r.value());
        }
        throw mismatch("Operator '" + operator.symbol() + "' cannot order " + left.type() + " values");
    }

    private static boolean order(BinaryOperator operator, int comparison) {
        return switch (operator) {
            case LESS_THAN -> comparison < 0;
            case LESS_EQUAL -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_EQUAL -> comparison >= 0;
            default -> throw new IllegalStateException("Not an ordering operator: " + operator);
        };
    }

    private static BigDecimal arithmetic(BinaryOperator operator, BigDecimal left, BigDecimal right) {
        try {
            switch (operator) {
                case ADD:
                    return left.add(right);
                case SUBTRACT:
                    return left.subtract(right);
                case MULTIPLY:
                    return left.multiply(right);
                case DIVIDE:
                    requireNonZero(right, operator);
                    return left.divide(right, FunctionLibrary.MATH);
                case MODULO:
                    requireNonZero(right, operator);
                    return left.remainder(right);
                default:
                    throw new IllegalStateException("Not an arithmetic operator: " + operator);
            }
        } catch (ArithmeticException e) {
            throw new FormulaEvaluationException(FailureReason.DOMAIN_ERROR,
                    "Operator '" + operator.symbol() + "' result is out of range for "
                        + left.toString() + " and " + right.toString(), e);
        }
    }

    private static void requireNonZero(BigDecimal divisor, BinaryOperator operator) {
        if (divisor.signum() == 0) {
            throw new FormulaEvaluationException(FailureReason.DIVISION_BY_ZERO,
                    "Operator '" + operator.symbol() + "' with a zero divisor");
        }
    }

    private static void requireSameType(FormulaValue left, FormulaValue right, BinaryOperator operator) {
        if (left.type() != right.type()) {
            throw mismatch("Operator '" + operator.symbol() + "' cannot combine "
                    + left.type() + " and " + right.type());
        }
    }

    private static boolean bool(FormulaValue value, String operator) {
        if (value instanceof BooleanValue b) {
            return b.value();
        }
        throw mismatch("'" + operator + "' needs a BOOLEAN but got " + describe(value));
    }

    private static BigDecimal number(FormulaValue value, String operator) {
        if (value instanceof NumberValue n) {
            return n.value();
        }
        throw mismatch("Operator '" + operator + "' needs NUMBER operands but got " + describe(value));
    }

    private static String describe(FormulaValue value) {
        return value.isNull() ? "null" : value.type() + " " + value;
    }

    private static FormulaEvaluationException mismatch(String message) {
        return new FormulaEvaluationException(FailureReason.TYPE_MISMATCH, message);
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.ast.Call;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.exceptions.FormulaEvaluationException;
import com.quill.formula.api.function.FormulaFunction;
import com.quill.formula.api.model.EvaluationContext;
import com.quill.formula.api.model.FailureReason;
import com.quill.formula.api.model.FormulaType;
import com.quill.formula.api.model.FormulaValue;
import com.quill.formula.api.model.FormulaValue.DateValue;
import com.quill.formula.api.model.FormulaValue.NumberValue;
import com.quill.formula.api.model.FormulaValue.TextValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Run-time behaviour of the whitelisted functions.
 *
 * <p>Single-argument functions return null for a null argument.
 * {@code min}, {@code max} and {@code sum} skip nulls; {@code concat} reads
 * null as the empty string; {@code coalesce} evaluates its arguments only
 * until one is non-null.
 */
final class FunctionLibrary {

    static final MathContext MATH = MathContext.DECIMAL64;
    static final int MAX_ROUND_DIGITS = 32;

    private FunctionLibrary() {
    }

    static FormulaValue apply(Call call, Function<FormulaNode, FormulaValue> evaluate, EvaluationContext context) {
        FormulaFunction function = call.function();
        if (function == FormulaFunction.COALESCE) {
            for (FormulaNode argument : call.arguments()) {
                FormulaValue value = evaluate.apply(argument);
                if (!value.isNull()) {
                    return value;
                }
            }
            return FormulaValue.NULL;
        }
        if (function == FormulaFunction.TODAY) {
            return FormulaValue.date(context.referenceDate().orElseThrow(() -> new FormulaEvaluationException(
                    FailureReason.UNRESOLVED_REFERENCE, "today() needs a reference date in the evaluation context")));
        }

        List<FormulaValue> args = new ArrayList<>(call.arguments().size());
        for (FormulaNode argument : call.arguments()) {
            args.add(evaluate.apply(argument));
        }
        String name = function.functionName();

        switch (function) {
            case MIN:
            case MAX:
            case SUM:
                return aggregate(function, args);
            case CONCAT: {
                StringBuilder sb = new StringBuilder();
                for (FormulaValue arg : args) {
                    if (!arg.isNull()) {
                        sb.append(text(name, arg));
                    }
                }
                return FormulaValue.text(sb.toString());
            }
            case IS_EMPTY: {
                FormulaValue arg = args.get(0);
                return FormulaValue.bool(arg.isNull() || (arg instanceof TextValue t && t.value().isBlank()));
            }
            default:
                break;
        }

        for (FormulaValue arg : args) {
            if (arg.isNull()) {
                return FormulaValue.NULL;
            }
        }

        switch (function) {
            case ABS:
                return FormulaValue.number(number(name, args.get(0)).abs());
            case ROUND: {
                int digits = args.size() > 1 ? wholeNumber(name, args.get(1), -MAX_ROUND_DIGITS, MAX_ROUND_DIGITS) : 0;
                return FormulaValue.number(rescale(name, number(name, args.get(0)), digits, RoundingMode.HALF_UP));
            }
            case POW:
                return FormulaValue.number(pow(number(name, args.get(0)), number(name, args.get(1))));
            case SQRT: {
                BigDecimal x = number(name, args.get(0));
                if (x.signum() < 0) {
                    throw domainError("sqrt of a negative number: " + x.toPlainString());
                }
                return FormulaValue.number(x.sqrt(MATH));
            }
            case FLOOR:
                return FormulaValue.number(rescale(name, number(name, args.get(0)), 0, RoundingMode.FLOOR));
            case CEIL:
                return FormulaValue.number(rescale(name, number(name, args.get(0)), 0, RoundingMode.CEILING));
            case UPPER:
                return FormulaValue.text(text(name, args.get(0)).toUpperCase(Locale.ROOT));
            case LOWER:
                return FormulaValue.text(text(name, args.get(0)).toLowerCase(Locale.ROOT));
            case TRIM:
                return FormulaValue.text(text(name, args.get(0)).trim());
            case LENGTH:
                return FormulaValue.number(text(name, args.get(0)).length());
            case LEFT: {
                String s = text(name, args.get(0));
                int count = wholeNumber(name, args.get(1), 0, Integer.MAX_VALUE);
                return FormulaValue.text(s.substring(0, Math.min(count, s.length())));
            }
            case RIGHT: {
                String s = text(name, args.get(0));
                int count = wholeNumber(name, args.get(1), 0, Integer.MAX_VALUE);
                return FormulaValue.text(s.substring(s.length() - Math.min(count, s.length())));
            }
            case MID: {
                String s = text(name, args.get(0));
                int start = wholeNumber(name, args.get(1), 1, Integer.MAX_VALUE);
                int count = wholeNumber(name, args.get(2), 0, Integer.MAX_VALUE);
                int from = Math.min(start - 1, s.length());
                return FormulaValue.text(s.substring(from, from + Math.min(count, s.length() - from)));
            }
            case YEAR:
                return FormulaValue.number(date(name, args.get(0)).value().getYear());
            case MONTH:
                return FormulaValue.number(date(name, args.get(0)).value().getMonthValue());
            case DAY:
                return FormulaValue.number(date(name, args.get(0)).value().getDayOfMonth());
            default:
                // IF_ELSE is parsed into a Conditional node and never reaches here
                throw new IllegalStateException("No run-time implementation for " + name);
        }
    }

    private static FormulaValue aggregate(FormulaFunction function, List<FormulaValue> args) {
        BigDecimal result = null;
        for (FormulaValue arg : args) {
            if (arg.isNull()) {
                continue;
            }
            BigDecimal x = number(function.functionName(), arg);
            if (result == null) {
                result = x;
            } else if (function == FormulaFunction.SUM) {
                result = result.add(x);
            } else if (function == FormulaFunction.MIN) {
                result = x.compareTo(result) < 0 ? x : result;
            } else {
                result = x.compareTo(result) > 0 ? x : result;
            }
        }
        if (result == null) {
            return function == FormulaFunction.SUM ? FormulaValue.number(BigDecimal.ZERO) : FormulaValue.NULL;
        }
        return FormulaValue.number(result);
    }

    private static BigDecimal pow(BigDecimal base, BigDecimal exponent) {
        try {
            if (isWhole(exponent)) {
                int n = exponent.intValueExact();
                if (base.signum() == 0 && n < 0) {
                    throw domainError("0 cannot be raised to a negative power");
                }
                return base.pow(n, MATH);
            }
            double result = Math.pow(base.doubleValue(), exponent.doubleValue());
            if (Double.isNaN(result) || Double.isInfinite(result)) {
                throw domainError("pow(" + base.toPlainString() + ", " + exponent.toPlainString() + ") is not a finite number");
            }
            return new BigDecimal(result, MATH);
        } catch (ArithmeticException e) {
            throw new FormulaEvaluationException(FailureReason.DOMAIN_ERROR,
                    "pow(" + base.toPlainString() + ", " + exponent.toPlainString() + ") is out of range", e);
        }
    }

    private static BigDecimal rescale(String function, BigDecimal value, int scale, RoundingMode mode) {
        try {
            return value.setScale(scale, mode);
        } catch (ArithmeticException e) {
            throw new FormulaEvaluationException(FailureReason.DOMAIN_ERROR,
                    function + "(" + value + ") is out of range", e);
        }
    }

    static boolean isWhole(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    private static int wholeNumber(String function, FormulaValue value, int min, int max) {
        if (value.isNull()) {
            throw domainError(function + " needs a whole number argument but got null");
        }
        BigDecimal x = number(function, value);
        if (!isWhole(x) || x.compareTo(BigDecimal.valueOf(min)) < 0 || x.compareTo(BigDecimal.valueOf(max)) > 0) {
            throw domainError(function + " needs a whole number between " + min + " and " + max
                    + " but got " + x.toPlainString());
        }
        return x.intValueExact();
    }

    private static BigDecimal number(String function, FormulaValue value) {
        if (value instanceof NumberValue n) {
            return n.value();
        }
        throw argumentMismatch(function, FormulaType.NUMBER, value);
    }

    private static String text(String function, FormulaValue value) {
        if (value instanceof TextValue t) {
            return t.value();
        }
        throw argumentMismatch(function, FormulaType.TEXT, value);
    }

    private static DateValue date(String function, FormulaValue value) {
        if (value instanceof DateValue d) {
            return d;
        }
        throw argumentMismatch(function, FormulaType.DATE, value);
    }

    private static FormulaEvaluationException argumentMismatch(String function, FormulaType expected, FormulaValue actual) {
        return new FormulaEvaluationException(FailureReason.TYPE_MISMATCH,
                function + " expects " + expected + " but got " + actual.type() + " " + actual);
    }

    private static FormulaEvaluationException domainError(String message) {
        return new FormulaEvaluationException(FailureReason.DOMAIN_ERROR, message);
    }
}

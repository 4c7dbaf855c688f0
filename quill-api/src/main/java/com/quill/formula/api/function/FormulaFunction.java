/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.function;

import com.quill.formula.api.model.FormulaType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.quill.formula.api.model.FormulaType.BOOLEAN;
import static com.quill.formula.api.model.FormulaType.DATE;
import static com.quill.formula.api.model.FormulaType.NUMBER;
import static com.quill.formula.api.model.FormulaType.TEXT;
import static com.quill.formula.api.model.FormulaType.UNKNOWN;

/**
 * The fixed whitelist of functions a formula may call.
 *
 * <p>The list is closed: there is no registration API, and nothing in it has
 * side effects or reads the environment. {@link #TODAY} reads the reference
 * date carried by the evaluation context, not the system clock.
 *
 * <p>Parameter types use {@link FormulaType#UNKNOWN} to mean "any type". When
 * a function is variadic, its last parameter type repeats.
 */
public enum FormulaFunction {

    ABS("abs", 1, 1, NUMBER, NUMBER),
    MIN("min", 1, Integer.MAX_VALUE, NUMBER, NUMBER),
    MAX("max", 1, Integer.MAX_VALUE, NUMBER, NUMBER),
    ROUND("round", 1, 2, NUMBER, NUMBER, NUMBER),
    SUM("sum", 1, Integer.MAX_VALUE, NUMBER, NUMBER),
    POW("pow", 2, 2, NUMBER, NUMBER, NUMBER),
    SQRT("sqrt", 1, 1, NUMBER, NUMBER),
    FLOOR("floor", 1, 1, NUMBER, NUMBER),
    CEIL("ceil", 1, 1, NUMBER, NUMBER),

    UPPER("upper", 1, 1, TEXT, TEXT),
    LOWER("lower", 1, 1, TEXT, TEXT),
    TRIM("trim", 1, 1, TEXT, TEXT),
    CONCAT("concat", 1, Integer.MAX_VALUE, TEXT, TEXT),
    LENGTH("length", 1, 1, NUMBER, TEXT),
    LEFT("left", 2, 2, TEXT, TEXT, NUMBER),
    RIGHT("right", 2, 2, TEXT, TEXT, NUMBER),
    MID("mid", 3, 3, TEXT, TEXT, NUMBER, NUMBER),

    /** Parsed into a {@code Conditional} node rather than a {@code Call}. */
    IF_ELSE("if_else", 3, 3, UNKNOWN, BOOLEAN, UNKNOWN, UNKNOWN),
    IS_EMPTY("is_empty", 1, 1, BOOLEAN, UNKNOWN),
    COALESCE("coalesce", 1, Integer.MAX_VALUE, UNKNOWN, UNKNOWN),

    TODAY("today", 0, 0, DATE),
    YEAR("year", 1, 1, NUMBER, DATE),
    MONTH("month", 1, 1, NUMBER, DATE),
    DAY("day", 1, 1, NUMBER, DATE);

    private static final Map<String, FormulaFunction> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(FormulaFunction::functionName, Function.identity())));

    private final String functionName;
    private final int minArity;
    private final int maxArity;
    private final FormulaType returnType;
    private final List<FormulaType> parameterTypes;

    FormulaFunction(String functionName, int minArity, int maxArity, FormulaType returnType,
                    FormulaType... parameterTypes) {
        this.functionName = functionName;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.returnType = returnType;
        this.parameterTypes = List.of(parameterTypes);
    }

    /**
     * Looks up a function by its exact (case-sensitive) name.
     */
    public static Optional<FormulaFunction> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(FormulaFunction::functionName).toList();
    }

    public String functionName() {
        return functionName;
    }

    public int minArity() {
        return minArity;
    }

    public int maxArity() {
        return maxArity;
    }

    public boolean isVariadic() {
        return maxArity == Integer.MAX_VALUE;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }

    /**
     * Declared result type; {@code UNKNOWN} when the result follows the
     * arguments ({@link #IF_ELSE}, {@link #COALESCE}).
     */
    public FormulaType returnType() {
        return returnType;
    }

    /**
     * Expected type of the argument at {@code index}; {@code UNKNOWN} accepts any type.
     */
    public FormulaType parameterType(int index) {
        if (parameterTypes.isEmpty()) {
            return UNKNOWN;
        }
        return parameterTypes.get(Math.min(index, parameterTypes.size() - 1));
    }

    /**
     * Human readable arity, e.g. {@code "1"}, {@code "1-2"} or {@code "at least 1"}.
     */
    public String describeArity() {
        if (isVariadic()) {
            return "at least " + minArity;
        }
        return minArity == maxArity ? Integer.toString(minArity) : minArity + "-" + maxArity;
    }
}

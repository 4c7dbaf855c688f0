/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed runtime value flowing through evaluation.
 *
 * <p>Numbers are {@link BigDecimal} so that {@code 0.1 + 0.2 == 0.3} holds and
 * document output never shows binary floating point artifacts. Equality of
 * numbers inside formulas uses {@link BigDecimal#compareTo}, not
 * {@link BigDecimal#equals}.
 */
public sealed interface FormulaValue extends Serializable {

    NullValue NULL = new NullValue();
    BooleanValue TRUE = new BooleanValue(true);
    BooleanValue FALSE = new BooleanValue(false);

    /**
     * Type of this value; {@code UNKNOWN} for {@link NullValue}.
     */
    FormulaType type();

    /**
     * Plain Java representation ({@code BigDecimal}, {@code String},
     * {@code Boolean}, {@code LocalDate} or {@code null}).
     */
    Object raw();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    static NumberValue number(BigDecimal value) {
        return new NumberValue(value);
    }

    static NumberValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static NumberValue number(String value) {
        return new NumberValue(new BigDecimal(value));
    }

    static TextValue text(String value) {
        return new TextValue(value);
    }

    static BooleanValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    static DateValue date(LocalDate value) {
        return new DateValue(value);
    }

    /**
     * Converts a snapshot value supplied by a caller.
     *
     * @throws IllegalArgumentException if the Java type has no formula equivalent
     */
    static FormulaValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof FormulaValue formulaValue) {
            return formulaValue;
        }
        if (value instanceof BigDecimal decimal) {
            return new NumberValue(decimal);
        }
        if (value instanceof BigInteger integer) {
            return new NumberValue(new BigDecimal(integer));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new NumberValue(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite number: " + d);
            }
            return new NumberValue(BigDecimal.valueOf(d));
        }
        if (value instanceof String s) {
            return new TextValue(s);
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof LocalDate date) {
            return new DateValue(date);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    record NumberValue(BigDecimal value) implements FormulaValue {
        public NumberValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public FormulaType type() {
            return FormulaType.NUMBER;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return value.stripTrailingZeros().toPlainString();
        }
    }

    record TextValue(String value) implements FormulaValue {
        public TextValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public FormulaType type() {
            return FormulaType.TEXT;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record BooleanValue(boolean value) implements FormulaValue {
        @Override
        public FormulaType type() {
            return FormulaType.BOOLEAN;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record DateValue(LocalDate value) implements FormulaValue {
        public DateValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public FormulaType type() {
            return FormulaType.DATE;
        }

        @Override
        public Object raw() {
            return value;
        }

        @JsonValue
        public String isoValue() {
            return value.toString();
        }

        @Override
        public String toString() {
            return "#" + value + "#";
        }
    }

    record NullValue() implements FormulaValue {
        @Override
        public FormulaType type() {
            return FormulaType.UNKNOWN;
        }

        @Override
        @JsonValue
        public Object raw() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}

/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.api.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Half-open character range {@code [start, end)} in the formula source.
 */
public record SourceSpan(
        @JsonProperty("start") int start,
        @JsonProperty("end") int end
) implements Serializable {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    /**
     * Smallest span covering both {@code this} and {@code other}.
     */
    public SourceSpan union(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns the slice of {@code source} covered by this span.
     */
    public String textOf(String source) {
        return source.substring(Math.min(start, source.length()), Math.min(end, source.length()));
    }
}

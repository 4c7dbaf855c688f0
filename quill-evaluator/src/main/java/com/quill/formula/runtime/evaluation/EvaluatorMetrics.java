/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.runtime.evaluation;

import com.quill.formula.api.model.FailureReason;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for formula and control-rule evaluation.
 *
 * <p>Lock-free ({@link LongAdder}), so one instance can be shared by
 * concurrent callers. Purely observational: nothing reads these values to
 * make decisions.
 */
public final class EvaluatorMetrics {

    private final LongAdder totalEvaluations = new LongAdder();
    private final LongAdder successfulEvaluations = new LongAdder();
    private final LongAdder totalEvaluationTimeNanos = new LongAdder();
    private final LongAdder controlFallbacks = new LongAdder();
    private final Map<FailureReason, LongAdder> failures = new EnumMap<>(FailureReason.class);

    private final BudgetHistogram latencies = new BudgetHistogram();

    public EvaluatorMetrics() {
        for (FailureReason reason : FailureReason.values()) {
            failures.put(reason, new LongAdder());
        }
    }

    /**
     * Record one evaluation.
     *
     * @param failureReason null when the evaluation succeeded
     */
    public void recordEvaluation(long evaluationTimeNanos, FailureReason failureReason) {
        totalEvaluations.increment();
        totalEvaluationTimeNanos.add(evaluationTimeNanos);
        latencies.record(evaluationTimeNanos);
        if (failureReason == null) {
            successfulEvaluations.increment();
        } else {
            failures.get(failureReason).increment();
        }
    }

    /**
     * Record a display rule that fell back to its default state.
     */
    public void recordControlFallback() {
        controlFallbacks.increment();
    }

    public long getTotalEvaluations() {
        return totalEvaluations.sum();
    }

    public long getFailureCount(FailureReason reason) {
        return failures.get(reason).sum();
    }

    public long getControlFallbacks() {
        return controlFallbacks.sum();
    }

    /**
     * Point-in-time copy of all counters; latency percentiles have
     * millisecond resolution.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long evals = totalEvaluations.sum();
        long totalTime = totalEvaluationTimeNanos.sum();

        snapshot.put("totalEvaluations", evals);
        snapshot.put("successfulEvaluations", successfulEvaluations.sum());
        snapshot.put("avgEvaluationTimeNanos", evals > 0 ? totalTime / evals : 0);
        snapshot.put("timeouts", failures.get(FailureReason.TIMEOUT).sum());
        snapshot.put("controlFallbacks", controlFallbacks.sum());

        Map<String, Long> byReason = new LinkedHashMap<>();
        failures.forEach((reason, count) -> byReason.put(reason.name(), count.sum()));
        snapshot.put("failuresByReason", byReason);

        snapshot.put("p50LatencyNanos", latencies.percentileNanos(0.50));
        snapshot.put("p99LatencyNanos", latencies.percentileNanos(0.99));
        return snapshot;
    }

    /**
     * One-millisecond buckets up to the output-mapping budget; anything
     * slower has already timed out and lands in the last bucket.
     */
    private static final class BudgetHistogram {
        private static final long BUCKET_NANOS = 1_000_000L;
        private static final int BUCKETS = 1000;

        private final LongAdder[] counts = new LongAdder[BUCKETS + 1];

        BudgetHistogram() {
            for (int i = 0; i < counts.length; i++) {
                counts[i] = new LongAdder();
            }
        }

        void record(long nanos) {
            int index = (int) Math.min(Math.max(nanos, 0) / BUCKET_NANOS, BUCKETS);
            counts[index].increment();
        }

        long percentileNanos(double quantile) {
            long[] snapshot = new long[counts.length];
            long recorded = 0;
            for (int i = 0; i < counts.length; i++) {
                snapshot[i] = counts[i].sum();
                recorded += snapshot[i];
            }
            if (recorded == 0) {
                return 0;
            }
            long rank = Math.max(1, (long) Math.ceil(recorded * quantile));
            long seen = 0;
            for (int i = 0; i < snapshot.length; i++) {
                seen += snapshot[i];
                if (seen >= rank) {
                    return (i + 1) * BUCKET_NANOS;
                }
            }
            return (BUCKETS + 1) * BUCKET_NANOS;
        }
    }
}

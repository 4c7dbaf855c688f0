/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Limits shared by the compiler, evaluator and control rule engine.
 *
 * <p>Values are resolved in this order, later wins: built-in defaults,
 * the classpath file {@code quill-formula.properties}, environment variables.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * FORMULA_CONTROL_RULE_TIMEOUT_MS=100
 * FORMULA_OUTPUT_MAPPING_TIMEOUT_MS=1000
 * FORMULA_CONTROL_CHAIN_MAX_DEPTH=10
 * FORMULA_PARSER_MAX_NESTING_DEPTH=64
 * FORMULA_MAX_LENGTH=10000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig strict = EngineConfig.builder()
 *     .controlRuleTimeout(Duration.ofMillis(50))
 *     .maxChainDepth(5)
 *     .build();
 *
 * IFormulaEvaluator evaluator = new FormulaEvaluator(config);
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_PROPERTIES = "quill-formula.properties";

    // ========================================================================
    // PROPERTY AND ENVIRONMENT KEYS
    // ========================================================================

    static final String PROP_CONTROL_RULE_TIMEOUT_MS = "formula.control-rule.timeout-ms";
    static final String PROP_OUTPUT_MAPPING_TIMEOUT_MS = "formula.output-mapping.timeout-ms";
    static final String PROP_MAX_CHAIN_DEPTH = "formula.control-chain.max-depth";
    static final String PROP_MAX_NESTING_DEPTH = "formula.parser.max-nesting-depth";
    static final String PROP_MAX_FORMULA_LENGTH = "formula.max-length";

    static final String ENV_CONTROL_RULE_TIMEOUT_MS = "FORMULA_CONTROL_RULE_TIMEOUT_MS";
    static final String ENV_OUTPUT_MAPPING_TIMEOUT_MS = "FORMULA_OUTPUT_MAPPING_TIMEOUT_MS";
    static final String ENV_MAX_CHAIN_DEPTH = "FORMULA_CONTROL_CHAIN_MAX_DEPTH";
    static final String ENV_MAX_NESTING_DEPTH = "FORMULA_PARSER_MAX_NESTING_DEPTH";
    static final String ENV_MAX_FORMULA_LENGTH = "FORMULA_MAX_LENGTH";

    private final Duration controlRuleTimeout;
    private final Duration outputMappingTimeout;
    private final int maxChainDepth;
    private final int maxNestingDepth;
    private final int maxFormulaLength;

    private EngineConfig(Builder builder) {
        this.controlRuleTimeout = builder.controlRuleTimeout;
        this.outputMappingTimeout = builder.outputMappingTimeout;
        this.maxChainDepth = builder.maxChainDepth;
        this.maxNestingDepth = builder.maxNestingDepth;
        this.maxFormulaLength = builder.maxFormulaLength;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, no file and no environment.
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by environment variables.
     */
    public static EngineConfig fromEnvironment() {
        return builder().applyEnvironment(System::getenv).build();
    }

    /**
     * Defaults, then {@value #DEFAULT_PROPERTIES} if on the classpath, then environment.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads a classpath properties file, then applies environment overrides.
     * A missing file leaves the defaults in place.
     */
    public static EngineConfig loadFromProperties(String resourcePath) {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} formula engine properties from classpath: {}", props.size(), resourcePath);
            } else {
                logger.debug("No {} on classpath, using defaults", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}. Using defaults.", resourcePath, e.getMessage());
        }
        return builder().applyProperties(props).applyEnvironment(System::getenv).build();
    }

    /**
     * Tighter budgets for interactive editors.
     */
    public static EngineConfig forInteractive() {
        return builder()
                .controlRuleTimeout(Duration.ofMillis(50))
                .outputMappingTimeout(Duration.ofMillis(500))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.controlRuleTimeout = this.controlRuleTimeout;
        builder.outputMappingTimeout = this.outputMappingTimeout;
        builder.maxChainDepth = this.maxChainDepth;
        builder.maxNestingDepth = this.maxNestingDepth;
        builder.maxFormulaLength = this.maxFormulaLength;
        return builder;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /** Budget for one control rule or calculated field. */
    public Duration controlRuleTimeout() {
        return controlRuleTimeout;
    }

    /** Budget for one output-mapping formula. */
    public Duration outputMappingTimeout() {
        return outputMappingTimeout;
    }

    /** Maximum number of control-chain hops resolved at run time. */
    public int maxChainDepth() {
        return maxChainDepth;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    public int maxFormulaLength() {
        return maxFormulaLength;
    }

    public static class Builder {

        private Duration controlRuleTimeout = Duration.ofMillis(100);
        private Duration outputMappingTimeout = Duration.ofMillis(1000);
        private int maxChainDepth = 10;
        private int maxNestingDepth = 64;
        private int maxFormulaLength = 10_000;

        private Builder() {
        }

        public Builder controlRuleTimeout(Duration timeout) {
            this.controlRuleTimeout = timeout;
            return this;
        }

        public Builder outputMappingTimeout(Duration timeout) {
            this.outputMappingTimeout = timeout;
            return this;
        }

        public Builder maxChainDepth(int depth) {
            this.maxChainDepth = depth;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder maxFormulaLength(int length) {
            this.maxFormulaLength = length;
            return this;
        }

        /**
         * Applies values from a properties file; unparsable entries are logged and skipped.
         */
        Builder applyProperties(Properties props) {
            return apply(props::getProperty, PROP_CONTROL_RULE_TIMEOUT_MS, PROP_OUTPUT_MAPPING_TIMEOUT_MS,
                    PROP_MAX_CHAIN_DEPTH, PROP_MAX_NESTING_DEPTH, PROP_MAX_FORMULA_LENGTH);
        }

        /**
         * Applies environment overrides read through {@code env}.
         */
        Builder applyEnvironment(Function<String, String> env) {
            return apply(env, ENV_CONTROL_RULE_TIMEOUT_MS, ENV_OUTPUT_MAPPING_TIMEOUT_MS,
                    ENV_MAX_CHAIN_DEPTH, ENV_MAX_NESTING_DEPTH, ENV_MAX_FORMULA_LENGTH);
        }

        private Builder apply(Function<String, String> source, String controlTimeoutKey, String outputTimeoutKey,
                              String chainDepthKey, String nestingDepthKey, String lengthKey) {
            readPositiveInt(source, controlTimeoutKey).ifPresent(ms -> controlRuleTimeout = Duration.ofMillis(ms));
            readPositiveInt(source, outputTimeoutKey).ifPresent(ms -> outputMappingTimeout = Duration.ofMillis(ms));
            readPositiveInt(source, chainDepthKey).ifPresent(v -> maxChainDepth = v);
            readPositiveInt(source, nestingDepthKey).ifPresent(v -> maxNestingDepth = v);
            readPositiveInt(source, lengthKey).ifPresent(v -> maxFormulaLength = v);
            return this;
        }

        private static Optional<Integer> readPositiveInt(Function<String, String> source, String key) {
            String raw = source.apply(key);
            if (raw == null || raw.trim().isEmpty()) {
                return Optional.empty();
            }
            try {
                int value = Integer.parseInt(raw.trim());
                if (value <= 0) {
                    logger.warn("Ignoring non-positive value for {}: {}", key, raw);
                    return Optional.empty();
                }
                logger.debug("Formula engine setting {}={}", key, value);
                return Optional.of(value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid int value for {}: {}", key, raw);
                return Optional.empty();
            }
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        requirePositive(controlRuleTimeout, "controlRuleTimeout");
        requirePositive(outputMappingTimeout, "outputMappingTimeout");
        if (maxChainDepth <= 0) {
            throw new IllegalArgumentException("maxChainDepth must be positive: " + maxChainDepth);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive: " + maxFormulaLength);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "controlRuleTimeout=" + controlRuleTimeout.toMillis() + "ms" +
                ", outputMappingTimeout=" + outputMappingTimeout.toMillis() + "ms" +
                ", maxChainDepth=" + maxChainDepth +
                ", maxNestingDepth=" + maxNestingDepth +
                ", maxFormulaLength=" + maxFormulaLength +
                '}';
    }
}

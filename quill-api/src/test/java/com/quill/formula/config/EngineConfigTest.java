/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    @DisplayName("Should expose the documented defaults")
    void shouldExposeDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.controlRuleTimeout()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.outputMappingTimeout()).isEqualTo(Duration.ofMillis(1000));
        assertThat(config.maxChainDepth()).isEqualTo(10);
        assertThat(config.maxNestingDepth()).isEqualTo(64);
        assertThat(config.maxFormulaLength()).isEqualTo(10_000);
        assertThat(config.toString()).startsWith("EngineConfig{controlRuleTimeout=100ms");
    }

    @Test
    @DisplayName("Should reject non-positive limits")
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> EngineConfig.builder().maxChainDepth(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxChainDepth");
        assertThatThrownBy(() -> EngineConfig.builder().controlRuleTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("controlRuleTimeout");
        assertThatThrownBy(() -> EngineConfig.builder().outputMappingTimeout(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should copy every setting through toBuilder")
    void shouldRoundTripThroughBuilder() {
        EngineConfig interactive = EngineConfig.forInteractive();
        EngineConfig copy = interactive.toBuilder().maxNestingDepth(8).build();

        assertThat(copy.controlRuleTimeout()).isEqualTo(Duration.ofMillis(50));
        assertThat(copy.outputMappingTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(copy.maxNestingDepth()).isEqualTo(8);
        assertThat(interactive.maxNestingDepth()).isEqualTo(64);
    }

    @Test
    @DisplayName("Should let environment values override properties")
    void shouldApplyEnvironmentAfterProperties() {
        Properties props = new Properties();
        props.setProperty(EngineConfig.PROP_CONTROL_RULE_TIMEOUT_MS, "200");
        props.setProperty(EngineConfig.PROP_MAX_NESTING_DEPTH, "32");
        Map<String, String> env = Map.of(
                EngineConfig.ENV_CONTROL_RULE_TIMEOUT_MS, "300",
                EngineConfig.ENV_MAX_FORMULA_LENGTH, "500");

        EngineConfig config = EngineConfig.builder()
                .applyProperties(props)
                .applyEnvironment(env::get)
                .build();

        assertThat(config.controlRuleTimeout()).isEqualTo(Duration.ofMillis(300));
        assertThat(config.maxNestingDepth()).isEqualTo(32);
        assertThat(config.maxFormulaLength()).isEqualTo(500);
        assertThat(config.outputMappingTimeout()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("Should ignore invalid and non-positive override values")
    void shouldIgnoreInvalidValues() {
        Map<String, String> env = Map.of(
                EngineConfig.ENV_MAX_CHAIN_DEPTH, "-3",
                EngineConfig.ENV_OUTPUT_MAPPING_TIMEOUT_MS, "fast",
                EngineConfig.ENV_MAX_NESTING_DEPTH, "  ");

        EngineConfig config = EngineConfig.builder().applyEnvironment(env::get).build();

        assertThat(config.maxChainDepth()).isEqualTo(10);
        assertThat(config.outputMappingTimeout()).isEqualTo(Duration.ofMillis(1000));
        assertThat(config.maxNestingDepth()).isEqualTo(64);
    }

    @Test
    @DisplayName("Should load a properties file from the classpath")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfig.loadFromProperties("quill-formula-test.properties");

        assertThat(config.controlRuleTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.maxChainDepth()).isEqualTo(4);
        assertThat(config.maxFormulaLength()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Should fall back to defaults when the file is missing")
    void shouldUseDefaultsForMissingFile() {
        EngineConfig config = EngineConfig.loadFromProperties("does-not-exist.properties");

        assertThat(config.maxNestingDepth()).isEqualTo(64);
        assertThat(config.maxChainDepth()).isEqualTo(10);
    }
}

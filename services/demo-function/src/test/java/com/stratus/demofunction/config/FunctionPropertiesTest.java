package com.stratus.demofunction.config;

import com.stratus.demofunction.domain.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FunctionProperties")
class FunctionPropertiesTest {

    @Test
    @DisplayName("should read all settings from the environment")
    void shouldReadEnvironment() {
        FunctionProperties properties = FunctionProperties.fromEnvironment(Map.of(
                FunctionProperties.ENV_REGION, "eu-west-1",
                FunctionProperties.ENV_SIMULATED_DELAY_MS, "5",
                FunctionProperties.ENV_FAIL_OPERATION, "S3"));

        assertThat(properties.region()).isEqualTo("eu-west-1");
        assertThat(properties.simulatedDelay()).isEqualTo(Duration.ofMillis(5));
        assertThat(properties.failOperation()).isEqualTo(Operation.S3);
    }

    @Test
    @DisplayName("should apply defaults for missing settings")
    void shouldApplyDefaults() {
        FunctionProperties properties = FunctionProperties.fromEnvironment(Map.of());

        assertThat(properties.region()).isEmpty();
        assertThat(properties.simulatedDelay()).isEqualTo(FunctionProperties.DEFAULT_SIMULATED_DELAY);
        assertThat(properties.failOperation()).isNull();
    }

    @Test
    @DisplayName("should fall back on malformed values")
    void shouldFallBackOnMalformedValues() {
        FunctionProperties properties = FunctionProperties.fromEnvironment(Map.of(
                FunctionProperties.ENV_SIMULATED_DELAY_MS, "fast",
                FunctionProperties.ENV_FAIL_OPERATION, "kinesis"));

        assertThat(properties.simulatedDelay()).isEqualTo(FunctionProperties.DEFAULT_SIMULATED_DELAY);
        assertThat(properties.failOperation()).isNull();
    }

    @Test
    @DisplayName("should disable delays for instant properties")
    void shouldDisableDelays() {
        assertThat(FunctionProperties.instant().simulatedDelay()).isZero();
    }
}

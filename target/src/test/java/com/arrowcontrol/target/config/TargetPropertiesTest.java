package com.arrowcontrol.target.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetPropertiesTest {

    private static TargetProperties with(int controllerPort, Duration base, Duration max, int attempts,
                                         TargetProperties.KeySimulator simulator) {
        return new TargetProperties(null, null, " ", controllerPort, true, false, Duration.ofSeconds(30), base, max,
                attempts, simulator, true, 8081, 3000, true, 65536);
    }

    @Test
    void defaultsMatchProtocolPorts() {
        TargetProperties defaults = TargetProperties.defaults();

        assertThat(defaults.controllerPort()).isEqualTo(8080);
        assertThat(defaults.discoveryPort()).isEqualTo(8081);
        assertThat(defaults.controllerDiscoveryPort()).isEqualTo(3000);
        assertThat(defaults.maxReconnectAttempts()).isEqualTo(10);
        assertThat(defaults.hasControllerHost()).isFalse();
    }

    @Test
    void blankHostAndMissingSimulatorFallBack() {
        TargetProperties properties = with(8080, Duration.ofSeconds(1), Duration.ofSeconds(30), 10, null);

        assertThat(properties.hasControllerHost()).isFalse();
        assertThat(properties.keySimulator()).isEqualTo(TargetProperties.KeySimulator.LOGGING);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> with(0, Duration.ofSeconds(1), Duration.ofSeconds(30), 10, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Controller port");
        assertThatThrownBy(() -> with(8080, Duration.ofSeconds(5), Duration.ofSeconds(1), 10, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("below the base delay");
        assertThatThrownBy(() -> with(8080, Duration.ZERO, Duration.ofSeconds(30), 10, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> with(8080, Duration.ofSeconds(1), Duration.ofSeconds(30), -1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

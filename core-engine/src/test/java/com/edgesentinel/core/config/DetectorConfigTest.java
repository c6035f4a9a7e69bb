package com.edgesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectorConfig}.
 */
class DetectorConfigTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        assertThatCode(() -> DetectorConfig.defaults().validate()).doesNotThrowAnyException();
        assertThat(DetectorConfig.defaults().confidence()).isCloseTo(0.99, within(1e-12));
    }

    @Test
    @DisplayName("Should collect every violation into one exception")
    void shouldCollectViolations() {
        DetectorConfig config = new DetectorConfig();
        config.setErrorRate(0);
        config.setTickSize(-1);
        config.setPrecision(-2);
        config.setShards(0);

        DetectorConfigurationException e =
                catchThrowableOfType(config::validate, DetectorConfigurationException.class);

        assertThat(e.getViolations()).hasSize(4);
        assertThat(e.getMessage()).contains("errorRate", "tickSize", "precision", "shards");
    }

    @Test
    @DisplayName("Should accept boundary decay values")
    void shouldAcceptDecayBounds() {
        DetectorConfig config = new DetectorConfig();
        config.setDecay(0);
        assertThatCode(config::validate).doesNotThrowAnyException();
        config.setDecay(1);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should copy into an equal, independent instance")
    void shouldCopy() {
        DetectorConfig config = new DetectorConfig();
        config.setMode("log");

        DetectorConfig copy = config.copy();
        copy.setMode("raw");

        assertThat(config.getMode()).isEqualTo("log");
        assertThat(config.copy()).isEqualTo(config);
    }

    @Test
    @DisplayName("Should bound precision to what a double can carry")
    void shouldBoundPrecision() {
        DetectorConfig config = new DetectorConfig();
        config.setPrecision(DetectorConfig.MAX_PRECISION);
        assertThatCode(config::validate).doesNotThrowAnyException();

        config.setPrecision(DetectorConfig.MAX_PRECISION + 1);
        DetectorConfigurationException e =
                catchThrowableOfType(config::validate, DetectorConfigurationException.class);

        assertThat(e.getViolations()).hasSize(1);
        assertThat(e.getViolations().get(0)).contains("precision", "[0, 17]");
    }
}

package com.netpulse.core.config;

import com.netpulse.core.model.DecompositionMode;
import com.netpulse.core.model.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyticsConfigLoader}.
 */
class AnalyticsConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        AnalyticsConfig config = AnalyticsConfigLoader.fromClasspath("test-analytics.yml");

        assertThat(config.getMinDataPoints()).isEqualTo(4);
        assertThat(config.getMaxDataPoints()).isEqualTo(50);
        assertThat(config.trackedMetricKinds())
                .containsExactly(MetricKind.LATENCY, MetricKind.JITTER, MetricKind.ERROR_RATE);
        assertThat(config.getTrend().getStableSlopeThreshold()).isEqualTo(0.5);
        assertThat(config.getAnomaly().getThreshold()).isEqualTo(0.9);
        assertThat(config.getAnomaly().getCriticalMultiplier()).isEqualTo(2.0);
        assertThat(config.getSeasonal().getPeriod()).isEqualTo(4);
        assertThat(config.getSeasonal().getMode()).isEqualTo(DecompositionMode.ADDITIVE);
        assertThat(config.getForecast().getSeasonalPeriod()).isEqualTo(4);
        assertThat(config.getForecast().getHorizon()).isEqualTo(3);
        assertThat(config.getForecast().getConfidenceLevel()).isEqualTo(0.90);
        assertThat(config.getForecast().getDefaultStepSeconds()).isEqualTo(60L);
    }

    @Test
    @DisplayName("Bundled configuration should match the built-in defaults")
    void bundledConfigurationShouldMatchDefaults() {
        AnalyticsConfig bundled = AnalyticsConfigLoader.fromClasspath(AnalyticsConfigLoader.DEFAULT_RESOURCE);
        AnalyticsConfig defaults = AnalyticsConfig.defaults();

        assertThat(bundled.getMinDataPoints()).isEqualTo(defaults.getMinDataPoints());
        assertThat(bundled.trackedMetricKinds()).isEqualTo(defaults.trackedMetricKinds());
        assertThat(bundled.getAnomaly().getThreshold()).isEqualTo(defaults.getAnomaly().getThreshold());
        assertThat(bundled.getForecast().getSeasonalPeriod())
                .isEqualTo(defaults.getForecast().getSeasonalPeriod());
        assertThat(bundled.getSeasonal().getMode()).isEqualTo(DecompositionMode.MULTIPLICATIVE);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromClasspath("invalid-analytics.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("minDataPoints must be >= 2")
                .hasMessageContaining("signalStrength")
                .hasMessageContaining("anomaly.threshold")
                .hasMessageContaining("forecast.alpha")
                .hasMessageContaining("forecast.confidenceLevel 0.42");
    }

    @Test
    @DisplayName("Empty document should yield the defaults")
    void shouldUseDefaultsForEmptyDocument() {
        AnalyticsConfig config = AnalyticsConfigLoader.fromClasspath("empty-analytics.yml");

        assertThat(config.getMinDataPoints()).isEqualTo(3);
        assertThat(config.getMaxDataPoints()).isZero();
        assertThat(config.trackedMetricKinds()).containsExactly(
                MetricKind.BANDWIDTH, MetricKind.LATENCY, MetricKind.PACKET_LOSS, MetricKind.JITTER);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load a configuration file from disk")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("analytics.yml");
        Files.writeString(file, "minDataPoints: 6\nanomaly:\n  threshold: 3.0\n");

        AnalyticsConfig config = AnalyticsConfigLoader.fromFile(file.toString());

        assertThat(config.getMinDataPoints()).isEqualTo(6);
        assertThat(config.getAnomaly().getThreshold()).isEqualTo(3.0);
        assertThat(config.getAnomaly().getCriticalMultiplier()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject unknown keys and duplicate keys as malformed")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path unknown = dir.resolve("unknown.yml");
        Files.writeString(unknown, "minDataPoints: 3\nwindowSize: 10\n");
        Path duplicate = dir.resolve("duplicate.yml");
        Files.writeString(duplicate, "minDataPoints: 3\nminDataPoints: 4\n");

        assertThatThrownBy(() -> AnalyticsConfigLoader.fromFile(unknown.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromFile(duplicate.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }
}

package com.netpulse.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfidenceLevels}.
 */
class ConfidenceLevelsTest {

    @Test
    @DisplayName("Should map every tabulated level to its two-sided z value")
    void shouldResolveTabulatedLevels() {
        assertThat(ConfidenceLevels.zScore(0.85)).isEqualTo(1.44);
        assertThat(ConfidenceLevels.zScore(0.90)).isEqualTo(1.645);
        assertThat(ConfidenceLevels.zScore(0.95)).isEqualTo(1.96);
        assertThat(ConfidenceLevels.zScore(0.99)).isEqualTo(2.576);
        assertThat(ConfidenceLevels.supportedLevels()).containsExactly(0.85, 0.90, 0.95, 0.99);
    }

    @Test
    @DisplayName("Forecast settings should validate the level against the same table")
    void shouldValidateSettingsAgainstTable() {
        ForecastSettings settings = new ForecastSettings();
        settings.setConfidenceLevel(0.95);
        List<String> errors = new ArrayList<>();
        settings.validate(errors);
        assertThat(errors).isEmpty();

        settings.setConfidenceLevel(0.42);
        settings.validate(errors);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).contains("forecast.confidenceLevel 0.42", "0.85, 0.9, 0.95, 0.99");
        assertThatThrownBy(() -> ConfidenceLevels.zScore(0.42))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported confidence level: 0.42");
    }
}

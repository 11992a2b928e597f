package com.netpulse.core.forecast;

import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.error.ErrorCode;
import com.netpulse.core.model.ForecastPoint;
import com.netpulse.core.model.SamplePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HoltWintersModel}.
 */
class HoltWintersModelTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);
    private static final double Z95 = 1.96;

    private static List<SamplePoint> history(Duration step, double... values) {
        List<SamplePoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(SamplePoint.of(T0.plus(step.multipliedBy(i)), values[i]));
        }
        return points;
    }

    private static HoltWintersModel model(int period) {
        return new HoltWintersModel(0.2, 0.1, 0.3, period, HOUR);
    }

    @Test
    @DisplayName("Should extrapolate a linear series with widening intervals")
    void shouldExtrapolateLinearSeries() {
        HoltWintersModel model = model(1);
        model.fit(history(HOUR, 100, 110, 120, 130, 140, 150));

        List<ForecastPoint> forecast = model.forecast(2, Z95);

        assertThat(forecast).hasSize(2);
        assertThat(forecast.get(0).getValue()).isCloseTo(158.782, within(1e-2));
        assertThat(forecast.get(1).getValue()).isCloseTo(168.098, within(1e-2));
        assertThat(forecast.get(0).getLower()).isCloseTo(148.798, within(1e-2));
        assertThat(forecast.get(1).getUpper()).isCloseTo(179.418, within(1e-2));
        for (ForecastPoint point : forecast) {
            assertThat(point.getLower()).isLessThan(point.getValue());
            assertThat(point.getUpper()).isGreaterThan(point.getValue());
        }
        double firstWidth = forecast.get(0).getUpper() - forecast.get(0).getLower();
        double secondWidth = forecast.get(1).getUpper() - forecast.get(1).getLower();
        assertThat(secondWidth).isGreaterThan(firstWidth);
    }

    @Test
    @DisplayName("Forecast timestamps should follow the history's sampling interval")
    void shouldStampForecastWithHistoryInterval() {
        Duration fiveMinutes = Duration.ofMinutes(5);
        HoltWintersModel model = model(1);
        model.fit(history(fiveMinutes, 1, 2, 3, 4));

        List<ForecastPoint> forecast = model.forecast(3, Z95);

        assertThat(model.getStep()).isEqualTo(fiveMinutes);
        assertThat(forecast).extracting(ForecastPoint::getTimestamp).containsExactly(
                T0.plus(Duration.ofMinutes(20)),
                T0.plus(Duration.ofMinutes(25)),
                T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("Should fall back to the default step when every sample shares a timestamp")
    void shouldUseDefaultStepWithoutInterval() {
        HoltWintersModel model = model(1);
        model.fit(history(Duration.ZERO, 5, 6, 7));

        assertThat(model.getStep()).isEqualTo(HOUR);
        assertThat(model.forecast(1, Z95).get(0).getTimestamp()).isEqualTo(T0.plus(HOUR));
    }

    @Test
    @DisplayName("Should reproduce a perfectly periodic square wave")
    void shouldReproduceSquareWave() {
        double[] wave = new double[32];
        for (int i = 0; i < wave.length; i++) {
            wave[i] = (i % 4) < 2 ? 10 : 1;
        }
        HoltWintersModel model = model(4);
        model.fit(history(HOUR, wave));

        List<ForecastPoint> forecast = model.forecast(8, Z95);

        double[] expected = {10, 10, 1, 1, 10, 10, 1, 1};
        for (int h = 0; h < expected.length; h++) {
            assertThat(forecast.get(h).getValue()).as("step %d", h + 1)
                    .isCloseTo(expected[h], within(1e-6));
            assertThat(forecast.get(h).getUpper() - forecast.get(h).getLower())
                    .isCloseTo(0.0, within(1e-6));
        }
        assertThat(model.confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(model.getRmse()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should refuse to fit on less than one full period")
    void shouldRejectShortHistory() {
        HoltWintersModel model = model(4);

        assertThatThrownBy(() -> model.fit(history(HOUR, 1, 2, 3)))
                .isInstanceOfSatisfying(AnalyticsException.class, e ->
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_TRAINING_DATA));
        assertThat(model.isTrained()).isFalse();
    }

    @Test
    @DisplayName("Incremental update should match a full fit when initialisation is unchanged")
    void incrementalUpdateShouldMatchRetrain() {
        List<SamplePoint> full = history(HOUR, 100, 110, 120, 130, 140, 150);

        HoltWintersModel incremental = model(1);
        incremental.fit(full.subList(0, 5));
        incremental.update(full.get(5));

        HoltWintersModel retrained = model(1);
        retrained.fit(full);

        assertThat(incremental.getLevel()).isCloseTo(retrained.getLevel(), within(1e-9));
        assertThat(incremental.getTrend()).isCloseTo(retrained.getTrend(), within(1e-9));
        assertThat(incremental.getResidualMse()).isCloseTo(retrained.getResidualMse(), within(1e-9));
        assertThat(incremental.getTrainedSampleCount()).isEqualTo(6);
        assertThat(incremental.getLastTimestamp()).isEqualTo(full.get(5).getTimestamp());
    }

    @Test
    @DisplayName("Update should require a fitted model and time-ordered samples")
    void updateShouldEnforcePreconditions() {
        HoltWintersModel model = model(1);
        assertThatThrownBy(() -> model.update(SamplePoint.of(T0, 1)))
                .isInstanceOf(IllegalStateException.class);

        model.fit(history(HOUR, 1, 2, 3));
        assertThatThrownBy(() -> model.update(SamplePoint.of(T0, 4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Out-of-order");
    }

    @Test
    @DisplayName("Copy should not share state with the original")
    void copyShouldBeIndependent() {
        HoltWintersModel model = model(2);
        model.fit(history(HOUR, 4, 8, 5, 9, 6, 10));
        HoltWintersModel copy = model.copy();

        model.update(SamplePoint.of(T0.plus(HOUR.multipliedBy(6)), 50));

        assertThat(copy.getTrainedSampleCount()).isEqualTo(6);
        assertThat(model.getTrainedSampleCount()).isEqualTo(7);
        assertThat(copy.getLevel()).isNotEqualTo(model.getLevel());
    }

    @Test
    @DisplayName("Confidence should stay within [0, 1] for an erratic series")
    void confidenceShouldBeBounded() {
        HoltWintersModel model = model(1);
        model.fit(history(HOUR, 1, 500, 2, 800, 3, 900));

        assertThat(model.confidence()).isBetween(0.0, 1.0);
        assertThat(model.getMape()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Should reject smoothing weights outside (0, 1)")
    void shouldRejectInvalidWeights() {
        assertThatThrownBy(() -> new HoltWintersModel(0, 0.1, 0.3, 1, HOUR))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HoltWintersModel(0.2, 1.0, 0.3, 1, HOUR))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HoltWintersModel(0.2, 0.1, 0.3, 0, HOUR))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

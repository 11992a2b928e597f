package com.netpulse.core.engine;

import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.detection.ZScoreAnomalyDetector;
import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.error.ErrorCode;
import com.netpulse.core.forecast.ForecastEngine;
import com.netpulse.core.forecast.TrainingMode;
import com.netpulse.core.model.AnalysisReport;
import com.netpulse.core.model.AnomalySeverity;
import com.netpulse.core.model.MetricForecast;
import com.netpulse.core.model.MetricKind;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.MetricsBatch;
import com.netpulse.core.model.SamplePoint;
import com.netpulse.core.model.SeasonalComponents;
import com.netpulse.core.model.TrendDirection;
import com.netpulse.core.seasonal.SeasonalDecomposer;
import com.netpulse.core.trend.TrendAnalyzer;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnalyticsOrchestrator}.
 */
class AnalyticsOrchestratorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-01-02T12:00:00Z");
    private static final Duration MINUTE = Duration.ofMinutes(1);

    private AnalyticsConfig config;

    @BeforeEach
    void setUp() {
        config = AnalyticsConfig.defaults();
        config.getForecast().setSeasonalPeriod(1);
        config.getForecast().setHorizon(2);
        config.getSeasonal().setPeriod(4);
    }

    private AnalyticsOrchestrator orchestrator() {
        config.validate();
        return new AnalyticsOrchestrator(config, TrendAnalyzer.fromConfig(config),
                ZScoreAnomalyDetector.fromConfig(config), SeasonalDecomposer.fromConfig(config),
                ForecastEngine.fromConfig(config), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<SamplePoint> points(double... values) {
        List<SamplePoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(SamplePoint.of(T0.plus(MINUTE.multipliedBy(i)), values[i]));
        }
        return points;
    }

    @Test
    @DisplayName("Should combine trends, statistics and forecasts of every tracked metric")
    void shouldProduceFullReport() {
        MetricsBatch batch = MetricsBatch.builder()
                .deviceId("edge-1")
                .metric(MetricKind.LATENCY, points(100, 120, 140))
                .metric(MetricKind.BANDWIDTH, points(100, 110, 120, 130, 140, 150))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getDeviceId()).isEqualTo("edge-1");
        assertThat(report.getTimestamp()).isEqualTo(NOW);
        assertThat(report.getTrends()).containsOnlyKeys(MetricKind.BANDWIDTH, MetricKind.LATENCY);
        assertThat(report.getTrends().get(MetricKind.LATENCY).getDirection())
                .isEqualTo(TrendDirection.INCREASING);
        assertThat(report.getStatistics().get(MetricKind.LATENCY).getMean()).isEqualTo(120.0);
        assertThat(report.getPredictions()).extracting(MetricForecast::getMetric)
                .containsExactly(MetricKind.BANDWIDTH, MetricKind.LATENCY);
        assertThat(report.getPredictions().get(0).getForecast().get(0).getValue()).isGreaterThan(150.0);
        assertThat(report.getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should flag a short latency burst with a lowered threshold")
    void shouldReportAnomalies() {
        config.getAnomaly().setThreshold(0.9);
        MetricsBatch batch = MetricsBatch.builder()
                .deviceId("edge-1")
                .metric(MetricKind.LATENCY, points(100, 500, 110))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getMetric()).isEqualTo(MetricKind.LATENCY);
            assertThat(anomaly.getIndex()).isEqualTo(1);
            assertThat(anomaly.getValue()).isEqualTo(500.0);
            assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        });
    }

    @Test
    @DisplayName("Too few samples should degrade each output instead of failing")
    void shouldDegradeOnShortSeries() {
        MetricsBatch batch = MetricsBatch.builder()
                .deviceId("edge-1")
                .metric(MetricKind.JITTER, points(5))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getTrends()).isEmpty();
        assertThat(report.getStatistics()).isEmpty();
        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getPredictions()).singleElement().satisfies(forecast -> {
            assertThat(forecast.getMetric()).isEqualTo(MetricKind.JITTER);
            assertThat(forecast.isEmpty()).isTrue();
            assertThat(forecast.getConfidence()).isZero();
        });
    }

    @Test
    @DisplayName("History shorter than one season should give an empty forecast but keep statistics")
    void shouldReturnEmptyForecastWithoutFullSeason() {
        config.getForecast().setSeasonalPeriod(24);
        MetricsBatch batch = MetricsBatch.builder()
                .deviceId("edge-1")
                .metric(MetricKind.PACKET_LOSS, points(0.1, 0.2, 0.4))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getPredictions()).singleElement()
                .satisfies(forecast -> assertThat(forecast.isEmpty()).isTrue());
        assertThat(report.getStatistics()).containsKey(MetricKind.PACKET_LOSS);
        assertThat(report.getTrends()).containsKey(MetricKind.PACKET_LOSS);
    }

    @Test
    @DisplayName("Untracked metrics should be ignored")
    void shouldIgnoreUntrackedMetrics() {
        MetricsBatch batch = MetricsBatch.builder()
                .deviceId("edge-1")
                .metric(MetricKind.ERROR_RATE, points(1, 2, 3, 4))
                .metric(MetricKind.LATENCY, points(10, 10, 10))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getTrends()).containsOnlyKeys(MetricKind.LATENCY);
        assertThat(report.getStatistics()).doesNotContainKey(MetricKind.ERROR_RATE);
        assertThat(report.getPredictions()).extracting(MetricForecast::getMetric)
                .containsExactly(MetricKind.LATENCY);
    }

    @Test
    @DisplayName("Samples should be ordered by timestamp before analysis")
    void shouldSortSamples() {
        List<SamplePoint> shuffled = List.of(
                SamplePoint.of(T0.plus(MINUTE.multipliedBy(2)), 140),
                SamplePoint.of(T0, 100),
                SamplePoint.of(T0.plus(MINUTE), 120));
        MetricsBatch batch = MetricsBatch.builder().deviceId("edge-1")
                .metric(MetricKind.LATENCY, shuffled).build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getTrends().get(MetricKind.LATENCY).getDirection())
                .isEqualTo(TrendDirection.INCREASING);
        assertThat(report.getPredictions().get(0).getForecast().get(0).getTimestamp())
                .isEqualTo(T0.plus(MINUTE.multipliedBy(3)));
    }

    @Test
    @DisplayName("Long histories should be downsampled for trend only, statistics keep every sample")
    void shouldDownsampleLongHistories() {
        config.setMaxDataPoints(5);
        MetricsBatch batch = MetricsBatch.builder().deviceId("edge-1")
                .metric(MetricKind.BANDWIDTH, points(1, 2, 3, 4, 5, 6, 7, 8, 9, 10))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getStatistics().get(MetricKind.BANDWIDTH).getCount()).isEqualTo(10);
        assertThat(report.getStatistics().get(MetricKind.BANDWIDTH).getMin()).isEqualTo(1.0);
        assertThat(report.getTrends().get(MetricKind.BANDWIDTH).getSampleCount()).isEqualTo(5);
        assertThat(report.getTrends().get(MetricKind.BANDWIDTH).getSlope()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("A spike in a downsampled history should keep its own index, timestamp and value")
    void shouldDetectAnomaliesOnEverySampleWhenDownsampling() {
        config.setMaxDataPoints(10);
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? 50 : 51;
        }
        values[37] = 500;
        MetricsBatch batch = MetricsBatch.builder().deviceId("edge-1")
                .metric(MetricKind.LATENCY, points(values))
                .build();

        AnalysisReport report = orchestrator().processMetrics(batch);

        assertThat(report.getAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getIndex()).isEqualTo(37);
            assertThat(anomaly.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:37:00Z"));
            assertThat(anomaly.getValue()).isEqualTo(500.0);
            assertThat(anomaly.getZScore()).isCloseTo(9.949, within(1e-3));
            assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        });
        assertThat(report.getStatistics().get(MetricKind.LATENCY).getCount()).isEqualTo(100);
        assertThat(report.getTrends().get(MetricKind.LATENCY).getSampleCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Incremental mode should reuse the device's models across batches")
    void shouldReuseModelsIncrementally() {
        AnalyticsOrchestrator orchestrator = orchestrator();
        orchestrator.processMetrics(MetricsBatch.builder().deviceId("edge-1")
                .metric(MetricKind.LATENCY, points(10, 11, 12, 13)).build());

        AnalysisReport next = orchestrator.processMetrics(MetricsBatch.builder().deviceId("edge-1")
                .sample(MetricKind.LATENCY, SamplePoint.of(T0.plus(MINUTE.multipliedBy(4)), 14))
                .build(), TrainingMode.INCREMENTAL);

        assertThat(next.getPredictions()).singleElement()
                .satisfies(forecast -> assertThat(forecast.isEmpty()).isFalse());
        assertThat(orchestrator.forgetDevice("edge-1")).isEqualTo(1);
        assertThat(orchestrator.getForecastEngine().activeModelCount()).isZero();
    }

    @Test
    @DisplayName("Should decompose a series with the configured seasonal settings")
    void shouldDecompose() {
        MetricSeries series = MetricSeries.ofValues("edge-1", MetricKind.BANDWIDTH, T0, MINUTE,
                120, 80, 110, 90, 120, 80, 110, 90);

        SeasonalComponents components = orchestrator().decompose(series);

        assertThat(components.getPeriod()).isEqualTo(4);
        assertThat(components.isLowConfidence()).isFalse();
    }

    @Test
    @DisplayName("Should reject a null batch, a blank device and an empty payload")
    void shouldRejectInvalidBatches() {
        AnalyticsOrchestrator orchestrator = orchestrator();

        assertInvalid(() -> orchestrator.processMetrics(null));
        assertInvalid(() -> orchestrator.processMetrics(MetricsBatch.builder().deviceId(" ")
                .metric(MetricKind.LATENCY, points(1, 2, 3)).build()));
        assertInvalid(() -> orchestrator.processMetrics(MetricsBatch.builder().deviceId("edge-1").build()));
        assertInvalid(() -> orchestrator.processMetrics(MetricsBatch.builder().deviceId("edge-1")
                .metric(MetricKind.LATENCY, List.of()).build()));
    }

    @Test
    @DisplayName("Should refuse an invalid configuration at construction")
    void shouldRejectInvalidConfig() {
        config.setMinDataPoints(0);

        assertThatThrownBy(() -> new AnalyticsOrchestrator(config))
                .isInstanceOf(IllegalStateException.class);
    }

    private static void assertInvalid(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(AnalyticsException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT);
                    assertThat(e.isRecoverable()).isFalse();
                });
    }
}

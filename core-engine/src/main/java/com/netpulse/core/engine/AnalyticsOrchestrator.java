package com.netpulse.core.engine;

import com.netpulse.core.aggregation.TimeSeriesDownsampler;
import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.detection.AnomalyDetector;
import com.netpulse.core.detection.ZScoreAnomalyDetector;
import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.forecast.ForecastEngine;
import com.netpulse.core.forecast.TrainingMode;
import com.netpulse.core.model.AnalysisReport;
import com.netpulse.core.model.MetricForecast;
import com.netpulse.core.model.MetricKind;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.MetricsBatch;
import com.netpulse.core.model.SamplePoint;
import com.netpulse.core.model.SeasonalComponents;
import com.netpulse.core.model.TrendResult;
import com.netpulse.core.seasonal.SeasonalDecomposer;
import com.netpulse.core.statistics.StatisticsEngine;
import com.netpulse.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every analysis over a device's metrics batch and assembles the
 * {@link AnalysisReport}.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   MetricsBatch
 *     → validate (INVALID_INPUT on null batch, blank device, empty payload)
 *     → per tracked metric, in enum order:
 *         sort by time
 *         → StatisticsEngine, AnomalyDetector           (every sample)
 *         → downsample (optional) → TrendAnalyzer, ForecastEngine
 *     → AnalysisReport
 * </pre>
 *
 * <p>
 * Anomalies always refer to the sample's own index, timestamp and value, so
 * downsampling never changes what is reported as anomalous.
 * </p>
 *
 * <h3>Degradation</h3>
 * <p>
 * Too few samples never fails the batch. An {@code UNKNOWN} trend is left out
 * of the trends map, a model that cannot be trained yields an empty forecast
 * with confidence 0, and statistics that cannot be computed are omitted.
 * Metrics the batch does not carry, or that are not tracked, are skipped.
 * </p>
 *
 * <p>
 * The orchestrator is thread-safe; its only mutable collaborator is the
 * {@link ForecastEngine}, which locks per device metric.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsOrchestrator.class);

    private final Set<MetricKind> trackedMetrics;
    private final int maxDataPoints;
    private final int horizon;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final SeasonalDecomposer seasonalDecomposer;
    private final ForecastEngine forecastEngine;
    private final Clock clock;

    /**
     * Build every component from a validated configuration.
     *
     * @throws IllegalStateException if {@code config} is invalid
     */
    public AnalyticsOrchestrator(AnalyticsConfig config) {
        this(validated(config), TrendAnalyzer.fromConfig(config),
                ZScoreAnomalyDetector.fromConfig(config),
                SeasonalDecomposer.fromConfig(config),
                ForecastEngine.fromConfig(config),
                Clock.systemUTC());
    }

    public AnalyticsOrchestrator(AnalyticsConfig config, TrendAnalyzer trendAnalyzer,
            AnomalyDetector anomalyDetector, SeasonalDecomposer seasonalDecomposer,
            ForecastEngine forecastEngine, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.trackedMetrics = config.trackedMetricKinds();
        this.maxDataPoints = config.getMaxDataPoints();
        this.horizon = config.getForecast().getHorizon();
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer must not be null");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "anomalyDetector must not be null");
        this.seasonalDecomposer = Objects.requireNonNull(seasonalDecomposer,
                "seasonalDecomposer must not be null");
        this.forecastEngine = Objects.requireNonNull(forecastEngine, "forecastEngine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        LOG.info("Analytics orchestrator tracking {}", trackedMetrics);
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Analyse a batch, retraining every forecast model from the supplied
     * history.
     *
     * @param batch the device's metric histories
     * @return the unified report
     * @throws AnalyticsException with {@code INVALID_INPUT} when the batch is
     *                            {@code null}, has no device id, carries no
     *                            metrics or carries an empty metric
     */
    public AnalysisReport processMetrics(MetricsBatch batch) {
        return processMetrics(batch, TrainingMode.RETRAIN);
    }

    /**
     * Analyse a batch with the given forecast training mode.
     *
     * @see #processMetrics(MetricsBatch)
     */
    public AnalysisReport processMetrics(MetricsBatch batch, TrainingMode mode) {
        validate(batch);
        Objects.requireNonNull(mode, "mode must not be null");

        AnalysisReport.Builder report = AnalysisReport.builder()
                .deviceId(batch.getDeviceId())
                .timestamp(clock.instant());

        for (MetricKind metric : trackedMetrics) {
            Optional<MetricSeries> series = batch.series(metric);
            if (series.isEmpty()) {
                continue;
            }
            analyzeMetric(sorted(series.get()), mode, report);
        }

        for (MetricKind metric : batch.getMetrics().keySet()) {
            if (!trackedMetrics.contains(metric)) {
                LOG.debug("Device {}: metric {} is not tracked, skipping", batch.getDeviceId(), metric);
            }
        }

        AnalysisReport result = report.build();
        LOG.debug("Device {}: {} trend(s), {} anomaly(ies), {} prediction(s)",
                result.getDeviceId(), result.getTrends().size(), result.getAnomalies().size(),
                result.getPredictions().size());
        return result;
    }

    /**
     * Decompose one series with the configured period and mode.
     */
    public SeasonalComponents decompose(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return seasonalDecomposer.decompose(sorted(series));
    }

    /**
     * Drop the forecast models of a device that is no longer monitored.
     *
     * @return number of models removed
     */
    public int forgetDevice(String deviceId) {
        return forecastEngine.discardDevice(deviceId);
    }

    public ForecastEngine getForecastEngine() {
        return forecastEngine;
    }

    public Set<MetricKind> getTrackedMetrics() {
        return trackedMetrics;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void analyzeMetric(MetricSeries series, TrainingMode mode, AnalysisReport.Builder report) {
        MetricKind metric = series.getMetric();

        try {
            report.statistics(metric, StatisticsEngine.summarize(series.values()));
        } catch (AnalyticsException e) {
            degradeOrRethrow(series, "statistics", e);
        }

        try {
            report.anomalies(anomalyDetector.detect(series));
        } catch (AnalyticsException e) {
            degradeOrRethrow(series, "anomalies", e);
        }

        MetricSeries reduced = downsampled(series);

        TrendResult trend = trendAnalyzer.analyze(reduced);
        if (trend.isKnown()) {
            report.trend(metric, trend);
        } else {
            LOG.debug("[{}:{}] trend unknown with {} sample(s)",
                    series.getDeviceId(), metric, reduced.size());
        }

        try {
            report.prediction(forecastEngine.forecast(reduced, horizon, mode));
        } catch (AnalyticsException e) {
            degradeOrRethrow(series, "forecast", e);
            report.prediction(MetricForecast.empty(metric));
        }
    }

    private static MetricSeries sorted(MetricSeries series) {
        MetricSeries ordered = series.sortedByTime();
        if (ordered != series) {
            LOG.debug("[{}:{}] samples were out of order, sorted by timestamp",
                    series.getDeviceId(), series.getMetric());
        }
        return ordered;
    }

    private MetricSeries downsampled(MetricSeries ordered) {
        if (maxDataPoints > 0 && ordered.size() > maxDataPoints) {
            LOG.debug("[{}:{}] downsampling {} sample(s) to at most {}",
                    ordered.getDeviceId(), ordered.getMetric(), ordered.size(), maxDataPoints);
            return TimeSeriesDownsampler.downsample(ordered, maxDataPoints);
        }
        return ordered;
    }

    private static void degradeOrRethrow(MetricSeries series, String output, AnalyticsException e) {
        if (!e.isRecoverable()) {
            throw e;
        }
        LOG.debug("[{}:{}] {} degraded: {} ({})", series.getDeviceId(), series.getMetric(),
                output, e.getMessage(), e.getErrorCode());
    }

    private static void validate(MetricsBatch batch) {
        if (batch == null) {
            throw AnalyticsException.invalidInput("Metrics batch must not be null");
        }
        if (batch.getDeviceId() == null || batch.getDeviceId().isBlank()) {
            throw AnalyticsException.invalidInput("Metrics batch has no device identifier");
        }
        if (batch.getMetrics().isEmpty()) {
            throw AnalyticsException.invalidInput(
                    "Metrics batch for device " + batch.getDeviceId() + " carries no metrics");
        }
        for (Map.Entry<MetricKind, List<SamplePoint>> entry : batch.getMetrics().entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw AnalyticsException.invalidInput("Metric " + entry.getKey()
                        + " of device " + batch.getDeviceId() + " has no samples");
            }
        }
    }

    private static AnalyticsConfig validated(AnalyticsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        return config;
    }
}

package com.netpulse.core.detection;

import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.config.AnomalySettings;
import com.netpulse.core.model.Anomaly;
import com.netpulse.core.model.AnomalySeverity;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.SamplePoint;
import com.netpulse.core.statistics.StatisticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Z-score outlier detector.
 *
 * <p>
 * Computes the population mean and standard deviation of the whole series and
 * flags every sample whose {@code |value - mean| / stdDev} exceeds the
 * threshold. Samples beyond {@code threshold * criticalMultiplier} are
 * {@code CRITICAL}, the rest {@code WARNING}. Confidence grows linearly with
 * the z-score and saturates at twice the threshold.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * A constant series (standard deviation 0) or one with fewer than two samples
 * yields no anomalies, whatever the values.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    private final double threshold;
    private final double criticalMultiplier;

    /**
     * @param threshold          z-score above which a sample is anomalous
     * @param criticalMultiplier multiple of {@code threshold} for the critical
     *                           tier; must be at least 1
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public ZScoreAnomalyDetector(double threshold, double criticalMultiplier) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be finite and > 0, got: " + threshold);
        }
        if (!(criticalMultiplier >= 1) || Double.isInfinite(criticalMultiplier)) {
            throw new IllegalArgumentException(
                    "criticalMultiplier must be finite and >= 1, got: " + criticalMultiplier);
        }
        this.threshold = threshold;
        this.criticalMultiplier = criticalMultiplier;
    }

    public static ZScoreAnomalyDetector fromConfig(AnalyticsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        AnomalySettings settings = config.getAnomaly();
        return new ZScoreAnomalyDetector(settings.getThreshold(), settings.getCriticalMultiplier());
    }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");

        if (series.size() < StatisticsEngine.MIN_SAMPLE_SIZE) {
            LOG.trace("[{}:{}] {} sample(s), nothing to compare against",
                    series.getDeviceId(), series.getMetric(), series.size());
            return Collections.emptyList();
        }

        double[] values = series.values();
        double mean = StatisticsEngine.mean(values);
        double stdDev = StatisticsEngine.stdDev(values);

        if (stdDev == 0) {
            return Collections.emptyList();
        }

        double criticalThreshold = threshold * criticalMultiplier;
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            // halved so extreme samples do not overflow the deviation
            double zScore = Math.abs(values[i] / 2 - mean / 2) / (stdDev / 2);
            if (zScore > threshold) {
                SamplePoint point = series.get(i);
                anomalies.add(Anomaly.builder()
                        .metric(series.getMetric())
                        .index(i)
                        .timestamp(point.getTimestamp())
                        .value(point.getValue())
                        .zScore(zScore)
                        .severity(zScore > criticalThreshold
                                ? AnomalySeverity.CRITICAL
                                : AnomalySeverity.WARNING)
                        .confidence(Math.min(zScore / (threshold * 2), 1))
                        .build());
            }
        }

        if (!anomalies.isEmpty()) {
            LOG.debug("[{}:{}] {} anomaly(ies) (mean={}, stdDev={}, threshold={})",
                    series.getDeviceId(), series.getMetric(), anomalies.size(), mean, stdDev, threshold);
        }
        return anomalies;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getCriticalMultiplier() {
        return criticalMultiplier;
    }
}

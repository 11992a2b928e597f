package com.netpulse.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unified output of one orchestrated analysis run.
 *
 * <p>
 * Downstream layers turn this into alert records, dashboard payloads or
 * stored analysis documents; the core never persists it.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code deviceId} and {@code timestamp} are
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final Instant timestamp;
    private final Map<MetricKind, TrendResult> trends;
    private final List<Anomaly> anomalies;
    private final List<MetricForecast> predictions;
    private final Map<MetricKind, SummaryStatistics> statistics;

    private AnalysisReport(Builder builder) {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.trends = Collections.unmodifiableMap(new EnumMap<>(builder.trends));
        this.anomalies = List.copyOf(builder.anomalies);
        this.predictions = List.copyOf(builder.predictions);
        this.statistics = Collections.unmodifiableMap(new EnumMap<>(builder.statistics));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnalysisReport}. Anomalies and predictions
     * keep insertion order.
     */
    public static class Builder {
        private String deviceId;
        private Instant timestamp;
        private final Map<MetricKind, TrendResult> trends = new EnumMap<>(MetricKind.class);
        private final List<Anomaly> anomalies = new ArrayList<>();
        private final List<MetricForecast> predictions = new ArrayList<>();
        private final Map<MetricKind, SummaryStatistics> statistics = new EnumMap<>(MetricKind.class);

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder trend(MetricKind metric, TrendResult trend) {
            trends.put(metric, trend);
            return this;
        }

        public Builder anomalies(List<Anomaly> metricAnomalies) {
            anomalies.addAll(metricAnomalies);
            return this;
        }

        public Builder prediction(MetricForecast prediction) {
            predictions.add(prediction);
            return this;
        }

        public Builder statistics(MetricKind metric, SummaryStatistics stats) {
            statistics.put(metric, stats);
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDeviceId() {
        return deviceId;
    }

    /** When the report was produced. */
    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<MetricKind, TrendResult> getTrends() {
        return trends;
    }

    /**
     * @return anomalies of all metrics, metric by metric, each in series order
     */
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public List<MetricForecast> getPredictions() {
        return predictions;
    }

    public Map<MetricKind, SummaryStatistics> getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "AnalysisReport{" +
                "deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", trends=" + trends +
                ", anomalies=" + anomalies.size() +
                ", predictions=" + predictions.size() +
                '}';
    }
}

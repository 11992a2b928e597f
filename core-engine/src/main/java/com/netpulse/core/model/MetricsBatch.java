package com.netpulse.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A device's metric histories handed to the orchestrator in one call.
 *
 * <p>
 * The batch is a plain carrier: it does not reject a missing device id or an
 * empty payload itself, that check belongs to
 * {@link com.netpulse.core.engine.AnalyticsOrchestrator#processMetrics(MetricsBatch)}
 * so that every entry point reports it the same way.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsBatch implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final Map<MetricKind, List<SamplePoint>> metrics;

    private MetricsBatch(Builder builder) {
        this.deviceId = builder.deviceId;
        EnumMap<MetricKind, List<SamplePoint>> copy = new EnumMap<>(MetricKind.class);
        builder.metrics.forEach((kind, points) -> copy.put(kind, List.copyOf(points)));
        this.metrics = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricsBatch}.
     */
    public static class Builder {
        private String deviceId;
        private final Map<MetricKind, List<SamplePoint>> metrics = new EnumMap<>(MetricKind.class);

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        /**
         * Set the samples of one metric, replacing any previous ones.
         */
        public Builder metric(MetricKind kind, List<SamplePoint> points) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(points, "points must not be null");
            metrics.put(kind, new ArrayList<>(points));
            return this;
        }

        /**
         * Append one sample to a metric.
         */
        public Builder sample(MetricKind kind, SamplePoint point) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(point, "point must not be null");
            metrics.computeIfAbsent(kind, k -> new ArrayList<>()).add(point);
            return this;
        }

        public MetricsBatch build() {
            return new MetricsBatch(this);
        }
    }

    public String getDeviceId() {
        return deviceId;
    }

    /**
     * @return unmodifiable map of metric kind to samples, in enum order
     */
    public Map<MetricKind, List<SamplePoint>> getMetrics() {
        return metrics;
    }

    public boolean hasMetric(MetricKind kind) {
        return metrics.containsKey(kind);
    }

    /**
     * @return the samples of {@code kind} wrapped as a series, or empty when
     *         the batch does not carry that metric
     */
    public Optional<MetricSeries> series(MetricKind kind) {
        List<SamplePoint> points = metrics.get(kind);
        return points == null
                ? Optional.empty()
                : Optional.of(new MetricSeries(deviceId, kind, points));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricsBatch that))
            return false;
        return Objects.equals(deviceId, that.deviceId) && metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, metrics);
    }

    @Override
    public String toString() {
        return "MetricsBatch{deviceId='" + deviceId + "', metrics=" + metrics.keySet() + '}';
    }
}

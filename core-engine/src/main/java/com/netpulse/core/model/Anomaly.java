package com.netpulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A sample whose z-score exceeded the configured threshold.
 *
 * <p>
 * The series index, the value and the source timestamp are all kept so
 * callers can correlate anomalies across metrics sampled at the same
 * instants.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metric}, {@code timestamp} and
 * {@code severity} are required; omitting one throws
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MetricKind metric;
    private final int index;
    private final Instant timestamp;
    private final double value;
    private final double zScore;
    private final AnomalySeverity severity;
    private final double confidence;

    private Anomaly(Builder builder) {
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.index = builder.index;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.value = builder.value;
        this.zScore = builder.zScore;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.confidence = builder.confidence;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private MetricKind metric;
        private int index;
        private Instant timestamp;
        private double value;
        private double zScore;
        private AnomalySeverity severity;
        private double confidence;

        public Builder metric(MetricKind metric) {
            this.metric = metric;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public MetricKind getMetric() {
        return metric;
    }

    /** Position of the sample in the analysed series. */
    public int getIndex() {
        return index;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    @JsonIgnore
    public boolean isCritical() {
        return severity == AnomalySeverity.CRITICAL;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return index == that.index
                && metric == that.metric
                && timestamp.equals(that.timestamp)
                && Double.compare(value, that.value) == 0
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, index, timestamp, value, severity);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "metric=" + metric +
                ", index=" + index +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", zScore=" + zScore +
                ", severity=" + severity +
                '}';
    }
}

package com.netpulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One time-stamped telemetry observation.
 *
 * <p>
 * Instances are immutable. The value must be finite; a missing quality
 * defaults to {@link SampleQuality#HIGH}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SamplePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;
    private final SampleQuality quality;

    /**
     * @param timestamp observation instant; must not be {@code null}
     * @param value     observed value; must be finite
     * @param quality   reported quality, {@code null} means {@code HIGH}
     * @throws NullPointerException     if {@code timestamp} is {@code null}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    @JsonCreator
    public SamplePoint(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") double value,
            @JsonProperty("quality") SampleQuality quality) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite, got: " + value);
        }
        this.value = value;
        this.quality = quality != null ? quality : SampleQuality.HIGH;
    }

    public static SamplePoint of(Instant timestamp, double value) {
        return new SamplePoint(timestamp, value, SampleQuality.HIGH);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public SampleQuality getQuality() {
        return quality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SamplePoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && quality == that.quality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, quality);
    }

    @Override
    public String toString() {
        return "SamplePoint{" + timestamp + ", " + value + ", " + quality + '}';
    }
}

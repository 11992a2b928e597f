package com.netpulse.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One forecast step with its confidence interval.
 *
 * @since 1.0.0
 */
public final class ForecastPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;
    private final double lower;
    private final double upper;

    public ForecastPoint(Instant timestamp, double value, double lower, double upper) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (lower > value || upper < value) {
            throw new IllegalArgumentException(
                    "Interval [" + lower + ", " + upper + "] does not contain " + value);
        }
        this.value = value;
        this.lower = lower;
        this.upper = upper;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return timestamp.equals(that.timestamp)
                && Double.compare(value, that.value) == 0
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, lower, upper);
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + timestamp + ", " + value + " [" + lower + ", " + upper + "]}";
    }
}

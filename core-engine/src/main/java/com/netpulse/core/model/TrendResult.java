package com.netpulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of a least-squares trend fit.
 *
 * <p>
 * {@code slope} and {@code intercept} are expressed per sample position, not
 * per unit of wall-clock time.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TrendDirection direction;
    private final double slope;
    private final double intercept;
    private final double confidence;
    private final int sampleCount;

    public TrendResult(TrendDirection direction, double slope, double intercept,
            double confidence, int sampleCount) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.slope = slope;
        this.intercept = intercept;
        this.confidence = confidence;
        this.sampleCount = sampleCount;
    }

    /**
     * @param sampleCount number of samples that were available
     * @return the terminal "not enough data" result
     */
    public static TrendResult unknown(int sampleCount) {
        return new TrendResult(TrendDirection.UNKNOWN, 0, 0, 0, sampleCount);
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @JsonIgnore
    public boolean isKnown() {
        return direction != TrendDirection.UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendResult that))
            return false;
        return direction == that.direction
                && Double.compare(slope, that.slope) == 0
                && Double.compare(intercept, that.intercept) == 0
                && Double.compare(confidence, that.confidence) == 0
                && sampleCount == that.sampleCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, slope, intercept, confidence, sampleCount);
    }

    @Override
    public String toString() {
        return "TrendResult{" +
                "direction=" + direction +
                ", slope=" + slope +
                ", confidence=" + confidence +
                ", sampleCount=" + sampleCount +
                '}';
    }
}

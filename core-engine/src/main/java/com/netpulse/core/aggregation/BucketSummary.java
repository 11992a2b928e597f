package com.netpulse.core.aggregation;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate of a run of consecutive samples.
 *
 * @since 1.0.0
 */
public final class BucketSummary {

    private final Instant start;
    private final int count;
    private final double mean;
    private final double min;
    private final double max;
    private final double stdDev;

    public BucketSummary(Instant start, int count, double mean, double min, double max, double stdDev) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.count = count;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.stdDev = stdDev;
    }

    /** Timestamp of the first sample in the bucket. */
    public Instant getStart() {
        return start;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /** Population standard deviation; 0 for a single-sample bucket. */
    public double getStdDev() {
        return stdDev;
    }

    @Override
    public String toString() {
        return "BucketSummary{start=" + start + ", count=" + count + ", mean=" + mean
                + ", min=" + min + ", max=" + max + ", stdDev=" + stdDev + '}';
    }
}

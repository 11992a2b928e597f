package com.netpulse.core.model;

import java.io.Serializable;

/**
 * Descriptive statistics of one numeric sample.
 *
 * <p>
 * Variance and standard deviation are population figures. Skewness carries
 * the small-sample bias correction; kurtosis is excess kurtosis.
 * </p>
 *
 * @since 1.0.0
 */
public final class SummaryStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int count;
    private final double mean;
    private final double variance;
    private final double stdDev;
    private final double median;
    private final double min;
    private final double max;
    private final double skewness;
    private final double kurtosis;

    public SummaryStatistics(int count, double mean, double variance, double median,
            double min, double max, double skewness, double kurtosis) {
        this.count = count;
        this.mean = mean;
        this.variance = variance;
        this.stdDev = Math.sqrt(variance);
        this.median = median;
        this.min = min;
        this.max = max;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMedian() {
        return median;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /** Spread between the largest and smallest value. */
    public double getRange() {
        return max - min;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    @Override
    public String toString() {
        return "SummaryStatistics{" +
                "count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", median=" + median +
                ", min=" + min +
                ", max=" + max +
                ", skewness=" + skewness +
                ", kurtosis=" + kurtosis +
                '}';
    }
}

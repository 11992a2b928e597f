package com.netpulse.core.statistics;

import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.model.SummaryStatistics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics over a numeric sample.
 *
 * <p>
 * All methods are pure functions of their input and safe to call from any
 * thread. Mean and variance use two passes over the data, which keeps the
 * variance accurate for long series with a large offset.
 * </p>
 *
 * <p>
 * Results are always finite for finite input. The mean and standard deviation
 * fall back to a rescaled computation when the plain sums overflow; a variance
 * that cannot be represented as a {@code double} raises {@code NUMERIC_OVERFLOW}.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <ul>
 * <li>Fewer than {@value #MIN_SAMPLE_SIZE} values: {@code INSUFFICIENT_DATA}.</li>
 * <li>Zero standard deviation: skewness and kurtosis are 0.</li>
 * <li>Skewness needs 3 values and kurtosis 4; below that they are 0.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class StatisticsEngine {

    /** Smallest sample for which the variance is defined. */
    public static final int MIN_SAMPLE_SIZE = 2;

    private StatisticsEngine() {
        // utility class
    }

    /**
     * Compute every summary statistic at once.
     *
     * @param values the sample; must not be {@code null}
     * @return the summary
     * @throws AnalyticsException with {@code INSUFFICIENT_DATA} when fewer than
     *                            two values are given, or {@code NUMERIC_OVERFLOW}
     *                            when the variance is not representable
     */
    public static SummaryStatistics summarize(double[] values) {
        requireSampleSize(values);
        double mean = mean(values);
        double variance = requireFiniteVariance(values, mean);
        double stdDev = Math.sqrt(variance);
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new SummaryStatistics(values.length, mean, variance, median(values), min, max,
                skewness(values, mean, stdDev), kurtosis(values, mean, stdDev));
    }

    /**
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute the mean of an empty sample");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / values.length;
        if (Double.isFinite(mean)) {
            return mean;
        }
        // sum overflowed, average the pre-divided values instead
        double scaled = 0;
        for (double v : values) {
            scaled += v / values.length;
        }
        return scaled;
    }

    /**
     * Population variance (divides by {@code n}).
     *
     * @throws AnalyticsException with {@code NUMERIC_OVERFLOW} when the
     *                            variance is not representable
     */
    public static double variance(double[] values) {
        requireSampleSize(values);
        return requireFiniteVariance(values, mean(values));
    }

    /**
     * Population standard deviation.
     *
     * <p>
     * Stays finite when the squared deviations overflow but the deviation
     * itself does not.
     * </p>
     */
    public static double stdDev(double[] values) {
        requireSampleSize(values);
        return stdDev(values, mean(values));
    }

    /**
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double median(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute the median of an empty sample");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[mid - 1] + sorted[mid]) / 2
                : sorted[mid];
    }

    /**
     * Bias-corrected sample skewness,
     * {@code n / ((n-1)(n-2)) * sum(((x - mean) / stdDev)^3)}.
     */
    public static double skewness(double[] values) {
        requireSampleSize(values);
        double mean = mean(values);
        return skewness(values, mean, stdDev(values, mean));
    }

    /**
     * Excess kurtosis,
     * {@code n(n+1) / ((n-1)(n-2)(n-3)) * sum(z^4) - 3(n-1)^2 / ((n-2)(n-3))}.
     */
    public static double kurtosis(double[] values) {
        requireSampleSize(values);
        double mean = mean(values);
        return kurtosis(values, mean, stdDev(values, mean));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireSampleSize(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < MIN_SAMPLE_SIZE) {
            throw AnalyticsException.insufficientData(MIN_SAMPLE_SIZE, values.length);
        }
    }

    private static double sumOfSquaredDeviations(double[] values, double mean) {
        double sum = 0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum;
    }

    private static double requireFiniteVariance(double[] values, double mean) {
        double variance = sumOfSquaredDeviations(values, mean) / values.length;
        if (!Double.isFinite(variance)) {
            throw AnalyticsException.numericOverflow("variance");
        }
        return variance;
    }

    private static double stdDev(double[] values, double mean) {
        double variance = sumOfSquaredDeviations(values, mean) / values.length;
        if (Double.isFinite(variance)) {
            return Math.sqrt(variance);
        }
        // squares overflowed: measure halved deviations against the largest one
        double scale = 0;
        for (double v : values) {
            scale = Math.max(scale, Math.abs(v / 2 - mean / 2));
        }
        double sum = 0;
        for (double v : values) {
            double d = (v / 2 - mean / 2) / scale;
            sum += d * d;
        }
        double stdDev = 2 * scale * Math.sqrt(sum / values.length);
        if (!Double.isFinite(stdDev)) {
            throw AnalyticsException.numericOverflow("standard deviation");
        }
        return stdDev;
    }

    private static double skewness(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (n < 3 || stdDev == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            double z = (v / 2 - mean / 2) / (stdDev / 2);
            sum += z * z * z;
        }
        return ((double) n / ((n - 1.0) * (n - 2.0))) * sum;
    }

    private static double kurtosis(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (n < 4 || stdDev == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            double z = (v / 2 - mean / 2) / (stdDev / 2);
            sum += z * z * z * z;
        }
        double scale = (n * (n + 1.0)) / ((n - 1.0) * (n - 2.0) * (n - 3.0));
        double correction = (3.0 * (n - 1.0) * (n - 1.0)) / ((n - 2.0) * (n - 3.0));
        return scale * sum - correction;
    }
}

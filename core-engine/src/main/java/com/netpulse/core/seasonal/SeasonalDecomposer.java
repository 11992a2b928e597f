package com.netpulse.core.seasonal;

import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.config.SeasonalSettings;
import com.netpulse.core.model.DecompositionMode;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.SeasonalComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Classical seasonal decomposition into trend, seasonal index and residual.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Trend: centered moving average spanning one period. For an even period
 * the two end samples get half weight (a 2&times;p average) so the window
 * stays centered. The first and last {@code period / 2} samples have no
 * trend value.</li>
 * <li>Detrend: {@code value / trend} (multiplicative) or
 * {@code value - trend} (additive) where the trend is defined.</li>
 * <li>Seasonal index: mean detrended value per position {@code i mod period},
 * normalized to mean 1 (multiplicative) or sum 0 (additive).</li>
 * <li>Residual: what is left after removing trend and seasonal index.</li>
 * </ol>
 *
 * <p>
 * With fewer than two full periods the index is neutral (no seasonal effect)
 * and the result is flagged {@link SeasonalComponents#isLowConfidence()}.
 * In multiplicative mode a zero trend or zero seasonal product is replaced by
 * the neutral ratio 1 instead of dividing by zero.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposer.class);

    /** Full periods needed before the seasonal index is estimated. */
    static final int MIN_FULL_PERIODS = 2;

    private final int period;
    private final DecompositionMode mode;

    /**
     * @param period samples per season; must be at least 1
     * @param mode   how the components combine; must not be {@code null}
     */
    public SeasonalDecomposer(int period, DecompositionMode mode) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1, got: " + period);
        }
        this.period = period;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public SeasonalDecomposer(int period) {
        this(period, DecompositionMode.MULTIPLICATIVE);
    }

    public static SeasonalDecomposer fromConfig(AnalyticsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        SeasonalSettings settings = config.getSeasonal();
        return new SeasonalDecomposer(settings.getPeriod(), settings.getMode());
    }

    /**
     * Decompose a series after ordering it by timestamp.
     */
    public SeasonalComponents decompose(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        SeasonalComponents components = decompose(series.sortedByTime().values());
        LOG.debug("Decomposed [{}:{}]: {}", series.getDeviceId(), series.getMetric(), components);
        return components;
    }

    /**
     * Decompose values already in time order.
     */
    public SeasonalComponents decompose(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        int half = period / 2;
        int definedLength = Math.max(0, n - 2 * half);

        double[] trend = movingAverage(values, half, definedLength);
        boolean lowConfidence = n / period < MIN_FULL_PERIODS || definedLength == 0;
        double[] index = lowConfidence
                ? neutralIndex()
                : seasonalIndex(values, trend, half);

        double[] residual = new double[definedLength];
        for (int j = 0; j < definedLength; j++) {
            int i = j + half;
            double seasonal = index[i % period];
            if (mode == DecompositionMode.MULTIPLICATIVE) {
                double denominator = trend[j] * seasonal;
                residual[j] = denominator == 0 ? 1.0 : values[i] / denominator;
            } else {
                residual[j] = values[i] - trend[j] - seasonal;
            }
        }

        if (lowConfidence) {
            LOG.trace("{} sample(s) cover fewer than {} periods of {}, seasonal index is neutral",
                    n, MIN_FULL_PERIODS, period);
        }
        return new SeasonalComponents(mode, n, definedLength == 0 ? 0 : half,
                trend, index, residual, lowConfidence);
    }

    public int getPeriod() {
        return period;
    }

    public DecompositionMode getMode() {
        return mode;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Centered moving average; {@code result[j]} belongs to series position
     * {@code j + half}.
     */
    private double[] movingAverage(double[] values, int half, int definedLength) {
        double[] trend = new double[definedLength];
        boolean even = period % 2 == 0;
        for (int j = 0; j < definedLength; j++) {
            int center = j + half;
            double sum = 0;
            if (even) {
                sum += 0.5 * values[center - half] + 0.5 * values[center + half];
                for (int k = center - half + 1; k < center + half; k++) {
                    sum += values[k];
                }
            } else {
                for (int k = center - half; k <= center + half; k++) {
                    sum += values[k];
                }
            }
            trend[j] = sum / period;
        }
        return trend;
    }

    private double[] seasonalIndex(double[] values, double[] trend, int half) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        int fullCycleEnd = (values.length / period) * period;

        for (int j = 0; j < trend.length; j++) {
            int i = j + half;
            if (i >= fullCycleEnd) {
                break;
            }
            double detrended;
            if (mode == DecompositionMode.MULTIPLICATIVE) {
                detrended = trend[j] == 0 ? 1.0 : values[i] / trend[j];
            } else {
                detrended = values[i] - trend[j];
            }
            sums[i % period] += detrended;
            counts[i % period]++;
        }

        double[] index = new double[period];
        for (int k = 0; k < period; k++) {
            index[k] = counts[k] == 0 ? mode.neutral() : sums[k] / counts[k];
        }
        return normalize(index);
    }

    private double[] normalize(double[] index) {
        double mean = Arrays.stream(index).average().orElse(mode.neutral());
        if (mode == DecompositionMode.MULTIPLICATIVE) {
            if (mean == 0 || !Double.isFinite(mean)) {
                return neutralIndex();
            }
            for (int k = 0; k < index.length; k++) {
                index[k] /= mean;
            }
        } else {
            for (int k = 0; k < index.length; k++) {
                index[k] -= mean;
            }
        }
        return index;
    }

    private double[] neutralIndex() {
        double[] index = new double[period];
        Arrays.fill(index, mode.neutral());
        return index;
    }
}

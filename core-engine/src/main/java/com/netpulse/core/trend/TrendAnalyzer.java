package com.netpulse.core.trend;

import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.TrendDirection;
import com.netpulse.core.model.TrendResult;
import com.netpulse.core.statistics.StatisticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Classifies the direction of a series with an ordinary least-squares line.
 *
 * <p>
 * The line is fitted against the sample position ({@code 0, 1, 2, ...}), not
 * against wall-clock time, so irregular sampling intervals do not bias the
 * slope. The slope is therefore "change per sample".
 * </p>
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>{@code UNKNOWN}, confidence 0, when fewer than {@code minDataPoints}
 * samples are available. This is a valid result, not an error.</li>
 * <li>{@code STABLE}, confidence 0, for a perfectly flat series, or when the
 * fitted line does not fit in a {@code double}.</li>
 * <li>{@code STABLE} when {@code |slope| < stableSlopeThreshold}.</li>
 * <li>Otherwise {@code INCREASING} or {@code DECREASING} by sign, with
 * confidence {@code min(|slope| / (max - min), 1)}.</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    private final int minDataPoints;
    private final double stableSlopeThreshold;

    /**
     * @param minDataPoints        fewest samples to fit; must be at least 2
     * @param stableSlopeThreshold slope magnitude below which the trend is
     *                             stable; must be finite and non-negative
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public TrendAnalyzer(int minDataPoints, double stableSlopeThreshold) {
        if (minDataPoints < 2) {
            throw new IllegalArgumentException("minDataPoints must be >= 2, got: " + minDataPoints);
        }
        if (!(stableSlopeThreshold >= 0) || Double.isInfinite(stableSlopeThreshold)) {
            throw new IllegalArgumentException(
                    "stableSlopeThreshold must be finite and >= 0, got: " + stableSlopeThreshold);
        }
        this.minDataPoints = minDataPoints;
        this.stableSlopeThreshold = stableSlopeThreshold;
    }

    public static TrendAnalyzer fromConfig(AnalyticsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new TrendAnalyzer(config.getMinDataPoints(),
                config.getTrend().getStableSlopeThreshold());
    }

    /**
     * Fit the series after ordering it by timestamp.
     *
     * @param series the samples; must not be {@code null}
     * @return the trend classification
     */
    public TrendResult analyze(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        TrendResult result = analyze(series.sortedByTime().values());
        LOG.debug("Trend [{}:{}]: {}", series.getDeviceId(), series.getMetric(), result);
        return result;
    }

    /**
     * Fit values already in time order.
     *
     * @param values the samples; must not be {@code null}
     * @return the trend classification
     */
    public TrendResult analyze(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < minDataPoints) {
            return TrendResult.unknown(n);
        }

        double min = values[0];
        double max = values[0];
        for (double y : values) {
            min = Math.min(min, y);
            max = Math.max(max, y);
        }
        if (max == min) {
            return new TrendResult(TrendDirection.STABLE, 0, values[0], 0, n);
        }

        // least squares on centred data so large offsets do not overflow the sums
        double xMean = (n - 1) / 2.0;
        double yMean = StatisticsEngine.mean(values);
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            sxx += dx * dx;
        }
        double slope = 0;
        for (int i = 0; i < n; i++) {
            slope += ((i - xMean) / sxx) * (values[i] - yMean);
        }
        double intercept = yMean - slope * xMean;
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            LOG.debug("Trend over {} samples is not representable, reporting STABLE", n);
            return new TrendResult(TrendDirection.STABLE, 0, yMean, 0, n);
        }

        // halved so the range of values near the double limits stays finite
        double confidence = Math.min((Math.abs(slope) / 2) / (max / 2 - min / 2), 1);

        TrendDirection direction;
        if (Math.abs(slope) < stableSlopeThreshold) {
            direction = TrendDirection.STABLE;
        } else {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        return new TrendResult(direction, slope, intercept, confidence, n);
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public double getStableSlopeThreshold() {
        return stableSlopeThreshold;
    }
}

package com.netpulse.core.forecast;

import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.model.ForecastPoint;
import com.netpulse.core.model.SamplePoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Triple exponential smoothing (Holt-Winters) with multiplicative
 * seasonality.
 *
 * <h3>State</h3>
 * <p>
 * Level {@code L}, trend {@code T} and one seasonal index per position in the
 * period. Every sample {@code y_t} first contributes its one-step-ahead error
 * {@code y_t - (L + T) * S[t mod p]} to the residual statistics, then updates
 * the state:
 * </p>
 *
 * <pre>
 * L' = alpha * (y / S[t mod p]) + (1 - alpha) * (L + T)
 * T' = beta * (L' - L) + (1 - beta) * T
 * S[t mod p] = gamma * (y / L') + (1 - gamma) * S[t mod p]
 * </pre>
 *
 * <h3>Initialisation</h3>
 * <ul>
 * <li>{@code L0}: mean of the first period.</li>
 * <li>{@code T0}: mean of {@code (y[p+k] - y[k]) / p} over the first period,
 * using the pairs the history contains (0 when there are none).</li>
 * <li>{@code S0[k]}: mean over full cycles of {@code y[i] / cycleMean},
 * normalized to mean 1.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. {@link ForecastEngine}
 * guards each instance with its own lock.
 * </p>
 *
 * @since 1.0.0
 */
public class HoltWintersModel {

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final int period;
    private final Duration defaultStep;

    private double level;
    private double trend;
    private double[] seasonals;

    /** Samples applied so far, which is also the next seasonal slot. */
    private int trainedSampleCount;
    private double sumSquaredError;
    private double sumAbsolutePercentError;
    private int percentErrorCount;

    private Instant lastTimestamp;
    private Duration step;

    /**
     * @param alpha       level smoothing weight in (0, 1)
     * @param beta        trend smoothing weight in (0, 1)
     * @param gamma       seasonal smoothing weight in (0, 1)
     * @param period      samples per season; at least 1
     * @param defaultStep forecast spacing used when the history cannot tell
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public HoltWintersModel(double alpha, double beta, double gamma, int period, Duration defaultStep) {
        requireOpenUnit("alpha", alpha);
        requireOpenUnit("beta", beta);
        requireOpenUnit("gamma", gamma);
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1, got: " + period);
        }
        Objects.requireNonNull(defaultStep, "defaultStep must not be null");
        if (defaultStep.isNegative() || defaultStep.isZero()) {
            throw new IllegalArgumentException("defaultStep must be positive, got: " + defaultStep);
        }
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.period = period;
        this.defaultStep = defaultStep;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Discard any previous state, initialise from {@code history} and replay
     * every sample.
     *
     * @param history samples in timestamp order
     * @throws AnalyticsException with {@code INSUFFICIENT_TRAINING_DATA} when
     *                            the history is shorter than one period or
     *                            than two samples
     */
    public void fit(List<SamplePoint> history) {
        Objects.requireNonNull(history, "history must not be null");
        int required = Math.max(period, 2);
        if (history.size() < required) {
            throw AnalyticsException.insufficientTrainingData(required, history.size());
        }

        double[] y = new double[history.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = history.get(i).getValue();
        }

        level = initialLevel(y);
        trend = initialTrend(y);
        seasonals = initialSeasonals(y);
        trainedSampleCount = 0;
        sumSquaredError = 0;
        sumAbsolutePercentError = 0;
        percentErrorCount = 0;
        lastTimestamp = null;
        step = medianStep(history);

        for (SamplePoint point : history) {
            apply(point);
        }
    }

    /**
     * Apply one more sample to a trained model.
     *
     * @param point a sample not older than the last one applied
     * @throws IllegalStateException    if the model has not been fitted
     * @throws IllegalArgumentException if {@code point} is older than the last
     *                                  applied sample
     */
    public void update(SamplePoint point) {
        Objects.requireNonNull(point, "point must not be null");
        if (!isTrained()) {
            throw new IllegalStateException("Model must be fitted before incremental updates");
        }
        if (point.getTimestamp().isBefore(lastTimestamp)) {
            throw new IllegalArgumentException("Out-of-order sample at " + point.getTimestamp()
                    + ", last applied sample is at " + lastTimestamp);
        }
        if (step == null && point.getTimestamp().isAfter(lastTimestamp)) {
            step = Duration.between(lastTimestamp, point.getTimestamp());
        }
        apply(point);
    }

    private void apply(SamplePoint point) {
        double y = point.getValue();
        int slot = trainedSampleCount % period;
        double seasonal = seasonals[slot];

        double predicted = (level + trend) * seasonal;
        double error = y - predicted;
        sumSquaredError += error * error;
        if (y != 0) {
            sumAbsolutePercentError += Math.abs(error / y);
            percentErrorCount++;
        }

        double previousLevel = level;
        double deseasonalized = seasonal == 0 ? y : y / seasonal;
        level = alpha * deseasonalized + (1 - alpha) * (previousLevel + trend);
        trend = beta * (level - previousLevel) + (1 - beta) * trend;
        if (level != 0) {
            seasonals[slot] = gamma * (y / level) + (1 - gamma) * seasonal;
        }

        trainedSampleCount++;
        lastTimestamp = point.getTimestamp();
    }

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    /**
     * Project the fitted state {@code horizon} steps ahead.
     *
     * <p>
     * Step {@code h} predicts {@code (L + h*T) * S[(n - 1 + h) mod p]} with the
     * interval half-width {@code z * sqrt(MSE * (1 + h(h+1) / 2n))}.
     * </p>
     *
     * @param horizon number of steps; at least 1
     * @param z       normal quantile of the interval, see {@link com.netpulse.core.config.ConfidenceLevels}
     * @return one point per step
     */
    public List<ForecastPoint> forecast(int horizon, double z) {
        if (!isTrained()) {
            throw new IllegalStateException("Model must be fitted before forecasting");
        }
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got: " + horizon);
        }
        if (!(z >= 0) || Double.isInfinite(z)) {
            throw new IllegalArgumentException("z must be finite and >= 0, got: " + z);
        }

        Duration spacing = step != null ? step : defaultStep;
        double mse = getResidualMse();
        int n = trainedSampleCount;
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            double value = (level + h * trend) * seasonals[(n - 1 + h) % period];
            double halfWidth = z * Math.sqrt(mse * (1 + h * (h + 1.0) / (2.0 * n)));
            points.add(new ForecastPoint(lastTimestamp.plus(spacing.multipliedBy(h)),
                    value, value - halfWidth, value + halfWidth));
        }
        return points;
    }

    /**
     * Confidence in the model's predictions, {@code 1 - MAPE / 100} clamped to
     * [0, 1]. A model that only ever saw zeros scores 1 when it reproduced them
     * and 0 otherwise.
     */
    public double confidence() {
        if (percentErrorCount == 0) {
            return sumSquaredError == 0 ? 1 : 0;
        }
        return Math.max(0, Math.min(1, 1 - getMape() / 100));
    }

    /**
     * @return an independent copy of this model's state
     */
    public HoltWintersModel copy() {
        HoltWintersModel copy = new HoltWintersModel(alpha, beta, gamma, period, defaultStep);
        copy.level = level;
        copy.trend = trend;
        copy.seasonals = seasonals != null ? seasonals.clone() : null;
        copy.trainedSampleCount = trainedSampleCount;
        copy.sumSquaredError = sumSquaredError;
        copy.sumAbsolutePercentError = sumAbsolutePercentError;
        copy.percentErrorCount = percentErrorCount;
        copy.lastTimestamp = lastTimestamp;
        copy.step = step;
        return copy;
    }

    // ---------------------------------------------------------------
    // Initialisation helpers
    // ---------------------------------------------------------------

    private double initialLevel(double[] y) {
        double sum = 0;
        for (int k = 0; k < period; k++) {
            sum += y[k];
        }
        return sum / period;
    }

    private double initialTrend(double[] y) {
        double sum = 0;
        int pairs = 0;
        for (int k = 0; k < period && period + k < y.length; k++) {
            sum += (y[period + k] - y[k]) / period;
            pairs++;
        }
        return pairs == 0 ? 0 : sum / pairs;
    }

    private double[] initialSeasonals(double[] y) {
        int cycles = y.length / period;
        double[] indices = new double[period];
        for (int c = 0; c < cycles; c++) {
            double cycleSum = 0;
            for (int k = 0; k < period; k++) {
                cycleSum += y[c * period + k];
            }
            double cycleMean = cycleSum / period;
            for (int k = 0; k < period; k++) {
                indices[k] += cycleMean == 0 ? 1.0 : y[c * period + k] / cycleMean;
            }
        }
        double total = 0;
        for (int k = 0; k < period; k++) {
            indices[k] /= cycles;
            total += indices[k];
        }
        double mean = total / period;
        if (mean == 0 || !Double.isFinite(mean)) {
            Arrays.fill(indices, 1.0);
            return indices;
        }
        for (int k = 0; k < period; k++) {
            indices[k] /= mean;
        }
        return indices;
    }

    /**
     * Median positive gap between consecutive samples, or {@code null} when
     * every sample shares one timestamp.
     */
    private static Duration medianStep(List<SamplePoint> history) {
        List<Duration> gaps = new ArrayList<>();
        for (int i = 1; i < history.size(); i++) {
            Duration gap = Duration.between(history.get(i - 1).getTimestamp(),
                    history.get(i).getTimestamp());
            if (!gap.isZero() && !gap.isNegative()) {
                gaps.add(gap);
            }
        }
        if (gaps.isEmpty()) {
            return null;
        }
        gaps.sort(null);
        return gaps.get(gaps.size() / 2);
    }

    private static void requireOpenUnit(String name, double value) {
        if (!(value > 0 && value < 1)) {
            throw new IllegalArgumentException(name + " must be in (0, 1), got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isTrained() {
        return seasonals != null && trainedSampleCount > 0;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public double getGamma() {
        return gamma;
    }

    public int getPeriod() {
        return period;
    }

    public double getLevel() {
        return level;
    }

    public double getTrend() {
        return trend;
    }

    /**
     * @return the seasonal indices (copy), or an empty array before fitting
     */
    public double[] getSeasonals() {
        return seasonals != null ? seasonals.clone() : new double[0];
    }

    public int getTrainedSampleCount() {
        return trainedSampleCount;
    }

    /** Mean squared one-step-ahead error over every applied sample. */
    public double getResidualMse() {
        return trainedSampleCount == 0 ? 0 : sumSquaredError / trainedSampleCount;
    }

    public double getRmse() {
        return Math.sqrt(getResidualMse());
    }

    /** Mean absolute percentage error over the non-zero samples, in percent. */
    public double getMape() {
        return percentErrorCount == 0 ? 0 : sumAbsolutePercentError / percentErrorCount * 100;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    /**
     * @return spacing of forecast timestamps
     */
    public Duration getStep() {
        return step != null ? step : defaultStep;
    }

    @Override
    public String toString() {
        return "HoltWintersModel{" +
                "level=" + level +
                ", trend=" + trend +
                ", period=" + period +
                ", trainedSampleCount=" + trainedSampleCount +
                ", rmse=" + getRmse() +
                '}';
    }
}

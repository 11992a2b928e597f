package com.netpulse.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Holt-Winters forecasting settings ({@code forecast:} section).
 *
 * @since 1.0.0
 */
public class ForecastSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int seasonalPeriod = 24;

    /** Level smoothing weight. */
    private double alpha = 0.2;

    /** Trend smoothing weight. */
    private double beta = 0.1;

    /** Seasonal smoothing weight. */
    private double gamma = 0.3;

    /** Number of future steps to predict. */
    private int horizon = 5;

    /** Coverage of the prediction interval; must be a tabulated level. */
    private double confidenceLevel = 0.95;

    /** Spacing of forecast timestamps when the history cannot tell. */
    private long defaultStepSeconds = 3_600;

    void validate(List<String> errors) {
        if (seasonalPeriod < 1) {
            errors.add("forecast.seasonalPeriod must be >= 1, got: " + seasonalPeriod);
        }
        requireOpenUnit("forecast.alpha", alpha, errors);
        requireOpenUnit("forecast.beta", beta, errors);
        requireOpenUnit("forecast.gamma", gamma, errors);
        if (horizon < 1) {
            errors.add("forecast.horizon must be >= 1, got: " + horizon);
        }
        if (!ConfidenceLevels.isSupported(confidenceLevel)) {
            errors.add("forecast.confidenceLevel " + confidenceLevel
                    + " is not supported. Supported: " + ConfidenceLevels.supportedLevels());
        }
        if (defaultStepSeconds < 1) {
            errors.add("forecast.defaultStepSeconds must be >= 1, got: " + defaultStepSeconds);
        }
    }

    private static void requireOpenUnit(String name, double value, List<String> errors) {
        if (!(value > 0 && value < 1)) {
            errors.add(name + " must be in (0, 1), got: " + value);
        }
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(int seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = beta;
    }

    public double getGamma() {
        return gamma;
    }

    public void setGamma(double gamma) {
        this.gamma = gamma;
    }

    public int getHorizon() {
        return horizon;
    }

    public void setHorizon(int horizon) {
        this.horizon = horizon;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public long getDefaultStepSeconds() {
        return defaultStepSeconds;
    }

    public void setDefaultStepSeconds(long defaultStepSeconds) {
        this.defaultStepSeconds = defaultStepSeconds;
    }

    @Override
    public String toString() {
        return "ForecastSettings{" +
                "seasonalPeriod=" + seasonalPeriod +
                ", alpha=" + alpha +
                ", beta=" + beta +
                ", gamma=" + gamma +
                ", horizon=" + horizon +
                ", confidenceLevel=" + confidenceLevel +
                ", defaultStepSeconds=" + defaultStepSeconds +
                '}';
    }
}

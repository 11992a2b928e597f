package com.netpulse.core.config;

import com.netpulse.core.model.MetricKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the analytics YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to the
 * default shown):
 * </p>
 *
 * <pre>
 * minDataPoints: 3
 * maxDataPoints: 0
 * trackedMetrics: [bandwidth, latency, packetLoss, jitter]
 * trend:
 *   stableSlopeThreshold: 0.1
 * anomaly:
 *   threshold: 2.5
 *   criticalMultiplier: 1.5
 * seasonal:
 *   period: 24
 *   mode: MULTIPLICATIVE
 * forecast:
 *   seasonalPeriod: 24
 *   alpha: 0.2
 *   beta: 0.1
 *   gamma: 0.3
 *   horizon: 5
 *   confidenceLevel: 0.95
 *   defaultStepSeconds: 3600
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading or after programmatic changes.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_TRACKED_METRICS =
            List.of("bandwidth", "latency", "packetLoss", "jitter");

    /** Fewest samples for which a trend or forecast is attempted. */
    private int minDataPoints = 3;

    /** Series longer than this are downsampled first; 0 disables. */
    private int maxDataPoints;

    private List<String> trackedMetrics = new ArrayList<>(DEFAULT_TRACKED_METRICS);

    private TrendSettings trend = new TrendSettings();
    private AnomalySettings anomaly = new AnomalySettings();
    private SeasonalSettings seasonal = new SeasonalSettings();
    private ForecastSettings forecast = new ForecastSettings();

    /**
     * @return a configuration holding every default value
     */
    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section and collect all problems into one exception.
     *
     * @throws IllegalStateException if any value is missing or out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minDataPoints < 2) {
            errors.add("minDataPoints must be >= 2, got: " + minDataPoints);
        }
        if (maxDataPoints < 0) {
            errors.add("maxDataPoints must be >= 0, got: " + maxDataPoints);
        } else if (maxDataPoints > 0 && maxDataPoints < minDataPoints) {
            errors.add("maxDataPoints must be 0 or >= minDataPoints, got: " + maxDataPoints);
        }
        if (trackedMetrics == null || trackedMetrics.isEmpty()) {
            errors.add("trackedMetrics must name at least one metric");
        } else {
            for (String key : trackedMetrics) {
                try {
                    MetricKind.fromKey(key);
                } catch (RuntimeException e) {
                    errors.add("trackedMetrics: " + e.getMessage());
                }
            }
        }

        if (trend == null) {
            errors.add("trend section must not be null");
        } else {
            trend.validate(errors);
        }
        if (anomaly == null) {
            errors.add("anomaly section must not be null");
        } else {
            anomaly.validate(errors);
        }
        if (seasonal == null) {
            errors.add("seasonal section must not be null");
        } else {
            seasonal.validate(errors);
        }
        if (forecast == null) {
            errors.add("forecast section must not be null");
        } else {
            forecast.validate(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analytics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Resolve {@link #getTrackedMetrics()} to metric kinds, in enum order.
     *
     * @return unmodifiable set of tracked kinds
     */
    public Set<MetricKind> trackedMetricKinds() {
        EnumSet<MetricKind> kinds = EnumSet.noneOf(MetricKind.class);
        for (String key : trackedMetrics) {
            kinds.add(MetricKind.fromKey(key));
        }
        return Collections.unmodifiableSet(kinds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public void setMinDataPoints(int minDataPoints) {
        this.minDataPoints = minDataPoints;
    }

    public int getMaxDataPoints() {
        return maxDataPoints;
    }

    public void setMaxDataPoints(int maxDataPoints) {
        this.maxDataPoints = maxDataPoints;
    }

    /**
     * @return unmodifiable list of tracked metric keys
     */
    public List<String> getTrackedMetrics() {
        return Collections.unmodifiableList(trackedMetrics);
    }

    public void setTrackedMetrics(List<String> trackedMetrics) {
        this.trackedMetrics = trackedMetrics != null ? new ArrayList<>(trackedMetrics) : null;
    }

    public TrendSettings getTrend() {
        return trend;
    }

    public void setTrend(TrendSettings trend) {
        this.trend = trend;
    }

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly;
    }

    public SeasonalSettings getSeasonal() {
        return seasonal;
    }

    public void setSeasonal(SeasonalSettings seasonal) {
        this.seasonal = seasonal;
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast;
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{" +
                "minDataPoints=" + minDataPoints +
                ", maxDataPoints=" + maxDataPoints +
                ", trackedMetrics=" + trackedMetrics +
                ", trend=" + trend +
                ", anomaly=" + anomaly +
                ", seasonal=" + seasonal +
                ", forecast=" + forecast +
                '}';
    }
}

package com.netpulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Forecast of one metric as it appears in an {@link AnalysisReport}.
 *
 * @since 1.0.0
 */
public final class MetricForecast implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MetricKind metric;
    private final List<ForecastPoint> forecast;
    private final double confidence;

    public MetricForecast(MetricKind metric, List<ForecastPoint> forecast, double confidence) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.forecast = List.copyOf(Objects.requireNonNull(forecast, "forecast must not be null"));
        this.confidence = confidence;
    }

    /**
     * @return the placeholder used when the model could not be trained
     */
    public static MetricForecast empty(MetricKind metric) {
        return new MetricForecast(metric, List.of(), 0);
    }

    public MetricKind getMetric() {
        return metric;
    }

    public List<ForecastPoint> getForecast() {
        return forecast;
    }

    public double getConfidence() {
        return confidence;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return forecast.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricForecast that))
            return false;
        return metric == that.metric
                && Double.compare(confidence, that.confidence) == 0
                && forecast.equals(that.forecast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, forecast, confidence);
    }

    @Override
    public String toString() {
        return "MetricForecast{metric=" + metric + ", steps=" + forecast.size()
                + ", confidence=" + confidence + '}';
    }
}

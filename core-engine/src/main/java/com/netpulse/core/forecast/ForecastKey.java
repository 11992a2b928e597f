package com.netpulse.core.forecast;

import com.netpulse.core.model.MetricKind;
import com.netpulse.core.model.MetricSeries;

import java.util.Objects;

/**
 * Identity of a forecast model: one per device and metric.
 *
 * @since 1.0.0
 */
public final class ForecastKey {

    private final String deviceId;
    private final MetricKind metric;

    public ForecastKey(String deviceId, MetricKind metric) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    public static ForecastKey of(MetricSeries series) {
        return new ForecastKey(series.getDeviceId(), series.getMetric());
    }

    public String getDeviceId() {
        return deviceId;
    }

    public MetricKind getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastKey that))
            return false;
        return deviceId.equals(that.deviceId) && metric == that.metric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, metric);
    }

    @Override
    public String toString() {
        return deviceId + ":" + metric;
    }
}

package com.netpulse.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered samples of one metric on one device.
 *
 * <p>
 * The series is immutable and only lives for the duration of a single
 * analysis call. Components that depend on ordering (trend, decomposition,
 * forecasting) call {@link #sortedByTime()} before reading it.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final MetricKind metric;
    private final List<SamplePoint> points;

    /**
     * @param deviceId owning device; must not be {@code null}
     * @param metric   metric kind; must not be {@code null}
     * @param points   samples; copied, elements must not be
     *                 {@code null}
     */
    public MetricSeries(String deviceId, MetricKind metric, List<SamplePoint> points) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(points, "points must not be null");
        this.points = List.copyOf(points);
    }

    /**
     * Build a series from raw values stamped at a fixed interval, mostly
     * useful for callers holding plain arrays.
     */
    public static MetricSeries ofValues(String deviceId, MetricKind metric, Instant start,
            Duration step, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(step, "step must not be null");
        List<SamplePoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(SamplePoint.of(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new MetricSeries(deviceId, metric, points);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public MetricKind getMetric() {
        return metric;
    }

    /**
     * @return unmodifiable list of samples in series order
     */
    public List<SamplePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SamplePoint get(int index) {
        return points.get(index);
    }

    /**
     * @return the sample values in series order (fresh array)
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * @return {@code true} if timestamps never decrease
     */
    public boolean isTimeOrdered() {
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).getTimestamp().isBefore(points.get(i - 1).getTimestamp())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return this series ordered by timestamp. The sort is stable, so samples
     * sharing a timestamp keep their relative order.
     *
     * @return {@code this} when already ordered, otherwise a sorted copy
     */
    public MetricSeries sortedByTime() {
        if (isTimeOrdered()) {
            return this;
        }
        List<SamplePoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(SamplePoint::getTimestamp));
        return new MetricSeries(deviceId, metric, sorted);
    }

    /**
     * @return a series with the same identity and the given samples
     */
    public MetricSeries withPoints(List<SamplePoint> newPoints) {
        return new MetricSeries(deviceId, metric, newPoints);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return deviceId.equals(that.deviceId) && metric == that.metric && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, metric, points);
    }

    @Override
    public String toString() {
        return "MetricSeries{deviceId='" + deviceId + "', metric=" + metric
                + ", size=" + points.size() + '}';
    }
}

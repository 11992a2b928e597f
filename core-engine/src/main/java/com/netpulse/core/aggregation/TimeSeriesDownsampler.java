package com.netpulse.core.aggregation;

import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.SamplePoint;
import com.netpulse.core.statistics.StatisticsEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reduces long series to a target number of points by averaging fixed-size
 * runs of consecutive samples.
 *
 * <p>
 * The bucket size is {@code ceil(n / targetPoints)}; the last bucket may be
 * smaller. Nothing is aggregated when the series already fits.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesDownsampler {

    private TimeSeriesDownsampler() {
        // utility class
    }

    /**
     * @param series       samples in time order
     * @param targetPoints upper bound on the number of buckets; at least 1
     * @return one summary per bucket, in series order
     */
    public static List<BucketSummary> aggregate(MetricSeries series, int targetPoints) {
        Objects.requireNonNull(series, "series must not be null");
        int factor = bucketSize(series.size(), targetPoints);
        double[] values = series.values();

        List<BucketSummary> buckets = new ArrayList<>();
        for (int from = 0; from < values.length; from += factor) {
            int to = Math.min(from + factor, values.length);
            double[] bucket = Arrays.copyOfRange(values, from, to);
            double min = bucket[0];
            double max = bucket[0];
            for (double v : bucket) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            double stdDev = bucket.length < StatisticsEngine.MIN_SAMPLE_SIZE
                    ? 0
                    : StatisticsEngine.stdDev(bucket);
            buckets.add(new BucketSummary(series.get(from).getTimestamp(), bucket.length,
                    StatisticsEngine.mean(bucket), min, max, stdDev));
        }
        return buckets;
    }

    /**
     * Replace each bucket by one sample holding its mean, stamped with the
     * bucket's first timestamp.
     *
     * @return {@code series} itself when no reduction is needed
     */
    public static MetricSeries downsample(MetricSeries series, int targetPoints) {
        Objects.requireNonNull(series, "series must not be null");
        if (bucketSize(series.size(), targetPoints) <= 1) {
            return series;
        }
        List<SamplePoint> points = new ArrayList<>();
        for (BucketSummary bucket : aggregate(series, targetPoints)) {
            points.add(SamplePoint.of(bucket.getStart(), bucket.getMean()));
        }
        return series.withPoints(points);
    }

    private static int bucketSize(int size, int targetPoints) {
        if (targetPoints < 1) {
            throw new IllegalArgumentException("targetPoints must be >= 1, got: " + targetPoints);
        }
        return Math.max(1, (size + targetPoints - 1) / targetPoints);
    }
}

package com.netpulse.core.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Result of a classical seasonal decomposition.
 *
 * <p>
 * The centered moving average is undefined near both ends of the series, so
 * trend and residual are stored only for the defined range
 * {@code [trendOffset, trendOffset + trendLength)}. {@link #trendAt(int)} and
 * {@link #residualAt(int)} take positions in the original series and return
 * an empty optional outside that range.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalComponents implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DecompositionMode mode;
    private final int seriesLength;
    private final int trendOffset;
    private final double[] trend;
    private final double[] seasonalIndex;
    private final double[] residual;
    private final boolean lowConfidence;

    /**
     * @param mode          combination mode
     * @param seriesLength  length of the decomposed series
     * @param trendOffset   series position of {@code trend[0]}
     * @param trend         trend values over the defined range
     * @param seasonalIndex one index per position in the period
     * @param residual      residual values, aligned with {@code trend}
     * @param lowConfidence {@code true} when fewer than two full periods were
     *                      available
     */
    public SeasonalComponents(DecompositionMode mode, int seriesLength, int trendOffset,
            double[] trend, double[] seasonalIndex, double[] residual, boolean lowConfidence) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(trend, "trend must not be null");
        Objects.requireNonNull(seasonalIndex, "seasonalIndex must not be null");
        Objects.requireNonNull(residual, "residual must not be null");
        if (trend.length != residual.length) {
            throw new IllegalArgumentException("trend and residual must have the same length");
        }
        if (seasonalIndex.length == 0) {
            throw new IllegalArgumentException("seasonalIndex must not be empty");
        }
        if (trendOffset < 0 || trendOffset + trend.length > seriesLength) {
            throw new IllegalArgumentException("trend range exceeds the series length");
        }
        this.seriesLength = seriesLength;
        this.trendOffset = trendOffset;
        this.trend = trend.clone();
        this.seasonalIndex = seasonalIndex.clone();
        this.residual = residual.clone();
        this.lowConfidence = lowConfidence;
    }

    public DecompositionMode getMode() {
        return mode;
    }

    public int getPeriod() {
        return seasonalIndex.length;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    /** Series position of the first defined trend value. */
    public int getTrendOffset() {
        return trendOffset;
    }

    /** Number of positions with a defined trend. */
    public int getTrendLength() {
        return trend.length;
    }

    /**
     * @return trend values over the defined range (copy)
     */
    public double[] getTrend() {
        return trend.clone();
    }

    /**
     * @return one seasonal index per period position (copy)
     */
    public double[] getSeasonalIndex() {
        return seasonalIndex.clone();
    }

    /**
     * @return residual values over the defined range (copy)
     */
    public double[] getResidual() {
        return residual.clone();
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public boolean isTrendDefined(int position) {
        return position >= trendOffset && position < trendOffset + trend.length;
    }

    public OptionalDouble trendAt(int position) {
        return isTrendDefined(position)
                ? OptionalDouble.of(trend[position - trendOffset])
                : OptionalDouble.empty();
    }

    public OptionalDouble residualAt(int position) {
        return isTrendDefined(position)
                ? OptionalDouble.of(residual[position - trendOffset])
                : OptionalDouble.empty();
    }

    /**
     * @param position series position, any non-negative value
     * @return the seasonal index tiled onto {@code position}
     */
    public double seasonalAt(int position) {
        return seasonalIndex[position % seasonalIndex.length];
    }

    /**
     * @return the seasonal index tiled across the whole series
     */
    public double[] tiledSeasonal() {
        double[] tiled = new double[seriesLength];
        for (int i = 0; i < seriesLength; i++) {
            tiled[i] = seasonalAt(i);
        }
        return tiled;
    }

    /**
     * Rebuild the original value at {@code position} from its components.
     *
     * <p>
     * In {@link DecompositionMode#MULTIPLICATIVE} mode a zero trend or seasonal
     * factor leaves the residual at the neutral 1, which carries no information
     * about the sample, so those positions are not recombinable.
     * </p>
     *
     * @return the recombined value, or empty where the trend is undefined or
     *         a multiplicative component is zero
     */
    public OptionalDouble recombine(int position) {
        if (!isTrendDefined(position)) {
            return OptionalDouble.empty();
        }
        int i = position - trendOffset;
        double seasonal = seasonalAt(position);
        if (mode == DecompositionMode.MULTIPLICATIVE && trend[i] * seasonal == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(mode.combine(trend[i], seasonal, residual[i]));
    }

    @Override
    public String toString() {
        return "SeasonalComponents{" +
                "mode=" + mode +
                ", period=" + seasonalIndex.length +
                ", seriesLength=" + seriesLength +
                ", trendRange=[" + trendOffset + ", " + (trendOffset + trend.length) + ")" +
                ", seasonalIndex=" + Arrays.toString(seasonalIndex) +
                ", lowConfidence=" + lowConfidence +
                '}';
    }
}

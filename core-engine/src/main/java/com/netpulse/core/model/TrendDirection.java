package com.netpulse.core.model;

/**
 * Direction of a fitted linear trend.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    /** Not enough samples to fit a line. */
    UNKNOWN
}

package com.netpulse.core.model;

/**
 * How trend, seasonal and residual components combine.
 *
 * @since 1.0.0
 */
public enum DecompositionMode {

    /** {@code value = trend * seasonal * residual}; index has mean 1. */
    MULTIPLICATIVE,

    /** {@code value = trend + seasonal + residual}; index sums to 0. */
    ADDITIVE;

    /**
     * @return the component value meaning "no effect" in this mode
     */
    public double neutral() {
        return this == MULTIPLICATIVE ? 1.0 : 0.0;
    }

    public double combine(double trend, double seasonal, double residual) {
        return this == MULTIPLICATIVE
                ? trend * seasonal * residual
                : trend + seasonal + residual;
    }
}

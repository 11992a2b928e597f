package com.netpulse.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Trend classification settings ({@code trend:} section).
 *
 * @since 1.0.0
 */
public class TrendSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Slopes with a smaller magnitude are classified as stable. */
    private double stableSlopeThreshold = 0.1;

    void validate(List<String> errors) {
        if (!(stableSlopeThreshold >= 0) || Double.isInfinite(stableSlopeThreshold)) {
            errors.add("trend.stableSlopeThreshold must be a finite value >= 0, got: "
                    + stableSlopeThreshold);
        }
    }

    public double getStableSlopeThreshold() {
        return stableSlopeThreshold;
    }

    public void setStableSlopeThreshold(double stableSlopeThreshold) {
        this.stableSlopeThreshold = stableSlopeThreshold;
    }

    @Override
    public String toString() {
        return "TrendSettings{stableSlopeThreshold=" + stableSlopeThreshold + '}';
    }
}

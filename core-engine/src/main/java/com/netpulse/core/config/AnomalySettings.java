package com.netpulse.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Z-score anomaly detection settings ({@code anomaly:} section).
 *
 * @since 1.0.0
 */
public class AnomalySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Number of standard deviations above which a sample is anomalous. */
    private double threshold = 2.5;

    /** Multiple of {@code threshold} above which an anomaly is critical. */
    private double criticalMultiplier = 1.5;

    void validate(List<String> errors) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            errors.add("anomaly.threshold must be a finite value > 0, got: " + threshold);
        }
        if (!(criticalMultiplier >= 1) || Double.isInfinite(criticalMultiplier)) {
            errors.add("anomaly.criticalMultiplier must be a finite value >= 1, got: "
                    + criticalMultiplier);
        }
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getCriticalMultiplier() {
        return criticalMultiplier;
    }

    public void setCriticalMultiplier(double criticalMultiplier) {
        this.criticalMultiplier = criticalMultiplier;
    }

    @Override
    public String toString() {
        return "AnomalySettings{threshold=" + threshold
                + ", criticalMultiplier=" + criticalMultiplier + '}';
    }
}

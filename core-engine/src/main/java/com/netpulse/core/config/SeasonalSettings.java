package com.netpulse.core.config;

import com.netpulse.core.model.DecompositionMode;

import java.io.Serializable;
import java.util.List;

/**
 * Seasonal decomposition settings ({@code seasonal:} section).
 *
 * @since 1.0.0
 */
public class SeasonalSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Samples per season, e.g. 24 for hourly samples with a daily cycle. */
    private int period = 24;

    private DecompositionMode mode = DecompositionMode.MULTIPLICATIVE;

    void validate(List<String> errors) {
        if (period < 1) {
            errors.add("seasonal.period must be >= 1, got: " + period);
        }
        if (mode == null) {
            errors.add("seasonal.mode is required");
        }
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public DecompositionMode getMode() {
        return mode;
    }

    public void setMode(DecompositionMode mode) {
        this.mode = mode;
    }

    @Override
    public String toString() {
        return "SeasonalSettings{period=" + period + ", mode=" + mode + '}';
    }
}

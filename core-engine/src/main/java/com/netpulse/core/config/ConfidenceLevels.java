package com.netpulse.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-sided normal quantiles for the supported prediction-interval levels.
 *
 * @since 1.0.0
 */
public final class ConfidenceLevels {

    private static final double[] LEVELS = {0.85, 0.90, 0.95, 0.99};
    private static final double[] Z_SCORES = {1.44, 1.645, 1.96, 2.576};
    private static final double TOLERANCE = 1e-9;

    private ConfidenceLevels() {
        // utility class
    }

    public static boolean isSupported(double level) {
        return indexOf(level) >= 0;
    }

    /**
     * @param level interval coverage, e.g. {@code 0.95}
     * @return the matching z value
     * @throws IllegalArgumentException if the level is not tabulated
     */
    public static double zScore(double level) {
        int i = indexOf(level);
        if (i < 0) {
            throw new IllegalArgumentException("Unsupported confidence level: " + level
                    + ". Supported: " + supportedLevels());
        }
        return Z_SCORES[i];
    }

    public static List<Double> supportedLevels() {
        List<Double> levels = new ArrayList<>(LEVELS.length);
        for (double level : LEVELS) {
            levels.add(level);
        }
        return levels;
    }

    private static int indexOf(double level) {
        for (int i = 0; i < LEVELS.length; i++) {
            if (Math.abs(LEVELS[i] - level) < TOLERANCE) {
                return i;
            }
        }
        return -1;
    }
}

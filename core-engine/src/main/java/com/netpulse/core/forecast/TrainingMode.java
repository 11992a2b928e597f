package com.netpulse.core.forecast;

/**
 * How a forecast request treats an existing model for the same key.
 *
 * @since 1.0.0
 */
public enum TrainingMode {

    /**
     * Re-estimate the initial state from the supplied history and replay every
     * sample. Deterministic: the same history always yields the same model.
     */
    RETRAIN,

    /**
     * Feed only the samples newer than the model's last one into the existing
     * state. Cheaper, but the state drifts from what a full retrain would
     * produce. Falls back to a full fit when no model exists yet.
     */
    INCREMENTAL
}

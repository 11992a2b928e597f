package com.netpulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Collector-reported quality of a single sample.
 *
 * @since 1.0.0
 */
public enum SampleQuality {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Case-insensitive lookup; collectors send {@code "high"}.
     *
     * @throws IllegalArgumentException for an unknown quality
     */
    @JsonCreator
    public static SampleQuality fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

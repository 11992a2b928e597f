package com.netpulse.core.model;

/**
 * Severity tier of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    WARNING,
    CRITICAL
}

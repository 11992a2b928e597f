/**
 * Anomaly detection.
 *
 * <p>
 * Detectors implement {@link com.netpulse.core.detection.AnomalyDetector}.
 * The built-in {@link com.netpulse.core.detection.ZScoreAnomalyDetector}
 * flags samples far from the series mean, in two severity tiers.
 * </p>
 *
 * @since 1.0.0
 */
package com.netpulse.core.detection;

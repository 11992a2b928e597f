package com.netpulse.core.detection;

import com.netpulse.core.model.Anomaly;
import com.netpulse.core.model.MetricSeries;

import java.util.List;

/**
 * Contract for anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: the result depends only on
 * the series passed in, so one instance can serve every device and metric
 * concurrently.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Scan a series for anomalous samples.
     *
     * @param series the samples to scan
     * @return anomalies in series order; empty when nothing stands out or the
     *         series is too short to judge
     */
    List<Anomaly> detect(MetricSeries series);
}

package com.netpulse.core.model;

import com.netpulse.core.error.AnalyticsException;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of telemetry metrics the engine knows how to analyse.
 *
 * <p>
 * Each kind carries the key used on the wire ({@code packetLoss},
 * {@code jitter}, ...). {@link #toString()} returns that key so JSON map keys
 * and log lines use the same spelling as the collectors.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricKind {

    BANDWIDTH("bandwidth"),
    LATENCY("latency"),
    PACKET_LOSS("packetLoss"),
    JITTER("jitter"),
    ERROR_RATE("errorRate"),
    RETRANSMISSION_RATE("retransmissionRate"),
    THROUGHPUT("throughput");

    private static final Map<String, MetricKind> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MetricKind::getKey, Function.identity()));

    private final String key;

    MetricKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve a wire key to its metric kind.
     *
     * @param key the metric key, e.g. {@code packetLoss}
     * @return the matching kind
     * @throws AnalyticsException with {@code INVALID_INPUT} for unknown keys
     */
    public static MetricKind fromKey(String key) {
        Objects.requireNonNull(key, "Metric key must not be null");
        MetricKind kind = BY_KEY.get(key);
        if (kind == null) {
            throw AnalyticsException.invalidInput("Unknown metric: '" + key
                    + "'. Supported: " + BY_KEY.keySet());
        }
        return kind;
    }

    @Override
    public String toString() {
        return key;
    }
}

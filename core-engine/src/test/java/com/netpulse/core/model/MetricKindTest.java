package com.netpulse.core.model;

import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricKind}.
 */
class MetricKindTest {

    @Test
    @DisplayName("Should resolve every wire key to its kind")
    void shouldResolveKeys() {
        for (MetricKind kind : MetricKind.values()) {
            assertThat(MetricKind.fromKey(kind.getKey())).isEqualTo(kind);
            assertThat(kind.toString()).isEqualTo(kind.getKey());
        }
        assertThat(MetricKind.fromKey("packetLoss")).isEqualTo(MetricKind.PACKET_LOSS);
    }

    @Test
    @DisplayName("Unknown keys should be INVALID_INPUT")
    void shouldRejectUnknownKey() {
        assertThatThrownBy(() -> MetricKind.fromKey("PacketLoss"))
                .isInstanceOfSatisfying(AnalyticsException.class, e ->
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT))
                .hasMessageContaining("Unknown metric");
    }
}

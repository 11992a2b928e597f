package com.netpulse.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.error.ErrorCode;
import com.netpulse.core.model.MetricKind;
import com.netpulse.core.model.MetricsBatch;
import com.netpulse.core.model.SamplePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON form of a {@link MetricsBatch}.
 *
 * <pre>
 * {"deviceId": "edge-1",
 *  "metrics": {"latency": [{"timestamp": "2024-01-01T00:00:00Z", "value": 12.5, "quality": "high"}]}}
 * </pre>
 *
 * <p>
 * The reader never drops a record: every problem
 * (malformed JSON, missing device id, unknown metric key, a sample without a
 * finite value or a timestamp) is reported as an {@link AnalyticsException}
 * with {@code INVALID_INPUT}. Unknown top-level and sample properties are
 * ignored. Timestamps are ISO-8601 strings or epoch seconds.
 * </p>
 *
 * <p>
 * Instances are thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsBatchReader {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsBatchReader.class);

    private final ObjectMapper mapper;

    public MetricsBatchReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MetricsBatch read(String json) {
        if (json == null || json.isBlank()) {
            throw AnalyticsException.invalidInput("Metrics batch JSON must not be empty");
        }
        try {
            return toBatch(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    public MetricsBatch read(byte[] json) {
        if (json == null || json.length == 0) {
            throw AnalyticsException.invalidInput("Metrics batch JSON must not be empty");
        }
        try {
            return toBatch(mapper.readTree(json));
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    public MetricsBatch read(InputStream in) {
        if (in == null) {
            throw AnalyticsException.invalidInput("Metrics batch stream must not be null");
        }
        try {
            return toBatch(mapper.readTree(in));
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private MetricsBatch toBatch(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw AnalyticsException.invalidInput("Metrics batch must be a JSON object");
        }

        JsonNode deviceNode = root.get("deviceId");
        if (deviceNode == null || !deviceNode.isTextual() || deviceNode.asText().isBlank()) {
            throw AnalyticsException.invalidInput("Metrics batch has no device identifier");
        }
        String deviceId = deviceNode.asText();

        JsonNode metricsNode = root.get("metrics");
        if (metricsNode == null || !metricsNode.isObject()) {
            throw AnalyticsException.invalidInput(
                    "Metrics batch for device " + deviceId + " has no 'metrics' object");
        }

        MetricsBatch.Builder builder = MetricsBatch.builder().deviceId(deviceId);
        Iterator<Map.Entry<String, JsonNode>> fields = metricsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            MetricKind kind = MetricKind.fromKey(field.getKey());
            builder.metric(kind, toSamples(deviceId, kind, field.getValue()));
        }

        MetricsBatch batch = builder.build();
        LOG.debug("Parsed metrics batch {}", batch);
        return batch;
    }

    private List<SamplePoint> toSamples(String deviceId, MetricKind kind, JsonNode samples) {
        if (!samples.isArray()) {
            throw AnalyticsException.invalidInput("Metric " + kind + " of device " + deviceId
                    + " must be an array of samples");
        }
        List<SamplePoint> points = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            JsonNode sample = samples.get(i);
            String where = kind + "[" + i + "] of device " + deviceId;
            if (!sample.isObject()) {
                throw AnalyticsException.invalidInput("Sample " + where + " must be an object");
            }
            JsonNode value = sample.get("value");
            if (value == null || !value.isNumber()) {
                throw AnalyticsException.invalidInput("Sample " + where + " has no numeric value");
            }
            JsonNode timestamp = sample.get("timestamp");
            if (timestamp == null || timestamp.isNull()) {
                throw AnalyticsException.invalidInput("Sample " + where + " has no timestamp");
            }
            try {
                points.add(mapper.treeToValue(sample, SamplePoint.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new AnalyticsException(ErrorCode.INVALID_INPUT,
                        "Invalid sample " + where + ": " + e.getMessage(), e);
            }
        }
        return points;
    }

    private static AnalyticsException malformed(IOException e) {
        return new AnalyticsException(ErrorCode.INVALID_INPUT,
                "Malformed metrics batch JSON: " + e.getMessage(), e);
    }
}

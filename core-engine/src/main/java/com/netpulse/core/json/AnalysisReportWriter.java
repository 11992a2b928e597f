package com.netpulse.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.netpulse.core.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Renders an {@link AnalysisReport} as JSON.
 * <p>
 * Timestamps are written as ISO-8601 strings and metrics by their wire key
 * ({@code packetLoss}), both as map keys and as values.
 * </p>
 */
public class AnalysisReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisReportWriter.class);

    private final ObjectMapper mapper;

    public AnalysisReportWriter() {
        this(false);
    }

    /**
     * @param pretty indent the output
     */
    public AnalysisReportWriter(boolean pretty) {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_ENUMS_USING_TO_STRING, true);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public String write(AnalysisReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize analysis report for device {}: {}",
                    report.getDeviceId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize analysis report", e);
        }
    }

    public byte[] writeBytes(AnalysisReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return mapper.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize analysis report for device {}: {}",
                    report.getDeviceId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize analysis report", e);
        }
    }
}

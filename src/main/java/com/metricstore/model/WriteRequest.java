package com.metricstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of a write call: one point for the series named by measurement and tags.
 */
public class WriteRequest {

    private final String measurement;
    private final Map<String, String> tags;
    private final Map<String, Double> fields;
    private final Long timestamp;

    @JsonCreator
    public WriteRequest(
            @JsonProperty("measurement") String measurement,
            @JsonProperty("tags") Map<String, String> tags,
            @JsonProperty("fields") Map<String, Double> fields,
            @JsonProperty("timestamp") Long timestamp) {
        this.measurement = measurement;
        this.tags = tags;
        this.fields = fields;
        this.timestamp = timestamp;
    }

    public String getMeasurement() {
        return measurement;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Map<String, Double> getFields() {
        return fields;
    }

    /**
     * Epoch milliseconds, or null to stamp the point with the time of insertion.
     */
    public Long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("WriteRequest{measurement='%s', tags=%s, fields=%s, timestamp=%s}",
                measurement, tags, fields, timestamp);
    }
}

package com.metricstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a query request for points of one measurement.
 */
public class QueryRequest {

    public static final int DEFAULT_LIMIT = 1000;

    private final String measurement;
    private final Map<String, String> tags;
    private final Long timeRangeMs;
    private final int limit;

    @JsonCreator
    public QueryRequest(
            @JsonProperty("measurement") String measurement,
            @JsonProperty("tags") Map<String, String> tags,
            @JsonProperty("timeRangeMs") Long timeRangeMs,
            @JsonProperty("limit") Integer limit) {
        this.measurement = Objects.requireNonNull(measurement, "Measurement cannot be null");
        this.tags = tags != null ? Collections.unmodifiableMap(new HashMap<>(tags)) : Collections.emptyMap();
        this.timeRangeMs = timeRangeMs;
        this.limit = limit != null ? limit : DEFAULT_LIMIT;

        if (this.limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        if (timeRangeMs != null && timeRangeMs < 0) {
            throw new IllegalArgumentException("Time range cannot be negative");
        }
    }

    public QueryRequest(String measurement) {
        this(measurement, null, null, null);
    }

    public String getMeasurement() {
        return measurement;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * Look-back window in milliseconds from now, or null for an unbounded query.
     */
    public Long getTimeRangeMs() {
        return timeRangeMs;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Checks if the given series is selected by this query.
     */
    public boolean matches(SeriesKey key) {
        return key.matches(measurement, tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        QueryRequest that = (QueryRequest) o;
        return limit == that.limit &&
               Objects.equals(measurement, that.measurement) &&
               Objects.equals(tags, that.tags) &&
               Objects.equals(timeRangeMs, that.timeRangeMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, timeRangeMs, limit);
    }

    @Override
    public String toString() {
        return String.format("QueryRequest{measurement='%s', tags=%s, timeRangeMs=%s, limit=%d}",
                measurement, tags, timeRangeMs, limit);
    }
}

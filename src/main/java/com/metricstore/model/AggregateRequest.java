package com.metricstore.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents an aggregate query: which points to select, which field to reduce,
 * the reduction function and an optional tag to group by.
 */
public class AggregateRequest {

    private final String measurement;
    private final Map<String, String> tags;
    private final Long timeRangeMs;
    private final Aggregation aggregation;
    private final String groupByTagKey;
    private final String field;

    public AggregateRequest(String measurement, Map<String, String> tags, Long timeRangeMs,
                            Aggregation aggregation, String groupByTagKey, String field) {
        this.measurement = Objects.requireNonNull(measurement, "Measurement cannot be null");
        this.tags = tags != null ? Collections.unmodifiableMap(new HashMap<>(tags)) : Collections.emptyMap();
        this.timeRangeMs = timeRangeMs;
        this.aggregation = aggregation != null ? aggregation : Aggregation.AVG;
        this.groupByTagKey = groupByTagKey;
        this.field = field;

        if (timeRangeMs != null && timeRangeMs < 0) {
            throw new IllegalArgumentException("Time range cannot be negative");
        }
    }

    public AggregateRequest(String measurement, Map<String, String> tags, Long timeRangeMs, Aggregation aggregation) {
        this(measurement, tags, timeRangeMs, aggregation, null, null);
    }

    public String getMeasurement() {
        return measurement;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Long getTimeRangeMs() {
        return timeRangeMs;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    /**
     * Tag whose values partition the matched points, or null for a scalar result.
     */
    public String getGroupByTagKey() {
        return groupByTagKey;
    }

    /**
     * Field to reduce. When null the first field of each point is used.
     */
    public String getField() {
        return field;
    }

    /**
     * Builds the query that selects this aggregate's input, capped at the given scan limit.
     */
    public QueryRequest toQuery(int scanLimit) {
        return new QueryRequest(measurement, tags, timeRangeMs, scanLimit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        AggregateRequest that = (AggregateRequest) o;
        return Objects.equals(measurement, that.measurement) &&
               Objects.equals(tags, that.tags) &&
               Objects.equals(timeRangeMs, that.timeRangeMs) &&
               aggregation == that.aggregation &&
               Objects.equals(groupByTagKey, that.groupByTagKey) &&
               Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, timeRangeMs, aggregation, groupByTagKey, field);
    }

    @Override
    public String toString() {
        return String.format("AggregateRequest{measurement='%s', tags=%s, timeRangeMs=%s, aggregation=%s, groupBy=%s, field=%s}",
                measurement, tags, timeRangeMs, aggregation, groupByTagKey, field);
    }
}

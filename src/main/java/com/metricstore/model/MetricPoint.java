package com.metricstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single timestamped observation within a series.
 * Points are immutable once created; field order is preserved as supplied.
 */
public class MetricPoint {

    private final long timestamp;
    private final Map<String, Double> fields;
    private final Map<String, String> tags;

    @JsonCreator
    public MetricPoint(
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("fields") Map<String, Double> fields,
            @JsonProperty("tags") Map<String, String> tags) {
        this.timestamp = timestamp;
        this.fields = Collections.unmodifiableMap(fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
        this.tags = Collections.unmodifiableMap(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>());
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, Double> getFields() {
        return fields;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * Returns the named field, or null if this point does not carry it.
     */
    public Double getField(String name) {
        return fields.get(name);
    }

    /**
     * True when every field has a name and a finite value and every tag has a non-null
     * key and value. Points decoded from a file are not checked on construction.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        for (Map.Entry<String, Double> field : fields.entrySet()) {
            if (field.getKey() == null || field.getValue() == null || !Double.isFinite(field.getValue())) {
                return false;
            }
        }
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (tag.getKey() == null || tag.getValue() == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the first field in insertion order, or null for a point without fields.
     */
    @JsonIgnore
    public Double getFirstField() {
        if (fields.isEmpty()) {
            return null;
        }
        return fields.values().iterator().next();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        MetricPoint that = (MetricPoint) o;
        return timestamp == that.timestamp &&
               Objects.equals(fields, that.fields) &&
               Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, fields, tags);
    }

    @Override
    public String toString() {
        return String.format("MetricPoint{timestamp=%d, fields=%s, tags=%s}", timestamp, fields, tags);
    }
}

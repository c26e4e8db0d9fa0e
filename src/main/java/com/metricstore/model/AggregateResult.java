package com.metricstore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of an aggregate query: empty when nothing matched, a single value,
 * or one value per group-by bucket.
 */
public class AggregateResult {

    private static final AggregateResult EMPTY = new AggregateResult(null, null);

    private final Double value;
    private final Map<String, Double> groups;

    private AggregateResult(Double value, Map<String, Double> groups) {
        this.value = value;
        this.groups = groups;
    }

    public static AggregateResult empty() {
        return EMPTY;
    }

    public static AggregateResult scalar(double value) {
        return new AggregateResult(value, null);
    }

    public static AggregateResult grouped(Map<String, Double> groups) {
        Objects.requireNonNull(groups, "Groups cannot be null");
        return new AggregateResult(null, Collections.unmodifiableMap(new LinkedHashMap<>(groups)));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return value == null && groups == null;
    }

    @JsonIgnore
    public boolean isGrouped() {
        return groups != null;
    }

    /**
     * Scalar result, or null for empty and grouped results.
     */
    public Double getValue() {
        return value;
    }

    /**
     * Per-bucket results, or null for empty and scalar results.
     */
    public Map<String, Double> getGroups() {
        return groups;
    }

    /**
     * The result in its natural shape: null, a number, or a bucket map.
     */
    @JsonIgnore
    public Object asObject() {
        return groups != null ? groups : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        AggregateResult that = (AggregateResult) o;
        return Objects.equals(value, that.value) && Objects.equals(groups, that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, groups);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "AggregateResult{empty}";
        }
        return isGrouped() ? "AggregateResult{groups=" + groups + "}" : "AggregateResult{value=" + value + "}";
    }
}

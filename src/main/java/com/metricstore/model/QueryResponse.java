package com.metricstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Represents a query response containing points sorted newest first.
 */
public class QueryResponse {

    private final List<MetricPoint> points;
    private final String measurement;
    private final long queryTimeMs;
    private final int totalPoints;
    private final boolean truncated;

    @JsonCreator
    public QueryResponse(
            @JsonProperty("points") List<MetricPoint> points,
            @JsonProperty("measurement") String measurement,
            @JsonProperty("queryTimeMs") long queryTimeMs,
            @JsonProperty("totalPoints") int totalPoints,
            @JsonProperty("truncated") boolean truncated) {
        this.points = Objects.requireNonNull(points, "Points cannot be null");
        this.measurement = measurement;
        this.queryTimeMs = queryTimeMs;
        this.totalPoints = totalPoints;
        this.truncated = truncated;
    }

    public List<MetricPoint> getPoints() {
        return points;
    }

    public String getMeasurement() {
        return measurement;
    }

    public long getQueryTimeMs() {
        return queryTimeMs;
    }

    /**
     * Number of points matched before the limit was applied.
     */
    public int getTotalPoints() {
        return totalPoints;
    }

    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        QueryResponse that = (QueryResponse) o;
        return queryTimeMs == that.queryTimeMs &&
               totalPoints == that.totalPoints &&
               truncated == that.truncated &&
               Objects.equals(points, that.points) &&
               Objects.equals(measurement, that.measurement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, measurement, queryTimeMs, totalPoints, truncated);
    }

    @Override
    public String toString() {
        return String.format("QueryResponse{measurement='%s', totalPoints=%d, queryTimeMs=%d, truncated=%s}",
                measurement, totalPoints, queryTimeMs, truncated);
    }
}

package com.metricstore.query;

import com.metricstore.model.AggregateRequest;
import com.metricstore.model.AggregateResult;
import com.metricstore.model.MetricPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces query results to a scalar or to one value per group-by bucket.
 */
public class AggregateEngine {

    /**
     * Bucket for points that do not carry the group-by tag.
     */
    public static final String DEFAULT_GROUP = "default";

    public AggregateResult aggregate(List<MetricPoint> points, AggregateRequest request) {
        if (points.isEmpty()) {
            return AggregateResult.empty();
        }

        if (request.getGroupByTagKey() == null) {
            List<Double> values = extractValues(points, request.getField());
            if (values.isEmpty()) {
                return AggregateResult.empty();
            }
            return AggregateResult.scalar(request.getAggregation().apply(values));
        }

        Map<String, List<MetricPoint>> groups = new LinkedHashMap<>();
        for (MetricPoint point : points) {
            String groupKey = point.getTags().getOrDefault(request.getGroupByTagKey(), DEFAULT_GROUP);
            groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(point);
        }

        Map<String, Double> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<MetricPoint>> group : groups.entrySet()) {
            List<Double> values = extractValues(group.getValue(), request.getField());
            if (!values.isEmpty()) {
                results.put(group.getKey(), request.getAggregation().apply(values));
            }
        }
        if (results.isEmpty()) {
            return AggregateResult.empty();
        }
        return AggregateResult.grouped(results);
    }

    // Points that lack the field, or carry a non-finite value, contribute nothing
    private static List<Double> extractValues(List<MetricPoint> points, String field) {
        List<Double> values = new ArrayList<>(points.size());
        for (MetricPoint point : points) {
            Double value = field != null ? point.getField(field) : point.getFirstField();
            if (value != null && Double.isFinite(value)) {
                values.add(value);
            }
        }
        return values;
    }
}

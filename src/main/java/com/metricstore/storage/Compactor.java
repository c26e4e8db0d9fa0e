package com.metricstore.storage;

import com.metricstore.model.MetricPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Lossy compaction of a series: interior points that do not represent a significant
 * change from their neighbours are discarded. Discarded points are gone for good.
 *
 * The first and last points are always kept. An interior point {@code p[i]} is kept when,
 * for any of its fields, either the change from the previously kept point or the change
 * to the original {@code p[i+1]} exceeds the threshold. Relative change is
 * {@code |current - reference| / max(|reference|, 1)}; a field that is missing or null
 * counts as zero.
 */
public class Compactor {

    private final double threshold;
    private final int minPoints;

    public Compactor(double threshold, int minPoints) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Compression threshold cannot be negative");
        }
        this.threshold = threshold;
        this.minPoints = Math.max(minPoints, 2);
    }

    /**
     * Compacts the series in place.
     *
     * @return number of points removed, 0 if the series was left untouched
     */
    public int apply(Series series) {
        return series.reduce(this::compact);
    }

    /**
     * Returns the compacted sequence without modifying the input. Lists shorter than the
     * minimum length are returned as they are.
     */
    public List<MetricPoint> compact(List<MetricPoint> points) {
        if (points.size() < minPoints) {
            return points;
        }

        List<MetricPoint> compacted = new ArrayList<>();
        compacted.add(points.get(0));

        for (int i = 1; i < points.size() - 1; i++) {
            MetricPoint previous = compacted.get(compacted.size() - 1);
            MetricPoint current = points.get(i);
            MetricPoint next = points.get(i + 1);

            if (isSignificant(previous, current, next)) {
                compacted.add(current);
            }
        }

        compacted.add(points.get(points.size() - 1));
        return compacted;
    }

    private boolean isSignificant(MetricPoint previous, MetricPoint current, MetricPoint next) {
        for (String field : current.getFields().keySet()) {
            double prevValue = valueOf(previous, field);
            double currValue = valueOf(current, field);
            double nextValue = valueOf(next, field);

            if (relativeChange(currValue, prevValue) > threshold
                    || relativeChange(nextValue, currValue) > threshold) {
                return true;
            }
        }
        return false;
    }

    private static double valueOf(MetricPoint point, String field) {
        Double value = point.getField(field);
        return value != null ? value : 0.0;
    }

    static double relativeChange(double current, double reference) {
        return Math.abs(current - reference) / Math.max(Math.abs(reference), 1.0);
    }
}

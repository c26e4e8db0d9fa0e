package com.metricstore.storage;

import com.metricstore.model.MetricPoint;
import com.metricstore.model.SeriesKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Points sharing one series key, in insertion order.
 *
 * All access goes through this object's monitor. Callers that need several steps to
 * happen atomically (append, then trim, then compact) synchronize on the series itself.
 * Readers receive copies and never see the backing list.
 */
public class Series {

    private final SeriesKey key;
    private List<MetricPoint> points;

    public Series(SeriesKey key) {
        this.key = key;
        this.points = new ArrayList<>();
    }

    public SeriesKey getKey() {
        return key;
    }

    public synchronized void append(MetricPoint point) {
        points.add(point);
    }

    public synchronized int size() {
        return points.size();
    }

    public synchronized boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Drops the oldest points so that at most {@code maxPoints} remain.
     *
     * @return number of points removed
     */
    public synchronized int trimToSize(int maxPoints) {
        int excess = points.size() - maxPoints;
        if (excess <= 0) {
            return 0;
        }
        points.subList(0, excess).clear();
        return excess;
    }

    /**
     * Drops every point with a timestamp strictly before the cutoff.
     *
     * @return number of points removed
     */
    public synchronized int evictOlderThan(long cutoff) {
        int before = points.size();
        points.removeIf(point -> point.getTimestamp() < cutoff);
        return before - points.size();
    }

    /**
     * Applies a reduction to the point list; the result replaces the contents only
     * when it is strictly shorter.
     *
     * @return number of points removed
     */
    public synchronized int reduce(UnaryOperator<List<MetricPoint>> reduction) {
        List<MetricPoint> reduced = reduction.apply(points);
        if (reduced.size() >= points.size()) {
            return 0;
        }
        int removed = points.size() - reduced.size();
        points = new ArrayList<>(reduced);
        return removed;
    }

    /**
     * Replaces the contents wholesale, used when restoring from a snapshot.
     */
    public synchronized void replaceAll(Collection<MetricPoint> restored) {
        points = new ArrayList<>(restored);
    }

    /**
     * Returns a copy of the points in insertion order.
     */
    public synchronized List<MetricPoint> snapshot() {
        return new ArrayList<>(points);
    }

    @Override
    public String toString() {
        return String.format("Series{key=%s, points=%d}", key, size());
    }
}

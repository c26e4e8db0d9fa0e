package com.metricstore.query;

import com.metricstore.model.MetricPoint;
import com.metricstore.model.QueryRequest;
import com.metricstore.model.QueryResponse;
import com.metricstore.storage.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates range queries over a set of matching series.
 * Each series is copied under its own lock; filtering and sorting run on the copies.
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private static final Comparator<MetricPoint> NEWEST_FIRST =
            Comparator.comparingLong(MetricPoint::getTimestamp).reversed();

    public QueryResponse execute(List<Series> matchingSeries, QueryRequest request, long now) {
        long startQueryTime = System.nanoTime();

        Long timeRange = request.getTimeRangeMs();
        long startTime = timeRange != null ? now - timeRange : Long.MIN_VALUE;

        List<MetricPoint> points = new ArrayList<>();
        for (Series series : matchingSeries) {
            for (MetricPoint point : series.snapshot()) {
                if (point.getTimestamp() >= startTime) {
                    points.add(point);
                }
            }
        }

        points.sort(NEWEST_FIRST);

        int total = points.size();
        boolean truncated = total > request.getLimit();
        List<MetricPoint> limited = truncated ? new ArrayList<>(points.subList(0, request.getLimit())) : points;

        long queryTime = (System.nanoTime() - startQueryTime) / 1_000_000;
        logger.debug("Query {} matched {} series, {} points in {}ms",
                request, matchingSeries.size(), total, queryTime);

        return new QueryResponse(limited, request.getMeasurement(), queryTime, total, truncated);
    }
}

package com.metricstore.storage;

import com.metricstore.config.StoreConfig;
import com.metricstore.model.AggregateRequest;
import com.metricstore.model.AggregateResult;
import com.metricstore.model.MetricPoint;
import com.metricstore.model.QueryRequest;
import com.metricstore.model.QueryResponse;
import com.metricstore.model.SeriesKey;
import com.metricstore.model.StoreStats;
import com.metricstore.query.AggregateEngine;
import com.metricstore.query.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process time-series store for tagged, timestamped numeric measurements.
 *
 * Memory is bounded per series by a point cap and a retention window, both enforced on
 * every insert and by {@link #cleanup()}. Compaction is lossy and runs on insert only
 * while compression is enabled; it can also be triggered explicitly through
 * {@link #compact(String, Map)} and {@link #compactAll()}.
 *
 * Mutations are serialized per series. Reads copy each series under its lock and do
 * the remaining work without holding any lock. There is no cross-series consistency.
 * {@link #clear()} and {@link #restore(Map)} exclude inserts for their duration, so no
 * insert can land in a series that has just been dropped from the index.
 */
public class TimeSeriesStore {

    private static final Logger logger = LoggerFactory.getLogger(TimeSeriesStore.class);

    private final Clock clock;
    private final SeriesIndex index;
    private final RetentionEnforcer retentionEnforcer;
    private final Compactor compactor;
    private final QueryEngine queryEngine;
    private final AggregateEngine aggregateEngine;
    private final int defaultQueryLimit;
    private final int aggregateScanLimit;
    private final ReentrantReadWriteLock lock;
    private volatile boolean compressionEnabled;

    public TimeSeriesStore(StoreConfig config, Clock clock) {
        this.clock = clock;
        this.index = new SeriesIndex();
        this.retentionEnforcer = new RetentionEnforcer(config.getRetentionPeriodMs(), config.getMaxPointsPerSeries());
        this.compactor = new Compactor(config.getCompressionThreshold(), config.getCompactionMinPoints());
        this.queryEngine = new QueryEngine();
        this.aggregateEngine = new AggregateEngine();
        this.defaultQueryLimit = config.getDefaultQueryLimit();
        this.aggregateScanLimit = config.getAggregateScanLimit();
        this.compressionEnabled = config.isCompressionEnabled();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Inserts a point into the series identified by the measurement and tags, then trims
     * and (if enabled) compacts that series.
     *
     * @param timestamp epoch milliseconds, or null for the current time
     * @return false if the input was rejected, in which case nothing was changed
     */
    public boolean insert(String measurement, Map<String, String> tags, Map<String, Double> fields, Long timestamp) {
        MetricPoint point;
        SeriesKey key;
        try {
            key = new SeriesKey(measurement, tags);
            validateFields(fields);
            point = new MetricPoint(timestamp != null ? timestamp : clock.millis(), fields, tags);
        } catch (IllegalArgumentException | NullPointerException e) {
            logger.warn("Rejected point for measurement '{}': {}", measurement, e.getMessage());
            return false;
        }

        // Shared: inserts only exclude clear and restore, not each other
        lock.readLock().lock();
        try {
            Series series = index.getOrCreate(key);
            synchronized (series) {
                series.append(point);
                retentionEnforcer.apply(series, clock.millis());
                if (compressionEnabled) {
                    compactor.apply(series);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return true;
    }

    public boolean insert(String measurement, Map<String, String> tags, Map<String, Double> fields) {
        return insert(measurement, tags, fields, null);
    }

    /**
     * Returns matching points, newest first, capped at the limit.
     *
     * @param timeRangeMs look-back window from now, or null for no time bound
     * @param limit maximum number of points, or null for the configured default
     */
    public List<MetricPoint> query(String measurement, Map<String, String> tags, Long timeRangeMs, Integer limit) {
        return query(new QueryRequest(measurement, tags, timeRangeMs, limit != null ? limit : defaultQueryLimit));
    }

    public List<MetricPoint> query(String measurement) {
        return query(measurement, null, null, null);
    }

    public List<MetricPoint> query(QueryRequest request) {
        return execute(request).getPoints();
    }

    /**
     * Runs a query and reports totals and truncation alongside the points.
     */
    public QueryResponse execute(QueryRequest request) {
        return queryEngine.execute(index.findMatching(request), request, clock.millis());
    }

    /**
     * Aggregates the selected field over matching points. At most the configured scan
     * limit of the newest points takes part.
     */
    public AggregateResult aggregate(AggregateRequest request) {
        List<MetricPoint> points = query(request.toQuery(aggregateScanLimit));
        return aggregateEngine.aggregate(points, request);
    }

    /**
     * Applies the retention and size rules to every series. Emptied series stay indexed.
     */
    public RetentionEnforcer.CleanupResult cleanup() {
        return retentionEnforcer.sweep(index.all(), clock.millis());
    }

    /**
     * Compacts one series regardless of whether compression on insert is enabled.
     *
     * @return number of points discarded
     */
    public int compact(String measurement, Map<String, String> tags) {
        Series series = index.get(new SeriesKey(measurement, tags));
        if (series == null) {
            return 0;
        }
        return compactor.apply(series);
    }

    /**
     * Compacts every series.
     *
     * @return number of points discarded
     */
    public int compactAll() {
        int removed = 0;
        for (Series series : index.all()) {
            removed += compactor.apply(series);
        }
        if (removed > 0) {
            logger.info("Compaction discarded {} points", removed);
        }
        return removed;
    }

    /**
     * Copies every series' points. Each series is copied under its own lock only.
     */
    public Map<SeriesKey, List<MetricPoint>> snapshotView() {
        Map<SeriesKey, List<MetricPoint>> view = new LinkedHashMap<>();
        for (Series series : index.all()) {
            view.put(series.getKey(), series.snapshot());
        }
        return view;
    }

    /**
     * Replaces the whole store with the given series, then applies the retention and
     * size rules to each of them.
     */
    public void restore(Map<SeriesKey, ? extends Collection<MetricPoint>> restored) {
        lock.writeLock().lock();
        try {
            index.clear();
            long now = clock.millis();
            for (Map.Entry<SeriesKey, ? extends Collection<MetricPoint>> entry : restored.entrySet()) {
                Series series = index.getOrCreate(entry.getKey());
                synchronized (series) {
                    series.replaceAll(entry.getValue());
                    retentionEnforcer.apply(series, now);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreStats stats() {
        long totalPoints = 0;
        Long oldest = null;
        Long newest = null;
        Collection<Series> allSeries = index.all();

        for (Series series : allSeries) {
            for (MetricPoint point : series.snapshot()) {
                totalPoints++;
                long ts = point.getTimestamp();
                oldest = oldest == null ? ts : Math.min(oldest, ts);
                newest = newest == null ? ts : Math.max(newest, ts);
            }
        }

        return new StoreStats(allSeries.size(), totalPoints, oldest, newest,
                retentionEnforcer.getRetentionPeriodMs(), retentionEnforcer.getMaxPointsPerSeries(),
                compressionEnabled);
    }

    /**
     * Removes every series and point.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            index.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Time-series store cleared");
    }

    public void setRetentionPeriodMs(long retentionPeriodMs) {
        retentionEnforcer.setRetentionPeriodMs(retentionPeriodMs);
        logger.info("Retention period set to: {}ms", retentionPeriodMs);
    }

    public void setMaxPointsPerSeries(int maxPointsPerSeries) {
        retentionEnforcer.setMaxPointsPerSeries(maxPointsPerSeries);
        logger.info("Max points per series set to: {}", maxPointsPerSeries);
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
        logger.info("Compression on insert {}", compressionEnabled ? "enabled" : "disabled");
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    private static void validateFields(Map<String, Double> fields) {
        if (fields == null) {
            return;
        }
        for (Map.Entry<String, Double> field : fields.entrySet()) {
            if (field.getKey() == null) {
                throw new IllegalArgumentException("Field names cannot be null");
            }
            Double value = field.getValue();
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("Field '" + field.getKey() + "' is not a finite number: " + value);
            }
        }
    }
}

package com.metricstore;

import com.metricstore.config.StoreConfig;
import com.metricstore.model.AggregateRequest;
import com.metricstore.model.AggregateResult;
import com.metricstore.model.Aggregation;
import com.metricstore.model.MetricPoint;
import com.metricstore.model.QueryRequest;
import com.metricstore.model.QueryResponse;
import com.metricstore.model.SeriesKey;
import com.metricstore.model.StoreStats;
import com.metricstore.storage.RetentionEnforcer;
import com.metricstore.storage.TimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class TimeSeriesStoreTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final long RETENTION = 24L * 60 * 60 * 1000;

    private TestClock clock;
    private StoreConfig config;
    private TimeSeriesStore store;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        config = new StoreConfig();
        store = new TimeSeriesStore(config, clock);
    }

    @Test
    void testSameMeasurementAndTagsResolveToOneSeries() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("carId", "1");
        first.put("team", "red");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("team", "red");
        second.put("carId", "1");

        assertTrue(store.insert("speed", first, Map.of("value", 200.0), NOW - 2));
        assertTrue(store.insert("speed", second, Map.of("value", 210.0), NOW - 1));

        assertEquals(1, store.stats().getSeriesCount());
        assertEquals(2, store.query("speed").size());
    }

    @Test
    void testSizeBoundKeepsMostRecentPoints() {
        store.setCompressionEnabled(false);
        long base = NOW - 20_000;

        for (int i = 0; i < 10_050; i++) {
            assertTrue(store.insert("speed", Map.of("carId", "1"), Map.of("value", (double) i), base + i));
        }

        List<MetricPoint> points = store.snapshotView().get(new SeriesKey("speed", Map.of("carId", "1")));
        assertEquals(10_000, points.size());
        assertEquals(base + 50, points.get(0).getTimestamp());
        assertEquals(base + 10_049, points.get(points.size() - 1).getTimestamp());
    }

    @Test
    void testRetentionSweepEvictsExpiredPoints() {
        assertTrue(store.insert("speed", Map.of("carId", "1"), Map.of("value", 1.0), NOW - RETENTION + 10));
        assertTrue(store.insert("speed", Map.of("carId", "1"), Map.of("value", 2.0), NOW - RETENTION + 1011));

        // First point is now at now - retention - 1, second at now - retention + 1000
        clock.advance(11);
        RetentionEnforcer.CleanupResult result = store.cleanup();

        assertEquals(1, result.getRemovedPoints());
        List<MetricPoint> remaining = store.query("speed");
        assertEquals(1, remaining.size());
        assertEquals(NOW - RETENTION + 1011, remaining.get(0).getTimestamp());
    }

    @Test
    void testSweepKeepsEmptySeriesIndexed() {
        store.insert("speed", Map.of("carId", "1"), Map.of("value", 1.0), NOW);

        clock.advance(RETENTION + 1);
        store.cleanup();

        StoreStats stats = store.stats();
        assertEquals(1, stats.getSeriesCount());
        assertEquals(0, stats.getTotalPoints());
        assertNull(stats.getOldestTimestamp());
        assertNull(stats.getNewestTimestamp());
    }

    @Test
    void testInsertOfExpiredPointIsAcceptedButNotRetained() {
        assertTrue(store.insert("speed", Map.of("carId", "1"), Map.of("value", 1.0), NOW - RETENTION - 1));
        assertTrue(store.query("speed").isEmpty());
    }

    @Test
    void testInvalidInsertsAreRejectedWithoutMutation() {
        Map<String, String> nullTagValue = new HashMap<>();
        nullTagValue.put("carId", null);
        Map<String, Double> nullField = new HashMap<>();
        nullField.put("value", null);

        assertFalse(store.insert("", Map.of(), Map.of("value", 1.0), NOW));
        assertFalse(store.insert(null, Map.of(), Map.of("value", 1.0), NOW));
        assertFalse(store.insert("speed", nullTagValue, Map.of("value", 1.0), NOW));
        assertFalse(store.insert("speed", Map.of(), Map.of("value", Double.NaN), NOW));
        assertFalse(store.insert("speed", Map.of(), Map.of("value", Double.POSITIVE_INFINITY), NOW));
        assertFalse(store.insert("speed", Map.of(), nullField, NOW));

        assertEquals(0, store.stats().getSeriesCount());
    }

    @Test
    void testEmptyFieldsAndMissingTimestampAreAccepted() {
        assertTrue(store.insert("heartbeat", Map.of("carId", "1"), Map.of()));

        List<MetricPoint> points = store.query("heartbeat");
        assertEquals(1, points.size());
        assertEquals(NOW, points.get(0).getTimestamp());
        assertTrue(points.get(0).getFields().isEmpty());
    }

    @Test
    void testQueryUnknownMeasurementReturnsEmptyList() {
        List<MetricPoint> points = store.query("nonexistent");
        assertNotNull(points);
        assertTrue(points.isEmpty());
    }

    @Test
    void testQuerySortsNewestFirstAcrossSeries() {
        store.insert("speed", Map.of("carId", "1"), Map.of("value", 100.0), NOW - 30);
        store.insert("speed", Map.of("carId", "2"), Map.of("value", 150.0), NOW - 10);
        store.insert("speed", Map.of("carId", "1"), Map.of("value", 120.0), NOW - 20);

        List<MetricPoint> points = store.query("speed");

        assertEquals(3, points.size());
        assertEquals(NOW - 10, points.get(0).getTimestamp());
        assertEquals(NOW - 20, points.get(1).getTimestamp());
        assertEquals(NOW - 30, points.get(2).getTimestamp());
    }

    @Test
    void testQueryTagFilterIsSupersetMatch() {
        store.insert("speed", Map.of("carId", "1", "team", "red"), Map.of("value", 100.0), NOW - 3);
        store.insert("speed", Map.of("carId", "1", "team", "blue"), Map.of("value", 110.0), NOW - 2);
        store.insert("speed", Map.of("carId", "2", "team", "red"), Map.of("value", 120.0), NOW - 1);

        assertEquals(2, store.query("speed", Map.of("carId", "1"), null, null).size());
        assertEquals(2, store.query("speed", Map.of("team", "red"), null, null).size());
        assertEquals(1, store.query("speed", Map.of("carId", "1", "team", "blue"), null, null).size());
        assertTrue(store.query("speed", Map.of("carId", "3"), null, null).isEmpty());
    }

    @Test
    void testQueryTimeRangeAndLimit() {
        store.setCompressionEnabled(false);
        for (int i = 0; i < 20; i++) {
            store.insert("speed", Map.of("carId", "1"), Map.of("value", (double) i), NOW - i * 1000L);
        }

        assertEquals(6, store.query("speed", null, 5000L, null).size());
        assertEquals(20, store.query("speed", null, null, null).size());

        QueryResponse response = store.execute(new QueryRequest("speed", null, null, 5));
        assertEquals(5, response.getPoints().size());
        assertEquals(20, response.getTotalPoints());
        assertTrue(response.isTruncated());
        assertEquals(NOW, response.getPoints().get(0).getTimestamp());
    }

    @Test
    void testNegativeLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.query("speed", null, null, -1));
    }

    @Test
    void testCompactionOnInsertKeepsEndpoints() {
        for (int i = 0; i < 20; i++) {
            store.insert("speed", Map.of("carId", "1"), Map.of("value", 100.0), NOW - 20 + i);
        }

        List<MetricPoint> points = store.snapshotView().get(new SeriesKey("speed", Map.of("carId", "1")));
        assertTrue(points.size() < 20);
        assertEquals(NOW - 20, points.get(0).getTimestamp());
        assertEquals(NOW - 1, points.get(points.size() - 1).getTimestamp());
    }

    @Test
    void testCompactionCanBeDisabledAndRunExplicitly() {
        store.setCompressionEnabled(false);
        for (int i = 0; i < 20; i++) {
            store.insert("speed", Map.of("carId", "1"), Map.of("value", 100.0), NOW - 20 + i);
        }
        assertEquals(20, store.query("speed").size());

        int removed = store.compact("speed", Map.of("carId", "1"));

        assertEquals(18, removed);
        assertEquals(2, store.query("speed").size());
        assertEquals(0, store.compact("speed", Map.of("carId", "unknown")));
    }

    @Test
    void testCompactAllSpansSeries() {
        store.setCompressionEnabled(false);
        for (int i = 0; i < 12; i++) {
            store.insert("speed", Map.of("carId", "1"), Map.of("value", 100.0), NOW - 20 + i);
            store.insert("speed", Map.of("carId", "2"), Map.of("value", 50.0), NOW - 20 + i);
        }

        assertEquals(20, store.compactAll());
        assertEquals(4, store.stats().getTotalPoints());
    }

    @Test
    void testAggregateFunctions() {
        insertValues("lap", Map.of("carId", "1"), 10, 20, 30);

        assertEquals(20.0, aggregate(Aggregation.AVG).getValue(), 0.0001);
        assertEquals(60.0, aggregate(Aggregation.SUM).getValue(), 0.0001);
        assertEquals(10.0, aggregate(Aggregation.MIN).getValue(), 0.0001);
        assertEquals(30.0, aggregate(Aggregation.MAX).getValue(), 0.0001);
        assertEquals(3.0, aggregate(Aggregation.COUNT).getValue(), 0.0001);
    }

    @Test
    void testUnknownAggregationFallsBackToAverage() {
        insertValues("lap", Map.of("carId", "1"), 10, 20, 30);

        AggregateResult result = store.aggregate(
                new AggregateRequest("lap", null, null, Aggregation.fromName("median")));

        assertEquals(20.0, result.getValue(), 0.0001);
    }

    @Test
    void testGroupByTag() {
        insertValues("lap", Map.of("region", "A"), 10, 20);
        insertValues("lap", Map.of("region", "B"), 5);

        AggregateResult result = store.aggregate(
                new AggregateRequest("lap", null, null, Aggregation.AVG, "region", null));

        assertTrue(result.isGrouped());
        assertEquals(Map.of("A", 15.0, "B", 5.0), result.getGroups());
    }

    @Test
    void testGroupByMissingTagUsesDefaultBucket() {
        insertValues("lap", Map.of("region", "A"), 10);
        insertValues("lap", Map.of("carId", "7"), 4, 6);

        AggregateResult result = store.aggregate(
                new AggregateRequest("lap", null, null, Aggregation.SUM, "region", null));

        assertEquals(Map.of("A", 10.0, "default", 10.0), result.getGroups());
    }

    @Test
    void testAggregateWithoutMatchesIsEmpty() {
        AggregateResult result = store.aggregate(new AggregateRequest("lap", null, null, Aggregation.AVG));
        assertTrue(result.isEmpty());
        assertNull(result.asObject());
    }

    @Test
    void testGroupByWithoutUsableValuesIsEmpty() {
        insertValues("lap", Map.of("region", "A"), 10, 20);

        AggregateResult result = store.aggregate(
                new AggregateRequest("lap", null, null, Aggregation.AVG, "region", "sector"));

        assertTrue(result.isEmpty());
        assertFalse(result.isGrouped());
        assertNull(result.asObject());
    }

    @Test
    void testAggregateUsesRequestedField() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("frontLeft", 90.0);
        fields.put("frontRight", 100.0);
        store.insert("tire_temp", Map.of("carId", "1"), fields, NOW - 2);

        Map<String, Double> more = new LinkedHashMap<>();
        more.put("frontLeft", 94.0);
        more.put("frontRight", 110.0);
        store.insert("tire_temp", Map.of("carId", "1"), more, NOW - 1);

        AggregateResult explicit = store.aggregate(
                new AggregateRequest("tire_temp", null, null, Aggregation.AVG, null, "frontRight"));
        AggregateResult implicit = store.aggregate(
                new AggregateRequest("tire_temp", null, null, Aggregation.AVG));
        AggregateResult missing = store.aggregate(
                new AggregateRequest("tire_temp", null, null, Aggregation.AVG, null, "rearLeft"));

        assertEquals(105.0, explicit.getValue(), 0.0001);
        assertEquals(92.0, implicit.getValue(), 0.0001);
        assertTrue(missing.isEmpty());
    }

    @Test
    void testStatsReportRangeAndSettings() {
        store.insert("speed", Map.of("carId", "1"), Map.of("value", 1.0), NOW - 500);
        store.insert("speed", Map.of("carId", "2"), Map.of("value", 1.0), NOW - 100);
        store.insert("position", Map.of("carId", "1"), Map.of("x", 1.0), NOW - 300);

        StoreStats stats = store.stats();

        assertEquals(3, stats.getSeriesCount());
        assertEquals(3, stats.getTotalPoints());
        assertEquals(1.0, stats.getAveragePointsPerSeries(), 0.0001);
        assertEquals(NOW - 500, stats.getOldestTimestamp());
        assertEquals(NOW - 100, stats.getNewestTimestamp());
        assertEquals(RETENTION, stats.getRetentionPeriodMs());
        assertEquals(10_000, stats.getMaxPointsPerSeries());
        assertTrue(stats.isCompressionEnabled());
    }

    @Test
    void testRuntimeSettingsApplyToLaterInserts() {
        store.setCompressionEnabled(false);
        store.setMaxPointsPerSeries(5);
        for (int i = 0; i < 8; i++) {
            store.insert("speed", Map.of("carId", "1"), Map.of("value", (double) i), NOW - 10 + i);
        }
        assertEquals(5, store.query("speed").size());

        store.setRetentionPeriodMs(3);
        store.cleanup();
        assertEquals(List.of(NOW - 3), timestamps(store.query("speed")));
    }

    @Test
    void testClearRemovesEverything() {
        store.insert("speed", Map.of("carId", "1"), Map.of("value", 1.0), NOW);
        store.clear();

        assertEquals(0, store.stats().getSeriesCount());
        assertTrue(store.query("speed").isEmpty());
    }

    @Test
    void testConcurrentWritersAndReaders() throws Exception {
        store.setCompressionEnabled(false);
        store.setMaxPointsPerSeries(500);
        int writers = 8;
        int insertsPerWriter = 200;

        ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            List<Future<?>> writerTasks = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String carId = "car-" + w;
                writerTasks.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < insertsPerWriter; i++) {
                        assertTrue(store.insert("speed", Map.of("carId", carId), Map.of("value", (double) i), NOW - i));
                        assertTrue(store.insert("speed", Map.of("carId", "shared"), Map.of("value", (double) i), NOW - i));
                    }
                    return null;
                }));
            }

            List<Future<?>> readerTasks = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readerTasks.add(executor.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        assertTrue(store.query("speed", Map.of("carId", "shared"), null, 100).size() <= 100);
                        store.aggregate(new AggregateRequest("speed", null, null, Aggregation.MAX, "carId", null));
                        for (List<MetricPoint> points : store.snapshotView().values()) {
                            assertTrue(points.size() <= 500);
                        }
                        store.stats();
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> task : writerTasks) {
                task.get(30, TimeUnit.SECONDS);
            }
            writing.set(false);
            for (Future<?> task : readerTasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            writing.set(false);
            executor.shutdownNow();
        }

        Map<SeriesKey, List<MetricPoint>> view = store.snapshotView();
        assertEquals(writers + 1, view.size());
        assertEquals(500, view.get(new SeriesKey("speed", Map.of("carId", "shared"))).size());
        for (int w = 0; w < writers; w++) {
            assertEquals(insertsPerWriter, view.get(new SeriesKey("speed", Map.of("carId", "car-" + w))).size());
        }
        assertEquals(writers * insertsPerWriter + 500, store.stats().getTotalPoints());
    }

    @Test
    void testInsertWaitsForRestoreToFinish() throws Exception {
        CountDownLatch restoring = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SeriesKey key = new SeriesKey("speed", Map.of("carId", "1"));
        Map<SeriesKey, List<MetricPoint>> restored = new AbstractMap<SeriesKey, List<MetricPoint>>() {
            @Override
            public Set<Map.Entry<SeriesKey, List<MetricPoint>>> entrySet() {
                restoring.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Map.of(key, List.of(new MetricPoint(NOW - 5, Map.of("value", 1.0), Map.of("carId", "1"))))
                        .entrySet();
            }
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> restore = executor.submit(() -> store.restore(restored));
            assertTrue(restoring.await(5, TimeUnit.SECONDS));

            Future<Boolean> insert = executor.submit(
                    () -> store.insert("speed", Map.of("carId", "1"), Map.of("value", 2.0), NOW));
            assertThrows(TimeoutException.class, () -> insert.get(200, TimeUnit.MILLISECONDS));

            release.countDown();
            restore.get(5, TimeUnit.SECONDS);
            assertTrue(insert.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of(NOW, NOW - 5), timestamps(store.query("speed")));
    }

    private void insertValues(String measurement, Map<String, String> tags, double... values) {
        for (int i = 0; i < values.length; i++) {
            assertTrue(store.insert(measurement, tags, Map.of("value", values[i]), NOW - 100 + i));
        }
    }

    private AggregateResult aggregate(Aggregation aggregation) {
        return store.aggregate(new AggregateRequest("lap", Map.of("carId", "1"), null, aggregation));
    }

    private static List<Long> timestamps(List<MetricPoint> points) {
        return points.stream().map(MetricPoint::getTimestamp).collect(java.util.stream.Collectors.toList());
    }
}

package com.metricstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Keeps series within the configured size cap and retention window.
 *
 * The size rule drops the oldest points beyond {@code maxPointsPerSeries}; the time rule
 * drops every point older than {@code now - retentionPeriodMs}. Both are idempotent and
 * their order does not affect the result.
 */
public class RetentionEnforcer {

    private static final Logger logger = LoggerFactory.getLogger(RetentionEnforcer.class);

    private volatile long retentionPeriodMs;
    private volatile int maxPointsPerSeries;

    public RetentionEnforcer(long retentionPeriodMs, int maxPointsPerSeries) {
        setRetentionPeriodMs(retentionPeriodMs);
        setMaxPointsPerSeries(maxPointsPerSeries);
    }

    /**
     * Applies both rules to one series.
     *
     * @return number of points removed
     */
    public int apply(Series series, long now) {
        long cutoff = now - retentionPeriodMs;
        synchronized (series) {
            return series.trimToSize(maxPointsPerSeries) + series.evictOlderThan(cutoff);
        }
    }

    /**
     * Applies both rules to every series. Series left empty are not removed.
     */
    public CleanupResult sweep(Collection<Series> allSeries, long now) {
        long removedPoints = 0;
        int affectedSeries = 0;

        for (Series series : allSeries) {
            int removed = apply(series, now);
            if (removed > 0) {
                removedPoints += removed;
                affectedSeries++;
            }
        }

        CleanupResult result = new CleanupResult(removedPoints, affectedSeries);
        if (removedPoints > 0) {
            logger.info("Cleaned up {} old data points from {} series", removedPoints, affectedSeries);
        }
        return result;
    }

    public long getRetentionPeriodMs() {
        return retentionPeriodMs;
    }

    public void setRetentionPeriodMs(long retentionPeriodMs) {
        if (retentionPeriodMs <= 0) {
            throw new IllegalArgumentException("Retention period must be positive");
        }
        this.retentionPeriodMs = retentionPeriodMs;
    }

    public int getMaxPointsPerSeries() {
        return maxPointsPerSeries;
    }

    public void setMaxPointsPerSeries(int maxPointsPerSeries) {
        if (maxPointsPerSeries <= 0) {
            throw new IllegalArgumentException("Max points per series must be positive");
        }
        this.maxPointsPerSeries = maxPointsPerSeries;
    }

    /**
     * Outcome of a retention sweep.
     */
    public static class CleanupResult {
        private final long removedPoints;
        private final int affectedSeries;

        public CleanupResult(long removedPoints, int affectedSeries) {
            this.removedPoints = removedPoints;
            this.affectedSeries = affectedSeries;
        }

        // Getters
        public long getRemovedPoints() { return removedPoints; }
        public int getAffectedSeries() { return affectedSeries; }

        @Override
        public String toString() {
            return String.format("CleanupResult{removedPoints=%d, affectedSeries=%d}", removedPoints, affectedSeries);
        }
    }
}

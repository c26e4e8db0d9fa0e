package com.metricstore.model;

/**
 * Point-in-time statistics of the store.
 */
public class StoreStats {

    private final int seriesCount;
    private final long totalPoints;
    private final Long oldestTimestamp;
    private final Long newestTimestamp;
    private final long retentionPeriodMs;
    private final int maxPointsPerSeries;
    private final boolean compressionEnabled;

    public StoreStats(int seriesCount, long totalPoints, Long oldestTimestamp, Long newestTimestamp,
                      long retentionPeriodMs, int maxPointsPerSeries, boolean compressionEnabled) {
        this.seriesCount = seriesCount;
        this.totalPoints = totalPoints;
        this.oldestTimestamp = oldestTimestamp;
        this.newestTimestamp = newestTimestamp;
        this.retentionPeriodMs = retentionPeriodMs;
        this.maxPointsPerSeries = maxPointsPerSeries;
        this.compressionEnabled = compressionEnabled;
    }

    // Getters
    public int getSeriesCount() { return seriesCount; }
    public long getTotalPoints() { return totalPoints; }
    public Long getOldestTimestamp() { return oldestTimestamp; }
    public Long getNewestTimestamp() { return newestTimestamp; }
    public long getRetentionPeriodMs() { return retentionPeriodMs; }
    public int getMaxPointsPerSeries() { return maxPointsPerSeries; }
    public boolean isCompressionEnabled() { return compressionEnabled; }

    public double getAveragePointsPerSeries() {
        return seriesCount > 0 ? (double) totalPoints / seriesCount : 0.0;
    }

    @Override
    public String toString() {
        return String.format("StoreStats{series=%d, points=%d, oldest=%s, newest=%s, retentionMs=%d, maxPoints=%d}",
                seriesCount, totalPoints, oldestTimestamp, newestTimestamp, retentionPeriodMs, maxPointsPerSeries);
    }
}

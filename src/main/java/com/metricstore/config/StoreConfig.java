package com.metricstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the metric store.
 */
@Component
@ConfigurationProperties(prefix = "store")
public class StoreConfig {

    /**
     * Maximum age of a point in milliseconds before it is evicted.
     */
    private long retentionPeriodMs = 24L * 60 * 60 * 1000;

    /**
     * Maximum number of points held per series; oldest points are evicted first.
     */
    private int maxPointsPerSeries = 10000;

    /**
     * Interval in milliseconds between snapshots to disk.
     */
    private long persistenceIntervalMs = 5L * 60 * 1000;

    /**
     * Interval in milliseconds between retention sweeps over all series.
     */
    private long cleanupIntervalMs = 60L * 60 * 1000;

    /**
     * Enable/disable lossy compaction on insert.
     */
    private boolean compressionEnabled = true;

    /**
     * Relative change (0.0 to 1.0) below which an interior point is considered redundant.
     */
    private double compressionThreshold = 0.05;

    /**
     * Minimum series length before compaction runs.
     */
    private int compactionMinPoints = 10;

    /**
     * Maximum number of points scanned by a single aggregate query.
     */
    private int aggregateScanLimit = 10000;

    /**
     * Limit applied to queries that do not specify one.
     */
    private int defaultQueryLimit = 1000;

    /**
     * Directory holding the snapshot file.
     */
    private String dataDirectory = "./data/timeseries";

    /**
     * Name of the snapshot file inside the data directory.
     */
    private String snapshotFileName = "timeseries.json";

    /**
     * Write a final snapshot when the scheduler stops.
     */
    private boolean snapshotOnShutdown = true;

    /**
     * Time in milliseconds to wait for an in-flight maintenance task on shutdown.
     */
    private long shutdownTimeoutMs = 10000;

    /**
     * Enable/disable the background cleanup and snapshot timers.
     */
    private boolean schedulerEnabled = true;

    // Getters and Setters
    public long getRetentionPeriodMs() {
        return retentionPeriodMs;
    }

    public void setRetentionPeriodMs(long retentionPeriodMs) {
        this.retentionPeriodMs = retentionPeriodMs;
    }

    public int getMaxPointsPerSeries() {
        return maxPointsPerSeries;
    }

    public void setMaxPointsPerSeries(int maxPointsPerSeries) {
        this.maxPointsPerSeries = maxPointsPerSeries;
    }

    public long getPersistenceIntervalMs() {
        return persistenceIntervalMs;
    }

    public void setPersistenceIntervalMs(long persistenceIntervalMs) {
        this.persistenceIntervalMs = persistenceIntervalMs;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public double getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(double compressionThreshold) {
        this.compressionThreshold = compressionThreshold;
    }

    public int getCompactionMinPoints() {
        return compactionMinPoints;
    }

    public void setCompactionMinPoints(int compactionMinPoints) {
        this.compactionMinPoints = compactionMinPoints;
    }

    public int getAggregateScanLimit() {
        return aggregateScanLimit;
    }

    public void setAggregateScanLimit(int aggregateScanLimit) {
        this.aggregateScanLimit = aggregateScanLimit;
    }

    public int getDefaultQueryLimit() {
        return defaultQueryLimit;
    }

    public void setDefaultQueryLimit(int defaultQueryLimit) {
        this.defaultQueryLimit = defaultQueryLimit;
    }

    public String getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public String getSnapshotFileName() {
        return snapshotFileName;
    }

    public void setSnapshotFileName(String snapshotFileName) {
        this.snapshotFileName = snapshotFileName;
    }

    public boolean isSnapshotOnShutdown() {
        return snapshotOnShutdown;
    }

    public void setSnapshotOnShutdown(boolean snapshotOnShutdown) {
        this.snapshotOnShutdown = snapshotOnShutdown;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    @Override
    public String toString() {
        return String.format("StoreConfig{retentionPeriodMs=%d, maxPointsPerSeries=%d, persistenceIntervalMs=%d, " +
                           "cleanupIntervalMs=%d, compressionEnabled=%s, compressionThreshold=%.3f, " +
                           "dataDirectory='%s', snapshotFileName='%s'}",
                retentionPeriodMs, maxPointsPerSeries, persistenceIntervalMs, cleanupIntervalMs,
                compressionEnabled, compressionThreshold, dataDirectory, snapshotFileName);
    }
}

package com.metricstore.scheduler;

import com.metricstore.config.StoreConfig;
import com.metricstore.persistence.PersistenceGateway;
import com.metricstore.storage.RetentionEnforcer;
import com.metricstore.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the periodic retention sweep and snapshot of the store.
 *
 * Both ticks run on a dedicated executor and can also be invoked directly. Stopping
 * the scheduler cancels future ticks, waits for a tick already in progress (so a
 * snapshot being written is completed), and then writes a final snapshot if configured.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PersistenceGateway persistenceGateway;

    @Autowired
    private StoreConfig config;

    private ScheduledExecutorService executor;
    private volatile boolean running;

    @PostConstruct
    public void initialize() {
        if (!config.isSchedulerEnabled()) {
            logger.info("Maintenance scheduler disabled by configuration");
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }

        executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "store-maintenance");
            t.setDaemon(true);
            return t;
        });

        executor.scheduleAtFixedRate(
            this::runCleanup,
            config.getCleanupIntervalMs(),
            config.getCleanupIntervalMs(),
            TimeUnit.MILLISECONDS
        );
        executor.scheduleAtFixedRate(
            this::runSnapshot,
            config.getPersistenceIntervalMs(),
            config.getPersistenceIntervalMs(),
            TimeUnit.MILLISECONDS
        );

        running = true;
        logger.info("Maintenance scheduler started: cleanup every {}ms, snapshot every {}ms",
                config.getCleanupIntervalMs(), config.getPersistenceIntervalMs());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.info("Stopping maintenance scheduler");

        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warn("Maintenance task did not finish within {}ms, interrupting", config.getShutdownTimeoutMs());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        if (config.isSnapshotOnShutdown()) {
            persistenceGateway.snapshot();
        }

        logger.info("Maintenance scheduler stopped");
    }

    /**
     * One retention sweep. Failures are logged so the periodic schedule survives them.
     */
    public void runCleanup() {
        try {
            RetentionEnforcer.CleanupResult result = store.cleanup();
            logger.debug("Cleanup tick completed: {}", result);
        } catch (RuntimeException e) {
            logger.error("Cleanup tick failed", e);
        }
    }

    /**
     * One snapshot. Failures are logged so the periodic schedule survives them.
     */
    public void runSnapshot() {
        try {
            persistenceGateway.snapshot();
        } catch (RuntimeException e) {
            logger.error("Snapshot tick failed", e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * True once the executor of the last run has shut down and all its threads have exited.
     */
    public boolean isTerminated() {
        ScheduledExecutorService current = executor;
        return current == null || current.isTerminated();
    }
}

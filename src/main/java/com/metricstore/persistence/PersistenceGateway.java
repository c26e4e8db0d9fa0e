package com.metricstore.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricstore.config.StoreConfig;
import com.metricstore.model.MetricPoint;
import com.metricstore.model.SeriesKey;
import com.metricstore.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshots the store to a single JSON file and restores it at startup.
 *
 * The file is one object mapping each series key string to its points
 * ({@code timestamp}, {@code fields}, {@code tags}) in series order. Writes go to a
 * temporary file which is then renamed over the previous snapshot, so a reader never
 * sees a partial file. Persistence is best-effort: failures are logged and leave the
 * in-memory store untouched.
 */
@Component
public class PersistenceGateway {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceGateway.class);

    private static final TypeReference<LinkedHashMap<String, List<MetricPoint>>> SNAPSHOT_TYPE =
            new TypeReference<LinkedHashMap<String, List<MetricPoint>>>() {};

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private StoreConfig config;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Object writeLock = new Object();

    private Path dataDirectory;
    private Path snapshotFile;

    @PostConstruct
    public void init() {
        dataDirectory = Paths.get(config.getDataDirectory());
        snapshotFile = dataDirectory.resolve(config.getSnapshotFileName());

        try {
            if (!Files.exists(dataDirectory)) {
                Files.createDirectories(dataDirectory);
                logger.info("Created time-series data directory: {}", dataDirectory);
            }
        } catch (IOException e) {
            logger.error("Failed to create data directory: {}", dataDirectory, e);
        }

        load();
    }

    /**
     * Writes every series to the snapshot file.
     *
     * @return true if the snapshot was written
     */
    public boolean snapshot() {
        Map<SeriesKey, List<MetricPoint>> view = store.snapshotView();

        Map<String, List<MetricPoint>> dataToPersist = new LinkedHashMap<>();
        long totalPoints = 0;
        for (Map.Entry<SeriesKey, List<MetricPoint>> entry : view.entrySet()) {
            dataToPersist.put(entry.getKey().toString(), entry.getValue());
            totalPoints += entry.getValue().size();
        }

        synchronized (writeLock) {
            Path tempFile = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
            try {
                Files.createDirectories(dataDirectory);
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), dataToPersist);
                moveIntoPlace(tempFile);
                logger.debug("Persisted {} series ({} points) to {}", dataToPersist.size(), totalPoints, snapshotFile);
                return true;
            } catch (IOException e) {
                logger.error("Error persisting time-series data to {}", snapshotFile, e);
                deleteQuietly(tempFile);
                return false;
            }
        }
    }

    /**
     * Replaces the store contents with the snapshot file, if one exists.
     *
     * @return number of series restored; 0 on a cold start or when the file cannot be read
     */
    public int load() {
        if (!Files.exists(snapshotFile)) {
            logger.info("No snapshot found at {}, starting with an empty store", snapshotFile);
            return 0;
        }

        Map<String, List<MetricPoint>> persisted;
        try {
            persisted = objectMapper.readValue(snapshotFile.toFile(), SNAPSHOT_TYPE);
        } catch (IOException e) {
            logger.error("Error loading persisted time-series data from {}", snapshotFile, e);
            return 0;
        }
        if (persisted == null) {
            logger.warn("Snapshot {} is empty", snapshotFile);
            return 0;
        }

        Map<SeriesKey, List<MetricPoint>> restored = new LinkedHashMap<>();
        for (Map.Entry<String, List<MetricPoint>> entry : persisted.entrySet()) {
            SeriesKey key;
            try {
                key = SeriesKey.parse(entry.getKey());
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unreadable series key '{}': {}", entry.getKey(), e.getMessage());
                continue;
            }

            List<MetricPoint> points = new ArrayList<>();
            int rejected = 0;
            if (entry.getValue() != null) {
                for (MetricPoint point : entry.getValue()) {
                    if (point != null && point.isWellFormed()) {
                        points.add(point);
                    } else {
                        rejected++;
                    }
                }
            }
            if (rejected > 0) {
                logger.warn("Skipped {} malformed points in series '{}'", rejected, entry.getKey());
            }
            restored.put(key, points);
        }

        store.restore(restored);
        logger.info("Loaded {} series from disk", restored.size());
        return restored.size();
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, snapshotFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, snapshotFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to remove temporary snapshot file {}", file, e);
        }
    }
}

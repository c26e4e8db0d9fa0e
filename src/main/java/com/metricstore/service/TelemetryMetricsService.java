package com.metricstore.service;

import com.metricstore.model.AggregateRequest;
import com.metricstore.model.AggregateResult;
import com.metricstore.model.Aggregation;
import com.metricstore.model.MetricPoint;
import com.metricstore.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer for per-car race telemetry.
 * Maps car samples onto measurements tagged by {@code carId}.
 */
@Service
public class TelemetryMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryMetricsService.class);

    public static final String SPEED = "speed";
    public static final String POSITION = "position";
    public static final String TIRE_TEMP = "tire_temp";
    public static final String ENGINE = "engine";

    public static final String CAR_ID_TAG = "carId";
    public static final String VALUE_FIELD = "value";

    public static final long DEFAULT_HISTORY_MS = 60L * 60 * 1000;

    @Autowired
    private TimeSeriesStore store;

    public boolean recordSpeed(String carId, double speed, Long timestamp) {
        return record(SPEED, carId, Map.of(VALUE_FIELD, speed), timestamp);
    }

    public boolean recordPosition(String carId, double x, double y, double z, Long timestamp) {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("x", x);
        fields.put("y", y);
        fields.put("z", z);
        return record(POSITION, carId, fields, timestamp);
    }

    /**
     * Records one temperature per tire, e.g. {@code frontLeft}, {@code frontRight}.
     */
    public boolean recordTireTemperatures(String carId, Map<String, Double> temperatures, Long timestamp) {
        return record(TIRE_TEMP, carId, temperatures, timestamp);
    }

    public boolean recordEngineData(String carId, Map<String, Double> engineData, Long timestamp) {
        return record(ENGINE, carId, engineData, timestamp);
    }

    public List<MetricPoint> speedHistory(String carId, long timeRangeMs) {
        return store.query(SPEED, carTags(carId), timeRangeMs, null);
    }

    public List<MetricPoint> speedHistory(String carId) {
        return speedHistory(carId, DEFAULT_HISTORY_MS);
    }

    public List<MetricPoint> positionHistory(String carId, long timeRangeMs) {
        return store.query(POSITION, carTags(carId), timeRangeMs, null);
    }

    public List<MetricPoint> positionHistory(String carId) {
        return positionHistory(carId, DEFAULT_HISTORY_MS);
    }

    /**
     * Average speed over the window, or null if the car has no samples in it.
     */
    public Double averageSpeed(String carId, long timeRangeMs) {
        return speedAggregate(carId, timeRangeMs, Aggregation.AVG);
    }

    public Double averageSpeed(String carId) {
        return averageSpeed(carId, DEFAULT_HISTORY_MS);
    }

    /**
     * Top speed over the window, or null if the car has no samples in it.
     */
    public Double maxSpeed(String carId, long timeRangeMs) {
        return speedAggregate(carId, timeRangeMs, Aggregation.MAX);
    }

    public Double maxSpeed(String carId) {
        return maxSpeed(carId, DEFAULT_HISTORY_MS);
    }

    private Double speedAggregate(String carId, long timeRangeMs, Aggregation aggregation) {
        AggregateResult result = store.aggregate(
                new AggregateRequest(SPEED, carTags(carId), timeRangeMs, aggregation, null, VALUE_FIELD));
        return result.getValue();
    }

    private boolean record(String measurement, String carId, Map<String, Double> fields, Long timestamp) {
        if (carId == null || carId.isEmpty()) {
            logger.warn("Dropping {} sample without a car id", measurement);
            return false;
        }
        boolean stored = store.insert(measurement, carTags(carId), fields, timestamp);
        if (stored) {
            logger.debug("Recorded {} sample for car {}", measurement, carId);
        }
        return stored;
    }

    private static Map<String, String> carTags(String carId) {
        return Map.of(CAR_ID_TAG, carId);
    }
}

package com.metricstore.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricstore.model.AggregateRequest;
import com.metricstore.model.AggregateResult;
import com.metricstore.model.Aggregation;
import com.metricstore.model.MetricPoint;
import com.metricstore.model.QueryRequest;
import com.metricstore.model.StoreStats;
import com.metricstore.model.WriteRequest;
import com.metricstore.persistence.PersistenceGateway;
import com.metricstore.storage.RetentionEnforcer;
import com.metricstore.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for metric store operations.
 */
@RestController
@RequestMapping("/api/v1/timeseries")
public class TimeseriesController {

    private static final Logger logger = LoggerFactory.getLogger(TimeseriesController.class);

    private static final String MEASUREMENT_REQUIRED = "Measurement parameter is required";
    private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<Map<String, String>>() {};

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PersistenceGateway persistenceGateway;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Write a single point.
     * POST /api/v1/timeseries/write
     */
    @PostMapping("/write")
    public ResponseEntity<Map<String, Object>> write(@RequestBody WriteRequest request) {
        if (isBlank(request.getMeasurement())) {
            return ResponseEntity.badRequest().body(createErrorResponse(MEASUREMENT_REQUIRED));
        }

        boolean stored = store.insert(request.getMeasurement(), request.getTags(), request.getFields(),
                request.getTimestamp());
        if (!stored) {
            return ResponseEntity.badRequest().body(createErrorResponse("Point rejected: " + request));
        }

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Point written successfully");
        return ResponseEntity.ok(response);
    }

    /**
     * Query points, newest first.
     * GET /api/v1/timeseries/query?measurement=speed&tags={"carId":"1"}&timeRange=3600000&limit=1000
     */
    @GetMapping("/query")
    public ResponseEntity<Map<String, Object>> query(@RequestParam(required = false) String measurement,
                                                     @RequestParam(required = false) String tags,
                                                     @RequestParam(defaultValue = "3600000") long timeRange,
                                                     @RequestParam(defaultValue = "1000") int limit) {
        if (isBlank(measurement)) {
            return ResponseEntity.badRequest().body(createErrorResponse(MEASUREMENT_REQUIRED));
        }

        try {
            List<MetricPoint> points = store.query(new QueryRequest(measurement, parseTags(tags), timeRange, limit));
            return ResponseEntity.ok(createDataResponse(points));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid query: {}", e.getMessage());
            return ResponseEntity.badRequest().body(createErrorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error getting time-series data", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(createErrorResponse("Internal server error"));
        }
    }

    /**
     * Aggregate a field over matching points.
     * GET /api/v1/timeseries/aggregate?measurement=speed&aggregation=max&groupBy=carId
     */
    @GetMapping("/aggregate")
    public ResponseEntity<Map<String, Object>> aggregate(@RequestParam(required = false) String measurement,
                                                         @RequestParam(required = false) String tags,
                                                         @RequestParam(defaultValue = "3600000") long timeRange,
                                                         @RequestParam(defaultValue = "avg") String aggregation,
                                                         @RequestParam(required = false) String groupBy,
                                                         @RequestParam(required = false) String field) {
        if (isBlank(measurement)) {
            return ResponseEntity.badRequest().body(createErrorResponse(MEASUREMENT_REQUIRED));
        }

        try {
            AggregateRequest request = new AggregateRequest(measurement, parseTags(tags), timeRange,
                    Aggregation.fromName(aggregation), groupBy, field);
            AggregateResult result = store.aggregate(request);
            return ResponseEntity.ok(createDataResponse(result.asObject()));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid aggregate query: {}", e.getMessage());
            return ResponseEntity.badRequest().body(createErrorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error getting aggregated data", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(createErrorResponse("Internal server error"));
        }
    }

    /**
     * Store statistics.
     * GET /api/v1/timeseries/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(store.stats());
    }

    /**
     * Write a snapshot now.
     * POST /api/v1/timeseries/snapshot
     */
    @PostMapping("/snapshot")
    public ResponseEntity<Map<String, Object>> snapshot() {
        if (!persistenceGateway.snapshot()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(createErrorResponse("Snapshot failed"));
        }
        return ResponseEntity.ok(createDataResponse(persistenceGateway.getSnapshotFile().toString()));
    }

    /**
     * Run a retention sweep now.
     * POST /api/v1/timeseries/cleanup
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        RetentionEnforcer.CleanupResult result = store.cleanup();
        return ResponseEntity.ok(createDataResponse(result));
    }

    /**
     * Compact every series now. Discarded points cannot be recovered.
     * POST /api/v1/timeseries/compact
     */
    @PostMapping("/compact")
    public ResponseEntity<Map<String, Object>> compact() {
        int removed = store.compactAll();
        return ResponseEntity.ok(createDataResponse(Map.of("removedPoints", removed)));
    }

    private Map<String, String> parseTags(String tags) {
        if (isBlank(tags)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, String> parsed = objectMapper.readValue(tags, TAGS_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags must be a JSON object of strings: " + tags, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private Map<String, Object> createDataResponse(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", data);
        return response;
    }

    /**
     * Creates an error response map.
     */
    private Map<String, Object> createErrorResponse(String error) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", error);
        return response;
    }
}

package com.metricstore.storage;

import com.metricstore.model.QueryRequest;
import com.metricstore.model.SeriesKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps series keys to their series. Series are created lazily and stay indexed
 * after their points expire.
 */
public class SeriesIndex {

    private final Map<SeriesKey, Series> series = new ConcurrentHashMap<>();

    public Series getOrCreate(SeriesKey key) {
        return series.computeIfAbsent(key, Series::new);
    }

    public Series get(SeriesKey key) {
        return series.get(key);
    }

    /**
     * Returns every series selected by the query's measurement and tag filter.
     */
    public List<Series> findMatching(QueryRequest request) {
        List<Series> matching = new ArrayList<>();
        for (Series candidate : series.values()) {
            if (request.matches(candidate.getKey())) {
                matching.add(candidate);
            }
        }
        return matching;
    }

    public Collection<Series> all() {
        return new ArrayList<>(series.values());
    }

    public int size() {
        return series.size();
    }

    public void clear() {
        series.clear();
    }
}

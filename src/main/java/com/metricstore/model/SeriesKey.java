package com.metricstore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identity of a series: a measurement plus its tags sorted by tag name.
 *
 * Two keys built from the same measurement and tag set are equal regardless of the
 * iteration order of the supplied tag map. The canonical string form
 * {@code measurement,tag1=val1,tag2=val2} backslash-escapes {@code \ , =} inside each
 * component so that {@link #parse(String)} always recovers the original key.
 */
public final class SeriesKey {

    private final String measurement;
    private final SortedMap<String, String> tags;

    public SeriesKey(String measurement, Map<String, String> tags) {
        this.measurement = Objects.requireNonNull(measurement, "Measurement cannot be null");
        if (measurement.isBlank()) {
            throw new IllegalArgumentException("Measurement cannot be empty");
        }

        TreeMap<String, String> sorted = new TreeMap<>();
        if (tags != null) {
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (tag.getKey() == null || tag.getValue() == null) {
                    throw new IllegalArgumentException("Tag keys and values cannot be null");
                }
                sorted.put(tag.getKey(), tag.getValue());
            }
        }
        this.tags = Collections.unmodifiableSortedMap(sorted);
    }

    public SeriesKey(String measurement) {
        this(measurement, null);
    }

    public String getMeasurement() {
        return measurement;
    }

    public SortedMap<String, String> getTags() {
        return tags;
    }

    /**
     * Checks whether this series is selected by a query: same measurement, and every
     * query tag present here with an equal value. Tags not named by the query are free.
     */
    public boolean matches(String queryMeasurement, Map<String, String> queryTags) {
        if (!measurement.equals(queryMeasurement)) {
            return false;
        }

        if (queryTags != null) {
            for (Map.Entry<String, String> requiredTag : queryTags.entrySet()) {
                if (!Objects.equals(requiredTag.getValue(), tags.get(requiredTag.getKey()))) {
                    return false;
                }
            }
        }

        return true;
    }

    /**
     * Parses the canonical string form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the string is not a well-formed key
     */
    public static SeriesKey parse(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Series key cannot be empty");
        }

        List<String> parts = splitUnescaped(key, ',');
        String measurement = unescape(parts.get(0));

        Map<String, String> tags = new TreeMap<>();
        for (String part : parts.subList(1, parts.size())) {
            List<String> kv = splitUnescaped(part, '=');
            if (kv.size() != 2 || kv.get(0).isEmpty()) {
                throw new IllegalArgumentException("Malformed tag '" + part + "' in series key: " + key);
            }
            tags.put(unescape(kv.get(0)), unescape(kv.get(1)));
        }

        return new SeriesKey(measurement, tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        SeriesKey that = (SeriesKey) o;
        return measurement.equals(that.measurement) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags);
    }

    /**
     * Canonical string form, used as the series identifier in snapshot files.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(escape(measurement));
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            sb.append(',').append(escape(tag.getKey())).append('=').append(escape(tag.getValue()));
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace(",", "\\,").replace("=", "\\=");
    }

    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder();
        boolean esc = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (esc) {
                sb.append(c);
                esc = false;
            } else if (c == '\\') {
                esc = true;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // Splits on the delimiter, leaving escape sequences in place for unescape()
    private static List<String> splitUnescaped(String s, char delimiter) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean esc = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (esc) {
                current.append(c);
                esc = false;
            } else if (c == '\\') {
                current.append(c);
                esc = true;
            } else if (c == delimiter) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (esc) {
            throw new IllegalArgumentException("Dangling escape in series key: " + s);
        }
        parts.add(current.toString());
        return parts;
    }
}

package com.metricstore.model;

import java.util.List;
import java.util.Locale;

/**
 * Reduction functions supported by aggregate queries.
 */
public enum Aggregation {

    AVG {
        @Override
        public double apply(List<Double> values) {
            return SUM.apply(values) / values.size();
        }
    },

    SUM {
        @Override
        public double apply(List<Double> values) {
            double sum = 0;
            for (double v : values) {
                sum += v;
            }
            return sum;
        }
    },

    MIN {
        @Override
        public double apply(List<Double> values) {
            double min = Double.POSITIVE_INFINITY;
            for (double v : values) {
                min = Math.min(min, v);
            }
            return min;
        }
    },

    MAX {
        @Override
        public double apply(List<Double> values) {
            double max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                max = Math.max(max, v);
            }
            return max;
        }
    },

    COUNT {
        @Override
        public double apply(List<Double> values) {
            return values.size();
        }
    };

    /**
     * Reduces a non-empty list of values.
     */
    public abstract double apply(List<Double> values);

    /**
     * Resolves a function by name, case-insensitively. Unknown or missing names yield {@link #AVG}.
     */
    public static Aggregation fromName(String name) {
        if (name == null) {
            return AVG;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return AVG;
        }
    }
}

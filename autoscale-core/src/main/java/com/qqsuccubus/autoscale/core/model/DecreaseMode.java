package com.qqsuccubus.autoscale.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregation applied to replica samples when checking for scale-down.
 */
public enum DecreaseMode {
    /**
     * Statistical median of the samples.
     */
    MEDIAN,

    /**
     * Largest sample. Scale-down only happens when every replica is below the threshold.
     */
    MAX;

    /**
     * Aggregates samples according to this mode.
     *
     * @param values sample values, must not be empty
     * @return aggregated value
     */
    public double aggregate(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty sample set");
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        if (this == MAX) {
            return sorted[sorted.length - 1];
        }
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Parses a label value, case-insensitive.
     *
     * @param value raw label value, may be null
     * @return parsed mode, empty when absent or unknown
     */
    public static Optional<DecreaseMode> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(DecreaseMode.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.qqsuccubus.autoscale.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Resource whose utilization drives scaling of a service.
 */
public enum MetricType {
    CPU("cpu"),
    MEMORY("memory");

    private final String label;

    MetricType(String label) {
        this.label = label;
    }

    /**
     * Lower-case form used in labels, reasons and routing keys.
     */
    public String label() {
        return label;
    }

    /**
     * Parses a label value ({@code cpu} or {@code memory}, case-insensitive).
     *
     * @param value raw label value, may be null
     * @return parsed metric, empty when the value is absent or unknown
     */
    public static Optional<MetricType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MetricType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}

package com.qqsuccubus.autoscale.controller.metrics;

import java.util.Locale;

/**
 * Where per-replica utilization is read from.
 */
public enum MetricsSourceType {
    /**
     * Kubelet Summary API, one call per node through the API server proxy.
     */
    KUBELET,

    /**
     * Prometheus HTTP API over cAdvisor series, one query per service.
     */
    PROMETHEUS;

    public static MetricsSourceType fromString(String value) {
        if (value == null || value.isBlank()) {
            return KUBELET;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown METRICS_SOURCE '" + value + "', expected kubelet or prometheus", e);
        }
    }
}

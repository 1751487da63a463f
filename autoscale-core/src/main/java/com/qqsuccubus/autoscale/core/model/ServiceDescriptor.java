package com.qqsuccubus.autoscale.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Resolved autoscaling configuration and observed state of one orchestrated service.
 * <p>
 * Built by the service registry from the service's labels and published only as part of a
 * {@link CacheSnapshot}. Instances are never modified after publication; equality over all
 * fields is what the registry uses to decide whether a refresh changed anything.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ServiceDescriptor {
    /**
     * Stable identifier, {@code namespace/name}.
     */
    String serviceId;

    String name;

    String namespace;

    /**
     * Whether the {@code autoscale} label is truthy.
     */
    boolean autoscaleEnabled;

    MetricType metric;

    int minReplicas;

    int maxReplicas;

    /**
     * Per-service lower threshold override, null when the global default applies.
     */
    Integer percentageMin;

    /**
     * Per-service upper threshold override, null when the global default applies.
     */
    Integer percentageMax;

    DecreaseMode decreaseMode;

    /**
     * When set, replica counts moved outside [min, max] by hand are walked back one step per tick.
     */
    boolean disableManualReplicas;

    /**
     * Desired replica count observed at discovery time.
     */
    int currentReplicas;

    Instant lastUpdated;

    /**
     * Orchestrator spec generation, bumps on every spec change.
     */
    long generation;

    /**
     * Problems found while parsing labels; defaults were substituted for each of them.
     */
    @Singular
    List<String> warnings;

    public double effectivePercentageMin(double globalDefault) {
        return percentageMin != null ? percentageMin : globalDefault;
    }

    public double effectivePercentageMax(double globalDefault) {
        return percentageMax != null ? percentageMax : globalDefault;
    }
}

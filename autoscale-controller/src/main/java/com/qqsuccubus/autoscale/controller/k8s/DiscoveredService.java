package com.qqsuccubus.autoscale.controller.k8s;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * A workload as listed by the orchestrator, before its labels are interpreted.
 */
@Value
@Builder(toBuilder = true)
@With
public class DiscoveredService {
    /**
     * {@code namespace/name}
     */
    String serviceId;

    String name;

    String namespace;

    /**
     * Metadata labels, with annotations of the same key used only where no label exists.
     */
    Map<String, String> labels;

    /**
     * Desired replica count from the workload spec.
     */
    int replicas;

    /**
     * Version used for optimistic locking of updates.
     */
    String resourceVersion;

    long generation;

    Instant lastUpdated;

    public static String serviceId(String namespace, String name) {
        return namespace + "/" + name;
    }
}

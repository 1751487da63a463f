package com.qqsuccubus.autoscale.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One running instance of a service, as reported by the orchestrator.
 */
@Value
@Builder(toBuilder = true)
@With
public class Replica {
    /**
     * Replica identifier (pod name).
     */
    String replicaId;

    String namespace;

    /**
     * Node the replica is scheduled on. Used to fan out node-local stats calls.
     */
    String nodeName;

    /**
     * Sum of container CPU limits in cores, 0 when no limit is configured.
     */
    double cpuLimitCores;

    /**
     * Sum of container memory limits in bytes, 0 when no limit is configured.
     */
    long memoryLimitBytes;

    public boolean hasCpuLimit() {
        return cpuLimitCores > 0;
    }

    public boolean hasMemoryLimit() {
        return memoryLimitBytes > 0;
    }
}

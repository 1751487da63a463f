package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Resolves node allocatable capacity for replicas that run without a limit.
 */
class NodeCapacityLookup {
    private static final Logger log = LoggerFactory.getLogger(NodeCapacityLookup.class);

    private final IOrchestratorClient orchestrator;
    private final Duration timeout;

    NodeCapacityLookup(IOrchestratorClient orchestrator, Duration timeout) {
        this.orchestrator = orchestrator;
        this.timeout = timeout;
    }

    static NodeCapacity unknown(String nodeName) {
        return new NodeCapacity(nodeName, 0.0, 0L);
    }

    /**
     * Capacity of the node, or {@link #unknown(String)} when not needed or not available.
     * Only called out to the orchestrator if one of the replicas lacks a limit for the metric.
     */
    Mono<NodeCapacity> capacityFor(String nodeName, List<Replica> replicas, MetricType metric) {
        boolean needed = replicas.stream().anyMatch(replica -> metric == MetricType.CPU
            ? !replica.hasCpuLimit()
            : !replica.hasMemoryLimit());
        if (!needed || nodeName == null) {
            return Mono.just(unknown(nodeName));
        }
        return orchestrator.nodeCapacity(nodeName)
            .timeout(timeout)
            .defaultIfEmpty(unknown(nodeName))
            .onErrorResume(err -> {
                log.debug("Capacity of node {} unavailable: {}", nodeName, err.toString());
                return Mono.just(unknown(nodeName));
            });
    }
}

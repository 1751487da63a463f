package com.qqsuccubus.autoscale.controller.k8s;

import com.qqsuccubus.autoscale.core.model.Replica;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Access to the container orchestrator (Dependency Inversion Principle).
 * <p>
 * Every call is bounded by the configured orchestrator timeout. Enables testing with in-memory
 * implementations.
 * </p>
 */
public interface IOrchestratorClient {

    /**
     * Lists workloads carrying the autoscale label, whatever its value.
     * Fails with {@link DiscoveryException} when the listing call fails.
     */
    Mono<List<DiscoveredService>> listServices();

    /**
     * Re-reads one workload. Empty when it no longer exists.
     */
    Mono<DiscoveredService> inspect(String serviceId);

    /**
     * Lists the running replicas of a workload. Empty list when none are running.
     */
    Mono<List<Replica>> listRunningReplicas(String serviceId);

    /**
     * Sets the desired replica count of a workload, failing on a concurrent modification.
     *
     * @param observed workload state read immediately before, its resource version guards the update
     * @param replicas new replica count
     * @return Mono completing when the orchestrator accepted the update, or failing with
     * {@link ScaleActionException}
     */
    Mono<Void> updateReplicas(DiscoveredService observed, int replicas);

    /**
     * Raw node-local stats summary (kubelet Summary API JSON). Empty when the node is unreachable.
     */
    Mono<String> nodeStatsSummary(String nodeName);

    /**
     * Allocatable capacity of a node. Empty when unknown.
     */
    Mono<NodeCapacity> nodeCapacity(String nodeName);

    void close();
}

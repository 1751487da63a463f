package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.k8s.DiscoveredService;
import com.qqsuccubus.autoscale.controller.k8s.DiscoveryException;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.model.Replica;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory orchestrator for tests. Updates change the stored replica count and bump the
 * resource version like the API server would.
 */
public class StubOrchestratorClient implements IOrchestratorClient {

    private final Map<String, DiscoveredService> services = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, List<Replica>> replicas = new HashMap<>();
    private final Map<String, String> nodeSummaries = new HashMap<>();
    private final Map<String, NodeCapacity> nodeCapacities = new HashMap<>();

    public final List<String> updates = new CopyOnWriteArrayList<>();
    public volatile boolean failListing;
    public volatile RuntimeException updateError;
    public volatile int listCalls;

    /**
     * Adds or replaces a workload with the given labels and desired replica count.
     */
    public StubOrchestratorClient service(String namespace, String name, int desired, Map<String, String> labels) {
        String id = DiscoveredService.serviceId(namespace, name);
        services.put(id, DiscoveredService.builder()
            .serviceId(id)
            .name(name)
            .namespace(namespace)
            .labels(labels)
            .replicas(desired)
            .resourceVersion("1")
            .generation(1)
            .lastUpdated(Instant.parse("2024-05-01T10:00:00Z"))
            .build());
        return this;
    }

    public StubOrchestratorClient replicas(String serviceId, List<Replica> running) {
        replicas.put(serviceId, running);
        return this;
    }

    public StubOrchestratorClient nodeSummary(String nodeName, String summaryJson) {
        nodeSummaries.put(nodeName, summaryJson);
        return this;
    }

    public StubOrchestratorClient nodeCapacity(NodeCapacity capacity) {
        nodeCapacities.put(capacity.getNodeName(), capacity);
        return this;
    }

    public void remove(String serviceId) {
        services.remove(serviceId);
    }

    public int desiredReplicas(String serviceId) {
        return services.get(serviceId).getReplicas();
    }

    @Override
    public Mono<List<DiscoveredService>> listServices() {
        listCalls++;
        if (failListing) {
            return Mono.error(new DiscoveryException("API server unreachable", null));
        }
        synchronized (services) {
            return Mono.just(new ArrayList<>(services.values()));
        }
    }

    @Override
    public Mono<DiscoveredService> inspect(String serviceId) {
        return Mono.justOrEmpty(services.get(serviceId));
    }

    @Override
    public Mono<List<Replica>> listRunningReplicas(String serviceId) {
        return Mono.just(replicas.getOrDefault(serviceId, List.of()));
    }

    @Override
    public Mono<Void> updateReplicas(DiscoveredService observed, int count) {
        updates.add(observed.getServiceId() + "=" + count);
        if (updateError != null) {
            return Mono.error(updateError);
        }
        DiscoveredService current = services.get(observed.getServiceId());
        long version = Long.parseLong(current.getResourceVersion()) + 1;
        services.put(observed.getServiceId(), current
            .withReplicas(count)
            .withResourceVersion(String.valueOf(version))
            .withGeneration(current.getGeneration() + 1));
        return Mono.empty();
    }

    @Override
    public Mono<String> nodeStatsSummary(String nodeName) {
        String summary = nodeSummaries.get(nodeName);
        return summary != null
            ? Mono.just(summary)
            : Mono.error(new IllegalStateException("node " + nodeName + " unreachable"));
    }

    @Override
    public Mono<NodeCapacity> nodeCapacity(String nodeName) {
        return Mono.justOrEmpty(nodeCapacities.get(nodeName));
    }

    @Override
    public void close() {
    }
}

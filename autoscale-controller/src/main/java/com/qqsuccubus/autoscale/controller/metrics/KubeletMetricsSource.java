package com.qqsuccubus.autoscale.controller.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.metrics.MetricsTags;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Reads utilization from the kubelet Summary API of each node that hosts a replica.
 * <p>
 * Replicas are grouped by node and the nodes are queried in parallel, bounded by the node
 * fan-out concurrency. A node that cannot be reached drops only the replicas it hosts.
 * </p>
 */
public class KubeletMetricsSource implements IMetricsSource {
    private static final Logger log = LoggerFactory.getLogger(KubeletMetricsSource.class);

    private static final double NANO = 1_000_000_000.0;

    private final IOrchestratorClient orchestrator;
    private final NodeCapacityLookup capacities;
    private final Duration timeout;
    private final int fanoutConcurrency;
    private final Counter droppedSamples;

    public KubeletMetricsSource(IOrchestratorClient orchestrator, AutoscalerConfig config, MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.timeout = config.getMetricsTimeout();
        this.capacities = new NodeCapacityLookup(orchestrator, timeout);
        this.fanoutConcurrency = Math.max(1, config.getNodeFanoutConcurrency());
        this.droppedSamples = Counter.builder(MetricsNames.SAMPLES_DROPPED_TOTAL)
            .tag(MetricsTags.SOURCE, "kubelet")
            .register(meterRegistry);
    }

    @Override
    public MetricsSourceType type() {
        return MetricsSourceType.KUBELET;
    }

    @Override
    public Mono<List<MetricSample>> collect(String serviceId, List<Replica> replicas, MetricType metric) {
        Map<String, List<Replica>> byNode = new LinkedHashMap<>();
        for (Replica replica : replicas) {
            if (replica.getNodeName() == null) {
                log.debug("Replica {} of {} is not scheduled; skipping", replica.getReplicaId(), serviceId);
                droppedSamples.increment();
                continue;
            }
            byNode.computeIfAbsent(replica.getNodeName(), node -> new ArrayList<>()).add(replica);
        }

        return Flux.fromIterable(byNode.entrySet())
            .flatMap(entry -> collectNode(serviceId, entry.getKey(), entry.getValue(), metric), fanoutConcurrency)
            .flatMapIterable(samples -> samples)
            .collectList();
    }

    private Mono<List<MetricSample>> collectNode(String serviceId, String nodeName, List<Replica> replicas,
                                                 MetricType metric) {
        return Mono.zip(
                orchestrator.nodeStatsSummary(nodeName).timeout(timeout),
                capacities.capacityFor(nodeName, replicas, metric)
            )
            .map(tuple -> {
                List<MetricSample> samples = parseSummary(
                    tuple.getT1(), serviceId, replicas, metric, tuple.getT2(), System.currentTimeMillis());
                if (samples.size() < replicas.size()) {
                    droppedSamples.increment(replicas.size() - samples.size());
                }
                return samples;
            })
            .defaultIfEmpty(List.of())
            .onErrorResume(err -> {
                log.debug("Stats of node {} unavailable for {}: {}", nodeName, serviceId, err.toString());
                droppedSamples.increment(replicas.size());
                return Mono.just(List.of());
            });
    }

    /**
     * Extracts samples for the given replicas from a kubelet Summary API document.
     * Pods of other services on the same node are ignored.
     */
    static List<MetricSample> parseSummary(String json, String serviceId, List<Replica> replicas,
                                           MetricType metric, NodeCapacity node, long timestampMs) {
        Map<String, Replica> wanted = replicas.stream()
            .collect(Collectors.toMap(KubeletMetricsSource::podKey, replica -> replica, (a, b) -> a));

        List<MetricSample> samples = new ArrayList<>();
        JsonNode pods = JsonUtils.readTree(json).path("pods");
        for (JsonNode pod : pods) {
            JsonNode ref = pod.path("podRef");
            Replica replica = wanted.get(ref.path("namespace").asText() + "/" + ref.path("name").asText());
            if (replica == null) {
                continue;
            }

            OptionalDouble value = metric == MetricType.CPU
                ? cpuPercent(pod, replica, node)
                : memoryPercent(pod, replica, node);
            if (value.isPresent()) {
                samples.add(new MetricSample(serviceId, replica.getReplicaId(), value.getAsDouble(), timestampMs));
            } else {
                log.debug("No {} stats for replica {}", metric, replica.getReplicaId());
            }
        }
        return samples;
    }

    private static OptionalDouble cpuPercent(JsonNode pod, Replica replica, NodeCapacity node) {
        JsonNode nanoCores = readPodOrContainers(pod, "cpu", "usageNanoCores");
        if (nanoCores == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Utilization.cpuPercent(nanoCores.asDouble() / NANO, replica, node));
    }

    private static OptionalDouble memoryPercent(JsonNode pod, Replica replica, NodeCapacity node) {
        JsonNode workingSet = readPodOrContainers(pod, "memory", "workingSetBytes");
        if (workingSet == null) {
            return OptionalDouble.empty();
        }
        return Utilization.memoryPercent(workingSet.asLong(), replica, node);
    }

    /**
     * Pod-level value when the kubelet reports it, otherwise the sum over containers.
     */
    private static JsonNode readPodOrContainers(JsonNode pod, String section, String field) {
        JsonNode podLevel = pod.path(section).path(field);
        if (podLevel.isNumber()) {
            return podLevel;
        }

        double sum = 0;
        boolean found = false;
        for (JsonNode container : pod.path("containers")) {
            JsonNode value = container.path(section).path(field);
            if (value.isNumber()) {
                sum += value.asDouble();
                found = true;
            }
        }
        return found ? JsonUtils.mapper().getNodeFactory().numberNode(sum) : null;
    }

    private static String podKey(Replica replica) {
        return replica.getNamespace() + "/" + replica.getReplicaId();
    }
}

package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.metrics.MetricsTags;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Reads utilization from cAdvisor series stored in Prometheus.
 * <p>
 * One query per service covers all of its replicas; replicas without a series are left out.
 * </p>
 */
public class PrometheusMetricsSource implements IMetricsSource {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsSource.class);

    static final String CPU_QUERY =
        "sum by (pod) (rate(container_cpu_usage_seconds_total{namespace=\"%s\",pod=~\"%s\",container!=\"\",container!=\"POD\"}[1m]))";
    static final String MEMORY_QUERY =
        "sum by (pod) (container_memory_working_set_bytes{namespace=\"%s\",pod=~\"%s\",container!=\"\",container!=\"POD\"})";

    private final PrometheusQueryService queryService;
    private final NodeCapacityLookup capacities;
    private final Counter droppedSamples;

    public PrometheusMetricsSource(PrometheusQueryService queryService, IOrchestratorClient orchestrator,
                                   AutoscalerConfig config, MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.capacities = new NodeCapacityLookup(orchestrator, config.getMetricsTimeout());
        this.droppedSamples = Counter.builder(MetricsNames.SAMPLES_DROPPED_TOTAL)
            .tag(MetricsTags.SOURCE, "prometheus")
            .register(meterRegistry);
    }

    @Override
    public MetricsSourceType type() {
        return MetricsSourceType.PROMETHEUS;
    }

    @Override
    public Mono<List<MetricSample>> collect(String serviceId, List<Replica> replicas, MetricType metric) {
        if (replicas.isEmpty()) {
            return Mono.just(List.of());
        }

        String query = buildQuery(replicas, metric);
        return queryService.query(query)
            .map(result -> result.getValuesByLabel("pod"))
            .flatMap(values -> toSamples(serviceId, replicas, metric, values));
    }

    private Mono<List<MetricSample>> toSamples(String serviceId, List<Replica> replicas, MetricType metric,
                                               Map<String, Double> values) {
        Map<String, List<Replica>> byNode = replicas.stream()
            .filter(replica -> values.containsKey(replica.getReplicaId()))
            .collect(Collectors.groupingBy(replica -> String.valueOf(replica.getNodeName())));

        long now = System.currentTimeMillis();
        return Flux.fromIterable(byNode.values())
            .flatMap(nodeReplicas -> capacities
                .capacityFor(nodeReplicas.get(0).getNodeName(), nodeReplicas, metric)
                .map(node -> normalize(serviceId, nodeReplicas, metric, values, node, now)))
            .flatMapIterable(samples -> samples)
            .collectList()
            .doOnNext(samples -> {
                if (samples.size() < replicas.size()) {
                    log.debug("{} of {} replicas of {} have no {} series",
                        replicas.size() - samples.size(), replicas.size(), serviceId, metric);
                    droppedSamples.increment(replicas.size() - samples.size());
                }
            });
    }

    static List<MetricSample> normalize(String serviceId, List<Replica> replicas, MetricType metric,
                                        Map<String, Double> values, NodeCapacity node, long timestampMs) {
        List<MetricSample> samples = new ArrayList<>();
        for (Replica replica : replicas) {
            double raw = values.get(replica.getReplicaId());
            OptionalDouble percent = metric == MetricType.CPU
                ? OptionalDouble.of(Utilization.cpuPercent(raw, replica, node))
                : Utilization.memoryPercent((long) raw, replica, node);
            percent.ifPresent(value -> samples.add(
                new MetricSample(serviceId, replica.getReplicaId(), value, timestampMs)));
        }
        return samples;
    }

    static String buildQuery(List<Replica> replicas, MetricType metric) {
        String namespace = replicas.get(0).getNamespace();
        String pods = replicas.stream()
            // Pod names are DNS labels; only '.' needs escaping, doubled for the PromQL string literal
            .map(replica -> replica.getReplicaId().replace(".", "\\\\."))
            .collect(Collectors.joining("|"));
        return String.format(metric == MetricType.CPU ? CPU_QUERY : MEMORY_QUERY, namespace, pods);
    }
}

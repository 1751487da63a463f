package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.controller.kafka.IEventPublisher;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.Replica;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import com.qqsuccubus.autoscale.core.msg.BusMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects samples for a service from the configured source and keeps the latest set.
 * <p>
 * The cache is a read-side convenience only; the decision engine always works on the samples
 * returned by {@link #collect(ServiceDescriptor, List)}, never on cached ones.
 * </p>
 */
public class MetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final IMetricsSource source;
    private final IEventPublisher publisher;
    private final Map<String, List<MetricSample>> latest = new ConcurrentHashMap<>();

    public MetricsCollector(IMetricsSource source, IEventPublisher publisher) {
        this.source = source;
        this.publisher = publisher;

        log.info("Metrics collector using {} source", source.type());
    }

    /**
     * Samples the service's configured metric on the given replicas.
     *
     * @return samples of the replicas that could be measured; empty list, never an error, when none could
     */
    public Mono<List<MetricSample>> collect(ServiceDescriptor service, List<Replica> replicas) {
        if (replicas.isEmpty()) {
            return Mono.just(List.of());
        }

        return source.collect(service.getServiceId(), replicas, service.getMetric())
            .onErrorResume(err -> {
                log.warn("Collecting {} samples for {} failed: {}", service.getMetric(), service.getServiceId(),
                    err.toString());
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of())
            .doOnNext(samples -> {
                log.debug("Collected {}/{} {} samples for {}",
                    samples.size(), replicas.size(), service.getMetric(), service.getServiceId());
                if (!samples.isEmpty()) {
                    latest.put(service.getServiceId(), List.copyOf(samples));
                    publisher.publish(BusMessages.MetricsUpdated.builder()
                        .serviceId(service.getServiceId())
                        .serviceName(service.getName())
                        .metric(service.getMetric().label())
                        .samples(samples)
                        .ts(System.currentTimeMillis())
                        .build());
                }
            });
    }

    public List<MetricSample> latestSamples(String serviceId) {
        return latest.getOrDefault(serviceId, List.of());
    }

    /**
     * Forgets samples of services that are no longer tracked.
     */
    public void retain(Set<String> serviceIds) {
        latest.keySet().retainAll(serviceIds);
    }

    public void clear() {
        latest.clear();
        log.info("Cleared cached metric samples");
    }
}

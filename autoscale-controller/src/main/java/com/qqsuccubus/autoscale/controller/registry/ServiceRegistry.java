package com.qqsuccubus.autoscale.controller.registry;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.k8s.DiscoveredService;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.kafka.IEventPublisher;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.model.CacheSnapshot;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import com.qqsuccubus.autoscale.core.msg.BusMessage;
import com.qqsuccubus.autoscale.core.msg.BusMessages;
import com.qqsuccubus.autoscale.core.msg.RoutingKeys;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Discovers autoscale-enabled services and publishes them as versioned snapshots.
 * <p>
 * The registry is the only writer of the current {@link CacheSnapshot}. Refreshes are
 * serialized: a refresh requested while another is running starts after it. A refresh that
 * finds nothing changed leaves the snapshot, and its version, untouched and emits no events.
 * </p>
 * <p>
 * When discovery fails the last good snapshot stays current and the registry reports itself
 * degraded until the next successful refresh.
 * </p>
 */
public class ServiceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final IOrchestratorClient orchestrator;
    private final LabelParser labelParser;
    private final IEventPublisher publisher;
    private final AutoscalerConfig config;

    private final AtomicReference<CacheSnapshot> current = new AtomicReference<>(CacheSnapshot.empty());
    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final Sinks.Many<BusMessage> changeEvents = Sinks.many().multicast().directBestEffort();
    private final Object refreshLock = new Object();
    private final Counter discoveryFailures;

    private Mono<CacheSnapshot> lastRefresh = Mono.empty();
    private Disposable refreshTask;

    @Getter
    private volatile Instant lastSuccessfulRefresh;

    public ServiceRegistry(
        IOrchestratorClient orchestrator,
        LabelParser labelParser,
        IEventPublisher publisher,
        AutoscalerConfig config,
        MeterRegistry meterRegistry
    ) {
        this.orchestrator = orchestrator;
        this.labelParser = labelParser;
        this.publisher = publisher;
        this.config = config;

        this.discoveryFailures = Counter.builder(MetricsNames.DISCOVERY_FAILURES_TOTAL)
            .register(meterRegistry);
        Gauge.builder(MetricsNames.SNAPSHOT_VERSION, current, ref -> ref.get().getVersion())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.REGISTRY_SERVICES, current, ref -> ref.get().size())
            .register(meterRegistry);
    }

    /**
     * Starts the refresh timer; the first refresh runs immediately.
     */
    public void start() {
        log.info("Starting service registry (refresh every {})", config.getRefreshInterval());

        refreshTask = Flux.interval(Duration.ZERO, config.getRefreshInterval())
            .onBackpressureDrop(tick -> log.debug("Refresh tick {} dropped, previous refresh still running", tick))
            .concatMap(tick -> refresh())
            .subscribe();
    }

    public CacheSnapshot snapshot() {
        return current.get();
    }

    public Optional<ServiceDescriptor> find(String serviceId) {
        return snapshot().find(serviceId);
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * Change events in publication order: added, removed and updated services followed by one
     * {@link RoutingKeys#SERVICES_UPDATED} summary per new snapshot. Hot; late subscribers miss
     * earlier events.
     */
    public Flux<BusMessage> events() {
        return changeEvents.asFlux();
    }

    /**
     * Runs one refresh outside the timer, after any refresh already in progress.
     *
     * @return the snapshot current after the refresh
     */
    public Mono<CacheSnapshot> forceRefresh() {
        log.info("Forced registry refresh requested");
        return refresh();
    }

    Mono<CacheSnapshot> refresh() {
        Mono<CacheSnapshot> next;
        synchronized (refreshLock) {
            Mono<CacheSnapshot> previous = lastRefresh;
            next = previous
                .onErrorResume(err -> Mono.empty())
                .then(Mono.defer(this::refreshOnce))
                .cache();
            lastRefresh = next;
        }
        return next;
    }

    private Mono<CacheSnapshot> refreshOnce() {
        return orchestrator.listServices()
            .map(this::apply)
            .doOnNext(snapshot -> {
                if (degraded.getAndSet(false)) {
                    log.info("Discovery recovered, registry no longer degraded");
                }
                lastSuccessfulRefresh = Instant.now();
            })
            .onErrorResume(err -> {
                discoveryFailures.increment();
                if (!degraded.getAndSet(true)) {
                    log.warn("Discovery failed, keeping snapshot v{}: {}", current.get().getVersion(), err.getMessage());
                } else {
                    log.debug("Discovery still failing: {}", err.getMessage());
                }
                return Mono.just(current.get());
            })
            .doOnNext(this::publishHealthCheck);
    }

    /**
     * Builds the candidate snapshot from a discovery result and swaps it in if it differs.
     */
    CacheSnapshot apply(List<DiscoveredService> discovered) {
        Map<String, ServiceDescriptor> candidate = new LinkedHashMap<>();
        for (DiscoveredService service : discovered) {
            ServiceDescriptor descriptor = labelParser.parse(service);
            if (descriptor.isAutoscaleEnabled()) {
                candidate.put(descriptor.getServiceId(), descriptor);
            }
        }

        CacheSnapshot previous = current.get();
        List<BusMessage> events = diff(previous.getServices(), candidate);
        if (events.isEmpty()) {
            log.debug("Refresh found no changes (snapshot v{}, {} services)", previous.getVersion(), previous.size());
            return previous;
        }

        Instant now = Instant.now();
        CacheSnapshot next = previous.next(candidate, now);
        current.set(next);
        log.info("Published snapshot v{} with {} services ({} changes)", next.getVersion(), next.size(), events.size());

        events.add(BusMessages.ServicesUpdated.builder()
            .version(next.getVersion())
            .servicesCount(next.size())
            .services(new ArrayList<>(next.descriptors()))
            .ts(now.toEpochMilli())
            .build());
        for (BusMessage event : events) {
            changeEvents.tryEmitNext(event);
            publisher.publish(event);
        }
        return next;
    }

    private static List<BusMessage> diff(Map<String, ServiceDescriptor> previous, Map<String, ServiceDescriptor> candidate) {
        long ts = System.currentTimeMillis();
        List<BusMessage> events = new ArrayList<>();

        candidate.forEach((id, descriptor) -> {
            ServiceDescriptor old = previous.get(id);
            if (old == null) {
                log.info("Service added: {}", id);
                events.add(changed(RoutingKeys.SERVICE_ADDED, descriptor, ts));
            } else if (!old.equals(descriptor)) {
                log.info("Service updated: {}", id);
                events.add(changed(RoutingKeys.SERVICE_UPDATED, descriptor, ts));
            }
        });
        previous.forEach((id, descriptor) -> {
            if (!candidate.containsKey(id)) {
                log.info("Service removed: {}", id);
                events.add(BusMessages.ServiceRemoved.builder()
                    .serviceId(id)
                    .serviceName(descriptor.getName())
                    .ts(ts)
                    .build());
            }
        });
        return events;
    }

    private static BusMessage changed(String event, ServiceDescriptor descriptor, long ts) {
        return BusMessages.ServiceChanged.builder()
            .event(event)
            .service(descriptor)
            .ts(ts)
            .build();
    }

    private void publishHealthCheck(CacheSnapshot snapshot) {
        publisher.publish(BusMessages.HealthCheck.builder()
            .source(config.getNodeId())
            .degraded(degraded.get())
            .snapshotVersion(snapshot.getVersion())
            .ts(System.currentTimeMillis())
            .build());
    }

    public void stop() {
        if (refreshTask != null) {
            refreshTask.dispose();
        }
        changeEvents.tryEmitComplete();
        log.info("Service registry stopped at snapshot v{}", current.get().getVersion());
    }
}

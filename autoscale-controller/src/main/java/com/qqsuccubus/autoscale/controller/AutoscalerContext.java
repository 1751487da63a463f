package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.history.IScalingHistory;
import com.qqsuccubus.autoscale.controller.history.InMemoryScalingHistory;
import com.qqsuccubus.autoscale.controller.k8s.ILeaderElection;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.kafka.IEventPublisher;
import com.qqsuccubus.autoscale.controller.kafka.KafkaEventPublisher;
import com.qqsuccubus.autoscale.controller.kafka.NoopEventPublisher;
import com.qqsuccubus.autoscale.controller.metrics.IMetricsSource;
import com.qqsuccubus.autoscale.controller.metrics.KubeletMetricsSource;
import com.qqsuccubus.autoscale.controller.metrics.MetricsCollector;
import com.qqsuccubus.autoscale.controller.metrics.PrometheusMetricsSource;
import com.qqsuccubus.autoscale.controller.metrics.PrometheusQueryService;
import com.qqsuccubus.autoscale.controller.redis.RedisScalingHistory;
import com.qqsuccubus.autoscale.controller.registry.LabelParser;
import com.qqsuccubus.autoscale.controller.registry.ServiceRegistry;
import com.qqsuccubus.autoscale.controller.scale.AutoscalerEngine;
import com.qqsuccubus.autoscale.controller.scale.ScalingExecutor;
import com.qqsuccubus.autoscale.core.model.CacheSnapshot;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Owns every long-lived component of one controller process.
 * <p>
 * Built once at start-up and closed at shutdown; nothing is held in static state. Also the
 * read and control surface for operators: snapshot, latest samples, history, health, and the
 * force refresh and force clear actions.
 * </p>
 */
public class AutoscalerContext {
    private static final Logger log = LoggerFactory.getLogger(AutoscalerContext.class);

    private final AutoscalerConfig config;
    private final IOrchestratorClient orchestrator;
    private final IEventPublisher publisher;
    private final IScalingHistory history;
    private final ILeaderElection leaderElection;
    @Getter
    private final ServiceRegistry registry;
    private final MetricsCollector collector;
    @Getter
    private final AutoscalerEngine engine;

    public AutoscalerContext(
        AutoscalerConfig config,
        IOrchestratorClient orchestrator,
        IMetricsSource metricsSource,
        IEventPublisher publisher,
        IScalingHistory history,
        ILeaderElection leaderElection,
        MeterRegistry meterRegistry
    ) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.publisher = publisher;
        this.history = history;
        this.leaderElection = leaderElection;

        this.registry = new ServiceRegistry(orchestrator, new LabelParser(), publisher, config, meterRegistry);
        this.collector = new MetricsCollector(metricsSource, publisher);
        this.engine = new AutoscalerEngine(
            config,
            registry,
            orchestrator,
            collector,
            new ScalingExecutor(orchestrator, meterRegistry),
            history,
            publisher,
            leaderElection,
            meterRegistry
        );
    }

    /**
     * Builds the metrics source, publisher and history store selected by the configuration.
     */
    public static AutoscalerContext create(
        AutoscalerConfig config,
        IOrchestratorClient orchestrator,
        ILeaderElection leaderElection,
        MeterRegistry meterRegistry
    ) {
        IMetricsSource metricsSource;
        switch (config.getMetricsSource()) {
            case PROMETHEUS:
                PrometheusQueryService queryService = new PrometheusQueryService(
                    config.getPrometheusHost(), config.getPrometheusPort(), config.getMetricsTimeout());
                queryService.healthCheck()
                    .subscribe(healthy -> {
                        if (!healthy) {
                            log.warn("Prometheus at {}:{} is not healthy yet",
                                config.getPrometheusHost(), config.getPrometheusPort());
                        }
                    });
                metricsSource = new PrometheusMetricsSource(queryService, orchestrator, config, meterRegistry);
                break;
            case KUBELET:
            default:
                metricsSource = new KubeletMetricsSource(orchestrator, config, meterRegistry);
                break;
        }

        IEventPublisher publisher = config.isEventBusEnabled()
            ? new KafkaEventPublisher(config, meterRegistry)
            : new NoopEventPublisher();

        IScalingHistory history = config.getHistoryStore() == AutoscalerConfig.HistoryStoreType.REDIS
            ? new RedisScalingHistory(config)
            : new InMemoryScalingHistory(config.getHistoryMaxEvents());

        return new AutoscalerContext(config, orchestrator, metricsSource, publisher, history, leaderElection,
            meterRegistry);
    }

    /**
     * Runs the first refresh, then starts the refresh and evaluation timers.
     */
    public void start() {
        try {
            CacheSnapshot initial = registry.forceRefresh().block(config.getOrchestratorTimeout().multipliedBy(2));
            if (initial != null) {
                log.info("Initial discovery: {} services (snapshot v{})", initial.size(), initial.getVersion());
            }
        } catch (IllegalStateException e) {
            log.warn("Initial discovery did not finish in time, continuing with the refresh timer");
        }
        registry.start();
        engine.start();
    }

    public CacheSnapshot snapshot() {
        return registry.snapshot();
    }

    public List<MetricSample> latestSamples(String serviceId) {
        return collector.latestSamples(serviceId);
    }

    public Mono<CacheSnapshot> forceRefresh() {
        return registry.forceRefresh();
    }

    /**
     * Drops cached samples and the scaling history. The snapshot is kept.
     */
    public Mono<Void> forceClear() {
        return Mono.fromRunnable(collector::clear)
            .then(history.clear());
    }

    public IScalingHistory history() {
        return history;
    }

    public HealthStatus health() {
        CacheSnapshot snapshot = registry.snapshot();
        return HealthStatus.builder()
            .nodeId(config.getNodeId())
            .degraded(registry.isDegraded())
            .snapshotVersion(snapshot.getVersion())
            .services(snapshot.size())
            .lastSuccessfulRefresh(registry.getLastSuccessfulRefresh())
            .lastSuccessfulTick(engine.getLastSuccessfulTick())
            .leader(leaderElection.isLeader())
            .dryRun(config.isDryRun())
            .metricsSource(config.getMetricsSource().name().toLowerCase())
            .eventBusEnabled(config.isEventBusEnabled())
            .eventBusConnected(publisher.isConnected())
            .build();
    }

    /**
     * Stops the engine first so no action starts against a closing client, then the registry.
     */
    public void close() {
        engine.stop();
        registry.stop();
        publisher.close();
        history.close();
        orchestrator.close();
        log.info("Autoscaler context closed");
    }
}

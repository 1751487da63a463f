package com.qqsuccubus.autoscale.controller.scale;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.history.IScalingHistory;
import com.qqsuccubus.autoscale.controller.k8s.ILeaderElection;
import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.kafka.IEventPublisher;
import com.qqsuccubus.autoscale.controller.metrics.MetricsCollector;
import com.qqsuccubus.autoscale.controller.registry.ServiceRegistry;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.metrics.MetricsTags;
import com.qqsuccubus.autoscale.core.model.CacheSnapshot;
import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import com.qqsuccubus.autoscale.core.msg.BusMessages;
import com.qqsuccubus.autoscale.core.util.Percentages;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic evaluation loop of the autoscaler.
 * <p>
 * Each tick reads the current snapshot once and evaluates every service in it, up to
 * {@code evaluationConcurrency} at a time. Per service: re-read the replica count, list running
 * replicas, collect samples, apply {@link ScalingPolicy}, then record and (unless dry-run)
 * execute the resulting change. Failures of one service never affect the others.
 * </p>
 * <p>
 * Ticks never overlap: a tick that fires while the previous one is still running is dropped.
 * The tick interval is the only cooldown between two changes of the same service.
 * </p>
 */
public class AutoscalerEngine {
    private static final Logger log = LoggerFactory.getLogger(AutoscalerEngine.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final AutoscalerConfig config;
    private final ServiceRegistry registry;
    private final IOrchestratorClient orchestrator;
    private final MetricsCollector collector;
    private final ScalingPolicy policy;
    private final ScalingExecutor executor;
    private final IScalingHistory history;
    private final IEventPublisher publisher;
    private final ILeaderElection leaderElection;
    private final MeterRegistry meterRegistry;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicReference<Sinks.Empty<Void>> currentTick = new AtomicReference<>();
    private final Timer tickLatency;

    private Disposable ticker;

    @Getter
    private volatile Instant lastSuccessfulTick;

    public AutoscalerEngine(
        AutoscalerConfig config,
        ServiceRegistry registry,
        IOrchestratorClient orchestrator,
        MetricsCollector collector,
        ScalingExecutor executor,
        IScalingHistory history,
        IEventPublisher publisher,
        ILeaderElection leaderElection,
        MeterRegistry meterRegistry
    ) {
        this.config = config;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.collector = collector;
        this.policy = new ScalingPolicy(config.getPercentageMin(), config.getPercentageMax());
        this.executor = executor;
        this.history = history;
        this.publisher = publisher;
        this.leaderElection = leaderElection;
        this.meterRegistry = meterRegistry;

        this.tickLatency = Timer.builder(MetricsNames.TICK_LATENCY)
            .register(meterRegistry);
    }

    public void start() {
        log.info("Starting autoscaler engine (interval={}, thresholds={}%..{}%, concurrency={}, dryRun={})",
            config.getEvaluationInterval(), Percentages.format(config.getPercentageMin()),
            Percentages.format(config.getPercentageMax()), config.getEvaluationConcurrency(), config.isDryRun());

        ticker = Flux.interval(Duration.ZERO, config.getEvaluationInterval())
            .onBackpressureDrop(tick -> log.warn("Evaluation tick {} dropped, previous tick still running", tick))
            // no prefetch: ticks arriving while one runs are dropped above, not queued
            .concatMap(tick -> tick(), 0)
            .subscribe();
    }

    /**
     * Runs one evaluation pass over the current snapshot.
     *
     * @return Mono completing when every started evaluation finished
     */
    public Mono<Void> tick() {
        return Mono.defer(() -> {
            if (stopping.get()) {
                return Mono.empty();
            }
            if (!leaderElection.isLeader()) {
                log.debug("Not the leader, skipping evaluation tick");
                return Mono.empty();
            }

            CacheSnapshot snapshot = registry.snapshot();
            collector.retain(snapshot.getServices().keySet());
            if (registry.isDegraded()) {
                log.warn("Evaluating on stale snapshot v{}, discovery is failing", snapshot.getVersion());
            }
            log.debug("Evaluation tick over snapshot v{} ({} services)", snapshot.getVersion(), snapshot.size());

            Sinks.Empty<Void> done = Sinks.empty();
            currentTick.set(done);
            Timer.Sample sample = Timer.start(meterRegistry);

            return Flux.fromIterable(snapshot.descriptors())
                .flatMap(service -> Mono.defer(() -> stopping.get() ? Mono.<Void>empty() : evaluate(service)),
                    Math.max(1, config.getEvaluationConcurrency()))
                .then()
                .doOnSuccess(v -> lastSuccessfulTick = Instant.now())
                .doFinally(signal -> {
                    sample.stop(tickLatency);
                    done.tryEmitEmpty();
                });
        });
    }

    /**
     * Evaluates one service, unless an evaluation of it is already running.
     */
    Mono<Void> evaluate(ServiceDescriptor service) {
        String serviceId = service.getServiceId();
        if (!inFlight.add(serviceId)) {
            log.warn("Evaluation of {} still in flight, skipping", serviceId);
            skipped("in_flight");
            return Mono.empty();
        }

        return orchestrator.inspect(serviceId)
            .doOnSuccess(live -> {
                if (live == null) {
                    log.info("{} no longer exists, skipping until the next refresh", serviceId);
                }
            })
            .flatMap(live -> {
                ServiceDescriptor fresh = service.withCurrentReplicas(live.getReplicas());
                return orchestrator.listRunningReplicas(serviceId)
                    .flatMap(replicas -> collector.collect(fresh, replicas))
                    .map(samples -> policy.decide(fresh, samples))
                    .flatMap(decision -> act(fresh, decision));
            })
            .onErrorResume(err -> {
                log.warn("Evaluation of {} failed: {}", serviceId, err.getMessage());
                skipped("error");
                return Mono.empty();
            })
            .doFinally(signal -> inFlight.remove(serviceId))
            .then();
    }

    private Mono<Void> act(ServiceDescriptor service, ScalingDecision decision) {
        String serviceId = service.getServiceId();
        switch (decision.getAction()) {
            case SKIP:
                if (ScalingPolicy.INSUFFICIENT_DATA.equals(decision.getReason())) {
                    log.info("{}: insufficient data, no {} samples from {} replicas",
                        serviceId, service.getMetric(), service.getCurrentReplicas());
                    skipped("no_samples");
                } else {
                    log.warn("{}: skipped, {}", serviceId, decision.getReason());
                    skipped("invalid_thresholds");
                }
                return Mono.empty();
            case NONE:
                if (ScalingPolicy.AT_MAXIMUM.equals(decision.getReason())) {
                    log.info("{}: {} {}% above {}% but at maximum ({} replicas)", serviceId, service.getMetric(),
                        Percentages.format(decision.getObservedValue()),
                        Percentages.format(policy.percentageMax(service)), service.getMaxReplicas());
                } else if (ScalingPolicy.AT_MINIMUM.equals(decision.getReason())) {
                    log.info("{}: {} {}% below {}% but at minimum ({} replicas)", serviceId, service.getMetric(),
                        Percentages.format(decision.getObservedValue()),
                        Percentages.format(policy.percentageMin(service)), service.getMinReplicas());
                } else {
                    log.debug("{}: {} {}% within band, {} replicas", serviceId, service.getMetric(),
                        Percentages.format(decision.getObservedValue()), service.getCurrentReplicas());
                }
                return Mono.empty();
            default:
                return applyChange(service, decision);
        }
    }

    private Mono<Void> applyChange(ServiceDescriptor service, ScalingDecision decision) {
        ScalingEvent event = ScalingEvent.builder()
            .serviceId(service.getServiceId())
            .service(service.getName())
            .metric(service.getMetric())
            .observedValue(decision.getObservedValue())
            .fromReplicas(decision.getFromReplicas())
            .toReplicas(decision.getToReplicas())
            .reason(decision.getReason())
            .dryRun(config.isDryRun())
            .timestampMs(System.currentTimeMillis())
            .build();

        Counter.builder(MetricsNames.SCALING_DECISIONS_TOTAL)
            .tag(MetricsTags.ACTION, decision.getAction().tag())
            .tag(MetricsTags.DRY_RUN, String.valueOf(config.isDryRun()))
            .register(meterRegistry)
            .increment();

        Mono<ScalingEvent> outcome;
        if (config.isDryRun()) {
            log.info("[dry-run] {}: would scale {} -> {} ({})", service.getServiceId(),
                decision.getFromReplicas(), decision.getToReplicas(), decision.getReason());
            outcome = Mono.just(event);
        } else {
            log.info("{}: scaling {} -> {} ({})", service.getServiceId(),
                decision.getFromReplicas(), decision.getToReplicas(), decision.getReason());
            outcome = executor.apply(service.getServiceId(), decision.getToReplicas())
                .thenReturn(event)
                .onErrorResume(err -> Mono.just(event.withActionError(err.getMessage())));
        }

        return outcome.flatMap(this::record);
    }

    private Mono<Void> record(ScalingEvent event) {
        publisher.publish(BusMessages.ScalingDecision.builder()
            .decision(event)
            .ts(event.getTimestampMs())
            .build());

        return history.record(event)
            .onErrorResume(err -> {
                log.error("Failed to store scaling event for {}: {}", event.getServiceId(), err.getMessage());
                return Mono.empty();
            });
    }

    private void skipped(String reason) {
        Counter.builder(MetricsNames.EVALUATIONS_SKIPPED_TOTAL)
            .tag(MetricsTags.REASON, reason)
            .register(meterRegistry)
            .increment();
    }

    /**
     * Stops starting new evaluations, waits for the running tick to finish (bounded), then
     * cancels the timer.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        Sinks.Empty<Void> running = currentTick.get();
        if (running != null) {
            try {
                running.asMono().block(SHUTDOWN_GRACE);
            } catch (IllegalStateException e) {
                log.warn("Running tick did not finish within {}, cancelling it", SHUTDOWN_GRACE);
            }
        }
        if (ticker != null) {
            ticker.dispose();
        }
        log.info("Autoscaler engine stopped");
    }
}

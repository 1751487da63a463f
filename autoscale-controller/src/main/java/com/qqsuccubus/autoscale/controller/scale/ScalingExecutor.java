package com.qqsuccubus.autoscale.controller.scale;

import com.qqsuccubus.autoscale.controller.k8s.IOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.ScaleActionException;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Applies a decided replica count to the orchestrator.
 * <p>
 * The service is re-read right before the update: if it already has the desired count nothing
 * is sent, otherwise a single update guarded by the re-read resource version is issued. A
 * concurrent modification fails with a conflict {@link ScaleActionException} and is not retried
 * here; the next tick re-evaluates from fresh state.
 * </p>
 */
public class ScalingExecutor {
    private static final Logger log = LoggerFactory.getLogger(ScalingExecutor.class);

    public enum Result {
        APPLIED,
        ALREADY_AT_TARGET
    }

    private final IOrchestratorClient orchestrator;
    private final Counter conflicts;
    private final Counter errors;

    public ScalingExecutor(IOrchestratorClient orchestrator, MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;

        conflicts = Counter.builder(MetricsNames.SCALING_ACTION_ERRORS_TOTAL)
            .tag(MetricsTags.REASON, "conflict")
            .register(meterRegistry);
        errors = Counter.builder(MetricsNames.SCALING_ACTION_ERRORS_TOTAL)
            .tag(MetricsTags.REASON, "error")
            .register(meterRegistry);
    }

    /**
     * @param serviceId service to scale
     * @param desired   replica count to set
     * @return what was done, or an error of type {@link ScaleActionException}
     */
    public Mono<Result> apply(String serviceId, int desired) {
        return orchestrator.inspect(serviceId)
            .switchIfEmpty(Mono.error(() -> new ScaleActionException(serviceId, "Service " + serviceId + " no longer exists")))
            .flatMap(observed -> {
                if (observed.getReplicas() == desired) {
                    log.info("{} already has {} replicas, no update needed", serviceId, desired);
                    return Mono.just(Result.ALREADY_AT_TARGET);
                }
                return orchestrator.updateReplicas(observed, desired)
                    .thenReturn(Result.APPLIED);
            })
            .onErrorMap(err -> !(err instanceof ScaleActionException),
                err -> new ScaleActionException(serviceId, "Update of " + serviceId + " failed: " + err.getMessage(), false, err))
            .doOnError(ScaleActionException.class, err -> {
                if (err.isConflict()) {
                    conflicts.increment();
                    log.warn("Scaling {} to {} lost a concurrent update, retrying next tick", serviceId, desired);
                } else {
                    errors.increment();
                    log.error("Scaling {} to {} failed: {}", serviceId, desired, err.getMessage());
                }
            });
    }
}

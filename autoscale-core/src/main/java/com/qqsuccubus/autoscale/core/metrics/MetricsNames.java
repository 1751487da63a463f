package com.qqsuccubus.autoscale.core.metrics;

/**
 * Micrometer metric names used by the controller.
 * <p>
 * <b>Naming convention:</b> {@code autoscaler.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Scaling decisions recorded.
     * <p>
     * Tags: action (scale_up/scale_down/correction), dry_run
     * </p>
     */
    public static final String SCALING_DECISIONS_TOTAL = "autoscaler.engine.decisions.total";

    /**
     * Counter: Scaling actions that the orchestrator rejected or that timed out.
     * <p>
     * Tags: reason (conflict/error)
     * </p>
     */
    public static final String SCALING_ACTION_ERRORS_TOTAL = "autoscaler.executor.errors.total";

    /**
     * Counter: Services skipped during a tick.
     * <p>
     * Tags: reason (no_samples/invalid_thresholds/in_flight/error)
     * </p>
     */
    public static final String EVALUATIONS_SKIPPED_TOTAL = "autoscaler.engine.skipped.total";

    /**
     * Timer: Duration of one evaluation tick.
     */
    public static final String TICK_LATENCY = "autoscaler.engine.tick.latency";

    /**
     * Gauge: Version of the current cache snapshot.
     */
    public static final String SNAPSHOT_VERSION = "autoscaler.registry.snapshot.version";

    /**
     * Gauge: Number of services in the current snapshot.
     */
    public static final String REGISTRY_SERVICES = "autoscaler.registry.services";

    /**
     * Counter: Failed discovery calls.
     */
    public static final String DISCOVERY_FAILURES_TOTAL = "autoscaler.registry.discovery.failures.total";

    /**
     * Counter: Replica samples that could not be obtained.
     * <p>
     * Tags: source (kubelet/prometheus)
     * </p>
     */
    public static final String SAMPLES_DROPPED_TOTAL = "autoscaler.collector.samples.dropped.total";

    /**
     * Counter: Event-bus messages that could not be published.
     */
    public static final String PUBLISH_FAILURES_TOTAL = "autoscaler.publisher.failures.total";
}

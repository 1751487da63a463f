package com.qqsuccubus.autoscale.controller.config;

import com.qqsuccubus.autoscale.controller.metrics.MetricsSourceType;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Configuration for the autoscaler, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class AutoscalerConfig {
    private static final Logger log = LoggerFactory.getLogger(AutoscalerConfig.class);

    public static final String DRY_RUN_ENV = "AUTOSCALER_DRYRUN";

    String nodeId;
    int httpPort;

    // Global thresholds, overridable per service through labels
    double percentageMin;
    double percentageMax;

    Duration refreshInterval;      // registry discovery timer
    Duration evaluationInterval;   // decision engine tick
    boolean dryRun;

    // Per-call timeouts, always shorter than the owning tick interval
    Duration orchestratorTimeout;
    Duration metricsTimeout;

    int evaluationConcurrency;     // services evaluated in parallel within one tick
    int nodeFanoutConcurrency;     // parallel node stats calls per service

    MetricsSourceType metricsSource;
    String prometheusHost;
    int prometheusPort;

    // Kubernetes
    String kubernetesNamespace;    // "*" watches every namespace
    String orchestratorUrl;        // empty = in-cluster / kubeconfig discovery
    boolean enableLeaderElection;

    // Event bus (Kafka); empty bootstrap disables publishing
    String eventBusBootstrap;
    String eventBusTopic;

    // Scaling history
    HistoryStoreType historyStore;
    String redisUrl;
    String redisKeyNamespace;
    int historyMaxEvents;

    public enum HistoryStoreType {
        MEMORY,
        REDIS
    }

    public boolean isEventBusEnabled() {
        return eventBusBootstrap != null && !eventBusBootstrap.isBlank();
    }

    public boolean isAllNamespaces() {
        return "*".equals(kubernetesNamespace);
    }

    public static AutoscalerConfig fromEnv() {
        Duration refreshInterval = Duration.ofSeconds(Integer.parseInt(getEnv("REFRESH_INTERVAL_SEC", "30")));
        Duration evaluationInterval = Duration.ofSeconds(Integer.parseInt(getEnv("AUTOSCALER_INTERVAL", "300")));

        return AutoscalerConfig.builder()
            .nodeId(getEnv("NODE_ID", "autoscaler-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .percentageMin(Double.parseDouble(getEnv("AUTOSCALER_MIN_PERCENTAGE", "25")))
            .percentageMax(Double.parseDouble(getEnv("AUTOSCALER_MAX_PERCENTAGE", "85")))
            .refreshInterval(refreshInterval)
            .evaluationInterval(evaluationInterval)
            // Presence-based: AUTOSCALER_DRYRUN= (even empty) enables dry-run
            .dryRun(System.getenv(DRY_RUN_ENV) != null)
            .orchestratorTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("ORCHESTRATOR_TIMEOUT_SEC", "10"))))
            .metricsTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("METRICS_TIMEOUT_SEC", "5"))))
            .evaluationConcurrency(Integer.parseInt(getEnv("EVALUATION_CONCURRENCY", "8")))
            .nodeFanoutConcurrency(Integer.parseInt(getEnv("NODE_FANOUT_CONCURRENCY", "4")))
            .metricsSource(MetricsSourceType.fromString(getEnv("METRICS_SOURCE", "kubelet")))
            .prometheusHost(getEnv("PROMETHEUS_HOST", "prometheus"))
            .prometheusPort(Integer.parseInt(getEnv("PROMETHEUS_PORT", "9090")))
            .kubernetesNamespace(getEnv("KUBERNETES_NAMESPACE", "default"))
            .orchestratorUrl(getEnv("ORCHESTRATOR_URL", ""))
            .enableLeaderElection(Boolean.parseBoolean(getEnv("ENABLE_LEADER_ELECTION", "false")))
            .eventBusBootstrap(getEnv("EVENT_BUS_BOOTSTRAP", ""))
            .eventBusTopic(getEnv("EVENT_BUS_TOPIC", "autoscaler.events"))
            .historyStore(HistoryStoreType.valueOf(getEnv("HISTORY_STORE", "memory").trim().toUpperCase()))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .redisKeyNamespace(getEnv("REDIS_KEY_NAMESPACE", "autoscaler"))
            .historyMaxEvents(Integer.parseInt(getEnv("EVENTS_MAX_ROWS", "10000")))
            .build()
            .withSafeTimeouts();
    }

    /**
     * Returns a copy whose network timeouts are strictly shorter than the tick they run in.
     * <p>
     * Orchestrator calls run inside both the refresh and the evaluation tick, so they are bounded
     * by the shorter of the two. Metrics calls only run inside evaluation ticks.
     * </p>
     *
     * @return adjusted configuration
     */
    public AutoscalerConfig withSafeTimeouts() {
        Duration orchestratorBound = min(refreshInterval, evaluationInterval);
        Duration safeOrchestrator = clamp("ORCHESTRATOR_TIMEOUT_SEC", orchestratorTimeout, orchestratorBound);
        Duration safeMetrics = clamp("METRICS_TIMEOUT_SEC", metricsTimeout, evaluationInterval);
        if (safeOrchestrator.equals(orchestratorTimeout) && safeMetrics.equals(metricsTimeout)) {
            return this;
        }
        return toBuilder()
            .orchestratorTimeout(safeOrchestrator)
            .metricsTimeout(safeMetrics)
            .build();
    }

    private static Duration clamp(String name, Duration timeout, Duration interval) {
        if (timeout.compareTo(interval) < 0) {
            return timeout;
        }
        Duration clamped = interval.dividedBy(2);
        if (clamped.isZero()) {
            clamped = Duration.ofMillis(Math.max(1, interval.toMillis() / 2));
        }
        log.warn("{}={} is not shorter than its tick interval {}; using {}", name, timeout, interval, clamped);
        return clamped;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

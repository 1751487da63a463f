package com.qqsuccubus.autoscale.core.msg;

/**
 * Routing keys of event-bus messages. Used as the Kafka record key.
 */
public final class RoutingKeys {
    private RoutingKeys() {
    }

    public static final String SERVICE_ADDED = "service.added";

    public static final String SERVICE_REMOVED = "service.removed";

    public static final String SERVICE_UPDATED = "service.updated";

    /**
     * Bulk summary published once per changed snapshot, after the per-service events.
     */
    public static final String SERVICES_UPDATED = "services.updated";

    public static final String SCALING_DECISION = "scaling.decision";

    public static final String HEALTH_CHECK = "health.check";

    /**
     * Prefix of per-service metrics messages.
     */
    public static final String METRICS_PREFIX = "metrics.";

    /**
     * Routing key for a metrics refresh of one service: {@code metrics.{serviceName}}
     *
     * @param serviceName service name
     * @return routing key
     */
    public static String metricsFor(String serviceName) {
        return METRICS_PREFIX + serviceName;
    }
}

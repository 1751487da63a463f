package com.qqsuccubus.autoscale.core.redis;

/**
 * Redis keyspace of the scaling history store.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use a namespace prefix so several controllers can share one Redis</li>
 *   <li>Bound growth by trimming sorted sets to the configured retention on every write</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * All scaling events: {@code {ns}:events}
     * <p>
     * <b>Type:</b> Sorted set, score = event timestamp (epoch millis), member = event JSON.
     * </p>
     *
     * @param namespace key namespace
     * @return Redis key
     */
    public static String events(String namespace) {
        return namespace + ":events";
    }

    /**
     * Scaling events of one service: {@code {ns}:events:svc:{service}}
     * <p>
     * <b>Type:</b> Sorted set mirroring {@link #events(String)} for the service filter.
     * </p>
     *
     * @param namespace key namespace
     * @param service   service id ({@code namespace/name})
     * @return Redis key
     */
    public static String serviceEvents(String namespace, String service) {
        return namespace + ":events:svc:" + service;
    }

    /**
     * Names of services that have history: {@code {ns}:services}
     * <p>
     * <b>Type:</b> Set
     * </p>
     *
     * @param namespace key namespace
     * @return Redis key
     */
    public static String services(String namespace) {
        return namespace + ":services";
    }
}

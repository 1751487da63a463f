package com.qqsuccubus.autoscale.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for controller instance identifier.
     */
    public static final String NODE_ID = "node_id";

    public static final String ACTION = "action";

    public static final String DRY_RUN = "dry_run";

    /**
     * Tag key for skip/failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for metrics source.
     */
    public static final String SOURCE = "source";
}

package com.qqsuccubus.autoscale.controller.registry;

/**
 * Label keys carrying per-service autoscaling configuration.
 * <p>
 * Read from the workload's metadata labels; an annotation with the same key is used when the
 * label is absent.
 * </p>
 */
public final class ServiceLabels {
    private ServiceLabels() {
    }

    /**
     * {@code true} (case-insensitive) opts the service in; any other value, or none, opts it out.
     */
    public static final String AUTOSCALE = "autoscale";

    public static final String MIN_REPLICAS = "autoscale.min";
    public static final String MAX_REPLICAS = "autoscale.max";
    public static final String PERCENTAGE_MIN = "autoscale.percentage-min";
    public static final String PERCENTAGE_MAX = "autoscale.percentage-max";

    /**
     * {@code MEDIAN} or {@code MAX}: how replica samples are aggregated for scale-down.
     */
    public static final String DECREASE_MODE = "autoscale.decrease-mode";

    /**
     * {@code cpu} or {@code memory}.
     */
    public static final String METRIC = "autoscale.metric";

    public static final String DISABLE_MANUAL_REPLICAS = "autoscale.disable-manual-replicas";

    public static final int DEFAULT_MIN_REPLICAS = 2;
    public static final int DEFAULT_MAX_REPLICAS = 15;
}

package com.qqsuccubus.autoscale.controller.scale;

import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import com.qqsuccubus.autoscale.core.util.Percentages;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Threshold band policy: one replica up when the mean is above the band, one down when the
 * decrease-mode aggregate is below it.
 * <p>
 * Order of checks for a service with current replica count {@code c}:
 * <ol>
 *   <li>mean &gt; max threshold: {@code c + 1} unless {@code c >= maxReplicas} ("at maximum")</li>
 *   <li>aggregate &lt; min threshold: {@code c - 1} unless {@code c <= minReplicas} ("at minimum")</li>
 *   <li>disable-manual-replicas and {@code c} outside [minReplicas, maxReplicas]: one step toward the bound</li>
 * </ol>
 * The first check that produces a change wins, so at most one step is taken per tick. A
 * threshold check that is blocked at a bound falls through to the correction.
 * </p>
 * <p>
 * Stateless and free of I/O.
 * </p>
 */
public class ScalingPolicy {
    static final String AT_MAXIMUM = "at maximum";
    static final String AT_MINIMUM = "at minimum";
    static final String WITHIN_BAND = "within band";
    static final String INSUFFICIENT_DATA = "insufficient data";
    static final String MANUAL_CORRECTION = "manual override correction";

    private final double globalPercentageMin;
    private final double globalPercentageMax;

    public ScalingPolicy(double globalPercentageMin, double globalPercentageMax) {
        this.globalPercentageMin = globalPercentageMin;
        this.globalPercentageMax = globalPercentageMax;
    }

    public double percentageMin(ServiceDescriptor service) {
        return service.effectivePercentageMin(globalPercentageMin);
    }

    public double percentageMax(ServiceDescriptor service) {
        return service.effectivePercentageMax(globalPercentageMax);
    }

    /**
     * Whether the resolved thresholds form a usable band. Services without one are not evaluated.
     */
    public boolean hasValidThresholds(ServiceDescriptor service) {
        return percentageMin(service) < percentageMax(service);
    }

    public ScalingDecision decide(ServiceDescriptor service, List<MetricSample> samples) {
        int current = service.getCurrentReplicas();

        if (!hasValidThresholds(service)) {
            return ScalingDecision.skip(current, String.format("invalid thresholds: percentage-min %s >= percentage-max %s",
                Percentages.format(percentageMin(service)), Percentages.format(percentageMax(service))));
        }
        if (samples.isEmpty()) {
            return ScalingDecision.skip(current, INSUFFICIENT_DATA);
        }

        List<Double> values = samples.stream().map(MetricSample::getValue).collect(Collectors.toList());
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double aggregate = service.getDecreaseMode().aggregate(values);
        double min = percentageMin(service);
        double max = percentageMax(service);

        String blocked = null;
        double observed;

        if (mean > max) {
            observed = mean;
            if (current < service.getMaxReplicas()) {
                return change(ScalingDecision.Action.SCALE_UP, current, current + 1, mean, Percentages.above(mean, max));
            }
            blocked = AT_MAXIMUM;
        } else {
            observed = aggregate;
        }
        if (blocked == null && aggregate < min) {
            if (current > service.getMinReplicas()) {
                return change(ScalingDecision.Action.SCALE_DOWN, current, current - 1, aggregate,
                    Percentages.below(aggregate, min));
            }
            blocked = AT_MINIMUM;
        }

        if (service.isDisableManualReplicas()) {
            if (current > service.getMaxReplicas()) {
                return change(ScalingDecision.Action.CORRECTION, current, current - 1, observed, MANUAL_CORRECTION);
            }
            if (current < service.getMinReplicas()) {
                return change(ScalingDecision.Action.CORRECTION, current, current + 1, observed, MANUAL_CORRECTION);
            }
        }

        return ScalingDecision.none(current, observed, blocked != null ? blocked : WITHIN_BAND);
    }

    private static ScalingDecision change(ScalingDecision.Action action, int from, int to, double observed, String reason) {
        return ScalingDecision.builder()
            .action(action)
            .fromReplicas(from)
            .toReplicas(to)
            .observedValue(observed)
            .reason(reason)
            .build();
    }
}

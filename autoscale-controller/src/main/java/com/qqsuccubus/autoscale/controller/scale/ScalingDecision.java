package com.qqsuccubus.autoscale.controller.scale;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of evaluating one service in one tick.
 */
@Value
@Builder(toBuilder = true)
public class ScalingDecision {

    public enum Action {
        SCALE_UP("scale_up"),
        SCALE_DOWN("scale_down"),
        CORRECTION("correction"),
        NONE("none"),
        /**
         * Not evaluated: no samples or unusable thresholds.
         */
        SKIP("skip");

        private final String tag;

        Action(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    Action action;
    int fromReplicas;
    int toReplicas;

    /**
     * Aggregate the decision was based on: the mean for scale-up, the decrease-mode aggregate
     * otherwise. NaN when there were no samples.
     */
    double observedValue;

    /**
     * Human-readable cause, e.g. {@code 90% > 85%}, {@code at maximum} or {@code insufficient data}.
     */
    String reason;

    public boolean changesReplicas() {
        return toReplicas != fromReplicas;
    }

    static ScalingDecision none(int current, double observed, String reason) {
        return ScalingDecision.builder()
            .action(Action.NONE)
            .fromReplicas(current)
            .toReplicas(current)
            .observedValue(observed)
            .reason(reason)
            .build();
    }

    static ScalingDecision skip(int current, String reason) {
        return ScalingDecision.builder()
            .action(Action.SKIP)
            .fromReplicas(current)
            .toReplicas(current)
            .observedValue(Double.NaN)
            .reason(reason)
            .build();
    }
}

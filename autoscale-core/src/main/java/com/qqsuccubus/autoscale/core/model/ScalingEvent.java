package com.qqsuccubus.autoscale.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Audit record of one scaling decision.
 * <p>
 * Emitted for every decision that changes the replica count, including dry-run decisions
 * that were never applied. A failed apply is recorded with {@link #getActionError()} set.
 * </p>
 */
@Value
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalingEvent {
    @JsonProperty("serviceId")
    String serviceId;

    @JsonProperty("service")
    String service;

    @JsonProperty("metric")
    MetricType metric;

    /**
     * Aggregate utilization the decision was based on.
     */
    @JsonProperty("observed")
    double observedValue;

    @JsonProperty("old")
    int fromReplicas;

    @JsonProperty("new")
    int toReplicas;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("dryRun")
    boolean dryRun;

    @JsonProperty("ts")
    long timestampMs;

    /**
     * Error detail when applying the decision failed, null otherwise.
     */
    @JsonProperty("actionError")
    String actionError;

    @Builder(toBuilder = true)
    @JsonCreator
    public ScalingEvent(
        @JsonProperty("serviceId") String serviceId,
        @JsonProperty("service") String service,
        @JsonProperty("metric") MetricType metric,
        @JsonProperty("observed") double observedValue,
        @JsonProperty("old") int fromReplicas,
        @JsonProperty("new") int toReplicas,
        @JsonProperty("reason") String reason,
        @JsonProperty("dryRun") boolean dryRun,
        @JsonProperty("ts") long timestampMs,
        @JsonProperty("actionError") String actionError
    ) {
        this.serviceId = serviceId;
        this.service = service;
        this.metric = metric;
        this.observedValue = observedValue;
        this.fromReplicas = fromReplicas;
        this.toReplicas = toReplicas;
        this.reason = reason;
        this.dryRun = dryRun;
        this.timestampMs = timestampMs;
        this.actionError = actionError;
    }

    @JsonProperty("delta")
    public int getDelta() {
        return toReplicas - fromReplicas;
    }

    @JsonProperty("direction")
    public String getDirection() {
        int delta = getDelta();
        return delta > 0 ? "up" : (delta < 0 ? "down" : "same");
    }

    public boolean isFailed() {
        return actionError != null;
    }
}

package com.qqsuccubus.autoscale.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Normalized utilization of one replica at one instant.
 * <p>
 * Values are percentages of the replica's configured limit and are not capped at 100:
 * a replica bursting above its limit reports more than 100.
 * </p>
 */
@Value
public class MetricSample {
    @JsonProperty("serviceId")
    String serviceId;

    @JsonProperty("replicaId")
    String replicaId;

    @JsonProperty("value")
    double value;

    @JsonProperty("timestampMs")
    long timestampMs;

    @JsonCreator
    public MetricSample(
        @JsonProperty("serviceId") String serviceId,
        @JsonProperty("replicaId") String replicaId,
        @JsonProperty("value") double value,
        @JsonProperty("timestampMs") long timestampMs
    ) {
        this.serviceId = serviceId;
        this.replicaId = replicaId;
        this.value = value;
        this.timestampMs = timestampMs;
    }
}

package com.qqsuccubus.autoscale.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time health of the controller as served on {@code /healthz}.
 */
@Value
@Builder
public class HealthStatus {
    @JsonProperty("nodeId")
    String nodeId;

    /**
     * Discovery is failing and decisions are made on a stale snapshot.
     */
    @JsonProperty("degraded")
    boolean degraded;

    @JsonProperty("snapshotVersion")
    long snapshotVersion;

    @JsonProperty("services")
    int services;

    @JsonProperty("lastSuccessfulRefresh")
    Instant lastSuccessfulRefresh;

    @JsonProperty("lastSuccessfulTick")
    Instant lastSuccessfulTick;

    @JsonProperty("leader")
    boolean leader;

    @JsonProperty("dryRun")
    boolean dryRun;

    @JsonProperty("metricsSource")
    String metricsSource;

    @JsonProperty("eventBusEnabled")
    boolean eventBusEnabled;

    @JsonProperty("eventBusConnected")
    boolean eventBusConnected;

    @JsonProperty("status")
    public String getStatus() {
        return degraded ? "degraded" : "ok";
    }
}

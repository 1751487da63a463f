package com.qqsuccubus.autoscale.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Messages published by the registry and the decision engine.
 * <p>
 * Publishing is best-effort: consumers must tolerate gaps and duplicates.
 * </p>
 */
public final class BusMessages {
    private BusMessages() {
    }

    /**
     * A service appeared in, or changed within, the snapshot.
     * The event is {@link RoutingKeys#SERVICE_ADDED} or {@link RoutingKeys#SERVICE_UPDATED}.
     */
    @Value
    @Builder(toBuilder = true)
    public static class ServiceChanged implements BusMessage {
        @JsonProperty("event")
        String event;

        @JsonProperty("service")
        ServiceDescriptor service;

        @JsonProperty("ts")
        long ts;
    }

    /**
     * A service left the snapshot: it was deleted or its autoscale label was removed.
     */
    @Value
    @Builder(toBuilder = true)
    public static class ServiceRemoved implements BusMessage {
        @JsonProperty("serviceId")
        String serviceId;

        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("ts")
        long ts;

        @Override
        @JsonProperty("event")
        public String getEvent() {
            return RoutingKeys.SERVICE_REMOVED;
        }
    }

    /**
     * Summary of a newly published snapshot.
     */
    @Value
    @Builder(toBuilder = true)
    public static class ServicesUpdated implements BusMessage {
        @JsonProperty("version")
        long version;

        @JsonProperty("servicesCount")
        int servicesCount;

        @JsonProperty("services")
        List<ServiceDescriptor> services;

        @JsonProperty("ts")
        long ts;

        @Override
        @JsonProperty("event")
        public String getEvent() {
            return RoutingKeys.SERVICES_UPDATED;
        }
    }

    /**
     * Fresh samples were collected for a service.
     */
    @Value
    @Builder(toBuilder = true)
    public static class MetricsUpdated implements BusMessage {
        @JsonProperty("serviceId")
        String serviceId;

        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("metric")
        String metric;

        @JsonProperty("samples")
        List<MetricSample> samples;

        @JsonProperty("ts")
        long ts;

        @Override
        @JsonProperty("event")
        public String getEvent() {
            return RoutingKeys.metricsFor(serviceName);
        }
    }

    /**
     * A scaling decision was recorded (applied, dry-run, or failed).
     */
    @Value
    @Builder(toBuilder = true)
    public static class ScalingDecision implements BusMessage {
        @JsonProperty("decision")
        ScalingEvent decision;

        @JsonProperty("ts")
        long ts;

        @Override
        @JsonProperty("event")
        public String getEvent() {
            return RoutingKeys.SCALING_DECISION;
        }
    }

    /**
     * Periodic liveness beacon of the controller.
     */
    @Value
    @Builder(toBuilder = true)
    public static class HealthCheck implements BusMessage {
        @JsonProperty("source")
        String source;

        @JsonProperty("degraded")
        boolean degraded;

        @JsonProperty("snapshotVersion")
        long snapshotVersion;

        @JsonProperty("ts")
        long ts;

        @Override
        @JsonProperty("event")
        public String getEvent() {
            return RoutingKeys.HEALTH_CHECK;
        }
    }
}

package com.qqsuccubus.autoscale.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.autoscale.core.model.DecreaseMode;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusMessagesTest {

    private static final ServiceDescriptor WEB = ServiceDescriptor.builder()
        .serviceId("shop/web")
        .name("web")
        .namespace("shop")
        .autoscaleEnabled(true)
        .metric(MetricType.CPU)
        .minReplicas(2)
        .maxReplicas(15)
        .decreaseMode(DecreaseMode.MEDIAN)
        .currentReplicas(3)
        .build();

    @Test
    void testServiceRemoved_EventFieldSerialized() {
        BusMessage message = BusMessages.ServiceRemoved.builder()
            .serviceId("shop/web")
            .serviceName("web")
            .ts(42L)
            .build();

        JsonNode json = JsonUtils.readTree(JsonUtils.writeValueAsString(message));

        assertEquals(RoutingKeys.SERVICE_REMOVED, json.path("event").asText());
        assertEquals("shop/web", json.path("serviceId").asText());
        assertEquals(42L, json.path("ts").asLong());
    }

    @Test
    void testServicesUpdated_CarriesDescriptors() {
        BusMessage message = BusMessages.ServicesUpdated.builder()
            .version(7)
            .servicesCount(1)
            .services(List.of(WEB))
            .ts(1L)
            .build();

        JsonNode json = JsonUtils.readTree(JsonUtils.writeValueAsString(message));

        assertEquals("services.updated", json.path("event").asText());
        assertEquals(7, json.path("version").asLong());
        assertEquals("shop/web", json.path("services").get(0).path("serviceId").asText());
    }

    @Test
    void testMetricsUpdated_RoutedPerService() {
        BusMessage message = BusMessages.MetricsUpdated.builder()
            .serviceId("shop/web")
            .serviceName("web")
            .metric("cpu")
            .samples(List.of())
            .ts(1L)
            .build();

        assertEquals("metrics.web", message.getEvent());
        assertTrue(message.getEvent().startsWith(RoutingKeys.METRICS_PREFIX));
    }
}

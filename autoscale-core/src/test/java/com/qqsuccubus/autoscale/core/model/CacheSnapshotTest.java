package com.qqsuccubus.autoscale.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheSnapshotTest {

    @Test
    void testEmpty_VersionZero() {
        CacheSnapshot empty = CacheSnapshot.empty();

        assertEquals(0, empty.getVersion());
        assertEquals(0, empty.size());
        assertEquals(Instant.EPOCH, empty.getPublishedAt());
    }

    @Test
    void testNext_IncrementsVersionAndCopiesServices() {
        Map<String, ServiceDescriptor> services = new HashMap<>();
        services.put("default/web", descriptor("default/web"));

        CacheSnapshot next = CacheSnapshot.empty().next(services, Instant.parse("2024-05-01T10:00:00Z"));
        services.put("default/api", descriptor("default/api"));

        assertEquals(1, next.getVersion());
        assertEquals(1, next.size());
        assertTrue(next.find("default/web").isPresent());
        assertFalse(next.find("default/api").isPresent());
    }

    @Test
    void testServices_Unmodifiable() {
        CacheSnapshot snapshot = CacheSnapshot.empty().next(Map.of("default/web", descriptor("default/web")), Instant.now());

        assertThrows(UnsupportedOperationException.class,
            () -> snapshot.getServices().put("default/api", descriptor("default/api")));
    }

    private static ServiceDescriptor descriptor(String id) {
        return ServiceDescriptor.builder()
            .serviceId(id)
            .name(id.substring(id.indexOf('/') + 1))
            .namespace("default")
            .autoscaleEnabled(true)
            .metric(MetricType.CPU)
            .minReplicas(2)
            .maxReplicas(15)
            .decreaseMode(DecreaseMode.MEDIAN)
            .currentReplicas(3)
            .build();
    }
}

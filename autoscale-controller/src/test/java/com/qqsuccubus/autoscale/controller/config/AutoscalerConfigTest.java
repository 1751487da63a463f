package com.qqsuccubus.autoscale.controller.config;

import com.qqsuccubus.autoscale.controller.TestConfigs;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoscalerConfigTest {

    @Test
    void testShortTimeouts_Unchanged() {
        AutoscalerConfig config = TestConfigs.defaults();

        assertSame(config, config.withSafeTimeouts());
    }

    @Test
    void testOrchestratorTimeout_BoundedByShorterInterval() {
        AutoscalerConfig config = TestConfigs.defaults().toBuilder()
            .refreshInterval(Duration.ofSeconds(10))
            .orchestratorTimeout(Duration.ofSeconds(30))
            .build()
            .withSafeTimeouts();

        assertEquals(Duration.ofSeconds(5), config.getOrchestratorTimeout());
        assertEquals(Duration.ofSeconds(1), config.getMetricsTimeout());
    }

    @Test
    void testMetricsTimeout_BoundedByEvaluationInterval() {
        AutoscalerConfig config = TestConfigs.defaults().toBuilder()
            .evaluationInterval(Duration.ofSeconds(4))
            .metricsTimeout(Duration.ofSeconds(4))
            .build()
            .withSafeTimeouts();

        assertEquals(Duration.ofSeconds(2), config.getMetricsTimeout());
        assertEquals(Duration.ofSeconds(2), config.getOrchestratorTimeout());
    }

    @Test
    void testEventBusEnabled_OnlyWithBootstrap() {
        assertFalse(TestConfigs.defaults().isEventBusEnabled());
        assertTrue(TestConfigs.defaults().toBuilder().eventBusBootstrap("kafka:9092").build().isEventBusEnabled());
    }

    @Test
    void testWildcardNamespace_AllNamespaces() {
        assertFalse(TestConfigs.defaults().isAllNamespaces());
        assertTrue(TestConfigs.defaults().toBuilder().kubernetesNamespace("*").build().isAllNamespaces());
    }
}

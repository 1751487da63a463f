package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.history.HistoryQuery;
import com.qqsuccubus.autoscale.controller.history.InMemoryScalingHistory;
import com.qqsuccubus.autoscale.controller.k8s.ILeaderElection;
import com.qqsuccubus.autoscale.core.model.Replica;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoscalerContextTest {

    private StubOrchestratorClient orchestrator;
    private FixedMetricsSource source;
    private AutoscalerContext context;

    @BeforeEach
    void setUp() {
        orchestrator = new StubOrchestratorClient()
            .service("shop", "web", 3, Map.of("autoscale", "true"))
            .replicas("shop/web", List.of(Replica.builder()
                .replicaId("web-a")
                .namespace("shop")
                .nodeName("node-1")
                .cpuLimitCores(1.0)
                .build()));
        source = new FixedMetricsSource().values(95);
        context = new AutoscalerContext(TestConfigs.defaults(), orchestrator, source, new RecordingEventPublisher(),
            new InMemoryScalingHistory(50), ILeaderElection.ALWAYS, new SimpleMeterRegistry());
    }

    @Test
    void testHealth_ReflectsRegistryState() {
        context.forceRefresh().block();

        HealthStatus health = context.health();

        assertEquals("ok", health.getStatus());
        assertEquals(1, health.getServices());
        assertEquals(1, health.getSnapshotVersion());
        assertTrue(health.isLeader());
        assertEquals("kubelet", health.getMetricsSource());
        assertFalse(health.isEventBusEnabled());

        orchestrator.failListing = true;
        context.forceRefresh().block();

        assertEquals("degraded", context.health().getStatus());
        assertEquals(1, context.snapshot().size());
    }

    @Test
    void testForceClear_DropsSamplesAndHistoryKeepsSnapshot() {
        context.forceRefresh().block();
        context.getEngine().tick().block();

        assertEquals(1, context.latestSamples("shop/web").size());
        StepVerifier.create(context.history().count(null)).expectNext(1L).verifyComplete();

        StepVerifier.create(context.forceClear()).verifyComplete();

        assertTrue(context.latestSamples("shop/web").isEmpty());
        StepVerifier.create(context.history().query(HistoryQuery.all()))
            .assertNext(page -> assertTrue(page.getEvents().isEmpty()))
            .verifyComplete();
        assertEquals(1, context.snapshot().size());
    }
}

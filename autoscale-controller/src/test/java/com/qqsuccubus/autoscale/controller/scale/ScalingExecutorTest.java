package com.qqsuccubus.autoscale.controller.scale;

import com.qqsuccubus.autoscale.controller.StubOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.ScaleActionException;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScalingExecutorTest {

    private StubOrchestratorClient orchestrator;
    private SimpleMeterRegistry meterRegistry;
    private ScalingExecutor executor;

    @BeforeEach
    void setUp() {
        orchestrator = new StubOrchestratorClient()
            .service("shop", "web", 3, Map.of("autoscale", "true"));
        meterRegistry = new SimpleMeterRegistry();
        executor = new ScalingExecutor(orchestrator, meterRegistry);
    }

    @Test
    void testDifferentCount_UpdateApplied() {
        StepVerifier.create(executor.apply("shop/web", 4))
            .expectNext(ScalingExecutor.Result.APPLIED)
            .verifyComplete();

        assertEquals(List.of("shop/web=4"), orchestrator.updates);
        assertEquals(4, orchestrator.desiredReplicas("shop/web"));
    }

    @Test
    void testAlreadyAtTarget_NoUpdateSent() {
        StepVerifier.create(executor.apply("shop/web", 3))
            .expectNext(ScalingExecutor.Result.ALREADY_AT_TARGET)
            .verifyComplete();

        assertTrue(orchestrator.updates.isEmpty());
    }

    @Test
    void testConflict_PropagatedWithoutRetry() {
        orchestrator.updateError = new ScaleActionException("shop/web", "resource version changed", true, null);

        StepVerifier.create(executor.apply("shop/web", 4))
            .expectErrorMatches(err -> err instanceof ScaleActionException && ((ScaleActionException) err).isConflict())
            .verify();

        assertEquals(1, orchestrator.updates.size());
        assertEquals(1.0, meterRegistry.get(MetricsNames.SCALING_ACTION_ERRORS_TOTAL)
            .tag("reason", "conflict").counter().count());
    }

    @Test
    void testUnexpectedError_WrappedAsActionError() {
        orchestrator.updateError = new IllegalStateException("connection reset");

        StepVerifier.create(executor.apply("shop/web", 4))
            .expectErrorSatisfies(err -> {
                assertTrue(err instanceof ScaleActionException);
                assertTrue(err.getMessage().contains("connection reset"));
            })
            .verify();
    }

    @Test
    void testMissingService_Fails() {
        orchestrator.remove("shop/web");

        StepVerifier.create(executor.apply("shop/web", 4))
            .expectErrorMatches(err -> err instanceof ScaleActionException
                && err.getMessage().contains("no longer exists"))
            .verify();
        assertTrue(orchestrator.updates.isEmpty());
    }
}

package com.qqsuccubus.autoscale.controller.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.autoscale.controller.AutoscalerContext;
import com.qqsuccubus.autoscale.controller.FixedMetricsSource;
import com.qqsuccubus.autoscale.controller.RecordingEventPublisher;
import com.qqsuccubus.autoscale.controller.StubOrchestratorClient;
import com.qqsuccubus.autoscale.controller.TestConfigs;
import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.history.InMemoryScalingHistory;
import com.qqsuccubus.autoscale.controller.k8s.ILeaderElection;
import com.qqsuccubus.autoscale.controller.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpServerTest {

    private StubOrchestratorClient orchestrator;
    private AutoscalerContext context;
    private PrometheusMetricsExporter exporter;
    private HttpServer httpServer;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        AutoscalerConfig config = TestConfigs.defaults();
        orchestrator = new StubOrchestratorClient()
            .service("shop", "web", 3, Map.of("autoscale", "true"));
        exporter = new PrometheusMetricsExporter(config.getNodeId());
        context = new AutoscalerContext(config, orchestrator, new FixedMetricsSource(), new RecordingEventPublisher(),
            new InMemoryScalingHistory(10), ILeaderElection.ALWAYS, exporter.getRegistry());
        httpServer = new HttpServer(config, context, exporter);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().host("localhost").port(server.port());
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
        exporter.close();
    }

    private Tuple2<Integer, String> get(String path) {
        Tuple2<Integer, String> response = client.get()
            .uri(path)
            .responseSingle((res, body) -> body.asString()
                .defaultIfEmpty("")
                .map(text -> Tuples.of(res.status().code(), text)))
            .block(Duration.ofSeconds(5));
        assertNotNull(response);
        return response;
    }

    @Test
    void testHealthz_DegradedReportedInBodyWithOk() {
        context.forceRefresh().block();

        Tuple2<Integer, String> healthy = get("/healthz");
        assertEquals(200, healthy.getT1());
        JsonNode body = JsonUtils.readTree(healthy.getT2());
        assertEquals("ok", body.path("status").asText());
        assertEquals(1, body.path("services").asInt());

        orchestrator.failListing = true;
        context.forceRefresh().block();

        Tuple2<Integer, String> degraded = get("/healthz");
        assertEquals(200, degraded.getT1());
        JsonNode degradedBody = JsonUtils.readTree(degraded.getT2());
        assertEquals("degraded", degradedBody.path("status").asText());
        assertEquals(1, degradedBody.path("services").asInt());
    }

    @Test
    void testMetrics_PrometheusText() {
        context.forceRefresh().block();

        Tuple2<Integer, String> metrics = get("/metrics");

        assertEquals(200, metrics.getT1());
        assertTrue(metrics.getT2().contains("jvm_memory_used_bytes"));
    }

    @Test
    void testUnknownPath_NotFound() {
        assertEquals(404, get("/history").getT1());
    }
}

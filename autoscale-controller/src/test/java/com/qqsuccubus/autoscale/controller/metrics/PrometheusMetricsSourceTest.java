package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.controller.StubOrchestratorClient;
import com.qqsuccubus.autoscale.controller.TestConfigs;
import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusMetricsSourceTest {

    private static final String CPU_RESPONSE = "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
        + "{\"metric\":{\"pod\":\"web-a\"},\"value\":[1714557600.0,\"0.25\"]},"
        + "{\"metric\":{\"pod\":\"web-b\"},\"value\":[1714557600.0,\"NaN\"]},"
        + "{\"metric\":{\"pod\":\"web-c\"},\"value\":[1714557600.0,\"2\"]}"
        + "]}}";

    private DisposableServer prometheus;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        prometheus = HttpServer.create()
            .host("localhost")
            .port(0)
            .route(routes -> routes.get("/api/v1/query", (request, response) -> {
                String uri = request.uri();
                lastQuery.set(uri.substring(uri.indexOf("query=") + "query=".length()));
                return response.header("Content-Type", "application/json").sendString(Mono.just(CPU_RESPONSE));
            }))
            .bindNow();
    }

    @AfterEach
    void tearDown() {
        prometheus.disposeNow();
    }

    private static Replica replica(String name, double cpuCores) {
        return Replica.builder()
            .replicaId(name)
            .namespace("shop")
            .nodeName("node-1")
            .cpuLimitCores(cpuCores)
            .memoryLimitBytes(512L * 1024 * 1024)
            .build();
    }

    @Test
    void testCollect_NormalizesAndSkipsNaN() {
        StubOrchestratorClient orchestrator = new StubOrchestratorClient()
            .nodeCapacity(new NodeCapacity("node-1", 8.0, 0L));
        PrometheusQueryService queryService = new PrometheusQueryService("localhost", prometheus.port(),
            Duration.ofSeconds(2));
        PrometheusMetricsSource source = new PrometheusMetricsSource(queryService, orchestrator,
            TestConfigs.defaults(), new SimpleMeterRegistry());

        List<Replica> replicas = List.of(replica("web-a", 0.5), replica("web-b", 0.5), replica("web-c", 0));

        StepVerifier.create(source.collect("shop/web", replicas, MetricType.CPU))
            .assertNext(samples -> {
                assertEquals(2, samples.size());
                for (MetricSample sample : samples) {
                    if ("web-a".equals(sample.getReplicaId())) {
                        assertEquals(50.0, sample.getValue(), 1e-6);
                    } else {
                        assertEquals("web-c", sample.getReplicaId());
                        assertEquals(25.0, sample.getValue(), 1e-6);
                    }
                }
            })
            .verifyComplete();
        assertTrue(lastQuery.get().contains("container_cpu_usage_seconds_total"));
    }

    @Test
    void testUnreachablePrometheus_EmptyResult() {
        PrometheusQueryService queryService = new PrometheusQueryService("localhost", 1, Duration.ofMillis(500));

        StepVerifier.create(queryService.query("up"))
            .assertNext(result -> assertTrue(result.isEmpty()))
            .verifyComplete();
    }

    @Test
    void testBuildQuery_CpuSelectorForAllPods() {
        String query = PrometheusMetricsSource.buildQuery(
            List.of(replica("web-a", 1), replica("web.b", 1)), MetricType.CPU);

        assertEquals("sum by (pod) (rate(container_cpu_usage_seconds_total{namespace=\"shop\","
            + "pod=~\"web-a|web\\\\.b\",container!=\"\",container!=\"POD\"}[1m]))", query);
    }

    @Test
    void testBuildQuery_MemoryUsesWorkingSet() {
        String query = PrometheusMetricsSource.buildQuery(List.of(replica("web-a", 1)), MetricType.MEMORY);

        assertTrue(query.startsWith("sum by (pod) (container_memory_working_set_bytes{namespace=\"shop\""));
    }

    @Test
    void testNormalize_MemoryAgainstLimit() {
        Map<String, Double> values = Map.of("web-a", 128.0 * 1024 * 1024);

        List<MetricSample> samples = PrometheusMetricsSource.normalize("shop/web", List.of(replica("web-a", 1)),
            MetricType.MEMORY, values, NodeCapacityLookup.unknown("node-1"), 1_000L);

        assertEquals(25.0, samples.get(0).getValue(), 1e-6);
        assertEquals(1_000L, samples.get(0).getTimestampMs());
    }

    @Test
    void testParse_ErrorStatusIsEmpty() {
        PrometheusQueryResult result = PrometheusQueryService.parse(
            "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}");

        assertTrue(result.isEmpty());
    }

    @Test
    void testParse_InfinityAndMissingLabelSkipped() {
        PrometheusQueryResult result = PrometheusQueryService.parse("{\"status\":\"success\",\"data\":{\"result\":["
            + "{\"metric\":{\"pod\":\"web-a\"},\"value\":[1.0,\"+Inf\"]},"
            + "{\"metric\":{},\"value\":[1.0,\"3\"]},"
            + "{\"metric\":{\"pod\":\"web-b\"},\"value\":[1.0,\"0.5\"]}"
            + "]}}");

        assertEquals(3, result.size());
        assertEquals(Map.of("web-b", 0.5), result.getValuesByLabel("pod"));
    }
}

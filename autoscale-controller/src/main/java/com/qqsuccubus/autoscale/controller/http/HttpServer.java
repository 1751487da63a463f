package com.qqsuccubus.autoscale.controller.http;

import com.qqsuccubus.autoscale.controller.AutoscalerContext;
import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;

/**
 * Operational HTTP endpoints: {@code /healthz} and {@code /metrics}.
 * <p>
 * {@code /healthz} always answers 200 with the health JSON; a failing discovery shows up as
 * {@code "status":"degraded"} in the body. The controller keeps evaluating on its last snapshot
 * and recovers by itself, so the endpoint is safe to use as a liveness probe.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final AutoscalerConfig config;
    private final AutoscalerContext context;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(AutoscalerConfig config, AutoscalerContext context, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.context = context;
        this.metricsExporter = metricsExporter;
    }

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                Mono.fromCallable(context::health)
                    .flatMap(health -> Mono.fromCallable(() -> JsonUtils.writeValueAsString(health))
                        .flatMap(json -> res
                            .status(HttpResponseStatus.OK)
                            .header("Content-Type", "application/json")
                            .sendString(Mono.just(json))
                            .then()))
                    .onErrorResume(err -> {
                        log.error("Failed to build health status", err);
                        return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                            .sendString(Mono.just("{\"error\":\"Health check failed\"}")).then();
                    })
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.fromCallable(metricsExporter::scrape))
                    .then()
            );
    }
}

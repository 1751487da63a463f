package com.qqsuccubus.autoscale.controller.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the Prometheus instant query API using reactor-netty HttpClient.
 * <p>
 * Configuration:
 * - Local: Prometheus at http://prometheus:9090
 * - Kubernetes: Prometheus service at http://prometheus-service.monitoring.svc.cluster.local:9090
 * </p>
 */
public class PrometheusQueryService {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryService.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * Creates a Prometheus query service.
     *
     * @param prometheusHost Prometheus host (e.g., "prometheus" or "prometheus-service.monitoring.svc.cluster.local")
     * @param prometheusPort Prometheus port (typically 9090)
     * @param timeout        bound on a single query, including connection setup
     */
    public PrometheusQueryService(String prometheusHost, int prometheusPort, Duration timeout) {
        this(HttpClient.create()
            .host(prometheusHost)
            .port(prometheusPort)
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(timeout), timeout);

        log.info("PrometheusQueryService initialized with {}:{} (timeout={})", prometheusHost, prometheusPort, timeout);
    }

    PrometheusQueryService(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    /**
     * Executes a PromQL instant query.
     * <p>
     * Unlike a plain HTTP call this never errors: unreachable Prometheus, timeouts and error
     * responses all yield an empty result, which callers treat as "no data".
     * </p>
     *
     * @param query PromQL query string
     * @return Mono<PrometheusQueryResult> containing query results
     */
    public Mono<PrometheusQueryResult> query(String query) {
        String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);

        String uri = "/api/v1/query?query=" + encodedQuery;

        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
            .uri(uri)
            .responseContent()
            .aggregate()
            .asString()
            .timeout(timeout)
            .map(PrometheusQueryService::parse)
            .doOnError(err -> log.warn("Failed to query Prometheus: {}", err.toString()))
            .onErrorReturn(PrometheusQueryResult.empty())
            .defaultIfEmpty(PrometheusQueryResult.empty());
    }

    static PrometheusQueryResult parse(String responseBody) {
        try {
            PrometheusResponse response = JsonUtils.readValue(responseBody, PrometheusResponse.class);

            if (!"success".equalsIgnoreCase(response.getStatus())) {
                log.error("Prometheus query failed: {} ({})", response.getError(), response.getErrorType());
                return PrometheusQueryResult.empty();
            }

            log.debug("Prometheus query successful, result count: {}",
                response.getData() != null && response.getData().getResult() != null
                    ? response.getData().getResult().size() : 0);

            return PrometheusQueryResult.from(response);
        } catch (Exception e) {
            log.error("Failed to parse Prometheus response: {}", e.getMessage(), e);
            return PrometheusQueryResult.empty();
        }
    }

    /**
     * Health check - tests Prometheus connectivity.
     *
     * @return Mono<Boolean> true if Prometheus is reachable
     */
    public Mono<Boolean> healthCheck() {
        return httpClient.get()
            .uri("/-/healthy")
            .responseSingle((response, body) -> Mono.just(response.status().code() == 200))
            .timeout(timeout)
            .doOnNext(healthy -> {
                if (healthy) {
                    log.debug("Prometheus health check: OK");
                } else {
                    log.warn("Prometheus health check: FAILED");
                }
            })
            .onErrorReturn(false);
    }

    /**
     * Data class for Prometheus API response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private PrometheusData data;
        private String error;
        private String errorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
    }
}

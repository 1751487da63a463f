package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the controller's own meters in Prometheus text format on {@code /metrics}.
 * <p>
 * Meters are registered on the reactor-netty global composite so HTTP client and server meters
 * end up in the same scrape as the engine and registry meters.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final JvmGcMetrics gcMetrics = new JvmGcMetrics();

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }
        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        gcMetrics.bindTo(registry);

        log.info("Metrics exporter initialized for {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    public void close() {
        gcMetrics.close();
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.remove(prometheusRegistry);
        }
        prometheusRegistry.close();
    }
}

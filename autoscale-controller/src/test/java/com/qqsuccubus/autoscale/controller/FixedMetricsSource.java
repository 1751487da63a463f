package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.metrics.IMetricsSource;
import com.qqsuccubus.autoscale.controller.metrics.MetricsSourceType;
import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Metrics source returning preset utilization values, one per replica in order.
 */
public class FixedMetricsSource implements IMetricsSource {
    public final AtomicInteger calls = new AtomicInteger();

    private volatile double[] values = new double[0];
    private volatile Supplier<Mono<List<MetricSample>>> override;

    public FixedMetricsSource values(double... values) {
        this.values = values;
        this.override = null;
        return this;
    }

    /**
     * Replaces the computed samples with the given publisher, e.g. one that never completes.
     */
    public FixedMetricsSource respondWith(Supplier<Mono<List<MetricSample>>> response) {
        this.override = response;
        return this;
    }

    @Override
    public Mono<List<MetricSample>> collect(String serviceId, List<Replica> replicas, MetricType metric) {
        calls.incrementAndGet();
        if (override != null) {
            return override.get();
        }
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < replicas.size() && i < values.length; i++) {
            samples.add(new MetricSample(serviceId, replicas.get(i).getReplicaId(), values[i], 1_000L));
        }
        return Mono.just(samples);
    }

    @Override
    public MetricsSourceType type() {
        return MetricsSourceType.KUBELET;
    }
}

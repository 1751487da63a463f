package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.core.model.MetricSample;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.Replica;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads normalized utilization samples for the running replicas of one service.
 * <p>
 * Implementations never fail the whole call because of one replica: unreachable, not running
 * or timed-out replicas are left out of the result. An empty list means no usable data.
 * </p>
 */
public interface IMetricsSource {

    Mono<List<MetricSample>> collect(String serviceId, List<Replica> replicas, MetricType metric);

    MetricsSourceType type();
}

package com.qqsuccubus.autoscale.controller.history;

import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Audit store of scaling events with bounded retention (Dependency Inversion Principle).
 */
public interface IScalingHistory {

    /**
     * Appends an event, evicting the oldest ones beyond the retention limit.
     */
    Mono<Void> record(ScalingEvent event);

    Mono<HistoryPage> query(HistoryQuery query);

    /**
     * Number of stored events, optionally for one service.
     *
     * @param serviceId service id, or null for all services
     */
    Mono<Long> count(String serviceId);

    /**
     * Distinct ids of services that have at least one stored event, sorted.
     */
    Mono<List<String>> services();

    Mono<Void> clear();

    void close();
}

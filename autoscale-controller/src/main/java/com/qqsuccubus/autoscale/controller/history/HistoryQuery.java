package com.qqsuccubus.autoscale.controller.history;

import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter and page of a scaling history query. Results are ordered newest first.
 */
@Value
@Builder(toBuilder = true)
public class HistoryQuery {
    public static final int DEFAULT_LIMIT = 100;

    /**
     * Service id ({@code namespace/name}) to filter on, null for all services.
     */
    String serviceId;

    /**
     * Inclusive lower bound on the event timestamp, null for unbounded.
     */
    Instant since;

    /**
     * Inclusive upper bound on the event timestamp, null for unbounded.
     */
    Instant until;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    int offset;

    public static HistoryQuery all() {
        return HistoryQuery.builder().build();
    }

    public long sinceMs() {
        return since != null ? since.toEpochMilli() : Long.MIN_VALUE;
    }

    public long untilMs() {
        return until != null ? until.toEpochMilli() : Long.MAX_VALUE;
    }

    public boolean matches(ScalingEvent event) {
        return (serviceId == null || serviceId.equals(event.getServiceId()))
            && event.getTimestampMs() >= sinceMs()
            && event.getTimestampMs() <= untilMs();
    }
}

package com.qqsuccubus.autoscale.controller.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import lombok.Value;

import java.util.List;

/**
 * One page of scaling events plus the number of events matching the filter.
 */
@Value
public class HistoryPage {
    @JsonProperty("events")
    List<ScalingEvent> events;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    @JsonProperty("hasMore")
    public boolean hasMore() {
        return offset + events.size() < total;
    }
}

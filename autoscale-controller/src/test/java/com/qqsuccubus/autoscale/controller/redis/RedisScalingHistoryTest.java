package com.qqsuccubus.autoscale.controller.redis;

import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RedisScalingHistoryTest {

    private static String stored(String serviceId, long ts) {
        return JsonUtils.writeValueAsString(ScalingEvent.builder()
            .serviceId(serviceId)
            .service(serviceId.substring(serviceId.indexOf('/') + 1))
            .metric(MetricType.CPU)
            .observedValue(90)
            .fromReplicas(3)
            .toReplicas(4)
            .reason("90% > 85%")
            .timestampMs(ts)
            .build());
    }

    @Test
    void testGroupByService_EvictedEventsOfEveryServiceKeptAsStored() {
        String api1 = stored("billing/api", 1);
        String web2 = stored("shop/web", 2);
        String api3 = stored("billing/api", 3);

        Map<String, List<String>> grouped = RedisScalingHistory.groupByService(List.of(api1, web2, api3));

        assertEquals(List.of("billing/api", "shop/web"), List.copyOf(grouped.keySet()));
        assertEquals(List.of(api1, api3), grouped.get("billing/api"));
        assertEquals(List.of(web2), grouped.get("shop/web"));
    }
}

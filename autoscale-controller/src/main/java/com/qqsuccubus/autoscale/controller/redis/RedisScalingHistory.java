package com.qqsuccubus.autoscale.controller.redis;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.history.HistoryPage;
import com.qqsuccubus.autoscale.controller.history.HistoryQuery;
import com.qqsuccubus.autoscale.controller.history.IScalingHistory;
import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import com.qqsuccubus.autoscale.core.redis.Keys;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scaling history kept in Redis sorted sets, shared by every controller instance.
 * <p>
 * Each event is stored twice, in the global set and in its service's set, scored by timestamp.
 * All operations are non-blocking using the Lettuce reactive API.
 * </p>
 */
public class RedisScalingHistory implements IScalingHistory {
    private static final Logger log = LoggerFactory.getLogger(RedisScalingHistory.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final String namespace;
    private final int maxEvents;

    public RedisScalingHistory(AutoscalerConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.namespace = config.getRedisKeyNamespace();
        this.maxEvents = config.getHistoryMaxEvents();
        log.info("Connected to Redis scaling history: {} (namespace={}, retention={} events)",
            config.getRedisUrl(), namespace, maxEvents);
    }

    @Override
    public Mono<Void> record(ScalingEvent event) {
        String json = JsonUtils.writeValueAsString(event);
        double score = event.getTimestampMs();
        String serviceKey = Keys.serviceEvents(namespace, event.getServiceId());

        return commands.zadd(Keys.events(namespace), score, json)
            .then(commands.zadd(serviceKey, score, json))
            .then(commands.sadd(Keys.services(namespace), event.getServiceId()))
            .then(trim())
            .doOnError(err -> log.error("Failed to record scaling event for {}: {}", event.getServiceId(), err.getMessage()));
    }

    /**
     * Drops events beyond the retention limit from the global set and from the service sets
     * they were mirrored into, whichever service they belong to. A service whose set becomes
     * empty leaves the services set.
     */
    private Mono<Void> trim() {
        String eventsKey = Keys.events(namespace);
        return commands.zrange(eventsKey, 0, -(maxEvents + 1L))
            .collectList()
            .filter(evicted -> !evicted.isEmpty())
            .flatMap(evicted -> commands.zrem(eventsKey, evicted.toArray(new String[0]))
                .thenMany(Flux.fromIterable(groupByService(evicted).entrySet()))
                .concatMap(entry -> evict(entry.getKey(), entry.getValue()))
                .then());
    }

    private Mono<Void> evict(String serviceId, List<String> members) {
        String serviceKey = Keys.serviceEvents(namespace, serviceId);
        return commands.zrem(serviceKey, members.toArray(new String[0]))
            .then(commands.zcard(serviceKey))
            .flatMap(left -> left == 0
                ? commands.srem(Keys.services(namespace), serviceId).then()
                : Mono.<Void>empty())
            .doOnSuccess(v -> log.debug("Evicted {} old events of {}", members.size(), serviceId));
    }

    /**
     * Groups stored event JSON by service id, keeping the member strings as stored.
     */
    static Map<String, List<String>> groupByService(List<String> members) {
        Map<String, List<String>> byService = new LinkedHashMap<>();
        for (String json : members) {
            String serviceId = JsonUtils.readValue(json, ScalingEvent.class).getServiceId();
            byService.computeIfAbsent(serviceId, id -> new ArrayList<>()).add(json);
        }
        return byService;
    }

    @Override
    public Mono<HistoryPage> query(HistoryQuery query) {
        String key = query.getServiceId() != null
            ? Keys.serviceEvents(namespace, query.getServiceId())
            : Keys.events(namespace);
        Range<Long> range = Range.from(
            query.getSince() != null ? Range.Boundary.including(query.sinceMs()) : Range.Boundary.unbounded(),
            query.getUntil() != null ? Range.Boundary.including(query.untilMs()) : Range.Boundary.unbounded());

        Mono<List<ScalingEvent>> page = commands
            .zrevrangebyscore(key, range, Limit.create(Math.max(0, query.getOffset()), Math.max(0, query.getLimit())))
            .map(json -> JsonUtils.readValue(json, ScalingEvent.class))
            .collectList();

        return Mono.zip(page, commands.zcount(key, range))
            .map(tuple -> new HistoryPage(tuple.getT1(), tuple.getT2(), query.getLimit(), query.getOffset()));
    }

    @Override
    public Mono<Long> count(String serviceId) {
        return serviceId != null
            ? commands.zcard(Keys.serviceEvents(namespace, serviceId))
            : commands.zcard(Keys.events(namespace));
    }

    @Override
    public Mono<List<String>> services() {
        return commands.smembers(Keys.services(namespace))
            .sort()
            .collectList();
    }

    @Override
    public Mono<Void> clear() {
        return commands.smembers(Keys.services(namespace))
            .map(serviceId -> Keys.serviceEvents(namespace, serviceId))
            .collectList()
            .flatMap(keys -> {
                List<String> all = new ArrayList<>(keys);
                all.add(Keys.events(namespace));
                all.add(Keys.services(namespace));
                return commands.del(all.toArray(new String[0]));
            })
            .doOnSuccess(deleted -> log.info("Scaling history cleared ({} keys)", deleted))
            .then();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}

package com.qqsuccubus.autoscale.controller.history;

import com.qqsuccubus.autoscale.core.model.ScalingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Process-local scaling history, lost on restart.
 * <p>
 * Keeps the newest {@code maxEvents} events in insertion order. All access is synchronized on
 * the deque; the store is small and writes happen at most once per service per tick.
 * </p>
 */
public class InMemoryScalingHistory implements IScalingHistory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryScalingHistory.class);

    private final int maxEvents;
    private final Deque<ScalingEvent> events = new ArrayDeque<>();

    public InMemoryScalingHistory(int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive: " + maxEvents);
        }
        this.maxEvents = maxEvents;
        log.info("In-memory scaling history initialized (retention={} events)", maxEvents);
    }

    @Override
    public Mono<Void> record(ScalingEvent event) {
        return Mono.fromRunnable(() -> {
            synchronized (events) {
                events.addLast(event);
                while (events.size() > maxEvents) {
                    events.removeFirst();
                }
            }
        });
    }

    @Override
    public Mono<HistoryPage> query(HistoryQuery query) {
        return Mono.fromCallable(() -> {
            List<ScalingEvent> matching = new ArrayList<>();
            synchronized (events) {
                Iterator<ScalingEvent> newestFirst = events.descendingIterator();
                while (newestFirst.hasNext()) {
                    ScalingEvent event = newestFirst.next();
                    if (query.matches(event)) {
                        matching.add(event);
                    }
                }
            }

            int from = Math.min(Math.max(0, query.getOffset()), matching.size());
            int to = Math.min(from + Math.max(0, query.getLimit()), matching.size());
            return new HistoryPage(List.copyOf(matching.subList(from, to)), matching.size(),
                query.getLimit(), query.getOffset());
        });
    }

    @Override
    public Mono<Long> count(String serviceId) {
        return Mono.fromCallable(() -> {
            synchronized (events) {
                if (serviceId == null) {
                    return (long) events.size();
                }
                return events.stream().filter(event -> serviceId.equals(event.getServiceId())).count();
            }
        });
    }

    @Override
    public Mono<List<String>> services() {
        return Mono.fromCallable(() -> {
            synchronized (events) {
                return events.stream()
                    .map(ScalingEvent::getServiceId)
                    .collect(Collectors.toCollection(TreeSet::new));
            }
        }).map(List::copyOf);
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> {
            synchronized (events) {
                events.clear();
            }
            log.info("Scaling history cleared");
        });
    }

    @Override
    public void close() {
    }
}

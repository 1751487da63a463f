package com.qqsuccubus.autoscale.controller.kafka;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.core.metrics.MetricsNames;
import com.qqsuccubus.autoscale.core.msg.BusMessage;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import reactor.util.concurrent.Queues;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes bus messages to a single Kafka topic with the routing key as record key.
 * <p>
 * Messages go through a bounded in-memory queue drained by one {@link KafkaSender} stream, so
 * callers never wait on the broker. When the queue is full the message is dropped.
 * </p>
 */
public class KafkaEventPublisher implements IEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private static final int QUEUE_SIZE = Queues.SMALL_BUFFER_SIZE * 4;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private final String topic;
    private final Sinks.Many<SenderRecord<String, String, String>> queue =
        Sinks.many().multicast().onBackpressureBuffer(QUEUE_SIZE, false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final Counter publishFailures;

    public KafkaEventPublisher(AutoscalerConfig config, MeterRegistry meterRegistry) {
        this.topic = config.getEventBusTopic();

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getEventBusBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "1");
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (int) config.getOrchestratorTimeout().toMillis());
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30_000);

        SenderOptions<String, String> senderOptions = SenderOptions.<String, String>create(producerProps)
            .stopOnError(false);
        this.sender = KafkaSender.create(senderOptions);

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getEventBusBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        this.publishFailures = Counter.builder(MetricsNames.PUBLISH_FAILURES_TOTAL)
            .register(meterRegistry);

        createTopicIfNotExists(topic, 3, (short) 1)
            .onErrorResume(err -> Mono.empty())
            .subscribe();

        sender.send(queue.asFlux())
            .doOnNext(result -> {
                if (result.exception() != null) {
                    onFailure(result.correlationMetadata(), result.exception());
                } else {
                    connected.set(true);
                    log.debug("Published {} to {}", result.correlationMetadata(), topic);
                }
            })
            .doOnError(err -> log.error("Kafka publishing stream terminated", err))
            .subscribe();

        log.info("Kafka event publisher initialized (bootstrap={}, topic={})", config.getEventBusBootstrap(), topic);
    }

    @Override
    public void publish(BusMessage message) {
        String json;
        try {
            json = JsonUtils.writeValueAsString(message);
        } catch (IllegalStateException e) {
            log.error("Failed to serialize {} message", message.getEvent(), e);
            publishFailures.increment();
            return;
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, message.getEvent(), json);
        Sinks.EmitResult result;
        // Sinks reject concurrent emitters; registry and engine publish from different threads
        synchronized (queue) {
            result = queue.tryEmitNext(SenderRecord.create(record, message.getEvent()));
        }
        if (result.isFailure()) {
            publishFailures.increment();
            log.warn("Dropped {} message, publish queue rejected it: {}", message.getEvent(), result);
        }
    }

    private void onFailure(String event, Exception error) {
        connected.set(false);
        publishFailures.increment();
        log.warn("Failed to publish {} message: {}", event, error.getMessage());
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(newTopic))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }

                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage());
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        synchronized (queue) {
            queue.tryEmitComplete();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka event publisher closed");
    }
}

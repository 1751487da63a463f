package com.qqsuccubus.autoscale.controller.kafka;

import com.qqsuccubus.autoscale.core.msg.BusMessage;

/**
 * Sink for registry and engine events (Dependency Inversion Principle).
 * <p>
 * Fire-and-forget: {@link #publish(BusMessage)} returns immediately, never throws and never
 * blocks the caller on the broker. Lost messages are logged and counted, not retried.
 * </p>
 */
public interface IEventPublisher {

    void publish(BusMessage message);

    /**
     * Whether the last delivery attempt reached the broker.
     */
    boolean isConnected();

    void close();
}

package com.qqsuccubus.autoscale.controller.kafka;

import com.qqsuccubus.autoscale.core.msg.BusMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher used when no event bus is configured. Messages are only traced.
 */
public class NoopEventPublisher implements IEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(NoopEventPublisher.class);

    @Override
    public void publish(BusMessage message) {
        log.trace("Event bus disabled, dropping {}", message.getEvent());
    }

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public void close() {
    }
}

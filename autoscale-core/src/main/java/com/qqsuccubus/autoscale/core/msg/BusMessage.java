package com.qqsuccubus.autoscale.core.msg;

/**
 * A message that can be published on the event bus.
 */
public interface BusMessage {

    /**
     * Routing key of this message, also serialized as its {@code event} field.
     */
    String getEvent();

    /**
     * Epoch millis at which the message was produced.
     */
    long getTs();
}

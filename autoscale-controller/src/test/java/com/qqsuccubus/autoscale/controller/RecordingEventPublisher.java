package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.kafka.IEventPublisher;
import com.qqsuccubus.autoscale.core.msg.BusMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Publisher stub that keeps every message.
 */
public class RecordingEventPublisher implements IEventPublisher {
    public final List<BusMessage> messages = new CopyOnWriteArrayList<>();

    @Override
    public void publish(BusMessage message) {
        messages.add(message);
    }

    public List<BusMessage> withEvent(String event) {
        return messages.stream()
            .filter(message -> event.equals(message.getEvent()))
            .collect(Collectors.toList());
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public void close() {
    }
}

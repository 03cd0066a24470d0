package com.taskchain.engine.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.port.PresenceOracle;
import com.taskchain.core.port.ResultPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Presence oracle and publisher with switchable answers that records every
 * published payload.
 */
public class RecordingPublisher implements PresenceOracle, ResultPublisher {

    private final AtomicBoolean listening = new AtomicBoolean(true);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final List<Published> published = new CopyOnWriteArrayList<>();

    @Override
    public boolean isListening(String userId) {
        return listening.get();
    }

    @Override
    public boolean publish(String userId, String routingKey, JsonNode payload) {
        if (!accepting.get()) {
            return false;
        }
        published.add(new Published(userId, routingKey, payload));
        return true;
    }

    public void setListening(boolean value) {
        listening.set(value);
    }

    /**
     * Make publish report that no delivery channel is open.
     */
    public void setAccepting(boolean value) {
        accepting.set(value);
    }

    public List<Published> published() {
        return List.copyOf(published);
    }

    public record Published(String userId, String routingKey, JsonNode payload) {
    }
}

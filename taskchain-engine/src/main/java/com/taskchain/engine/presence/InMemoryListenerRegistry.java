package com.taskchain.engine.presence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.port.PresenceOracle;
import com.taskchain.core.port.ResultPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process presence oracle and result publisher.
 * A user is listening while at least one listener is subscribed; publishing
 * delivers to every listener of the user.
 */
public class InMemoryListenerRegistry implements PresenceOracle, ResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryListenerRegistry.class);

    private final Map<String, List<ResultListener>> listeners = new ConcurrentHashMap<>();

    /**
     * Subscribe a listener for a user's results.
     * 
     * @return Handle that unsubscribes the listener when closed
     */
    public Subscription subscribe(String userId, ResultListener listener) {
        listeners.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Listener subscribed for user {}", userId);
        return () -> unsubscribe(userId, listener);
    }

    private void unsubscribe(String userId, ResultListener listener) {
        listeners.computeIfPresent(userId, (k, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
        log.debug("Listener unsubscribed for user {}", userId);
    }

    @Override
    public boolean isListening(String userId) {
        List<ResultListener> current = listeners.get(userId);
        return current != null && !current.isEmpty();
    }

    @Override
    public boolean publish(String userId, String routingKey, JsonNode payload) {
        List<ResultListener> current = listeners.get(userId);
        if (current == null || current.isEmpty()) {
            return false;
        }
        int delivered = 0;
        for (ResultListener listener : current) {
            try {
                listener.onResult(routingKey, payload);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener of user {} rejected {}: {}", userId, routingKey, e.getMessage());
            }
        }
        return delivered > 0;
    }

    /**
     * Number of listeners subscribed for a user.
     */
    public int listenerCount(String userId) {
        List<ResultListener> current = listeners.get(userId);
        return current != null ? current.size() : 0;
    }

    /**
     * Subscription handle.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

package com.taskchain.engine.presence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class InMemoryListenerRegistryTest {

    private final InMemoryListenerRegistry registry = new InMemoryListenerRegistry();

    @Test
    void user_shouldBeListeningWhileSubscribed() {
        assertThat(registry.isListening("u1")).isFalse();

        InMemoryListenerRegistry.Subscription subscription = registry.subscribe("u1", (key, payload) -> { });
        assertThat(registry.isListening("u1")).isTrue();
        assertThat(registry.isListening("u2")).isFalse();

        subscription.close();
        assertThat(registry.isListening("u1")).isFalse();
    }

    @Test
    void publish_shouldReachEveryListenerOfTheUser() {
        List<String> received = new CopyOnWriteArrayList<>();
        registry.subscribe("u1", (key, payload) -> received.add("a:" + key + ":" + payload.asText()));
        registry.subscribe("u1", (key, payload) -> received.add("b:" + key + ":" + payload.asText()));
        registry.subscribe("u2", (key, payload) -> received.add("c:" + key));

        boolean delivered = registry.publish("u1", "list_machines", TextNode.valueOf("m"));

        assertThat(delivered).isTrue();
        assertThat(received).containsExactlyInAnyOrder("a:list_machines:m", "b:list_machines:m");
    }

    @Test
    void publish_withoutListeners_shouldReportNoChannel() {
        assertThat(registry.publish("u1", "ping", TextNode.valueOf("x"))).isFalse();
    }

    @Test
    void failingListener_shouldNotBlockOthers() {
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        registry.subscribe("u1", (key, payload) -> {
            throw new IllegalStateException("socket closed");
        });
        registry.subscribe("u1", (key, payload) -> received.add(payload));

        assertThat(registry.publish("u1", "ping", TextNode.valueOf("x"))).isTrue();
        assertThat(received).hasSize(1);
        assertThat(registry.listenerCount("u1")).isEqualTo(2);
    }
}

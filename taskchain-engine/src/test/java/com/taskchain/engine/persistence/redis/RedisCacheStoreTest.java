package com.taskchain.engine.persistence.redis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchain.core.exception.CacheStoreException;
import com.taskchain.engine.cache.TaskCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RedisCacheStoreTest {

    private final ObjectMapper objectMapper = TaskCache.defaultObjectMapper();

    private StringRedisTemplate redis;
    private ValueOperations<String, String> valueOps;
    private RedisCacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(valueOps);
        store = new RedisCacheStore(redis, objectMapper);
    }

    @Test
    void get_shouldParseStoredJson() {
        when(valueOps.get("taskchain:abc")).thenReturn("{\"seqId\":\"S1\"}");

        assertThat(store.get("taskchain:abc"))
            .hasValueSatisfying(node -> assertThat(node.get("seqId").asText()).isEqualTo("S1"));
    }

    @Test
    void get_shouldReturnEmptyForMissingKey() {
        when(valueOps.get("taskchain:abc")).thenReturn(null);

        assertThat(store.get("taskchain:abc")).isEmpty();
    }

    @Test
    void get_shouldTreatMalformedJsonAsAbsent() {
        when(valueOps.get("taskchain:abc")).thenReturn("{not json");

        assertThat(store.get("taskchain:abc")).isEmpty();
    }

    @Test
    void set_shouldStoreJsonWithoutExpiry() {
        JsonNode record = objectMapper.valueToTree(Map.of("seqId", "S1"));

        store.set("taskchain:abc", record);

        verify(valueOps).set("taskchain:abc", "{\"seqId\":\"S1\"}");
    }

    @Test
    void delete_shouldReportWhetherKeyExisted() {
        when(redis.delete("taskchain:abc")).thenReturn(true);
        when(redis.delete("taskchain:def")).thenReturn(false);

        assertThat(store.delete("taskchain:abc")).isTrue();
        assertThat(store.delete("taskchain:def")).isFalse();
    }

    @Test
    void connectionFailure_shouldBeWrapped() {
        when(valueOps.get("taskchain:abc")).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.get("taskchain:abc"))
            .isInstanceOf(CacheStoreException.class)
            .hasMessageContaining("taskchain:abc")
            .extracting(e -> ((CacheStoreException) e).getErrorCode())
            .isEqualTo(CacheStoreException.ERROR_CODE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ping_shouldReportReachability() {
        when(redis.execute(any(RedisCallback.class))).thenReturn("PONG");
        assertThat(store.ping()).isTrue();

        when(redis.execute(any(RedisCallback.class))).thenThrow(new RedisConnectionFailureException("down"));
        assertThat(store.ping()).isFalse();
    }
}

package com.taskchain.engine.persistence.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchain.core.exception.CacheStoreException;
import com.taskchain.core.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;

/**
 * Redis implementation of CacheStore.
 * Records are stored as JSON strings under their cache key, without expiry;
 * freshness is judged from the record timestamp, never from a Redis TTL.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisCacheStore(StringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        String value;
        try {
            value = redis.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new CacheStoreException("get", key, e);
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(value));
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed JSON at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, JsonNode record) {
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("encode", key, e);
        } catch (DataAccessException e) {
            throw new CacheStoreException("set", key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redis.delete(key));
        } catch (DataAccessException e) {
            throw new CacheStoreException("delete", key, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            String pong = redis.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}

package com.taskchain.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.repository.CacheStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CacheStore.
 * Shared by all workers of one process; for tests and single-node setups.
 */
public class InMemoryCacheStore implements CacheStore {
    
    private final Map<String, JsonNode> entries = new ConcurrentHashMap<>();
    
    @Override
    public Optional<JsonNode> get(String key) {
        JsonNode value = entries.get(key);
        return value != null ? Optional.of(value.deepCopy()) : Optional.empty();
    }
    
    @Override
    public void set(String key, JsonNode record) {
        entries.put(key, record.deepCopy());
    }
    
    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }
    
    @Override
    public boolean ping() {
        return true;
    }
    
    /**
     * Number of stored records.
     */
    public int size() {
        return entries.size();
    }
    
    /**
     * Check whether a key is present.
     */
    public boolean contains(String key) {
        return entries.containsKey(key);
    }
}

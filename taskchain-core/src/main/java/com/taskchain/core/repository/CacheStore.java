package com.taskchain.core.repository;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Shared key-value store holding result and error records.
 * No transactional guarantee spans two keys; callers must tolerate read skew
 * between the result and the error record of one identity.
 * 
 * Implementations throw {@link com.taskchain.core.exception.CacheStoreException}
 * when the backing store is unreachable.
 */
public interface CacheStore {

    /**
     * Read a record.
     * 
     * @param key The cache key
     * @return The stored record, empty if absent
     */
    Optional<JsonNode> get(String key);

    /**
     * Store or overwrite a record. Records never expire on their own.
     * 
     * @param key The cache key
     * @param record The record to store
     */
    void set(String key, JsonNode record);

    /**
     * Delete a record.
     * 
     * @param key The cache key
     * @return true if a record was deleted
     */
    boolean delete(String key);

    /**
     * Check that the store is reachable.
     * 
     * @return true if the store answered
     */
    boolean ping();
}

package com.taskchain.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskchain.core.model.ErrorRecord;
import com.taskchain.core.model.ResultRecord;
import com.taskchain.core.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Typed view of the cache store: reads and writes result and error records
 * as JSON documents.
 * 
 * A document that no longer decodes (e.g. written by an incompatible
 * version) is reported as absent, so the chain recomputes and overwrites it.
 */
public class TaskCache {

    private static final Logger log = LoggerFactory.getLogger(TaskCache.class);

    private final CacheStore store;
    private final ObjectMapper objectMapper;

    public TaskCache(CacheStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Object mapper used for cache documents and task payloads.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    public Optional<ResultRecord> getResult(String resultKey) {
        return read(resultKey, ResultRecord.class);
    }

    public void putResult(String resultKey, ResultRecord record) {
        store.set(resultKey, objectMapper.valueToTree(record));
    }

    public boolean deleteResult(String resultKey) {
        return store.delete(resultKey);
    }

    public Optional<ErrorRecord> getError(String errorKey) {
        return read(errorKey, ErrorRecord.class);
    }

    public void putError(String errorKey, ErrorRecord record) {
        store.set(errorKey, objectMapper.valueToTree(record));
    }

    public boolean deleteError(String errorKey) {
        return store.delete(errorKey);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Optional<JsonNode> document = store.get(key);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(document.get(), type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring undecodable {} at {}: {}", type.getSimpleName(), key, e.getMessage());
            return Optional.empty();
        }
    }
}

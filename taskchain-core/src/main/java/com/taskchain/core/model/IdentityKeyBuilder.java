package com.taskchain.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.taskchain.core.exception.TaskChainException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Maps a task identity to its cache keys.
 * 
 * The identity is encoded as the canonical JSON array
 * {@code [taskName, [userId, args...], kwargs]} (map entries and bean
 * properties sorted by key, JSON objects included) and hashed with SHA-256, so every key has the
 * same length whatever the arguments. The error key is the result key with
 * {@value #ERROR_SUFFIX} appended.
 */
public final class IdentityKeyBuilder {

    public static final String KEY_PREFIX = "taskchain:";
    public static final String ERROR_SUFFIX = "error";
    public static final String ERROR_CODE = "KEY_ENCODING_FAILED";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private static final TypeReference<List<Object>> PLAIN_LIST = new TypeReference<>() {
    };

    private IdentityKeyBuilder() {
    }

    /**
     * Canonical JSON form of the identity. Also used in log lines.
     */
    public static String describe(TaskIdentity identity) {
        List<Object> positional = new ArrayList<>(identity.args().size() + 1);
        positional.add(identity.userId());
        positional.addAll(identity.args());
        try {
            // JSON trees keep field insertion order; convert them to maps so the entries get sorted
            List<Object> plain = CANONICAL.convertValue(
                List.of(identity.taskName(), positional, identity.kwargs()), PLAIN_LIST);
            return CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TaskChainException(ERROR_CODE,
                "Cannot encode arguments of task '" + identity.taskName() + "'", e);
        }
    }

    /**
     * Key of the result record for an identity.
     */
    public static String resultKey(TaskIdentity identity) {
        return KEY_PREFIX + sha256(describe(identity));
    }

    /**
     * Key of the error record that belongs to a result key.
     */
    public static String errorKey(String resultKey) {
        return resultKey + ERROR_SUFFIX;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

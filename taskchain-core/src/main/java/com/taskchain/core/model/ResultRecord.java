package com.taskchain.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Last successful result of a task identity, as held by the cache store.
 * Overwritten on every successful, published execution.
 */
public record ResultRecord(
    Instant timestamp,
    JsonNode payload,
    String seqId
) {
    /**
     * Get the age of this result at the given instant.
     */
    public Duration age(Instant now) {
        return Duration.between(timestamp, now);
    }

    /**
     * Check if the result is younger than the freshness window.
     */
    public boolean isFresh(Instant now, Duration resultFresh) {
        return age(now).compareTo(resultFresh) < 0;
    }

    /**
     * Check if the result may still be served to a caller.
     */
    public boolean isUsable(Instant now, Duration resultExpires) {
        return age(now).compareTo(resultExpires) < 0;
    }

    /**
     * Check if this result was produced by the given chain.
     */
    public boolean belongsTo(String otherSeqId) {
        return seqId != null && seqId.equals(otherSeqId);
    }
}

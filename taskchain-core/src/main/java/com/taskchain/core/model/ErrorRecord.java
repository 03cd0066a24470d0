package com.taskchain.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Consecutive failures of a task identity since its last success or give-up.
 * 
 * Invariants:
 * - timestamps is non-decreasing
 * - timestamps.size() equals the number of consecutive failures
 */
public record ErrorRecord(
    String seqId,
    List<Instant> timestamps
) {
    public ErrorRecord {
        timestamps = timestamps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(timestamps));
    }

    /**
     * Start an empty error record for a chain.
     */
    public static ErrorRecord start(String seqId) {
        return new ErrorRecord(seqId, List.of());
    }

    /**
     * Copy of this record with one more failure. A failure time earlier than
     * the last recorded one (clock skew between workers) is clamped to it.
     */
    public ErrorRecord withFailure(Instant at) {
        List<Instant> updated = new ArrayList<>(timestamps);
        if (!updated.isEmpty() && at.isBefore(updated.get(updated.size() - 1))) {
            at = updated.get(updated.size() - 1);
        }
        updated.add(at);
        return new ErrorRecord(seqId, updated);
    }

    /**
     * Number of consecutive failures.
     */
    public int failureCount() {
        return timestamps.size();
    }

    /**
     * Failure times as offsets from the first failure; the first entry is zero.
     */
    public List<Duration> offsets() {
        if (timestamps.isEmpty()) {
            return List.of();
        }
        Instant first = timestamps.get(0);
        List<Duration> offsets = new ArrayList<>(timestamps.size());
        for (Instant t : timestamps) {
            offsets.add(Duration.between(first, t));
        }
        return Collections.unmodifiableList(offsets);
    }
}

package com.taskchain.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Short-lived lock on one chain of one task identity, so that two workers
 * handed the same delivery do not both execute it.
 * 
 * Primary Key: leaseKey
 * 
 * Invariants:
 * - Only one active lease per leaseKey
 * - fenceToken increases on every acquisition
 * - Lease expires automatically, a crashed worker never blocks the chain for long
 */
public record ChainLease(
    // Primary key: {resultKey}:{seqId}
    String leaseKey,
    
    // Ownership
    UUID holderId,
    
    // Timing
    Instant acquiredAt,
    Instant expiresAt,
    
    // Fencing
    long fenceToken
) {
    /**
     * Default lease duration: 5 minutes.
     */
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofMinutes(5);

    /**
     * Create a lease key from a result key and execution sequence.
     */
    public static String createLeaseKey(String resultKey, String seqId) {
        return resultKey + ":" + seqId;
    }

    /**
     * Create a new lease.
     */
    public static ChainLease create(String leaseKey, UUID holderId, Instant now, Duration duration) {
        return new ChainLease(leaseKey, holderId, now, now.plus(duration), 0L);
    }

    /**
     * Copy of this lease with the fence token it was granted.
     */
    public ChainLease withFenceToken(long fenceToken) {
        return new ChainLease(leaseKey, holderId, acquiredAt, expiresAt, fenceToken);
    }

    /**
     * Check if the lease is still valid at the given instant.
     */
    public boolean isValidAt(Instant now) {
        return expiresAt.isAfter(now);
    }
}

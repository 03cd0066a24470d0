package com.taskchain.core.repository;

import com.taskchain.core.model.ChainLease;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for chain leases.
 * Guards a single (identity, sequence) against concurrent execution after a
 * duplicate delivery.
 */
public interface ChainLeaseStore {

    /**
     * Try to acquire a lease.
     * 
     * @param lease The lease to acquire
     * @param now Current time, used to detect expired holders
     * @return The granted lease carrying its fence token, empty if another holder has it
     */
    Optional<ChainLease> tryAcquire(ChainLease lease, Instant now);

    /**
     * Release a lease.
     * 
     * @param leaseKey The lease key
     * @param holderId The current holder ID
     * @return true if release succeeded, false if the lease was already released or taken
     */
    boolean release(String leaseKey, UUID holderId);
}

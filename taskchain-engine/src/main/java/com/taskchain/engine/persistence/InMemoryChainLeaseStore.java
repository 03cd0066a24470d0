package com.taskchain.engine.persistence;

import com.taskchain.core.model.ChainLease;
import com.taskchain.core.repository.ChainLeaseStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of ChainLeaseStore.
 * For tests and single-node setups.
 */
public class InMemoryChainLeaseStore implements ChainLeaseStore {
    
    private final Map<String, ChainLease> leases = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> fenceTokens = new ConcurrentHashMap<>();
    
    @Override
    public Optional<ChainLease> tryAcquire(ChainLease lease, Instant now) {
        synchronized (leases) {
            ChainLease existing = leases.get(lease.leaseKey());
            
            if (existing != null && existing.isValidAt(now)) {
                // Lease still held by someone
                return Optional.empty();
            }
            
            long fenceToken = fenceTokens
                .computeIfAbsent(lease.leaseKey(), k -> new AtomicLong(0))
                .incrementAndGet();
            ChainLease granted = lease.withFenceToken(fenceToken);
            leases.put(lease.leaseKey(), granted);
            return Optional.of(granted);
        }
    }
    
    @Override
    public boolean release(String leaseKey, UUID holderId) {
        synchronized (leases) {
            ChainLease existing = leases.get(leaseKey);
            if (existing == null || !existing.holderId().equals(holderId)) {
                return false;
            }
            leases.remove(leaseKey);
            return true;
        }
    }
    
    /**
     * Find a held lease by key.
     */
    public Optional<ChainLease> findByKey(String leaseKey) {
        return Optional.ofNullable(leases.get(leaseKey));
    }
    
    /**
     * Get the last fence token granted for a key (0 if never acquired).
     */
    public long getFenceToken(String leaseKey) {
        AtomicLong token = fenceTokens.get(leaseKey);
        return token != null ? token.get() : 0;
    }
}

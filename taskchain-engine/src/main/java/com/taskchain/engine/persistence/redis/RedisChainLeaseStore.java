package com.taskchain.engine.persistence.redis;

import com.taskchain.core.exception.CacheStoreException;
import com.taskchain.core.model.ChainLease;
import com.taskchain.core.repository.ChainLeaseStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis implementation of ChainLeaseStore.
 * 
 * Acquisition is a single {@code SET key holder NX PX ttl}; expiry is left to
 * Redis. The fence token is a counter kept next to the lease key and
 * incremented on every successful acquisition. Release only deletes the key
 * while it still names the releasing holder.
 */
public class RedisChainLeaseStore implements ChainLeaseStore {

    static final String KEY_PREFIX = "lease:";
    static final String FENCE_SUFFIX = ":fence";

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
        "if redis.call('get', KEYS[1]) == ARGV[1] then "
            + "return redis.call('del', KEYS[1]) "
            + "else return 0 end",
        Long.class);

    private final StringRedisTemplate redis;

    public RedisChainLeaseStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<ChainLease> tryAcquire(ChainLease lease, Instant now) {
        String key = KEY_PREFIX + lease.leaseKey();
        Duration ttl = Duration.between(now, lease.expiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            return Optional.empty();
        }
        try {
            Boolean acquired = redis.opsForValue().setIfAbsent(key, lease.holderId().toString(), ttl);
            if (!Boolean.TRUE.equals(acquired)) {
                return Optional.empty();
            }
            Long fenceToken = redis.opsForValue().increment(key + FENCE_SUFFIX);
            return Optional.of(lease.withFenceToken(fenceToken != null ? fenceToken : 0L));
        } catch (DataAccessException e) {
            throw new CacheStoreException("acquire lease", key, e);
        }
    }

    @Override
    public boolean release(String leaseKey, UUID holderId) {
        String key = KEY_PREFIX + leaseKey;
        try {
            Long deleted = redis.execute(RELEASE_SCRIPT, List.of(key), holderId.toString());
            return deleted != null && deleted > 0;
        } catch (DataAccessException e) {
            throw new CacheStoreException("release lease", key, e);
        }
    }
}

package com.taskchain.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.model.IdentityKeyBuilder;
import com.taskchain.core.model.ResultRecord;
import com.taskchain.core.model.TaskDefinition;
import com.taskchain.core.model.TaskIdentity;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.core.port.TaskQueue;
import com.taskchain.engine.cache.TaskCache;
import com.taskchain.engine.registry.TaskRegistry;
import com.taskchain.engine.service.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Coordinator for external triggers.
 * Submits chain starts to the queue and answers from the cache where possible.
 */
public class TriggerCoordinator implements TriggerService {

    private static final Logger log = LoggerFactory.getLogger(TriggerCoordinator.class);

    private final TaskRegistry registry;
    private final TaskCache cache;
    private final TaskQueue queue;
    private final Clock clock;

    public TriggerCoordinator(TaskRegistry registry, TaskCache cache, TaskQueue queue, Clock clock) {
        this.registry = registry;
        this.cache = cache;
        this.queue = queue;
        this.clock = clock;
    }

    @Override
    public void trigger(TaskInvocation invocation) {
        registry.get(invocation.taskName());
        queue.submit(externalStart(invocation));
        log.info("Triggered {} for user {}", invocation.taskName(), invocation.userId());
    }

    @Override
    public Optional<JsonNode> smartDelay(TaskInvocation invocation) {
        TaskDefinition definition = registry.get(invocation.taskName());
        TaskInvocation start = externalStart(invocation);
        String resultKey = IdentityKeyBuilder.resultKey(TaskIdentity.of(start));

        Optional<ResultRecord> cached = cache.getResult(resultKey);
        if (cached.isEmpty()) {
            queue.submit(start);
            log.debug("No cached result for {}, scheduled", invocation.taskName());
            return Optional.empty();
        }

        Instant now = clock.instant();
        Duration age = cached.get().age(now);
        if (age.compareTo(definition.resultFresh()) > 0) {
            queue.submit(start);
            log.debug("Cached {} is {} old, scheduled refresh", invocation.taskName(), age);
        }
        if (cached.get().isUsable(now, definition.resultExpires())) {
            log.debug("Smart delay cache hit for {}", invocation.taskName());
            return Optional.ofNullable(cached.get().payload());
        }
        return Optional.empty();
    }

    @Override
    public boolean clearCache(TaskInvocation invocation) {
        String resultKey = IdentityKeyBuilder.resultKey(TaskIdentity.of(invocation));
        log.info("Clearing cached result of {} for user {}", invocation.taskName(), invocation.userId());
        return cache.deleteResult(resultKey);
    }

    private static TaskInvocation externalStart(TaskInvocation invocation) {
        if (!invocation.kwargs().containsKey(TaskInvocation.SEQ_ID)) {
            return invocation;
        }
        return new TaskInvocation(invocation.taskName(), invocation.userId(),
            invocation.args(), invocation.kwargsWithoutSeqId());
    }
}

package com.taskchain.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.taskchain.core.exception.TaskExecutionException;
import com.taskchain.core.model.*;
import com.taskchain.core.port.PresenceOracle;
import com.taskchain.core.port.ResultPublisher;
import com.taskchain.core.port.TaskQueue;
import com.taskchain.core.repository.ChainLeaseStore;
import com.taskchain.engine.cache.TaskCache;
import com.taskchain.engine.logging.LoggingContext;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs one invocation of a chain task to completion.
 *
 * Each call walks the chain state machine once: derive keys, load the error
 * record, check presence, check the cached result against the inbound
 * sequence, assign the sequence, execute, then either back off or publish,
 * cache and (for polling tasks) reschedule. Waiting is always expressed as a
 * delayed resubmission, never by blocking the worker.
 *
 * Domain failures are converted into backoff decisions here and never leave
 * this class. Cache store and queue failures propagate to the caller.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final TaskRegistry registry;
    private final TaskCache cache;
    private final PresenceOracle presence;
    private final ResultPublisher publisher;
    private final TaskQueue queue;
    private final ChainLeaseStore leaseStore;
    private final Duration leaseDuration;
    private final TaskChainMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Supplier<String> seqIdSupplier;
    private final UUID workerId;

    private TaskRunner(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.cache = Objects.requireNonNull(builder.cache, "cache");
        this.presence = Objects.requireNonNull(builder.presence, "presence");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.leaseStore = builder.leaseStore;
        this.leaseDuration = builder.leaseDuration;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.objectMapper = builder.objectMapper;
        this.seqIdSupplier = builder.seqIdSupplier;
        this.workerId = builder.workerId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run one invocation of a registered chain task.
     *
     * @param invocation The task, its arguments and the inbound seq_id (if any)
     * @return How this invocation ended
     * @throws com.taskchain.core.exception.UnknownTaskException if the task is not registered
     * @throws com.taskchain.core.exception.CacheStoreException if the cache store fails
     * @throws com.taskchain.core.exception.QueueSubmissionException if a resubmission is refused
     */
    public ChainOutcome run(TaskInvocation invocation) {
        TaskDefinition definition = registry.get(invocation.taskName());
        try (LoggingContext ctx = LoggingContext.forTask(invocation.taskName(), invocation.userId())) {
            ChainOutcome outcome = runChain(definition, invocation);
            metrics.chainOutcome(definition.taskName(), outcome);
            log.debug("Invocation ended with {}", outcome);
            return outcome;
        }
    }

    private ChainOutcome runChain(TaskDefinition definition, TaskInvocation invocation) {
        // 1. Identity and keys
        TaskIdentity identity = TaskIdentity.of(invocation);
        String resultKey = IdentityKeyBuilder.resultKey(identity);
        String errorKey = IdentityKeyBuilder.errorKey(resultKey);
        String inboundSeqId = invocation.seqId();
        LoggingContext.setSeqId(inboundSeqId);

        // 2. Failure history
        Optional<ErrorRecord> errorRecord = cache.getError(errorKey);

        // 3. Presence
        if (!presence.isListening(invocation.userId())) {
            if (errorRecord.isPresent()) {
                cache.deleteError(errorKey);
            }
            log.info("No listener for user {}, ending chain", invocation.userId());
            return ChainOutcome.PRESENCE_LOST;
        }

        // 4. Conflict check
        Optional<ResultRecord> cached = cache.getResult(resultKey);
        if (cached.isPresent()) {
            ResultRecord result = cached.get();
            if (!inboundSeqId.isEmpty() && !result.belongsTo(inboundSeqId)) {
                log.info("Chain {} superseded by {}", inboundSeqId, result.seqId());
                return ChainOutcome.SUPERSEDED;
            }
            if (inboundSeqId.isEmpty() && result.isFresh(clock.instant(), definition.resultFresh())) {
                log.debug("Fresh result cached {} ago, not recomputing", result.age(clock.instant()));
                return ChainOutcome.FRESH_CACHE_HIT;
            }
        }

        // 5. Sequence assignment
        String seqId = inboundSeqId.isEmpty() ? seqIdSupplier.get() : inboundSeqId;
        LoggingContext.setSeqId(seqId);

        if (leaseStore == null) {
            return executeAndAdvance(definition, invocation, seqId, resultKey, errorKey, errorRecord);
        }

        String leaseKey = ChainLease.createLeaseKey(resultKey, seqId);
        Optional<ChainLease> lease = leaseStore.tryAcquire(
            ChainLease.create(leaseKey, workerId, clock.instant(), leaseDuration), clock.instant());
        metrics.leaseAcquired(definition.taskName(), lease.isPresent());
        if (lease.isEmpty()) {
            log.info("Chain {} is already running on another worker", seqId);
            return ChainOutcome.DUPLICATE_DELIVERY;
        }
        log.debug("Acquired chain lease {} with fence token {}", leaseKey, lease.get().fenceToken());
        try {
            return executeAndAdvance(definition, invocation, seqId, resultKey, errorKey, errorRecord);
        } finally {
            if (!leaseStore.release(leaseKey, workerId)) {
                log.warn("Chain lease {} expired before release", leaseKey);
            }
        }
    }

    private ChainOutcome executeAndAdvance(
            TaskDefinition definition,
            TaskInvocation invocation,
            String seqId,
            String resultKey,
            String errorKey,
            Optional<ErrorRecord> errorRecord) {

        // 6. / 7. Execute and translate failures
        ExecutionOutcome outcome = execute(definition, invocation, seqId, errorKey, errorRecord);

        switch (outcome.kind()) {
            case RETRY:
                queue.submit(invocation.withSeqId(seqId), outcome.retryDelay());
                log.info("Retrying in {} after {}", outcome.retryDelay(), outcome.errorCode());
                return ChainOutcome.RETRY_SCHEDULED;
            case GIVE_UP:
                log.warn("Giving up after {}", outcome.errorCode());
                return ChainOutcome.GAVE_UP;
            default:
                break;
        }

        // 8. Success
        if (errorRecord.isPresent()) {
            cache.deleteError(errorKey);
        }
        ResultRecord result = new ResultRecord(clock.instant(), outcome.payload(), seqId);

        if (!publisher.publish(invocation.userId(), definition.taskName(), outcome.payload())) {
            log.info("Nobody received the result, ending chain without caching");
            return ChainOutcome.PUBLISH_FAILED;
        }
        cache.putResult(resultKey, result);

        if (!definition.polling()) {
            return ChainOutcome.COMPLETED;
        }
        queue.submit(invocation.withSeqId(seqId), definition.resultFresh());
        log.debug("Next poll in {}", definition.resultFresh());
        return ChainOutcome.RESCHEDULED;
    }

    private ExecutionOutcome execute(
            TaskDefinition definition,
            TaskInvocation invocation,
            String seqId,
            String errorKey,
            Optional<ErrorRecord> errorRecord) {

        TaskContext context = new TaskContext(invocation, seqId, objectMapper);
        Instant started = clock.instant();
        try {
            JsonNode payload = definition.handler().execute(context);
            metrics.executionRecorded(definition.taskName(), true, Duration.between(started, clock.instant()));
            return ExecutionOutcome.success(payload != null ? payload : NullNode.getInstance());
        } catch (TaskExecutionException e) {
            metrics.executionRecorded(definition.taskName(), false, Duration.between(started, clock.instant()));
            log.warn("Task failed [{}]: {}", e.getErrorCode(), e.getMessage());
            if (!e.isRetryable()) {
                if (errorRecord.isPresent()) {
                    cache.deleteError(errorKey);
                }
                return ExecutionOutcome.giveUp(e.getErrorCode());
            }
            return onFailure(definition, invocation, seqId, errorKey, errorRecord, e.getErrorCode());
        } catch (RuntimeException e) {
            metrics.executionRecorded(definition.taskName(), false, Duration.between(started, clock.instant()));
            log.warn("Task failed unexpectedly", e);
            return onFailure(definition, invocation, seqId, errorKey, errorRecord, INTERNAL_ERROR);
        }
    }

    private ExecutionOutcome onFailure(
            TaskDefinition definition,
            TaskInvocation invocation,
            String seqId,
            String errorKey,
            Optional<ErrorRecord> errorRecord,
            String errorCode) {

        ErrorRecord updated = errorRecord
            .orElseGet(() -> ErrorRecord.start(seqId))
            .withFailure(clock.instant());

        BackoffDecision decision;
        try {
            decision = definition.backoffPolicy().decide(updated.offsets(), invocation);
        } catch (RuntimeException e) {
            log.error("Backoff policy of {} failed, giving up", definition.taskName(), e);
            decision = BackoffDecision.giveUp();
        }

        if (decision == null || decision.isGiveUp()) {
            cache.deleteError(errorKey);
            return ExecutionOutcome.giveUp(errorCode);
        }
        cache.putError(errorKey, updated);
        log.debug("Failure #{} of chain {}", updated.failureCount(), seqId);
        return ExecutionOutcome.retry(decision.delay(), errorCode);
    }

    /**
     * Builder for TaskRunner.
     */
    public static class Builder {
        private TaskRegistry registry;
        private TaskCache cache;
        private PresenceOracle presence;
        private ResultPublisher publisher;
        private TaskQueue queue;
        private ChainLeaseStore leaseStore;
        private Duration leaseDuration = ChainLease.DEFAULT_LEASE_DURATION;
        private TaskChainMetrics metrics = new TaskChainMetrics();
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper = TaskCache.defaultObjectMapper();
        private Supplier<String> seqIdSupplier = () -> UUID.randomUUID().toString().replace("-", "");
        private UUID workerId = UUID.randomUUID();

        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder cache(TaskCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder presence(PresenceOracle presence) {
            this.presence = presence;
            return this;
        }

        public Builder publisher(ResultPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder queue(TaskQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Guard each (identity, seq_id) with a lease; without a store,
         * duplicate deliveries may execute concurrently.
         */
        public Builder leaseStore(ChainLeaseStore leaseStore, Duration leaseDuration) {
            this.leaseStore = leaseStore;
            this.leaseDuration = leaseDuration;
            return this;
        }

        public Builder metrics(TaskChainMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder seqIdSupplier(Supplier<String> seqIdSupplier) {
            this.seqIdSupplier = seqIdSupplier;
            return this;
        }

        public Builder workerId(UUID workerId) {
            this.workerId = workerId;
            return this;
        }

        public TaskRunner build() {
            return new TaskRunner(this);
        }
    }
}

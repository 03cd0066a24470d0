package com.taskchain.engine.metrics;

import com.taskchain.core.model.ChainOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for task chains and bounded-retry jobs.
 * 
 * Metrics exposed:
 * - Chain invocation outcomes per task
 * - Execute step latency
 * - Infrastructure failures (cache store, queue)
 * - Chain lease contention
 * - Job outcomes
 * - Queue backlog
 * 
 * Until bound to an application registry, meters go to a private
 * {@link SimpleMeterRegistry}.
 */
public class TaskChainMetrics implements MeterBinder {

    // Metric names
    public static final String CHAIN_OUTCOMES = "taskchain.chain.outcomes";
    public static final String EXECUTION_DURATION = "taskchain.execution.duration";
    public static final String INFRASTRUCTURE_FAILURES = "taskchain.infrastructure.failures";
    public static final String LEASE_ACQUISITIONS = "taskchain.lease.acquisitions";
    public static final String JOB_OUTCOMES = "taskchain.job.outcomes";
    public static final String QUEUE_PENDING = "taskchain.queue.pending";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicInteger queuePending = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(QUEUE_PENDING, queuePending, AtomicInteger::get)
            .description("Invocations waiting for delivery")
            .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void chainOutcome(String taskName, ChainOutcome outcome) {
        Counter.builder(CHAIN_OUTCOMES)
            .tag("task", taskName)
            .tag("outcome", outcome.name().toLowerCase())
            .description("Chain task invocations by outcome")
            .register(registry)
            .increment();
    }

    public void executionRecorded(String taskName, boolean success, Duration duration) {
        Timer.builder(EXECUTION_DURATION)
            .tag("task", taskName)
            .tag("outcome", success ? "success" : "failure")
            .description("Duration of the execute step")
            .register(registry)
            .record(duration);
    }

    public void infrastructureFailure(String taskName, String errorCode) {
        Counter.builder(INFRASTRUCTURE_FAILURES)
            .tag("task", taskName)
            .tag("error_code", errorCode != null ? errorCode : "UNKNOWN")
            .description("Invocations aborted by cache store or queue failures")
            .register(registry)
            .increment();
    }

    public void leaseAcquired(String taskName, boolean success) {
        Counter.builder(LEASE_ACQUISITIONS)
            .tag("task", taskName)
            .tag("success", String.valueOf(success))
            .description("Chain lease acquisition attempts")
            .register(registry)
            .increment();
    }

    public void jobOutcome(String jobName, String outcome) {
        Counter.builder(JOB_OUTCOMES)
            .tag("job", jobName)
            .tag("outcome", outcome.toLowerCase())
            .description("Bounded-retry job attempts by outcome")
            .register(registry)
            .increment();
    }

    public void recordQueuePending(int pending) {
        queuePending.set(pending);
    }

    /**
     * Read a chain outcome counter, 0 if never incremented.
     */
    public double chainOutcomeCount(String taskName, ChainOutcome outcome) {
        Counter counter = registry.find(CHAIN_OUTCOMES)
            .tag("task", taskName)
            .tag("outcome", outcome.name().toLowerCase())
            .counter();
        return counter != null ? counter.count() : 0;
    }
}

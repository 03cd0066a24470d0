package com.taskchain.engine.queue;

import com.taskchain.core.exception.QueueSubmissionException;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.core.port.TaskConsumer;
import com.taskchain.core.port.TaskQueue;
import com.taskchain.engine.metrics.TaskChainMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delayed task queue backed by a scheduled worker pool in this process.
 * 
 * Each submission is delivered once, no earlier than its delay, to the
 * consumer given at start-up. Deliveries run concurrently on the pool; a
 * waiting invocation holds no thread. Pending invocations are lost on stop.
 */
public class InProcessTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(InProcessTaskQueue.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final int workers;
    private final TaskChainMetrics metrics;
    private final AtomicInteger pending = new AtomicInteger(0);

    private volatile ScheduledExecutorService scheduler;
    private volatile TaskConsumer consumer;
    private volatile boolean running = false;

    public InProcessTaskQueue(int workers, TaskChainMetrics metrics) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        this.workers = workers;
        this.metrics = metrics;
    }

    /**
     * Start delivering to the given consumer.
     */
    public synchronized void start(TaskConsumer consumer) {
        if (running) {
            log.warn("Task queue already running");
            return;
        }
        this.consumer = consumer;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(workers, new WorkerThreadFactory());
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
        running = true;
        log.info("Task queue started with {} workers", workers);
    }

    /**
     * Stop the queue. Running deliveries get a grace period; waiting ones are dropped.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int dropped = pending.getAndSet(0);
        metrics.recordQueuePending(0);
        log.info("Task queue stopped, {} pending invocations dropped", dropped);
    }

    @Override
    public void submit(TaskInvocation invocation, Duration delay) {
        if (!running) {
            throw new QueueSubmissionException(invocation.taskName(), "queue is not running");
        }
        long delayMs = delay == null || delay.isNegative() ? 0 : delay.toMillis();
        metrics.recordQueuePending(pending.incrementAndGet());
        try {
            scheduler.schedule(() -> deliver(invocation), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            metrics.recordQueuePending(pending.decrementAndGet());
            throw new QueueSubmissionException(invocation.taskName(), e);
        }
        log.debug("Queued {} for user {} in {}ms", invocation.taskName(), invocation.userId(), delayMs);
    }

    private void deliver(TaskInvocation invocation) {
        metrics.recordQueuePending(pending.decrementAndGet());
        try {
            consumer.consume(invocation);
        } catch (RuntimeException e) {
            log.error("Consumer failed on {} for user {}", invocation.taskName(), invocation.userId(), e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Number of invocations waiting for delivery.
     */
    public int getPendingCount() {
        return pending.get();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "taskchain-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

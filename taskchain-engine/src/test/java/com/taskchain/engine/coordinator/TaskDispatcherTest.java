package com.taskchain.engine.coordinator;

import com.taskchain.core.exception.CacheStoreException;
import com.taskchain.core.exception.RetryJobException;
import com.taskchain.core.model.TaskDefinition;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.core.test.FailureInjector;
import com.taskchain.engine.cache.TaskCache;
import com.taskchain.engine.job.BoundedRetryJob;
import com.taskchain.engine.job.JobContext;
import com.taskchain.engine.job.RetryingJobRunner;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.persistence.InMemoryCacheStore;
import com.taskchain.engine.registry.TaskRegistry;
import com.taskchain.engine.test.RecordingPublisher;
import com.taskchain.engine.test.RecordingTaskQueue;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class TaskDispatcherTest {

    private FailureInjector handler;
    private AtomicInteger jobRuns;
    private TaskChainMetrics metrics;
    private InMemoryCacheStore store;
    private TaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        handler = FailureInjector.neverFail();
        jobRuns = new AtomicInteger();
        metrics = new TaskChainMetrics();
        store = new InMemoryCacheStore();
        RecordingTaskQueue queue = new RecordingTaskQueue();
        RecordingPublisher publisher = new RecordingPublisher();

        TaskRegistry registry = new TaskRegistry().register(TaskDefinition.builder("list_sizes")
            .resultFresh(Duration.ofHours(1))
            .resultExpires(Duration.ofDays(7))
            .handler(handler)
            .build());
        TaskRunner runner = TaskRunner.builder()
            .registry(registry)
            .cache(new TaskCache(store, TaskCache.defaultObjectMapper()))
            .presence(publisher)
            .publisher(publisher)
            .queue(queue)
            .metrics(metrics)
            .build();
        RetryingJobRunner jobRunner = new RetryingJobRunner(queue, metrics).register(new BoundedRetryJob() {
            @Override
            public String name() {
                return "ssh_command";
            }

            @Override
            public int maxRetries() {
                return 0;
            }

            @Override
            public void run(JobContext context) throws RetryJobException {
                jobRuns.incrementAndGet();
            }

            @Override
            public void onGiveUp(JobContext context, Exception cause) {
            }
        });
        dispatcher = new TaskDispatcher(registry, runner, jobRunner, metrics);
    }

    private double infrastructureFailures(String task, String code) {
        Counter counter = metrics.getRegistry().find(TaskChainMetrics.INFRASTRUCTURE_FAILURES)
            .tag("task", task)
            .tag("error_code", code)
            .counter();
        return counter != null ? counter.count() : 0;
    }

    @Test
    void chainTasks_shouldGoToTheRunner() {
        dispatcher.consume(TaskInvocation.of("list_sizes", "u1", "backend-1"));

        assertThat(handler.getCallCount()).isEqualTo(1);
        assertThat(jobRuns).hasValue(0);
    }

    @Test
    void jobs_shouldGoToTheJobRunner() {
        dispatcher.consume(TaskInvocation.of("ssh_command", "u1", "backend-1", "machine-1", "uptime"));

        assertThat(jobRuns).hasValue(1);
        assertThat(handler.getCallCount()).isZero();
    }

    @Test
    void unknownTasks_shouldBeDroppedAndCounted() {
        assertThatCode(() -> dispatcher.consume(TaskInvocation.of("nope", "u1"))).doesNotThrowAnyException();
        assertThat(infrastructureFailures("nope", "UNKNOWN_TASK")).isEqualTo(1.0);
    }

    @Test
    void infrastructureFailures_shouldBeContainedAndCounted() {
        InMemoryCacheStore broken = new InMemoryCacheStore() {
            @Override
            public Optional<com.fasterxml.jackson.databind.JsonNode> get(String key) {
                throw new CacheStoreException("get", key, new IllegalStateException("down"));
            }
        };
        RecordingPublisher publisher = new RecordingPublisher();
        TaskRegistry registry = new TaskRegistry().register(TaskDefinition.builder("list_sizes")
            .resultFresh(Duration.ofHours(1))
            .resultExpires(Duration.ofDays(7))
            .handler(handler)
            .build());
        TaskRunner runner = TaskRunner.builder()
            .registry(registry)
            .cache(new TaskCache(broken, TaskCache.defaultObjectMapper()))
            .presence(publisher)
            .publisher(publisher)
            .queue(new RecordingTaskQueue())
            .metrics(metrics)
            .build();
        TaskDispatcher failing = new TaskDispatcher(
            registry, runner, new RetryingJobRunner(new RecordingTaskQueue(), metrics), metrics);

        assertThatCode(() -> failing.consume(TaskInvocation.of("list_sizes", "u1", "backend-1")))
            .doesNotThrowAnyException();
        assertThat(infrastructureFailures("list_sizes", CacheStoreException.ERROR_CODE)).isEqualTo(1.0);
        assertThat(handler.getCallCount()).isZero();
    }
}

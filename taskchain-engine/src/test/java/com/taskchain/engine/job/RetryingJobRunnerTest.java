package com.taskchain.engine.job;

import com.taskchain.core.exception.InvalidTaskDefinitionException;
import com.taskchain.core.exception.RetryJobException;
import com.taskchain.core.exception.UnknownTaskException;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.test.RecordingTaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingJobRunnerTest {

    private RecordingTaskQueue queue;
    private RetryingJobRunner runner;

    @BeforeEach
    void setUp() {
        queue = new RecordingTaskQueue();
        runner = new RetryingJobRunner(queue, new TaskChainMetrics());
    }

    /**
     * Job failing transiently a given number of times.
     */
    private static class FlakyJob implements BoundedRetryJob {
        private final AtomicInteger failuresLeft;
        private final List<Exception> givenUp = new CopyOnWriteArrayList<>();
        private final AtomicInteger runs = new AtomicInteger();

        FlakyJob(int failures) {
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public String name() {
            return "flaky";
        }

        @Override
        public int maxRetries() {
            return 2;
        }

        @Override
        public void run(JobContext context) throws RetryJobException {
            runs.incrementAndGet();
            if (failuresLeft.getAndDecrement() > 0) {
                throw new RetryJobException("host unreachable", Duration.ofSeconds(60));
            }
        }

        @Override
        public void onGiveUp(JobContext context, Exception cause) {
            givenUp.add(cause);
        }
    }

    @Test
    void transientFailure_shouldBeRedeliveredWithRetryCount() {
        FlakyJob job = new FlakyJob(1);
        runner.register(job);

        JobOutcome first = runner.run(TaskInvocation.of("flaky", "u1", "m1"));

        assertThat(first).isEqualTo(JobOutcome.RETRY_SCHEDULED);
        assertThat(queue.last().delay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(queue.last().invocation().kwargs()).containsEntry(RetryingJobRunner.RETRIES, 1);
        assertThat(queue.last().invocation().args()).containsExactly("m1");

        assertThat(runner.run(queue.last().invocation())).isEqualTo(JobOutcome.SUCCEEDED);
        assertThat(job.givenUp).isEmpty();
    }

    @Test
    void exhaustedRetries_shouldGiveUpOnce() {
        FlakyJob job = new FlakyJob(10);
        runner.register(job);

        runner.run(TaskInvocation.of("flaky", "u1"));
        runner.run(queue.last().invocation());
        JobOutcome last = runner.run(queue.last().invocation());

        assertThat(last).isEqualTo(JobOutcome.FAILED);
        assertThat(job.runs).hasValue(3);
        assertThat(queue.size()).isEqualTo(2);
        assertThat(job.givenUp).hasSize(1).first().isInstanceOf(RetryJobException.class);
    }

    @Test
    void unexpectedFailure_shouldGiveUpWithoutRetry() {
        List<Exception> givenUp = new CopyOnWriteArrayList<>();
        runner.register(new BoundedRetryJob() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public int maxRetries() {
                return 5;
            }

            @Override
            public void run(JobContext context) {
                throw new IllegalArgumentException("bad script");
            }

            @Override
            public void onGiveUp(JobContext context, Exception cause) {
                givenUp.add(cause);
            }
        });

        assertThat(runner.run(TaskInvocation.of("broken", "u1"))).isEqualTo(JobOutcome.FAILED);
        assertThat(queue.size()).isZero();
        assertThat(givenUp).hasSize(1);
    }

    @Test
    void retriesKwarg_shouldAcceptStrings() {
        TaskInvocation invocation = TaskInvocation.of("flaky", "u1").withKwarg(RetryingJobRunner.RETRIES, "3");

        assertThat(RetryingJobRunner.retriesOf(invocation)).isEqualTo(3);
        assertThat(RetryingJobRunner.retriesOf(TaskInvocation.of("flaky", "u1"))).isZero();
    }

    @Test
    void registration_shouldRejectDuplicatesAndUnknownNames() {
        runner.register(new FlakyJob(0));

        assertThatThrownBy(() -> runner.register(new FlakyJob(0)))
            .isInstanceOf(InvalidTaskDefinitionException.class);
        assertThatThrownBy(() -> runner.run(TaskInvocation.of("missing", "u1")))
            .isInstanceOf(UnknownTaskException.class);
    }
}

package com.taskchain.tasks.cloud;

import com.taskchain.core.model.TaskInvocation;
import com.taskchain.engine.job.JobOutcome;
import com.taskchain.engine.job.RetryingJobRunner;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.test.RecordingTaskQueue;
import com.taskchain.tasks.test.RecordingBackendSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MachineCountJobTest {

    private static final String USER = "frank@example.com";

    private final RecordingBackendSettings settings = new RecordingBackendSettings();
    private final RecordingTaskQueue queue = new RecordingTaskQueue();
    private final RetryingJobRunner runner = new RetryingJobRunner(queue, new TaskChainMetrics())
        .register(new MachineCountJob(settings));

    @Test
    void run_shouldStoreCountPerBackendAndKeepUserTotal() {
        assertThat(runner.run(TaskInvocation.of(MachineCountJob.NAME, USER, "b1", 3))).isEqualTo(JobOutcome.SUCCEEDED);
        assertThat(runner.run(TaskInvocation.of(MachineCountJob.NAME, USER, "b2", "4"))).isEqualTo(JobOutcome.SUCCEEDED);
        assertThat(runner.run(TaskInvocation.of(MachineCountJob.NAME, USER, "b1", 1))).isEqualTo(JobOutcome.SUCCEEDED);

        assertThat(settings.machineCounts())
            .containsEntry(USER + "/b1", 1)
            .containsEntry(USER + "/b2", 4);
        assertThat(settings.totalMachineCount(USER)).isEqualTo(5);
    }

    @Test
    void run_shouldFailWithoutRetryOnMalformedCount() {
        assertThat(runner.run(TaskInvocation.of(MachineCountJob.NAME, USER, "b1", "many")))
            .isEqualTo(JobOutcome.FAILED);
        assertThat(runner.run(TaskInvocation.of(MachineCountJob.NAME, USER, "b1", -2)))
            .isEqualTo(JobOutcome.FAILED);

        assertThat(queue.size()).isZero();
        assertThat(settings.machineCounts()).isEmpty();
    }
}

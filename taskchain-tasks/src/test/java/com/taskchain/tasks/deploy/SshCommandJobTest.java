package com.taskchain.tasks.deploy;

import com.taskchain.core.model.TaskInvocation;
import com.taskchain.engine.job.JobOutcome;
import com.taskchain.engine.job.RetryingJobRunner;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.test.RecordingTaskQueue;
import com.taskchain.tasks.test.RecordingNotifier;
import com.taskchain.tasks.test.RecordingShell;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SshCommandJobTest {

    private static final String USER = "dave@example.com";

    private final RecordingShell shell = new RecordingShell();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final RecordingTaskQueue queue = new RecordingTaskQueue();
    private final RetryingJobRunner runner = new RetryingJobRunner(queue, new TaskChainMetrics())
        .register(new SshCommandJob(shell, notifier));

    private static TaskInvocation command(String command) {
        return new TaskInvocation(SshCommandJob.NAME, USER,
            List.of("b1", "m1", "1.2.3.4", command), Map.of("key_id", "deploy-key"));
    }

    @Test
    void run_shouldStayQuietOnSuccess() {
        shell.thenReturn(0, "ok");

        assertThat(runner.run(command("uptime"))).isEqualTo(JobOutcome.SUCCEEDED);

        assertThat(shell.executions()).singleElement().satisfies(e -> {
            assertThat(e.host()).isEqualTo("1.2.3.4");
            assertThat(e.command()).isEqualTo("uptime");
            assertThat(e.credentials().keyId()).isEqualTo("deploy-key");
            assertThat(e.credentials().port()).isEqualTo(ShellCredentials.DEFAULT_PORT);
        });
        assertThat(notifier.userNotifications()).isEmpty();
    }

    @Test
    void run_shouldNotifyUserOnNonZeroExit() {
        shell.thenReturn(1, "permission denied");

        assertThat(runner.run(command("reboot"))).isEqualTo(JobOutcome.SUCCEEDED);

        assertThat(notifier.userNotifications()).singleElement().satisfies(n -> {
            assertThat(n.userId()).isEqualTo(USER);
            assertThat(n.subject()).isEqualTo("Async command failed for machine m1 (1.2.3.4)");
            assertThat(n.body()).isEqualTo("permission denied");
        });
    }

    @Test
    void run_shouldNotRetryConnectionFailures() {
        shell.thenThrow(new SshException("connection refused", null));

        assertThat(runner.run(command("uptime"))).isEqualTo(JobOutcome.FAILED);

        assertThat(queue.size()).isZero();
        assertThat(notifier.userNotifications()).singleElement()
            .satisfies(n -> assertThat(n.body()).isEqualTo("connection refused"));
    }

    @Test
    void credentials_shouldHidePassword() {
        ShellCredentials credentials = new ShellCredentials(null, "root", "s3cret", 22);

        assertThat(credentials.toString()).doesNotContain("s3cret").contains("root");
    }
}

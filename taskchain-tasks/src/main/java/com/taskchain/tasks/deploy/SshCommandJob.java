package com.taskchain.tasks.deploy;

import com.taskchain.core.port.Notifier;
import com.taskchain.engine.job.BoundedRetryJob;
import com.taskchain.engine.job.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a command on a machine in the background and tells the user if it
 * exits non-zero.
 * 
 * Arguments: backend ID, machine ID, host, command.
 * Keywords: key_id, username, password, port.
 */
public class SshCommandJob implements BoundedRetryJob {

    private static final Logger log = LoggerFactory.getLogger(SshCommandJob.class);

    public static final String NAME = "ssh_command";

    private final RemoteShell shell;
    private final Notifier notifier;

    public SshCommandJob(RemoteShell shell, Notifier notifier) {
        this.shell = shell;
        this.notifier = notifier;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int maxRetries() {
        return 0;
    }

    @Override
    public void run(JobContext context) throws Exception {
        String machineId = context.getString(1);
        String host = context.getString(2);
        CommandResult result = shell.execute(context.getUserId(), context.getString(0), machineId, host,
            context.getString(3), ShellCredentials.from(context));
        if (!result.succeeded()) {
            log.info("Async command on {} exited with {}", host, result.exitStatus());
            notifier.notifyUser(context.getUserId(),
                String.format("Async command failed for machine %s (%s)", machineId, host),
                result.output());
        }
    }

    @Override
    public void onGiveUp(JobContext context, Exception cause) {
        notifier.notifyUser(context.getUserId(),
            String.format("Async command failed for machine %s (%s)", context.getString(1), context.getString(2)),
            String.valueOf(cause.getMessage()));
    }
}

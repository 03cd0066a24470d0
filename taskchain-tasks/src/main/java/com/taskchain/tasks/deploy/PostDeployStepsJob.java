package com.taskchain.tasks.deploy;

import com.taskchain.core.exception.RetryJobException;
import com.taskchain.core.port.Notifier;
import com.taskchain.engine.job.BoundedRetryJob;
import com.taskchain.engine.job.JobContext;
import com.taskchain.tasks.cloud.CloudInventory;
import com.taskchain.tasks.cloud.CloudProviderException;
import com.taskchain.tasks.cloud.Machine;
import com.taskchain.tasks.cloud.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Runs the deployment script on a freshly created machine.
 *
 * Waits for the machine to get a public IPv4 address, optionally enables
 * monitoring (prepending the agent install command to the script), runs the
 * script and reports the outcome to the user and the admin channel. Unreachable providers or hosts
 * are retried up to 5 times; every final outcome is reported.
 *
 * Arguments: backend ID, machine ID, monitoring flag, command.
 * Keywords: key_id, username, password, port.
 */
public class PostDeployStepsJob implements BoundedRetryJob {

    private static final Logger log = LoggerFactory.getLogger(PostDeployStepsJob.class);

    public static final String NAME = "post_deploy_steps";

    static final int MAX_RETRIES = 5;
    static final Duration NO_ADDRESS_DELAY = Duration.ofSeconds(120);
    static final Duration UNREACHABLE_DELAY = Duration.ofSeconds(60);

    private final CloudInventory inventory;
    private final RemoteShell shell;
    private final MonitoringService monitoring;
    private final Notifier notifier;
    private final Clock clock;

    public PostDeployStepsJob(
            CloudInventory inventory,
            RemoteShell shell,
            MonitoringService monitoring,
            Notifier notifier,
            Clock clock) {
        this.inventory = inventory;
        this.shell = shell;
        this.monitoring = monitoring;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int maxRetries() {
        return MAX_RETRIES;
    }

    @Override
    public void run(JobContext context) throws Exception {
        String userId = context.getUserId();
        String backendId = context.getString(0);
        String machineId = context.getString(1);
        boolean enableMonitoring = Boolean.parseBoolean(context.getString(2));
        String command = context.getString(3);

        try {
            Machine machine = findMachine(userId, backendId, machineId);
            List<String> ips = machine != null ? machine.publicIpv4s() : List.of();
            if (ips.isEmpty()) {
                throw new RetryJobException("Machine " + machineId + " has no public IPv4 address yet", NO_ADDRESS_DELAY);
            }
            String host = ips.get(0);

            if (enableMonitoring) {
                command = withMonitoring(userId, backendId, machine, command);
            }

            Instant started = clock.instant();
            CommandResult result = shell.execute(userId, backendId, machineId, host, command,
                ShellCredentials.from(context));
            Duration took = Duration.between(started, clock.instant());

            String report = report(command, result, took);
            String subject = String.format("Deployment script %s for machine %s (%s)",
                result.succeeded() ? "succeeded" : "failed", machine.name(), machine.id());
            notifier.notifyUser(userId, subject, report);
            notifier.notifyAdmin(subject + " of user " + userId, report);
        } catch (ServiceUnavailableException | SshException e) {
            throw new RetryJobException(e.getMessage(), UNREACHABLE_DELAY, e);
        }
    }

    @Override
    public void onGiveUp(JobContext context, Exception cause) {
        String userId = context.getUserId();
        String backendId = context.getString(0);
        String machineId = context.getString(1);
        log.warn("Deployment script failed for machine {} in backend {} by user {} after {} retries",
            machineId, backendId, userId, context.getRetries(), cause);
        notifier.notifyUser(userId,
            String.format("Deployment script failed for machine %s after %d retries", machineId, context.getRetries()),
            String.valueOf(cause.getMessage()));
        notifier.notifyAdmin(
            String.format("Deployment script failed for machine %s in backend %s by user %s after %d retries",
                machineId, backendId, userId, context.getRetries()),
            cause.toString());
    }

    private Machine findMachine(String userId, String backendId, String machineId) throws CloudProviderException {
        for (Machine machine : inventory.listMachines(userId, backendId)) {
            if (machine.id().equals(machineId)) {
                return machine;
            }
        }
        return null;
    }

    /**
     * Enable monitoring and prepend its install command. A monitoring failure
     * is reported but does not stop the deployment script.
     */
    private String withMonitoring(String userId, String backendId, Machine machine, String command) {
        try {
            return monitoring.enableMonitoring(userId, backendId, machine) + ";" + command;
        } catch (CloudProviderException e) {
            log.warn("Enabling monitoring failed for machine {}: {}", machine.id(), e.getMessage());
            notifier.notifyUser(userId,
                String.format("Enable monitoring failed for machine %s (%s)", machine.name(), machine.id()),
                e.toString());
            notifier.notifyAdmin(
                String.format("Enable monitoring on creation failed for user %s machine %s: %s",
                    userId, machine.name(), e),
                e.toString());
            return command;
        }
    }

    private static String report(String command, CommandResult result, Duration took) {
        return String.format(Locale.ROOT, "Command: %s%nReturn value: %d%nDuration: %.3f seconds%nOutput:%n%s",
            command, result.exitStatus(), took.toMillis() / 1000.0, result.output());
    }
}

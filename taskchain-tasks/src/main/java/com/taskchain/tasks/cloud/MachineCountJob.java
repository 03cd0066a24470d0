package com.taskchain.tasks.cloud;

import com.taskchain.engine.job.BoundedRetryJob;
import com.taskchain.engine.job.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records how many machines a backend has. Runs once; failures are logged.
 *
 * Arguments: backend ID, machine count.
 */
public class MachineCountJob implements BoundedRetryJob {

    private static final Logger log = LoggerFactory.getLogger(MachineCountJob.class);

    public static final String NAME = "update_machine_count";

    private final BackendSettings settings;

    public MachineCountJob(BackendSettings settings) {
        this.settings = settings;
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
    public void run(JobContext context) {
        String backendId = context.getString(0);
        int machineCount = Integer.parseInt(context.getString(1));
        if (machineCount < 0) {
            throw new IllegalArgumentException("Negative machine count " + machineCount + " for backend " + backendId);
        }
        settings.updateMachineCount(context.getUserId(), backendId, machineCount);
        log.debug("Backend {} of user {} has {} machines", backendId, context.getUserId(), machineCount);
    }

    @Override
    public void onGiveUp(JobContext context, Exception cause) {
        log.warn("Could not update machine count of backend {} for user {}: {}",
            context.getString(0), context.getUserId(), cause.getMessage());
    }
}

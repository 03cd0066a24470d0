package com.taskchain.engine.coordinator;

import com.taskchain.core.exception.TaskChainException;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.core.port.TaskConsumer;
import com.taskchain.engine.job.RetryingJobRunner;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue consumer. Routes each delivery to the task runner for chain tasks or
 * to the job runner for bounded-retry jobs.
 * 
 * Infrastructure failures end the delivery here: they are logged and counted,
 * never retried, and never reach the queue as a failed delivery.
 */
public class TaskDispatcher implements TaskConsumer {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final TaskRegistry registry;
    private final TaskRunner taskRunner;
    private final RetryingJobRunner jobRunner;
    private final TaskChainMetrics metrics;

    public TaskDispatcher(
            TaskRegistry registry,
            TaskRunner taskRunner,
            RetryingJobRunner jobRunner,
            TaskChainMetrics metrics) {
        this.registry = registry;
        this.taskRunner = taskRunner;
        this.jobRunner = jobRunner;
        this.metrics = metrics;
    }

    @Override
    public void consume(TaskInvocation invocation) {
        try {
            if (registry.contains(invocation.taskName())) {
                taskRunner.run(invocation);
            } else if (jobRunner.contains(invocation.taskName())) {
                jobRunner.run(invocation);
            } else {
                log.error("Dropping delivery of unknown task '{}'", invocation.taskName());
                metrics.infrastructureFailure(invocation.taskName(), "UNKNOWN_TASK");
            }
        } catch (TaskChainException e) {
            log.error("Invocation of {} for user {} aborted [{}]",
                invocation.taskName(), invocation.userId(), e.getErrorCode(), e);
            metrics.infrastructureFailure(invocation.taskName(), e.getErrorCode());
        }
    }
}

package com.taskchain.engine.job;

import com.taskchain.core.exception.InvalidTaskDefinitionException;
import com.taskchain.core.exception.RetryJobException;
import com.taskchain.core.exception.UnknownTaskException;
import com.taskchain.core.model.TaskInvocation;
import com.taskchain.core.port.TaskQueue;
import com.taskchain.engine.logging.LoggingContext;
import com.taskchain.engine.metrics.TaskChainMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes bounded-retry jobs.
 * 
 * A transient failure ({@link RetryJobException}) is redelivered through the
 * queue with the job's delay and an incremented {@value #RETRIES} keyword
 * while the retry budget lasts. Any other failure, or a transient failure
 * with no retries left, ends the job through {@link BoundedRetryJob#onGiveUp}.
 */
public class RetryingJobRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryingJobRunner.class);

    public static final String RETRIES = "retries";

    private final TaskQueue queue;
    private final TaskChainMetrics metrics;
    private final Map<String, BoundedRetryJob> jobs = new ConcurrentHashMap<>();

    public RetryingJobRunner(TaskQueue queue, TaskChainMetrics metrics) {
        this.queue = queue;
        this.metrics = metrics;
    }

    /**
     * Register a job.
     * 
     * @throws InvalidTaskDefinitionException if the name is already taken
     */
    public RetryingJobRunner register(BoundedRetryJob job) {
        if (job.maxRetries() < 0) {
            throw new InvalidTaskDefinitionException("maxRetries", "must be >= 0 for " + job.name());
        }
        if (jobs.putIfAbsent(job.name(), job) != null) {
            throw new InvalidTaskDefinitionException("name", "duplicate registration of job " + job.name());
        }
        log.info("Registered job: {}", job.name());
        return this;
    }

    public boolean contains(String name) {
        return jobs.containsKey(name);
    }

    /**
     * Run one attempt of a registered job.
     * 
     * @throws UnknownTaskException if no job is registered under the name
     * @throws com.taskchain.core.exception.QueueSubmissionException if a redelivery is refused
     */
    public JobOutcome run(TaskInvocation invocation) {
        BoundedRetryJob job = jobs.get(invocation.taskName());
        if (job == null) {
            throw new UnknownTaskException(invocation.taskName());
        }
        int retries = retriesOf(invocation);
        JobContext context = new JobContext(invocation, retries, job.maxRetries());

        try (LoggingContext ctx = LoggingContext.forJob(job.name(), invocation.userId(), retries + 1)) {
            JobOutcome outcome = attempt(job, context);
            metrics.jobOutcome(job.name(), outcome.name());
            return outcome;
        }
    }

    private JobOutcome attempt(BoundedRetryJob job, JobContext context) {
        try {
            job.run(context);
            log.info("Job {} succeeded", job.name());
            return JobOutcome.SUCCEEDED;
        } catch (RetryJobException e) {
            if (context.hasRetriesLeft()) {
                TaskInvocation next = context.getInvocation().withKwarg(RETRIES, context.getRetries() + 1);
                queue.submit(next, e.getRetryDelay());
                log.info("Job {} failed transiently ({}), retry {}/{} in {}",
                    job.name(), e.getMessage(), context.getRetries() + 1, context.getMaxRetries(), e.getRetryDelay());
                return JobOutcome.RETRY_SCHEDULED;
            }
            log.warn("Job {} failed after {} retries: {}", job.name(), context.getRetries(), e.getMessage());
            giveUp(job, context, e);
            return JobOutcome.FAILED;
        } catch (Exception e) {
            log.error("Job {} failed with unexpected error", job.name(), e);
            giveUp(job, context, e);
            return JobOutcome.FAILED;
        }
    }

    private void giveUp(BoundedRetryJob job, JobContext context, Exception cause) {
        try {
            job.onGiveUp(context, cause);
        } catch (RuntimeException e) {
            log.error("Failure report of job {} failed", job.name(), e);
        }
    }

    static int retriesOf(TaskInvocation invocation) {
        Object value = invocation.kwargs().get(RETRIES);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed retries value '{}'", value);
            }
        }
        return 0;
    }
}

package com.taskchain.engine.job;

import com.taskchain.core.exception.RetryJobException;

/**
 * A stateless job retried a fixed number of times on transient failures.
 * No caching, no deduplication, no presence gating: every delivery runs.
 */
public interface BoundedRetryJob {

    /**
     * Name under which the job is submitted to the queue.
     */
    String name();

    /**
     * Number of redeliveries allowed after the first attempt.
     */
    int maxRetries();

    /**
     * Run one attempt.
     * 
     * @param context Execution context providing arguments and the retry count
     * @throws RetryJobException on a transient failure worth retrying
     * @throws Exception on any other failure; the job is not retried
     */
    void run(JobContext context) throws Exception;

    /**
     * Called once when the job fails for good: retries exhausted or an
     * unexpected error. Implementations report the failure.
     * 
     * @param context Context of the last attempt
     * @param cause The failure of the last attempt
     */
    void onGiveUp(JobContext context, Exception cause);
}

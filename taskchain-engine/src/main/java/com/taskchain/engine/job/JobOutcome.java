package com.taskchain.engine.job;

/**
 * How one attempt of a bounded-retry job ended.
 */
public enum JobOutcome {
    SUCCEEDED,
    RETRY_SCHEDULED,
    FAILED
}

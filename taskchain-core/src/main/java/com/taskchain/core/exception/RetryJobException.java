package com.taskchain.core.exception;

import java.time.Duration;

/**
 * Signals a transient failure of a bounded-retry job. The job runner redelivers
 * the job after {@link #getRetryDelay()} while the retry budget lasts.
 */
public class RetryJobException extends Exception {
    
    private final Duration retryDelay;
    
    public RetryJobException(String message, Duration retryDelay) {
        super(message);
        this.retryDelay = retryDelay;
    }
    
    public RetryJobException(String message, Duration retryDelay, Throwable cause) {
        super(message, cause);
        this.retryDelay = retryDelay;
    }
    
    public Duration getRetryDelay() {
        return retryDelay;
    }
}

package com.taskchain.core.exception;

/**
 * Exception thrown by task handlers on failure.
 * Retryable failures are handed to the task's backoff policy; non-retryable
 * ones end the chain immediately.
 */
public class TaskExecutionException extends Exception {
    
    private final String errorCode;
    private final boolean retryable;
    
    public TaskExecutionException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }
    
    public TaskExecutionException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }
    
    public TaskExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static TaskExecutionException permanent(String errorCode, String message) {
        return new TaskExecutionException(errorCode, message, null, false);
    }
}

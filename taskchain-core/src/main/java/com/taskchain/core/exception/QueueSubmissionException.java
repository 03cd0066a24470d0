package com.taskchain.core.exception;

/**
 * Thrown when the task queue refuses a submission, e.g. after shutdown.
 */
public class QueueSubmissionException extends TaskChainException {
    
    public static final String ERROR_CODE = "QUEUE_REJECTED";
    
    public QueueSubmissionException(String taskName, String reason) {
        super(ERROR_CODE, String.format("Cannot submit task '%s': %s", taskName, reason));
    }
    
    public QueueSubmissionException(String taskName, Throwable cause) {
        super(ERROR_CODE, String.format("Cannot submit task '%s': %s", taskName, cause.getMessage()), cause);
    }
}

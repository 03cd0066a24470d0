package com.taskchain.core.exception;

/**
 * Thrown when no task definition or job is registered under a name.
 */
public class UnknownTaskException extends TaskChainException {
    
    public static final String ERROR_CODE = "UNKNOWN_TASK";
    
    public UnknownTaskException(String taskName) {
        super(ERROR_CODE, String.format("No task registered with name '%s'", taskName));
    }
}

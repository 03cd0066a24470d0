package com.taskchain.core.exception;

/**
 * Thrown when a task definition fails validation.
 */
public class InvalidTaskDefinitionException extends TaskChainException {
    
    public static final String ERROR_CODE = "INVALID_TASK_DEFINITION";
    
    public InvalidTaskDefinitionException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid task definition: %s - %s", field, reason));
    }
}

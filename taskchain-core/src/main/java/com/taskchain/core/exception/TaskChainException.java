package com.taskchain.core.exception;

/**
 * Base exception for all task chain errors.
 */
public class TaskChainException extends RuntimeException {
    
    private final String errorCode;
    
    public TaskChainException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TaskChainException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}

package com.taskchain.tasks.cloud;

/**
 * Failure talking to a cloud provider or to a machine.
 */
public class CloudProviderException extends Exception {
    
    private final String errorCode;
    
    public CloudProviderException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public CloudProviderException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}

package com.taskchain.tasks.cloud;

/**
 * The provider API or the remote host is temporarily unreachable.
 */
public class ServiceUnavailableException extends CloudProviderException {
    
    public static final String ERROR_CODE = "SERVICE_UNAVAILABLE";
    
    public ServiceUnavailableException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ServiceUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

package com.taskchain.tasks.deploy;

import com.taskchain.tasks.cloud.CloudProviderException;

/**
 * SSH connection or authentication failure.
 */
public class SshException extends CloudProviderException {
    
    public static final String ERROR_CODE = "SSH_FAILED";
    
    public SshException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

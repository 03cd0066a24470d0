package com.taskchain.tasks.deploy;

import com.taskchain.tasks.cloud.CloudProviderException;

/**
 * Runs a command on a machine over SSH.
 */
@FunctionalInterface
public interface RemoteShell {

    /**
     * Connect, run the command and disconnect.
     * 
     * @return The exit status and output; a non-zero status is not an exception
     * @throws SshException if the connection cannot be established
     * @throws CloudProviderException on other provider errors
     */
    CommandResult execute(String userId, String backendId, String machineId, String host,
                          String command, ShellCredentials credentials) throws CloudProviderException;
}

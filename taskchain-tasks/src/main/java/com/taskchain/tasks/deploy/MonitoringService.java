package com.taskchain.tasks.deploy;

import com.taskchain.tasks.cloud.CloudProviderException;
import com.taskchain.tasks.cloud.Machine;

/**
 * Registers machines with the monitoring service.
 */
@FunctionalInterface
public interface MonitoringService {

    /**
     * Enable monitoring for a machine without touching it.
     * 
     * @return Shell command that installs the monitoring agent on the machine
     */
    String enableMonitoring(String userId, String backendId, Machine machine) throws CloudProviderException;
}

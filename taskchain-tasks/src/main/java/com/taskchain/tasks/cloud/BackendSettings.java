package com.taskchain.tasks.cloud;

/**
 * Mutable per-user backend configuration.
 */
public interface BackendSettings {

    /**
     * Stop polling a backend for the user until they enable it again.
     */
    void disableBackend(String userId, String backendId);

    /**
     * Store the number of machines last seen in a backend and recompute the
     * user's total across backends.
     */
    void updateMachineCount(String userId, String backendId, int machineCount);
}

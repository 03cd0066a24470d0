package com.taskchain.tasks.machine;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.tasks.cloud.CloudProviderException;

/**
 * Connects to a machine over SSH and reports its vital signs
 * (uptime, load, cores, logged-in users).
 */
@FunctionalInterface
public interface SshProber {

    JsonNode probe(String userId, String backendId, String machineId, String host) throws CloudProviderException;
}

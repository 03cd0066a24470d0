package com.taskchain.tasks.machine;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.tasks.cloud.CloudProviderException;

/**
 * Sends ICMP echo requests to a host and reports loss and round-trip times.
 */
@FunctionalInterface
public interface HostPinger {

    JsonNode ping(String host) throws CloudProviderException;
}

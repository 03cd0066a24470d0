package com.taskchain.core.port;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Delivers computed results to every listener of a user.
 */
@FunctionalInterface
public interface ResultPublisher {

    /**
     * Publish a payload.
     * 
     * @param userId The user whose listeners receive the payload
     * @param routingKey The task name the payload belongs to
     * @param payload The result
     * @return false if no delivery channel is open for the user
     */
    boolean publish(String userId, String routingKey, JsonNode payload);
}

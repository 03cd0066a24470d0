package com.taskchain.engine.presence;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A client connection waiting for a user's results.
 */
@FunctionalInterface
public interface ResultListener {

    /**
     * Receive a published result.
     * 
     * @param routingKey The name of the task that produced the payload
     * @param payload The result
     */
    void onResult(String routingKey, JsonNode payload);
}

package com.taskchain.core.port;

/**
 * Answers whether any client is still waiting for results for a user.
 */
@FunctionalInterface
public interface PresenceOracle {

    boolean isListening(String userId);
}

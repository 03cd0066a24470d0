package com.taskchain.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Result of the execute step of one invocation, consumed by the runner's
 * state machine: a payload, a retry delay, or give-up.
 */
public record ExecutionOutcome(
    Kind kind,
    JsonNode payload,
    Duration retryDelay,
    String errorCode
) {
    public enum Kind {
        SUCCESS,
        RETRY,
        GIVE_UP
    }

    public static ExecutionOutcome success(JsonNode payload) {
        return new ExecutionOutcome(Kind.SUCCESS, payload, null, null);
    }

    public static ExecutionOutcome retry(Duration delay, String errorCode) {
        return new ExecutionOutcome(Kind.RETRY, null, delay, errorCode);
    }

    public static ExecutionOutcome giveUp(String errorCode) {
        return new ExecutionOutcome(Kind.GIVE_UP, null, null, errorCode);
    }
}

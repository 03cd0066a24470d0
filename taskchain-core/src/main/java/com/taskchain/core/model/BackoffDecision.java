package com.taskchain.core.model;

import java.time.Duration;

/**
 * What a backoff policy decided after a failure: retry after a delay, or give up.
 */
public record BackoffDecision(Duration delay) {

    private static final BackoffDecision GIVE_UP = new BackoffDecision(null);

    public BackoffDecision {
        if (delay != null && delay.isNegative()) {
            throw new IllegalArgumentException("Retry delay must not be negative: " + delay);
        }
    }

    public static BackoffDecision retryIn(Duration delay) {
        return new BackoffDecision(delay);
    }

    public static BackoffDecision giveUp() {
        return GIVE_UP;
    }

    public boolean isGiveUp() {
        return delay == null;
    }
}

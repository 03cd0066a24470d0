package com.taskchain.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Per-task translation of a failure history into a retry delay or give-up.
 * 
 * The policy receives the consecutive failure times as offsets from the first
 * failure (so {@code failureOffsets.size()} is the failure count) together with
 * the invocation that failed. Policies may perform side effects, e.g. disable
 * a resource before giving up.
 */
@FunctionalInterface
public interface BackoffPolicy {

    BackoffDecision decide(List<Duration> failureOffsets, TaskInvocation invocation);

    /**
     * Default policy: retry after 30s, 2min and 10min, then give up.
     */
    static BackoffPolicy defaultPolicy() {
        return stepped(Duration.ofSeconds(30), Duration.ofMinutes(2), Duration.ofMinutes(10));
    }

    /**
     * Retry after the n-th delay on the n-th consecutive failure; give up once
     * the delays run out.
     */
    static BackoffPolicy stepped(Duration... delays) {
        List<Duration> steps = List.of(delays);
        return (failureOffsets, invocation) -> {
            int failures = failureOffsets.size();
            if (failures >= 1 && failures <= steps.size()) {
                return BackoffDecision.retryIn(steps.get(failures - 1));
            }
            return BackoffDecision.giveUp();
        };
    }

    /**
     * Retry after {@code unit * 2^failures}, capped at {@code max}. Never gives up.
     */
    static BackoffPolicy exponential(Duration unit, Duration max) {
        return (failureOffsets, invocation) -> {
            int exponent = Math.min(failureOffsets.size(), 30);
            Duration delay = unit.multipliedBy(1L << exponent);
            return BackoffDecision.retryIn(delay.compareTo(max) < 0 ? delay : max);
        };
    }

    /**
     * Always retry after the same delay. Never gives up.
     */
    static BackoffPolicy constant(Duration delay) {
        return (failureOffsets, invocation) -> BackoffDecision.retryIn(delay);
    }
}

package com.taskchain.core.model;

/**
 * How one invocation of a chain task ended.
 */
public enum ChainOutcome {
    /**
     * No client is listening for the user; error record cleared. Terminal.
     */
    PRESENCE_LOST,

    /**
     * A newer chain owns the cached result. Terminal.
     */
    SUPERSEDED,

    /**
     * External trigger found a fresh cached result. Terminal.
     */
    FRESH_CACHE_HIT,

    /**
     * Another worker is running the same chain right now. Terminal for this delivery.
     */
    DUPLICATE_DELIVERY,

    /**
     * Execution failed; the chain was resubmitted after the backoff delay.
     */
    RETRY_SCHEDULED,

    /**
     * Execution failed and the backoff policy gave up. Terminal.
     */
    GAVE_UP,

    /**
     * Execution succeeded but nobody received the result; nothing cached. Terminal.
     */
    PUBLISH_FAILED,

    /**
     * Non-polling task published and cached its result. Terminal.
     */
    COMPLETED,

    /**
     * Polling task published and cached its result and scheduled its next run.
     */
    RESCHEDULED
}

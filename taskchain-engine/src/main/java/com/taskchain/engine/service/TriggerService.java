package com.taskchain.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.model.TaskInvocation;

import java.util.Optional;

/**
 * External entry point for chain tasks.
 * Every call here starts a new chain: any inbound seq_id is discarded.
 */
public interface TriggerService {

    /**
     * Submit a task for immediate execution.
     * 
     * @param invocation The task and its arguments
     */
    void trigger(TaskInvocation invocation);

    /**
     * Cache-aware trigger. Submits the task if nothing is cached or the cached
     * result is stale, and returns the cached payload while it is still usable.
     * 
     * @param invocation The task and its arguments
     * @return The cached payload if younger than the task's expiry window
     */
    Optional<JsonNode> smartDelay(TaskInvocation invocation);

    /**
     * Invalidate the cached result of a task identity.
     * 
     * @param invocation The task and its arguments
     * @return true if a result was removed
     */
    boolean clearCache(TaskInvocation invocation);
}

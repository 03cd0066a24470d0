package com.taskchain.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchain.core.exception.TaskExecutionException;

/**
 * Domain logic of a task definition: the single, possibly slow, call into
 * external collaborators. Must tolerate stale external state, e.g. a machine
 * that no longer exists.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute the task.
     * 
     * @param context Invocation details and helpers
     * @return The payload to publish and cache
     * @throws TaskExecutionException if the task fails
     */
    JsonNode execute(TaskContext context) throws TaskExecutionException;
}

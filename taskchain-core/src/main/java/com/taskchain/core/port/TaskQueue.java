package com.taskchain.core.port;

import com.taskchain.core.model.TaskInvocation;

import java.time.Duration;

/**
 * Distributed task queue.
 * Delivery is at-least-once and no earlier than the requested delay; there is
 * no ordering guarantee beyond that.
 */
public interface TaskQueue {

    /**
     * Enqueue a task for execution.
     * 
     * @param invocation The task and its arguments
     * @param delay Minimum time before delivery
     * @throws com.taskchain.core.exception.QueueSubmissionException if the queue refuses the task
     */
    void submit(TaskInvocation invocation, Duration delay);

    /**
     * Enqueue a task for immediate execution.
     */
    default void submit(TaskInvocation invocation) {
        submit(invocation, Duration.ZERO);
    }
}

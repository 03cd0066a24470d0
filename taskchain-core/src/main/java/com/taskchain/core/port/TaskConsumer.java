package com.taskchain.core.port;

import com.taskchain.core.model.TaskInvocation;

/**
 * Receives invocations delivered by a task queue.
 */
@FunctionalInterface
public interface TaskConsumer {

    void consume(TaskInvocation invocation);
}

package com.taskchain.app.config;

import com.taskchain.engine.coordinator.TaskDispatcher;
import com.taskchain.engine.queue.InProcessTaskQueue;
import org.springframework.context.SmartLifecycle;

/**
 * Starts delivering queued invocations once the context is refreshed and
 * stops before the beans they use are destroyed.
 */
public class TaskQueueLifecycle implements SmartLifecycle {

    private final InProcessTaskQueue queue;
    private final TaskDispatcher dispatcher;

    public TaskQueueLifecycle(InProcessTaskQueue queue, TaskDispatcher dispatcher) {
        this.queue = queue;
        this.dispatcher = dispatcher;
    }

    @Override
    public void start() {
        queue.start(dispatcher);
    }

    @Override
    public void stop() {
        queue.stop();
    }

    @Override
    public boolean isRunning() {
        return queue.isRunning();
    }
}

package com.taskchain.app.health;

import com.taskchain.core.repository.CacheStore;
import com.taskchain.engine.queue.InProcessTaskQueue;
import com.taskchain.engine.registry.TaskRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the task chain worker.
 * Reports down when the cache store does not answer or the queue is not
 * delivering; includes the backlog and the registered tasks.
 */
@Component
public class TaskChainHealthIndicator implements HealthIndicator {

    private final CacheStore cacheStore;
    private final InProcessTaskQueue taskQueue;
    private final TaskRegistry taskRegistry;

    public TaskChainHealthIndicator(CacheStore cacheStore, InProcessTaskQueue taskQueue, TaskRegistry taskRegistry) {
        this.cacheStore = cacheStore;
        this.taskQueue = taskQueue;
        this.taskRegistry = taskRegistry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("tasks", taskRegistry.names());
        details.put("pending", taskQueue.getPendingCount());

        boolean storeHealthy = checkStore(details);
        boolean queueRunning = taskQueue.isRunning();
        details.put("queue", queueRunning ? "running" : "stopped");

        if (!storeHealthy || !queueRunning) {
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    private boolean checkStore(Map<String, Object> details) {
        try {
            boolean answered = cacheStore.ping();
            details.put("cacheStore", answered ? "connected" : "not responding");
            return answered;
        } catch (Exception e) {
            details.put("cacheStore", "disconnected");
            details.put("cacheStoreError", e.getMessage());
            return false;
        }
    }
}

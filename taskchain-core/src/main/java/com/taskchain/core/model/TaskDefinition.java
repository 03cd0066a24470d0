package com.taskchain.core.model;

import com.taskchain.core.exception.InvalidTaskDefinitionException;

import java.time.Duration;

/**
 * Static description of a named task: its freshness windows, whether it polls,
 * how it backs off and what it executes. Defined once at start-up.
 * 
 * Invariants:
 * - taskName is non-blank
 * - 0 <= resultFresh <= resultExpires
 * - a polling task has a positive resultFresh (its rerun cadence)
 */
public record TaskDefinition(
    String taskName,
    
    // Cache windows
    Duration resultFresh,
    Duration resultExpires,
    
    // Chain behaviour
    boolean polling,
    BackoffPolicy backoffPolicy,
    
    // Domain logic
    TaskHandler handler
) {
    public TaskDefinition {
        if (taskName == null || taskName.isBlank()) {
            throw new InvalidTaskDefinitionException("taskName", "must not be blank");
        }
        if (resultFresh == null || resultFresh.isNegative()) {
            throw new InvalidTaskDefinitionException("resultFresh", "must be >= 0 for " + taskName);
        }
        if (resultExpires == null || resultExpires.compareTo(resultFresh) < 0) {
            throw new InvalidTaskDefinitionException("resultExpires", "must be >= resultFresh for " + taskName);
        }
        if (polling && resultFresh.isZero()) {
            throw new InvalidTaskDefinitionException("resultFresh", "polling task " + taskName + " needs a positive rerun interval");
        }
        if (handler == null) {
            throw new InvalidTaskDefinitionException("handler", "missing for " + taskName);
        }
        if (backoffPolicy == null) {
            backoffPolicy = BackoffPolicy.defaultPolicy();
        }
    }

    /**
     * Builder for TaskDefinition.
     */
    public static Builder builder(String taskName) {
        return new Builder(taskName);
    }

    public static class Builder {
        private final String taskName;
        private Duration resultFresh = Duration.ZERO;
        private Duration resultExpires = Duration.ZERO;
        private boolean polling = false;
        private BackoffPolicy backoffPolicy = BackoffPolicy.defaultPolicy();
        private TaskHandler handler;

        private Builder(String taskName) {
            this.taskName = taskName;
        }

        public Builder resultFresh(Duration resultFresh) {
            this.resultFresh = resultFresh;
            return this;
        }

        public Builder resultExpires(Duration resultExpires) {
            this.resultExpires = resultExpires;
            return this;
        }

        public Builder polling(boolean polling) {
            this.polling = polling;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder handler(TaskHandler handler) {
            this.handler = handler;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(taskName, resultFresh, resultExpires, polling, backoffPolicy, handler);
        }
    }
}

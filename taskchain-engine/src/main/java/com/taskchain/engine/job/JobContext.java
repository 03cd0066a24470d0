package com.taskchain.engine.job;

import com.taskchain.core.model.TaskInvocation;

import java.util.List;

/**
 * Context provided to bounded-retry jobs during execution.
 */
public class JobContext {
    
    private final TaskInvocation invocation;
    private final int retries;
    private final int maxRetries;
    
    public JobContext(TaskInvocation invocation, int retries, int maxRetries) {
        this.invocation = invocation;
        this.retries = retries;
        this.maxRetries = maxRetries;
    }
    
    public TaskInvocation getInvocation() {
        return invocation;
    }
    
    public String getUserId() {
        return invocation.userId();
    }
    
    public List<Object> getArgs() {
        return invocation.args();
    }
    
    /**
     * Get a positional argument as a string.
     * 
     * @throws IllegalArgumentException if the argument is missing
     */
    public String getString(int index) {
        if (index >= invocation.args().size()) {
            throw new IllegalArgumentException(String.format(
                "Job '%s' expects argument #%d, got %d arguments",
                invocation.taskName(), index, invocation.args().size()));
        }
        Object value = invocation.args().get(index);
        return value != null ? value.toString() : null;
    }
    
    /**
     * Get an optional keyword argument as a string.
     */
    public String getKwarg(String name) {
        Object value = invocation.kwargs().get(name);
        return value != null ? value.toString() : null;
    }
    
    /**
     * Number of redeliveries before this attempt (0 on the first attempt).
     */
    public int getRetries() {
        return retries;
    }
    
    public int getMaxRetries() {
        return maxRetries;
    }
    
    /**
     * Check if a transient failure of this attempt would still be retried.
     */
    public boolean hasRetriesLeft() {
        return retries < maxRetries;
    }
}

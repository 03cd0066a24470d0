package com.taskchain.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {
    
    private final TaskInvocation invocation;
    private final String seqId;
    private final ObjectMapper objectMapper;
    
    public TaskContext(TaskInvocation invocation, String seqId, ObjectMapper objectMapper) {
        this.invocation = invocation;
        this.seqId = seqId;
        this.objectMapper = objectMapper;
    }
    
    public TaskInvocation getInvocation() {
        return invocation;
    }
    
    public String getTaskName() {
        return invocation.taskName();
    }
    
    public String getUserId() {
        return invocation.userId();
    }
    
    /**
     * Get the execution sequence of the running chain.
     */
    public String getSeqId() {
        return seqId;
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
                "Task '%s' expects argument #%d, got %d arguments",
                invocation.taskName(), index, invocation.args().size()));
        }
        Object value = invocation.args().get(index);
        return value != null ? value.toString() : null;
    }
    
    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}

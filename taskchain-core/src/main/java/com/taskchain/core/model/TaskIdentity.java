package com.taskchain.core.model;

import java.util.List;
import java.util.Map;

/**
 * Which logical task an invocation refers to: name, user, positional and
 * keyword arguments, never the execution sequence.
 */
public record TaskIdentity(
    String taskName,
    String userId,
    List<Object> args,
    Map<String, Object> kwargs
) {
    /**
     * Derive the identity of an invocation, dropping its sequence token.
     */
    public static TaskIdentity of(TaskInvocation invocation) {
        return new TaskIdentity(
            invocation.taskName(),
            invocation.userId(),
            invocation.args(),
            invocation.kwargsWithoutSeqId()
        );
    }
}

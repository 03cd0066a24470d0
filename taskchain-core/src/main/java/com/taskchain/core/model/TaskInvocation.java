package com.taskchain.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One request to run a task, as carried by the queue.
 * 
 * The reserved keyword {@value #SEQ_ID} carries the execution sequence of the
 * chain this invocation belongs to. It is absent (or empty) for an external
 * trigger and set on every self-rescheduled rerun.
 * 
 * Invariants:
 * - taskName and userId are non-null
 * - args and kwargs are immutable copies
 */
public record TaskInvocation(
    String taskName,
    String userId,
    List<Object> args,
    Map<String, Object> kwargs
) {
    public static final String SEQ_ID = "seq_id";

    public TaskInvocation {
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(userId, "userId");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /**
     * Create an external trigger with positional arguments only.
     */
    public static TaskInvocation of(String taskName, String userId, Object... args) {
        return new TaskInvocation(taskName, userId, List.of(args), Map.of());
    }

    /**
     * Get the execution sequence carried by this invocation, or an empty string.
     */
    public String seqId() {
        Object value = kwargs.get(SEQ_ID);
        return value != null ? value.toString() : "";
    }

    /**
     * Check if this invocation continues an existing chain.
     */
    public boolean hasSeqId() {
        return !seqId().isEmpty();
    }

    /**
     * Copy of this invocation carrying the given execution sequence.
     */
    public TaskInvocation withSeqId(String seqId) {
        return withKwarg(SEQ_ID, seqId);
    }

    /**
     * Copy of this invocation with one keyword argument replaced.
     */
    public TaskInvocation withKwarg(String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(kwargs);
        updated.put(name, value);
        return new TaskInvocation(taskName, userId, args, updated);
    }

    /**
     * Keyword arguments without the reserved sequence field.
     */
    public Map<String, Object> kwargsWithoutSeqId() {
        if (!kwargs.containsKey(SEQ_ID)) {
            return kwargs;
        }
        Map<String, Object> stripped = new LinkedHashMap<>(kwargs);
        stripped.remove(SEQ_ID);
        return Collections.unmodifiableMap(stripped);
    }
}

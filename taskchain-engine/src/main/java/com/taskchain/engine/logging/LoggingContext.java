package com.taskchain.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of one invocation carry the task identity and chain.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask("list_machines", userId)) {
 *     LoggingContext.setSeqId(seqId);
 *     log.info("Executing task"); // Automatically includes taskName, userId, seqId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [taskchain-worker-1] INFO  c.t.e.c.TaskRunner - Executing task
 *   taskName=list_machines userId=u-42 seqId=9f2c... traceId=1a2b3c4d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_NAME = "taskName";
    public static final String USER_ID = "userId";
    public static final String SEQ_ID = "seqId";
    public static final String JOB_NAME = "jobName";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one chain task invocation.
     */
    public static LoggingContext forTask(String taskName, String userId) {
        LoggingContext ctx = new LoggingContext();
        if (taskName != null) {
            MDC.put(TASK_NAME, taskName);
        }
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one attempt of a bounded-retry job.
     */
    public static LoggingContext forJob(String jobName, String userId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        if (jobName != null) {
            MDC.put(JOB_NAME, jobName);
        }
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the execution sequence to the current context.
     */
    public static void setSeqId(String seqId) {
        if (seqId != null && !seqId.isEmpty()) {
            MDC.put(SEQ_ID, seqId);
        }
    }

    /**
     * Get current task name from context.
     */
    public static String getTaskName() {
        return MDC.get(TASK_NAME);
    }

    public static String getSeqId() {
        return MDC.get(SEQ_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK_NAME);
        MDC.remove(USER_ID);
        MDC.remove(SEQ_ID);
        MDC.remove(JOB_NAME);
        MDC.remove(ATTEMPT);
        // Worker threads are pooled; a trace ID must not leak into the next delivery
        MDC.remove(TRACE_ID);
    }
}

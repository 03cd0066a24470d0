package com.taskchain.tasks.machine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskchain.core.exception.TaskExecutionException;
import com.taskchain.core.model.BackoffPolicy;
import com.taskchain.core.model.TaskContext;
import com.taskchain.core.model.TaskDefinition;
import com.taskchain.tasks.cloud.CloudProviderException;

import java.time.Duration;

/**
 * Polling chain tasks watching a single machine.
 * 
 * Arguments: backend ID, machine ID, host. Results are published as
 * {@code {"backend_id", "machine_id", "host", "result"}}.
 */
public final class MachineTasks {

    public static final String PROBE = "probe";
    public static final String PING = "ping";

    static final Duration PROBE_FRESH = Duration.ofMinutes(2);
    static final Duration PROBE_EXPIRE = Duration.ofHours(2);
    static final Duration PING_FRESH = Duration.ofMinutes(15);
    static final Duration PING_EXPIRE = Duration.ofHours(2);

    /**
     * Probe retries: 2, 4, 8, 16, then every 32 minutes.
     */
    static final BackoffPolicy PROBE_BACKOFF =
        BackoffPolicy.exponential(Duration.ofMinutes(1), Duration.ofMinutes(32));

    private MachineTasks() {
    }

    /**
     * Probe a machine over SSH every 2 minutes while the user listens.
     */
    public static TaskDefinition probe(SshProber prober) {
        return TaskDefinition.builder(PROBE)
            .resultFresh(PROBE_FRESH)
            .resultExpires(PROBE_EXPIRE)
            .polling(true)
            .backoffPolicy(PROBE_BACKOFF)
            .handler(ctx -> {
                try {
                    JsonNode probe = prober.probe(ctx.getUserId(), ctx.getString(0), ctx.getString(1), ctx.getString(2));
                    return result(ctx, probe);
                } catch (CloudProviderException e) {
                    throw new TaskExecutionException(e.getErrorCode(), "SSH probe of " + ctx.getString(2) + " failed", e);
                }
            })
            .build();
    }

    /**
     * Ping a machine every 15 minutes while the user listens; failures retry
     * at the same cadence forever.
     */
    public static TaskDefinition ping(HostPinger pinger) {
        return TaskDefinition.builder(PING)
            .resultFresh(PING_FRESH)
            .resultExpires(PING_EXPIRE)
            .polling(true)
            .backoffPolicy(BackoffPolicy.constant(PING_FRESH))
            .handler(ctx -> {
                try {
                    return result(ctx, pinger.ping(ctx.getString(2)));
                } catch (CloudProviderException e) {
                    throw new TaskExecutionException(e.getErrorCode(), "Ping of " + ctx.getString(2) + " failed", e);
                }
            })
            .build();
    }

    private static JsonNode result(TaskContext ctx, JsonNode measurement) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("backend_id", ctx.getString(0));
        result.put("machine_id", ctx.getString(1));
        result.put("host", ctx.getString(2));
        result.set("result", measurement);
        return result;
    }
}

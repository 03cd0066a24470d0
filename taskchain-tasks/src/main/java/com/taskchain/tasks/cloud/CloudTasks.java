package com.taskchain.tasks.cloud;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskchain.core.exception.TaskExecutionException;
import com.taskchain.core.model.BackoffDecision;
import com.taskchain.core.model.BackoffPolicy;
import com.taskchain.core.model.TaskContext;
import com.taskchain.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Chain tasks listing the contents of a cloud backend.
 * 
 * All of them take the backend ID as their only argument and publish
 * {@code {"backend_id": ..., "<kind>": [...]}}. Machine listings poll; the
 * catalogue listings (images, sizes, locations) run once per trigger.
 */
public final class CloudTasks {

    private static final Logger log = LoggerFactory.getLogger(CloudTasks.class);

    public static final String LIST_MACHINES = "list_machines";
    public static final String LIST_IMAGES = "list_images";
    public static final String LIST_SIZES = "list_sizes";
    public static final String LIST_LOCATIONS = "list_locations";

    static final Duration MACHINES_FRESH = Duration.ofSeconds(10);
    static final Duration MACHINES_EXPIRE = Duration.ofDays(1);
    static final Duration CATALOG_FRESH = Duration.ofHours(1);
    static final Duration CATALOG_EXPIRE = Duration.ofDays(7);

    /**
     * Consecutive machine listing failures retried before the backend is disabled.
     */
    static final int MACHINES_MAX_FAILURES = 6;

    private CloudTasks() {
    }

    /**
     * Poll the machines of a backend every 10 seconds while the user listens.
     */
    public static TaskDefinition listMachines(CloudInventory inventory, BackendSettings settings) {
        return TaskDefinition.builder(LIST_MACHINES)
            .resultFresh(MACHINES_FRESH)
            .resultExpires(MACHINES_EXPIRE)
            .polling(true)
            .backoffPolicy(disableAfterFailures(settings, MACHINES_MAX_FAILURES, MACHINES_FRESH))
            .handler(ctx -> {
                String backendId = ctx.getString(0);
                log.info("Listing machines of backend {}", backendId);
                List<Machine> machines = call(ctx, () -> inventory.listMachines(ctx.getUserId(), backendId));
                return result(ctx, backendId, "machines", machines);
            })
            .build();
    }

    public static TaskDefinition listImages(CloudInventory inventory) {
        return catalog(LIST_IMAGES, "images",
            ctx -> call(ctx, () -> inventory.listImages(ctx.getUserId(), ctx.getString(0))));
    }

    public static TaskDefinition listSizes(CloudInventory inventory) {
        return catalog(LIST_SIZES, "sizes",
            ctx -> call(ctx, () -> inventory.listSizes(ctx.getUserId(), ctx.getString(0))));
    }

    public static TaskDefinition listLocations(CloudInventory inventory) {
        return catalog(LIST_LOCATIONS, "locations",
            ctx -> call(ctx, () -> inventory.listLocations(ctx.getUserId(), ctx.getString(0))));
    }

    /**
     * Backoff that retries after a fixed delay for the first {@code maxFailures}
     * consecutive failures; on the next one it disables the backend named by
     * the first argument and gives up.
     */
    public static BackoffPolicy disableAfterFailures(BackendSettings settings, int maxFailures, Duration delay) {
        return (failureOffsets, invocation) -> {
            if (failureOffsets.size() <= maxFailures) {
                return BackoffDecision.retryIn(delay);
            }
            String backendId = String.valueOf(invocation.args().get(0));
            log.warn("Backend {} of user {} failed {} times in a row, disabling it",
                backendId, invocation.userId(), failureOffsets.size());
            settings.disableBackend(invocation.userId(), backendId);
            return BackoffDecision.giveUp();
        };
    }

    private static TaskDefinition catalog(String taskName, String field, CatalogLookup lookup) {
        return TaskDefinition.builder(taskName)
            .resultFresh(CATALOG_FRESH)
            .resultExpires(CATALOG_EXPIRE)
            .handler(ctx -> result(ctx, ctx.getString(0), field, lookup.list(ctx)))
            .build();
    }

    private static ObjectNode result(TaskContext ctx, String backendId, String field, List<?> entries) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("backend_id", backendId);
        result.set(field, ctx.toJsonNode(entries));
        return result;
    }

    /**
     * Run a provider call, translating provider failures into task failures.
     */
    static <T> T call(TaskContext ctx, ProviderCall<T> call) throws TaskExecutionException {
        try {
            return call.run();
        } catch (CloudProviderException e) {
            throw new TaskExecutionException(e.getErrorCode(),
                ctx.getTaskName() + " failed for user " + ctx.getUserId() + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    interface ProviderCall<T> {
        T run() throws CloudProviderException;
    }

    @FunctionalInterface
    private interface CatalogLookup {
        List<CatalogEntry> list(TaskContext ctx) throws TaskExecutionException;
    }
}

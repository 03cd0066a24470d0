package com.taskchain.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under {@code taskchain.*}.
 *
 * @param store   where results, failure histories and chain leases live
 * @param workers threads delivering queued invocations
 * @param lease   duplicate delivery guard
 */
@ConfigurationProperties(prefix = "taskchain")
public record TaskChainProperties(
        @DefaultValue("memory") Store store,
        @DefaultValue("4") int workers,
        @DefaultValue Lease lease
) {
    public TaskChainProperties {
        if (workers < 1) {
            throw new IllegalArgumentException("taskchain.workers must be at least 1, got " + workers);
        }
    }

    public enum Store {
        MEMORY,
        REDIS
    }

    public record Lease(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("5m") Duration duration
    ) {
    }
}

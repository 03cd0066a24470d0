package com.taskchain.tasks.deploy;

import com.taskchain.engine.job.JobContext;

/**
 * How to log into a machine. Null fields are resolved from the user's stored
 * keys and the machine's defaults.
 */
public record ShellCredentials(
    String keyId,
    String username,
    String password,
    int port
) {
    public static final int DEFAULT_PORT = 22;

    /**
     * Read credentials from the {@code key_id}, {@code username},
     * {@code password} and {@code port} keywords of a job.
     */
    public static ShellCredentials from(JobContext context) {
        String port = context.getKwarg("port");
        return new ShellCredentials(
            context.getKwarg("key_id"),
            context.getKwarg("username"),
            context.getKwarg("password"),
            port != null ? Integer.parseInt(port) : DEFAULT_PORT);
    }

    @Override
    public String toString() {
        return "ShellCredentials[keyId=" + keyId + ", username=" + username + ", port=" + port + "]";
    }
}

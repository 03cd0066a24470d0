package com.taskchain.core.exception;

/**
 * Thrown when the shared cache store cannot be reached or rejects an operation.
 * Treated as fatal to the current invocation, never fed into a backoff policy.
 */
public class CacheStoreException extends TaskChainException {
    
    public static final String ERROR_CODE = "CACHE_STORE_UNAVAILABLE";
    
    public CacheStoreException(String operation, String key, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Cache store %s failed for key '%s': %s",
            operation, key, cause.getMessage()
        ), cause);
    }
}

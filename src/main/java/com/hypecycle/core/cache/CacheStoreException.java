package com.hypecycle.core.cache;

/**
 * Thrown when the cache store cannot be read or written.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.reference.matching.cache;

/**
 * Runtime exception thrown when a cache file cannot be read or written.
 * Callers treat it as "no cached result"; it never aborts a run.
 */
public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message) {
        super(message);
    }

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

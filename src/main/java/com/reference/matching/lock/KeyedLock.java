package com.reference.matching.lock;

/**
 * Mutual exclusion per lookup key, used to keep at most one fetch in flight
 * for the same {@code (storeId, canonical reference)} pair.
 */
public interface KeyedLock {

    /**
     * Acquires the lock for the given key, waiting up to the configured timeout.
     *
     * @param key the lock key (typically storeId:canonical)
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the given key.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Builds the lock key for a store and canonical reference.
     */
    static String keyOf(String storeId, String canonical) {
        return storeId + ":" + canonical;
    }
}

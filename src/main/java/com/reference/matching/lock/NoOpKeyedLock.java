package com.reference.matching.lock;

/**
 * Lock that never blocks. Suitable for the default single-flow run.
 */
public class NoOpKeyedLock implements KeyedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}

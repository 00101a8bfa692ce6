package com.reference.matching.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock striped over a fixed array of {@link ReentrantLock}s.
 * Distinct keys may share a stripe; memory stays bounded however many
 * references a run touches.
 */
public class StripedKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(StripedKeyedLock.class);

    private final ReentrantLock[] stripes;
    private final LockConfig config;

    public StripedKeyedLock() {
        this(LockConfig.defaults());
    }

    public StripedKeyedLock(LockConfig config) {
        this.config = config;
        this.stripes = new ReentrantLock[config.stripes()];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = stripeFor(key);
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: {}", key);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = stripeFor(key);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    private ReentrantLock stripeFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}

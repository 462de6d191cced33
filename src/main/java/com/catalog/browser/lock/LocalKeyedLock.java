package com.catalog.browser.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock using one {@link ReentrantLock} per key.
 * Entries are reference counted and dropped once no thread holds or waits on them,
 * so the map does not grow with the number of distinct keys ever seen.
 */
public class LocalKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalKeyedLock.class);

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalKeyedLock() {
        this(LockConfig.defaults());
    }

    public LocalKeyedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        try {
            boolean acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                release(key);
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: {}", key);
            return true;
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        LockEntry entry = locks.get(key);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(key);
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Returns the number of keys currently held or waited on.
     */
    public int activeKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    // users is only touched inside ConcurrentHashMap compute functions
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}

package com.catalog.browser.lock;

/**
 * Per-key mutual exclusion used to give cache fills and token refreshes
 * single-flight semantics: the first caller for a key works, later callers
 * for the same key wait for it.
 */
public interface KeyedLock {

    /**
     * Acquires the lock for the given key, waiting up to the configured timeout.
     *
     * @param key the lock key (typically a call signature slug)
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key held by the current thread.
     *
     * @param key the lock key
     */
    void unlock(String key);
}

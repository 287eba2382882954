/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the reconciliations in progress so that one resource is never reconciled by two workers at once. A lock
 * lives in the map only while somebody holds it or waits for it.
 */
public class ReconciliationLockManager {
    private static final Logger LOGGER = LogManager.getLogger(ReconciliationLockManager.class);

    /*test*/ final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    /**
     * Tries to lock the lock for given key. The registration of the caller as an interested party happens inside
     * {@code locks.compute(...)} so that it cannot race with the removal in {@link #unlock(String)}.
     *
     * @param key   The key for which the lock should be obtained
     * @param time  How many units of time should we wait for the lock
     * @param unit  How long the unit of waiting is
     *
     * @return  True if the lock was successfully obtained. False otherwise
     *
     * @throws InterruptedException Throws in InterruptedException in case interrupted while waiting for the lock
     */
    public boolean tryLock(String key, long time, TimeUnit unit) throws InterruptedException {
        KeyLock keyLock = locks.compute(key, (k, v) -> v == null ? new KeyLock() : v.register());
        LOGGER.debug("Trying to obtain lock {}", key);

        boolean locked = false;
        try {
            locked = keyLock.lock.tryLock(time, unit);
        } finally {
            if (!locked) {
                release(key, keyLock, false);
            }
        }

        return locked;
    }

    /**
     * Unlocks the lock for given key. The lock is removed from the map when nobody else waits for it.
     *
     * @param key   The key of the lock which should be unlocked
     */
    public void unlock(String key)    {
        KeyLock keyLock = locks.get(key);

        if (keyLock == null) {
            LOGGER.warn("Lock with key {} does not exist and cannot be unlocked", key);
        } else {
            LOGGER.debug("Releasing lock {}", key);
            release(key, keyLock, true);
        }
    }

    private void release(String key, KeyLock keyLock, boolean held) {
        locks.compute(key, (k, v) -> {
            if (held) {
                keyLock.lock.unlock();
            }

            if (v != null && --v.holders == 0) {
                LOGGER.debug("Lock {} is not in use anymore and will be removed", key);
                return null;
            } else {
                return v;
            }
        });
    }

    /**
     * A lock together with the number of parties holding it or waiting for it. The counter is only touched inside
     * {@code locks.compute(...)}.
     */
    static class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        /*test*/ int holders = 1;

        private KeyLock register() {
            holders++;
            return this;
        }
    }
}

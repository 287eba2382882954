/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.longhorn.operator.common.ReconciliationLogger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The process watches owned by one controller, keyed by the name of the instance manager. There is at most one watch
 * per instance manager.
 */
public class ProcessWatchRegistry {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ProcessWatchRegistry.class);

    private final Map<String, ProcessWatch> watches = new HashMap<>();
    private final Lock lock = new ReentrantLock();
    private final AtomicInteger activeWatches;

    /**
     * @param activeWatches     Gauge which is kept equal to the number of registered watches
     */
    public ProcessWatchRegistry(AtomicInteger activeWatches) {
        this.activeWatches = activeWatches;
    }

    /**
     * Creates and starts a watch for the instance manager unless one is already registered.
     *
     * @param name      Name of the instance manager
     * @param factory   Creates the watch. Called only when there is no watch yet.
     *
     * @return  True when a new watch was started. False when one already existed.
     */
    public boolean startIfAbsent(String name, Supplier<ProcessWatch> factory) {
        lock.lock();
        try {
            if (watches.containsKey(name)) {
                return false;
            }

            ProcessWatch watch = factory.get();
            watch.start();
            watches.put(name, watch);
            activeWatches.set(watches.size());
            LOGGER.debugOp("Process watch for instance manager {} was registered", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops and removes the watch of the instance manager if there is one.
     *
     * @param name  Name of the instance manager
     *
     * @return  True when a watch was stopped
     */
    public boolean stop(String name) {
        ProcessWatch watch;

        lock.lock();
        try {
            watch = watches.remove(name);
            activeWatches.set(watches.size());
        } finally {
            lock.unlock();
        }

        if (watch != null) {
            watch.stop();
            LOGGER.debugOp("Process watch for instance manager {} was stopped", name);
            return true;
        }

        return false;
    }

    /**
     * Stops all watches. Used when the controller shuts down.
     */
    public void stopAll() {
        List<ProcessWatch> stopped;

        lock.lock();
        try {
            stopped = new ArrayList<>(watches.values());
            watches.clear();
            activeWatches.set(0);
        } finally {
            lock.unlock();
        }

        LOGGER.infoOp("Stopping {} process watches", stopped.size());
        stopped.forEach(ProcessWatch::stop);
    }

    /**
     * @param name  Name of the instance manager
     *
     * @return  True when a watch is registered for the instance manager
     */
    public boolean contains(String name) {
        lock.lock();
        try {
            return watches.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return watches.size();
        } finally {
            lock.unlock();
        }
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.instancemanager.InstanceManagerStore;
import io.longhorn.operator.instancemanager.UpdateResult;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>Keeps the process list of one running instance manager up to date by following the event stream of its
 * management daemon.</p>
 *
 * <p>The watch runs two threads. The receive thread keeps a stream open (reopening it after a failure), and writes
 * every received event into the instance manager, retrying on conflicts. The shutdown thread waits for the stop
 * signal, closes the stream and wakes the receive thread up.</p>
 *
 * <p>A watch can be stopped only once. Stopping waits for the receive thread to finish a write which is in progress,
 * so whoever stops the watch can modify the instance manager afterwards without being overwritten by the watch.</p>
 */
public class ProcessWatch {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ProcessWatch.class);
    private static final long STOP_TIMEOUT_MS = 10_000L;

    private final String instanceManagerName;
    private final ProcessManagerClient client;
    private final InstanceManagerStore store;
    private final long reconnectIntervalMs;
    private final long updateRetryIntervalMs;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object streamLock = new Object();
    private final Thread receiveThread;
    private final Thread shutdownThread;

    private volatile boolean done = false;
    private volatile boolean receiving = false;
    private ProcessStream stream; // guarded by streamLock

    /**
     * Creates the watch. It does not do anything until it is started.
     *
     * @param instanceManagerName       Name of the watched instance manager
     * @param client                    Client for the daemon of the instance manager
     * @param store                     Store used to read and write the instance manager
     * @param reconnectIntervalMs       How long to wait before reopening a stream which failed to open
     * @param updateRetryIntervalMs     How long to wait before retrying a write which ran into a conflict
     */
    public ProcessWatch(String instanceManagerName, ProcessManagerClient client, InstanceManagerStore store, long reconnectIntervalMs, long updateRetryIntervalMs) {
        this.instanceManagerName = instanceManagerName;
        this.client = client;
        this.store = store;
        this.reconnectIntervalMs = reconnectIntervalMs;
        this.updateRetryIntervalMs = updateRetryIntervalMs;

        this.receiveThread = new Thread(this::receiveLoop, "process-watch-" + instanceManagerName);
        this.receiveThread.setDaemon(true);
        this.shutdownThread = new Thread(this::shutdownLoop, "process-watch-shutdown-" + instanceManagerName);
        this.shutdownThread.setDaemon(true);
    }

    /**
     * @return  Name of the watched instance manager
     */
    public String instanceManagerName() {
        return instanceManagerName;
    }

    /**
     * Starts the receive and shutdown threads
     */
    public void start() {
        if (stopRequested.get()) {
            LOGGER.warnOp("Process watch for instance manager {} was stopped before it was started", instanceManagerName);
            done = true;
        } else if (started.compareAndSet(false, true)) {
            LOGGER.debugOp("Starting process watch for instance manager {}", instanceManagerName);
            shutdownThread.start();
            receiveThread.start();
        } else {
            LOGGER.warnOp("Process watch for instance manager {} was already started", instanceManagerName);
        }
    }

    /**
     * Stops the watch and waits for the receive thread to finish.
     *
     * @return  False when the watch was already stopped before. True otherwise.
     */
    public boolean stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            LOGGER.warnOp("Process watch for instance manager {} was already stopped", instanceManagerName);
            return false;
        }

        LOGGER.debugOp("Stopping process watch for instance manager {}", instanceManagerName);
        stopSignal.countDown();

        if (started.get() && Thread.currentThread() != receiveThread) {
            try {
                receiveThread.join(STOP_TIMEOUT_MS);
                if (receiveThread.isAlive()) {
                    LOGGER.warnOp("Process watch for instance manager {} did not stop within {} ms", instanceManagerName, STOP_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.debugOp("Interrupted while waiting for the process watch of instance manager {} to stop", instanceManagerName);
            }
        }

        return true;
    }

    /**
     * @return  True once the stop signal was processed
     */
    public boolean isDone() {
        return done;
    }

    /**
     * @return  True while the receive thread is running
     */
    public boolean isAlive() {
        return receiveThread.isAlive();
    }

    private void shutdownLoop() {
        try {
            stopSignal.await();
        } catch (InterruptedException e) {
            LOGGER.debugOp("Shutdown thread of process watch for instance manager {} was interrupted", instanceManagerName);
        }

        done = true;

        synchronized (streamLock) {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        // Closing the stream does not wake up every blocking read
        if (receiving) {
            receiveThread.interrupt();
        }
    }

    private void receiveLoop() {
        while (!done) {
            ProcessStream current;

            synchronized (streamLock) {
                current = stream;
            }

            if (current == null) {
                // Opening can block on an unresponsive daemon, so it happens outside of the lock where the shutdown
                // thread can interrupt it
                current = open();

                if (current == null) {
                    if (!done) {
                        awaitStop(reconnectIntervalMs);
                    }
                    continue;
                }

                synchronized (streamLock) {
                    if (done) {
                        current.close();
                        break;
                    }

                    stream = current;
                }
            }

            ProcessObservation observation;
            try {
                receiving = true;
                if (done) {
                    break;
                }

                observation = current.receive();
            } catch (ProcessManagerException e) {
                if (!done) {
                    LOGGER.errorOp("Error receiving next item in process watch for instance manager {}: {}", instanceManagerName, e.getMessage());
                }

                synchronized (streamLock) {
                    if (stream == current) {
                        current.close();
                        stream = null;
                    }
                }

                if (!done) {
                    awaitStop(reconnectIntervalMs);
                }
                continue;
            } finally {
                receiving = false;
            }

            apply(observation);
        }

        synchronized (streamLock) {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        // The interrupt used for waking up the receive call is not meant for anyone else
        Thread.interrupted();
        LOGGER.debugOp("Process watch for instance manager {} finished", instanceManagerName);
    }

    /**
     * Opens a new stream. The receiving flag is raised before the done flag is checked, so either this thread sees
     * the stop or the shutdown thread sees the flag and interrupts the open.
     *
     * @return  The stream, or null when it could not be opened or the watch was stopped
     */
    private ProcessStream open() {
        try {
            receiving = true;
            if (done) {
                return null;
            }

            return client.watch();
        } catch (ProcessManagerException e) {
            if (!done) {
                LOGGER.errorOp("Error starting process watch for instance manager {}: {}", instanceManagerName, e.getMessage());
            }
            return null;
        } finally {
            receiving = false;
        }
    }

    /**
     * Writes the observation into the instance manager. Conflicts are retried until the write succeeds, fails for
     * another reason or the watch is stopped.
     *
     * @param observation   Observed process
     */
    private void apply(ProcessObservation observation) {
        while (!done) {
            InstanceManager instanceManager;
            try {
                instanceManager = store.getInstanceManager(instanceManagerName);
            } catch (KubernetesClientException e) {
                LOGGER.errorOp("Could not get instance manager {}", instanceManagerName, e);
                return;
            }

            if (instanceManager == null) {
                LOGGER.errorOp("Could not get instance manager {}: it does not exist", instanceManagerName);
                return;
            }

            MergeOutcome outcome = InstanceProcessMerger.merge(instanceManagerName, instanceManager.getStatus().getInstances(), observation);
            if (!outcome.changed()) {
                LOGGER.traceOp("Process event {} did not change instance manager {}: {}", observation.name(), instanceManagerName, outcome);
                return;
            }

            UpdateResult result;
            try {
                result = store.update(instanceManager);
            } catch (KubernetesClientException e) {
                LOGGER.errorOp("Error updating instance manager {} with process update {}", instanceManagerName, observation.name(), e);
                return;
            }

            if (result == UpdateResult.UPDATED) {
                LOGGER.debugOp("Instance manager {} was updated with process update {}: {}", instanceManagerName, observation.name(), outcome);
                return;
            } else if (result == UpdateResult.NOT_FOUND) {
                LOGGER.errorOp("Error updating instance manager {} with process update {}: instance manager not found", instanceManagerName, observation.name());
                return;
            }

            awaitStop(updateRetryIntervalMs);
        }
    }

    private void awaitStop(long timeoutMs) {
        try {
            stopSignal.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            LOGGER.traceOp("Process watch for instance manager {} was interrupted while waiting", instanceManagerName);
        }
    }
}

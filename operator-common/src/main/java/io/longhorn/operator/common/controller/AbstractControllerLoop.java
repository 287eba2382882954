/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.common.metrics.ControllerMetricsHolder;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Abstract controller loop provides the shared functionality for reconciling resources in Longhorn controllers. It
 * takes an event from the queue, reconciles it under the lock of the resource and decides about retries.
 */
public abstract class AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractControllerLoop.class);
    private static final long PROGRESS_WARNING_MS = 60_000L;

    private final String name;
    private final Thread controllerThread;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ScheduledExecutorService scheduledExecutor;

    private volatile boolean stop = false;
    private volatile boolean running = false;

    /**
     * Creates the controller loop. Several loops usually share one queue and one lock manager.
     *
     * @param name                  The name of this controller loop. It is used as the thread name as well.
     * @param workQueue             Queue from which events should be consumed
     * @param lockManager           Lock manager for making sure no parallel reconciliations for a given resource can happen
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings
     */
    public AbstractControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ScheduledExecutorService scheduledExecutor) {
        this.name = name;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.scheduledExecutor = scheduledExecutor;
        this.controllerThread = new Thread(new Runner(), name);
    }

    /**
     * The main reconciliation logic.
     *
     * @param reconciliation    Reconciliation identifier used for logging
     *
     * @return  Whether the resource is done or should be reconciled again after a back-off
     */
    protected abstract ReconcileResult reconcile(Reconciliation reconciliation);

    /**
     * @return  The Controller Metrics Holder instance
     */
    protected abstract ControllerMetricsHolder metrics();

    /**
     * Starts the controller: this method creates a new thread in which the controller will run
     */
    public void start() {
        LOGGER.debugOp("{}: Starting the controller loop", name);
        controllerThread.start();
    }

    /**
     * Stops the controller: this method sets the stop flag and interrupt the run loop
     *
     * @throws InterruptedException InterruptedException is thrown when interrupted while joining the thread
     */
    public void stop() throws InterruptedException {
        LOGGER.infoOp("{}: Requesting the controller loop to stop", name);
        this.stop = true;
        controllerThread.interrupt();
        controllerThread.join();
    }

    /**
     * @return  True when the controller is in the run loop, false otherwise
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return  True when the controller loop thread is alive, false otherwise
     */
    public boolean isAlive() {
        return controllerThread.isAlive();
    }

    /**
     * Obtains the lock for the resource and reconciles it. If the lock is in use, the reconciliation is re-queued.
     *
     * @param reconciliation    Reconciliation marker
     */
    private void reconcileWithLock(SimplifiedReconciliation reconciliation) {
        String lockName = reconciliation.lockName();
        boolean requeue = false;

        try {
            boolean locked = lockManager.tryLock(lockName, 1_000, TimeUnit.MILLISECONDS);

            if (locked) {
                try {
                    reconcileWrapper(reconciliation);
                } finally {
                    lockManager.unlock(lockName);
                }
            } else {
                LOGGER.warnOp("{}: Failed to acquire lock {}. The resource will be re-queued for later.", name, lockName);
                metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
                requeue = true;
            }
        } catch (InterruptedException e) {
            LOGGER.warnOp("{}: Interrupted while trying to acquire lock {}. The resource will be re-queued for later.", name, lockName);
            metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
            requeue = true;
        }

        if (requeue) {
            workQueue.enqueue(reconciliation);
        }
    }

    /**
     * Runs the reconciliation with progress warnings and metrics and hands failed or lost reconciliations to the
     * retry logic of the queue.
     *
     * @param simplified    Queue entry of the reconciliation
     */
    private void reconcileWrapper(SimplifiedReconciliation simplified) {
        Reconciliation reconciliation = simplified.toReconciliation();

        ScheduledFuture<?> progressWarning = scheduledExecutor
                .scheduleAtFixedRate(() -> LOGGER.infoCr(reconciliation, "Reconciliation is in progress"), PROGRESS_WARNING_MS, PROGRESS_WARNING_MS, TimeUnit.MILLISECONDS);
        metrics().reconciliationsCounter(reconciliation.namespace()).increment();
        Timer.Sample reconciliationTimerSample = Timer.start(metrics().metricsProvider().meterRegistry());

        try {
            ReconcileResult result = reconcile(reconciliation);
            metrics().successfulReconciliationsCounter(reconciliation.namespace()).increment();

            if (result == ReconcileResult.REQUEUE) {
                LOGGER.debugCr(reconciliation, "Reconciliation will be retried");
                workQueue.enqueueAfterConflict(simplified);
            } else {
                workQueue.forget(simplified);
            }
        } catch (RuntimeException e) {
            metrics().failedReconciliationsCounter(reconciliation.namespace()).increment();
            LOGGER.warnCr(reconciliation, "Reconciliation failed", e);
            workQueue.enqueueWithBackOff(simplified);
        } finally   {
            reconciliationTimerSample.stop(metrics().reconciliationsTimer(reconciliation.namespace()));
            progressWarning.cancel(true);
        }
    }

    /**
     * Runs the controller loop. This is a private inner class to not expose the run method.
     */
    private class Runner implements Runnable {
        @Override
        public void run() {
            LOGGER.debugOp("{}: Starting", name);
            running = true;

            while (!stop) {
                try {
                    LOGGER.debugOp("{}: Waiting for next event from work queue", name);
                    SimplifiedReconciliation reconciliation = workQueue.take();
                    reconcileWithLock(reconciliation);
                } catch (InterruptedException e) {
                    LOGGER.debugOp("{}: was interrupted", name, e);
                } catch (Exception e) {
                    LOGGER.warnOp("{}: reconciliation failed", name, e);
                }
            }

            LOGGER.infoOp("{}: Stopping", name);
            running = false;
        }
    }
}

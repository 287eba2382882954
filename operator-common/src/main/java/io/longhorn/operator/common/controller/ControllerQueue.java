/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

import io.longhorn.operator.common.BackOff;
import io.longhorn.operator.common.metrics.ControllerMetricsHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Controller queue wraps a blocking queue and exposes the methods used by controllers: taking events from the queue,
 * enqueueing new events and re-enqueueing failed ones with an exponential back-off. Resources which fail more often
 * than the configured maximum of retries are dropped from the queue until something enqueues them again.
 */
public class ControllerQueue {
    private final static Logger LOGGER = LogManager.getLogger(ControllerQueue.class);

    /*test*/ final BlockingQueue<SimplifiedReconciliation> queue;
    /*test*/ final Map<String, BackOff> backOffs = new ConcurrentHashMap<>();
    private final int maxRetries;
    private final long retryDelayMs;
    private final ControllerMetricsHolder metrics;
    private final ScheduledExecutorService scheduledExecutor;

    /**
     * Creates the controller queue.
     *
     * @param queueSize         The capacity of the work queue
     * @param maxRetries        How many times a resource is re-enqueued after a failure before it is dropped
     * @param retryDelayMs      Delay before the first retry. It doubles with every following retry.
     * @param metrics           Holder for the controller metrics
     * @param scheduledExecutor Executor used to run the delayed re-enqueueing
     */
    public ControllerQueue(int queueSize, int maxRetries, long retryDelayMs, ControllerMetricsHolder metrics, ScheduledExecutorService scheduledExecutor) {
        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        this.metrics = metrics;
        this.scheduledExecutor = scheduledExecutor;
    }

    /**
     * @return  Takes the next item from the queue. Blocks if the queue is empty.
     *
     * @throws InterruptedException InterruptedException is thrown if interrupted while waiting to get the next resource from the queue (e.g. when the queue is empty)
     */
    public SimplifiedReconciliation take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Enqueues the next reconciliation. It checks whether another reconciliation for the same resource is already in
     * the queue and enqueues the new event only if it is not there yet.
     *
     * @param reconciliation    Reconciliation identifier
     */
    public void enqueue(SimplifiedReconciliation reconciliation)    {
        if (!queue.contains(reconciliation)) {
            LOGGER.debug("Enqueueing {}", reconciliation);
            if (!queue.offer(reconciliation))    {
                LOGGER.warn("Failed to enqueue {} because the controller queue is full", reconciliation);
            }
        } else {
            metrics.alreadyEnqueuedReconciliationsCounter(reconciliation.namespace).increment();
            LOGGER.debug("{} is already enqueued => ignoring", reconciliation);
        }
    }

    /**
     * Enqueues the reconciliation again once its back-off delay passes. When the resource already used all of its
     * retries, it is dropped instead and its retry history is forgotten.
     *
     * @param reconciliation    Reconciliation identifier
     *
     * @return  True if the reconciliation was scheduled for a retry. False if it was dropped.
     */
    public boolean enqueueWithBackOff(SimplifiedReconciliation reconciliation) {
        String key = reconciliation.lockName();
        long[] delay = new long[] {-1L};

        backOffs.compute(key, (k, backOff) -> {
            BackOff current = backOff != null ? backOff : new BackOff(retryDelayMs, 2, maxRetries, Math.max(retryDelayMs, 60_000L));

            if (current.done()) {
                return null;
            } else {
                delay[0] = current.delayMs();
                return current;
            }
        });

        if (delay[0] < 0) {
            LOGGER.error("Dropping {} out of the queue after {} retries", reconciliation, maxRetries);
            metrics.droppedReconciliationsCounter(reconciliation.namespace).increment();
            return false;
        }

        return schedule(reconciliation, delay[0]);
    }

    /**
     * Enqueues a reconciliation which lost a race (for example an update conflict) again after the initial retry
     * delay. Lost races are not failures: the retry history of the resource is forgotten, so they never get it dropped.
     *
     * @param reconciliation    Reconciliation identifier
     *
     * @return  True if the reconciliation was scheduled. False if the controller is shutting down.
     */
    public boolean enqueueAfterConflict(SimplifiedReconciliation reconciliation) {
        forget(reconciliation);
        return schedule(reconciliation, retryDelayMs);
    }

    private boolean schedule(SimplifiedReconciliation reconciliation, long delayMs) {
        LOGGER.debug("Re-enqueueing {} in {} ms", reconciliation, delayMs);
        try {
            scheduledExecutor.schedule(() -> enqueue(reconciliation.withTrigger("retry")), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Cannot re-enqueue {} because the controller is shutting down", reconciliation);
            return false;
        }

        return true;
    }

    /**
     * Forgets the retry history of a resource. Called after a successful reconciliation.
     *
     * @param reconciliation    Reconciliation identifier
     */
    public void forget(SimplifiedReconciliation reconciliation) {
        backOffs.remove(reconciliation.lockName());
    }

    /**
     * @param reconciliation    Reconciliation identifier
     *
     * @return  How many times the resource was re-enqueued since its last successful reconciliation
     */
    public int numRequeues(SimplifiedReconciliation reconciliation) {
        BackOff backOff = backOffs.get(reconciliation.lockName());
        return backOff != null ? backOff.retries() : 0;
    }
}

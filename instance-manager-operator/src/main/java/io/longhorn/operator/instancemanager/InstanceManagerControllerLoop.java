/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationException;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.common.controller.AbstractControllerLoop;
import io.longhorn.operator.common.controller.ControllerQueue;
import io.longhorn.operator.common.controller.ReconcileResult;
import io.longhorn.operator.common.controller.ReconciliationLockManager;
import io.longhorn.operator.common.metrics.ControllerMetricsHolder;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Controller loop reconciling the instance managers taken from the work queue
 */
public class InstanceManagerControllerLoop extends AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InstanceManagerControllerLoop.class);

    private final InstanceManagerReconciler reconciler;
    private final ControllerMetricsHolder metrics;

    /**
     * Constructor of the instance manager reconciliation loop
     *
     * @param name                  Name of the reconciliation loop
     * @param workQueue             ControllerQueue from which the reconciliation events should be taken
     * @param lockManager           LockManager which is used to avoid the same resource being reconciled in multiple loops in parallel
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings
     * @param reconciler            The reconciler with the actual reconciliation logic
     * @param metrics               The metrics holder for providing metrics about the reconciliation
     */
    public InstanceManagerControllerLoop(
            String name,
            ControllerQueue workQueue,
            ReconciliationLockManager lockManager,
            ScheduledExecutorService scheduledExecutor,
            InstanceManagerReconciler reconciler,
            ControllerMetricsHolder metrics
    ) {
        super(name, workQueue, lockManager, scheduledExecutor);

        this.reconciler = reconciler;
        this.metrics = metrics;
    }

    /**
     * Runs the reconciler. Any failure is reported as a ReconciliationException carrying the key of the instance
     * manager, so that the loop retries it.
     *
     * @param reconciliation    Reconciliation identifier used for logging
     *
     * @return  Result of the reconciliation
     */
    @Override
    protected ReconcileResult reconcile(Reconciliation reconciliation) {
        LOGGER.debugCr(reconciliation, "{} will be reconciled", reconciliation.kind());

        try {
            ReconcileResult result = reconciler.reconcile(reconciliation);
            LOGGER.debugCr(reconciliation, "reconciled with result {}", result);
            return result;
        } catch (ReconciliationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReconciliationException(reconciliation.key(), "fail to sync instance manager", e);
        }
    }

    @Override
    protected ControllerMetricsHolder metrics() {
        return metrics;
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.metrics;

import io.longhorn.operator.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A metrics holder for controllers.
 */
public class ControllerMetricsHolder extends MetricsHolder {
    public static final String METRICS_RECONCILIATIONS_ALREADY_ENQUEUED = METRICS_RECONCILIATIONS + ".already.enqueued";
    public static final String METRICS_RECONCILIATIONS_DROPPED = METRICS_RECONCILIATIONS + ".dropped";

    private final Map<String, Counter> alreadyQueuedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> droppedReconciliationsCounterMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the controller metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param metricsProvider   Metrics provider
     */
    public ControllerMetricsHolder(String kind, MetricsProvider metricsProvider) {
        super(kind, metricsProvider);
    }

    /**
     * Counter metric for number of reconciliations which are already queued when we try to enqueue them again. This
     * might indicate for example that the periodic reconciliations are triggering too often (faster than the operator
     * reconciles them).
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter alreadyEnqueuedReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_ALREADY_ENQUEUED,
                "Number of reconciliations skipped because the same resource was already waiting in the queue", alreadyQueuedReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of resources which failed to reconcile so many times in a row that they were dropped
     * from the work queue. They are picked up again by the next event or periodic reconciliation.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter droppedReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_DROPPED,
                "Number of resources dropped from the work queue after exhausting their retries", droppedReconciliationsCounterMap);
    }
}

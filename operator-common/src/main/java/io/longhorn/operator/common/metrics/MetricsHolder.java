/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.metrics;

import io.longhorn.operator.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Abstract base class holding common metrics used by operators and controllers. Every metric is tagged with the kind
 * of the reconciled resources and their namespace. Subclasses can add more specialized metrics.
 */
public abstract class MetricsHolder {
    /**
     * Prefix used for metrics provided by Longhorn operators
     */
    public static final String METRICS_PREFIX = "longhorn.";
    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    public static final String METRICS_RECONCILIATIONS_PERIODICAL = METRICS_RECONCILIATIONS + ".periodical";
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    public static final String METRICS_RECONCILIATIONS_LOCKED = METRICS_RECONCILIATIONS + ".locked";
    public static final String METRICS_RESOURCES = METRICS_PREFIX + "resources";

    protected final String kind;
    protected final MetricsProvider metricsProvider;

    private final Map<String, AtomicInteger> resourceCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> periodicReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> reconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> failedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> successfulReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Counter> lockedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<String, Timer> reconciliationsTimerMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param metricsProvider   Metrics provider
     */
    public MetricsHolder(String kind, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @return  Metrics provider used for the metrics by this holder class
     */
    public MetricsProvider metricsProvider()    {
        return metricsProvider;
    }

    ////////////////////
    // Methods for individual counters
    ////////////////////

    /**
     * Counter metric for number of periodic reconciliations. It is incremented once per timer tick, not once per
     * resource found by the periodic reconciliation.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter periodicReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_PERIODICAL,
                "Number of periodical reconciliations done by the operator", periodicReconciliationsCounterMap);
    }

    public Counter reconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS,
                "Number of reconciliations done by the operator for individual resources", reconciliationsCounterMap);
    }

    public Counter failedReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_FAILED,
                "Number of reconciliations done by the operator for individual resources which failed", failedReconciliationsCounterMap);
    }

    public Counter successfulReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_SUCCESSFUL,
                "Number of reconciliations done by the operator for individual resources which were successful", successfulReconciliationsCounterMap);
    }

    public Timer reconciliationsTimer(String namespace) {
        return metric(namespace, reconciliationsTimerMap,
                tags -> metricsProvider.timer(METRICS_RECONCILIATIONS_DURATION, "The time the reconciliation takes to complete", tags));
    }

    /**
     * Counter metric for number of reconciliations which did not happen because they did not get the lock (another
     * reconciliation for the same resource was in progress).
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter lockedReconciliationsCounter(String namespace) {
        return getCounter(namespace, METRICS_RECONCILIATIONS_LOCKED,
                "Number of reconciliations skipped because another reconciliation for the same resource was still running", lockedReconciliationsCounterMap);
    }

    /**
     * Gauge with the number of custom resources seen by the operator
     *
     * @param namespace     Namespace of the resources
     *
     * @return  Gauge value
     */
    public AtomicInteger resourceCounter(String namespace) {
        return getGauge(namespace, METRICS_RESOURCES, "Number of custom resources the operator sees", resourceCounterMap);
    }

    ////////////////////
    // Helpers
    ////////////////////

    protected <M> M metric(String namespace, Map<String, M> metricMap, Function<Tags, M> fn) {
        return metricMap.computeIfAbsent(namespace, ns -> fn.apply(Tags.of(Tag.of("kind", kind), Tag.of("namespace", ns))));
    }

    protected Counter getCounter(String namespace, String metricName, String metricHelp, Map<String, Counter> counterMap) {
        return metric(namespace, counterMap, tags -> metricsProvider.counter(metricName, metricHelp, tags));
    }

    protected AtomicInteger getGauge(String namespace, String metricName, String metricHelp, Map<String, AtomicInteger> gaugeMap) {
        return metric(namespace, gaugeMap, tags -> metricsProvider.gauge(metricName, metricHelp, tags));
    }
}

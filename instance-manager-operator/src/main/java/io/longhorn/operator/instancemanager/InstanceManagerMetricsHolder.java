/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.longhorn.operator.common.MetricsProvider;
import io.longhorn.operator.common.metrics.ControllerMetricsHolder;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Controller metrics extended with the metrics specific to the instance manager controller
 */
public class InstanceManagerMetricsHolder extends ControllerMetricsHolder {
    public static final String METRICS_PROCESS_WATCHES = METRICS_PREFIX + "process.watches";

    private final Map<String, AtomicInteger> processWatchesGaugeMap = new ConcurrentHashMap<>(1);

    /**
     * @param kind              Kind of the resources for which these metrics apply
     * @param metricsProvider   Metrics provider
     */
    public InstanceManagerMetricsHolder(String kind, MetricsProvider metricsProvider) {
        super(kind, metricsProvider);
    }

    /**
     * Gauge with the number of process watches the controller keeps open
     *
     * @param namespace     Namespace of the instance managers
     *
     * @return  Gauge value
     */
    public AtomicInteger activeProcessWatches(String namespace) {
        return getGauge(namespace, METRICS_PROCESS_WATCHES, "Number of process watches kept open by the controller", processWatchesGaugeMap);
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.http;

/**
 * A liveness check implemented by an operator and called by the {@link HealthCheckAndMetricsServer} when handling a
 * health check request.
 */
public interface Liveness {

    /**
     * Indicates whether the operator is alive. It is invoked on the HTTP request handling thread, so it should not
     * block.
     *
     * @return  True when the operator is alive, false otherwise.
     */
    boolean isAlive();
}

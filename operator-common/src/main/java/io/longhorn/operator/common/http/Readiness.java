/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.http;

/**
 * A readiness check implemented by an operator and called by the {@link HealthCheckAndMetricsServer} when handling a
 * readiness request.
 */
public interface Readiness {

    /**
     * Indicates whether the operator is ready, for example when all its controller threads are running. It is
     * invoked on the HTTP request handling thread, so it should not block.
     *
     * @return  True when the operator is ready, false otherwise
     */
    boolean isReady();
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

/**
 * Outcome of a reconciliation which did not fail
 */
public enum ReconcileResult {
    /**
     * Nothing more to do until the next event
     */
    DONE,

    /**
     * The reconciliation lost a race (for example an update conflict) and the resource should be reconciled again
     * after a back-off
     */
    REQUEUE
}

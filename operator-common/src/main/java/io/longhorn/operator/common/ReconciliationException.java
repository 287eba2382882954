/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

/**
 * Wraps any failure of a reconciliation together with the key of the resource which was reconciled. The
 * controller loop uses the key to decide about retrying.
 */
public class ReconciliationException extends RuntimeException {
    private final String key;

    /**
     * Creates new exception
     *
     * @param key       Key ({@code namespace/name}) of the reconciled resource
     * @param message   Description of the failure
     * @param cause     Exception which caused the reconciliation to fail
     */
    public ReconciliationException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    /**
     * Creates new exception without an underlying cause
     *
     * @param key       Key ({@code namespace/name}) of the reconciled resource
     * @param message   Description of the failure
     */
    public ReconciliationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    /**
     * @return  Key of the resource which failed to reconcile
     */
    public String getKey() {
        return key;
    }
}

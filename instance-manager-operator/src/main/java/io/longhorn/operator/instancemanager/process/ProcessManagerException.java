/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

/**
 * Failure to talk to the management daemon running inside an instance manager pod: the daemon is not reachable,
 * it answered with an error or it sent something we could not decode.
 */
public class ProcessManagerException extends Exception {
    /**
     * @param message   Description of the failure
     */
    public ProcessManagerException(String message) {
        super(message);
    }

    /**
     * @param message   Description of the failure
     * @param cause     Underlying exception
     */
    public ProcessManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}

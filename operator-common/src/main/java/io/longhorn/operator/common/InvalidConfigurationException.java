/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

/**
 * Raised when the operator is started with a missing or malformed configuration value
 */
public class InvalidConfigurationException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

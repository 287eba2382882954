/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States of the instance manager lifecycle. {@code STOPPED} is terminal.
 */
public enum InstanceManagerState {
    UNKNOWN,
    STARTING,
    RUNNING,
    ERROR,
    STOPPED;

    @JsonCreator
    public static InstanceManagerState forValue(String value) {
        if (value == null) {
            return null;
        }

        switch (value) {
            case "unknown":
                return UNKNOWN;
            case "starting":
                return STARTING;
            case "running":
                return RUNNING;
            case "error":
                return ERROR;
            case "stopped":
                return STOPPED;
            default:
                return null;
        }
    }

    @JsonValue
    public String toValue() {
        switch (this) {
            case UNKNOWN:
                return "unknown";
            case STARTING:
                return "starting";
            case RUNNING:
                return "running";
            case ERROR:
                return "error";
            case STOPPED:
                return "stopped";
            default:
                return null;
        }
    }
}

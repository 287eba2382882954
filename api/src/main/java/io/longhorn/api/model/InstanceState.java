/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Runtime state of a single engine or replica process as reported by its instance manager
 */
public enum InstanceState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR;

    @JsonCreator
    public static InstanceState forValue(String value) {
        if (value == null) {
            return null;
        }

        switch (value) {
            case "starting":
                return STARTING;
            case "running":
                return RUNNING;
            case "stopping":
                return STOPPING;
            case "stopped":
                return STOPPED;
            case "error":
                return ERROR;
            default:
                return null;
        }
    }

    @JsonValue
    public String toValue() {
        switch (this) {
            case STARTING:
                return "starting";
            case RUNNING:
                return "running";
            case STOPPING:
                return "stopping";
            case STOPPED:
                return "stopped";
            case ERROR:
                return "error";
            default:
                return null;
        }
    }
}

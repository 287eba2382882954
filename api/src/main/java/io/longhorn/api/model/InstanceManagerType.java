/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of an instance manager: engine managers run the volume engines, replica managers run the replicas
 */
public enum InstanceManagerType {
    ENGINE,
    REPLICA;

    @JsonCreator
    public static InstanceManagerType forValue(String value) {
        if (value == null) {
            return null;
        }

        switch (value) {
            case "engine":
                return ENGINE;
            case "replica":
                return REPLICA;
            default:
                return null;
        }
    }

    @JsonValue
    public String toValue() {
        switch (this) {
            case ENGINE:
                return "engine";
            case REPLICA:
                return "replica";
            default:
                return null;
        }
    }
}

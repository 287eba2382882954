/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.longhorn.api.model.InstanceManagerType;

/**
 * The API differences between engine managers and replica managers. Each role knows where its daemon serves the
 * process list and the process events and how to convert its records into the common process representation.
 */
public interface ManagerRole {
    /**
     * @return  Type of the instance managers with this role
     */
    InstanceManagerType type();

    /**
     * @return  Path of the endpoint listing all processes
     */
    String listPath();

    /**
     * @return  Path of the endpoint streaming the process events
     */
    String watchPath();

    /**
     * Decodes one record sent by the daemon.
     *
     * @param mapper    Object mapper used for the decoding
     * @param record    The JSON record
     *
     * @return  Observed process
     *
     * @throws JsonProcessingException  When the record does not match the role's format
     */
    ProcessObservation decode(ObjectMapper mapper, JsonNode record) throws JsonProcessingException;

    /**
     * Finds the role for an instance manager type.
     *
     * @param type  Type of the instance manager
     *
     * @return  The role or null when the type is not known
     */
    static ManagerRole forType(InstanceManagerType type) {
        if (type == null) {
            return null;
        }

        return switch (type) {
            case ENGINE -> EngineManagerRole.INSTANCE;
            case REPLICA -> ReplicaManagerRole.INSTANCE;
        };
    }
}

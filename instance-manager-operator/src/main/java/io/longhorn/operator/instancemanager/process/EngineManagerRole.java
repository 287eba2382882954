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
 * Role of the engine managers
 */
public class EngineManagerRole implements ManagerRole {
    /**
     * Shared instance. The role has no state.
     */
    public static final EngineManagerRole INSTANCE = new EngineManagerRole();

    /**
     * Value of the process type reported for engines
     */
    public static final String PROCESS_TYPE = "engine";

    private EngineManagerRole() {
    }

    @Override
    public InstanceManagerType type() {
        return InstanceManagerType.ENGINE;
    }

    @Override
    public String listPath() {
        return "/v1/engines";
    }

    @Override
    public String watchPath() {
        return "/v1/engines/watch";
    }

    @Override
    public ProcessObservation decode(ObjectMapper mapper, JsonNode record) throws JsonProcessingException {
        EngineProcess engine = mapper.treeToValue(record, EngineProcess.class);
        return new ProcessObservation(engine.toInstanceProcess(), engine.isDeleted());
    }

    @Override
    public String toString() {
        return "engine-manager";
    }
}

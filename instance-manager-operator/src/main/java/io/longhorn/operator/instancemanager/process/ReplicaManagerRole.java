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
 * Role of the replica managers
 */
public class ReplicaManagerRole implements ManagerRole {
    public static final ReplicaManagerRole INSTANCE = new ReplicaManagerRole();
    public static final String PROCESS_TYPE = "replica";

    private ReplicaManagerRole() {
    }

    @Override
    public InstanceManagerType type() {
        return InstanceManagerType.REPLICA;
    }

    @Override
    public String listPath() {
        return "/v1/processes";
    }

    @Override
    public String watchPath() {
        return "/v1/processes/watch";
    }

    @Override
    public ProcessObservation decode(ObjectMapper mapper, JsonNode record) throws JsonProcessingException {
        ReplicaProcess replica = mapper.treeToValue(record, ReplicaProcess.class);
        return new ProcessObservation(replica.toInstanceProcess(), replica.isDeleted());
    }

    @Override
    public String toString() {
        return "replica-manager";
    }
}

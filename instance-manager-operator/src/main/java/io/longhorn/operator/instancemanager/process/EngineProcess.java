/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.longhorn.api.model.InstanceProcess;

/**
 * Process record of the engine manager daemon. Unlike replicas, engines also report their listen address and the
 * frontend endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineProcess {
    private String name;
    private String uuid;
    private boolean deleted;
    private String listen;
    private String endpoint;
    private ProcessRecordStatus status;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public String getListen() {
        return listen;
    }

    public void setListen(String listen) {
        this.listen = listen;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public ProcessRecordStatus getStatus() {
        return status;
    }

    public void setStatus(ProcessRecordStatus status) {
        this.status = status;
    }

    /**
     * @return  The record in the custom resource representation
     */
    public InstanceProcess toInstanceProcess() {
        InstanceProcess process = ReplicaProcess.toInstanceProcess(name, uuid, status, EngineManagerRole.PROCESS_TYPE);
        process.getStatus().setListen(listen);
        process.getStatus().setEndpoint(endpoint);
        return process;
    }
}

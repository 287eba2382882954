/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.longhorn.api.model.InstanceProcess;
import io.longhorn.api.model.InstanceProcessSpec;
import io.longhorn.api.model.InstanceProcessStatus;
import io.longhorn.api.model.InstanceState;

/**
 * Process record of the replica manager daemon
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicaProcess {
    private String name;
    private String uuid;
    private boolean deleted;
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
        return toInstanceProcess(name, uuid, status, ReplicaManagerRole.PROCESS_TYPE);
    }

    static InstanceProcess toInstanceProcess(String name, String uuid, ProcessRecordStatus recordStatus, String type) {
        InstanceProcessSpec spec = new InstanceProcessSpec();
        spec.setName(name);
        spec.setUuid(uuid);

        InstanceProcessStatus status = new InstanceProcessStatus();
        status.setType(type);

        if (recordStatus != null) {
            status.setState(InstanceState.forValue(recordStatus.getState()));
            status.setErrorMsg(recordStatus.getErrorMsg());
            status.setResourceVersion(recordStatus.getResourceVersion());
            status.setPortStart(recordStatus.getPortStart());
            status.setPortEnd(recordStatus.getPortEnd());
        }

        return new InstanceProcess(spec, status);
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * A single engine or replica process run by an instance manager
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"spec", "status"})
@EqualsAndHashCode
@ToString
public class InstanceProcess implements Serializable {
    private static final long serialVersionUID = 1L;

    private InstanceProcessSpec spec;
    private InstanceProcessStatus status;

    public InstanceProcess() {
    }

    public InstanceProcess(InstanceProcessSpec spec, InstanceProcessStatus status) {
        this.spec = spec;
        this.status = status;
    }

    public InstanceProcessSpec getSpec() {
        return spec;
    }

    public void setSpec(InstanceProcessSpec spec) {
        this.spec = spec;
    }

    public InstanceProcessStatus getStatus() {
        return status;
    }

    public void setStatus(InstanceProcessStatus status) {
        this.status = status;
    }
}

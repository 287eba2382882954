/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Observed state of an instance manager, including the last known view of every process it runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"currentState", "ip", "nodeBootID", "instances"})
@EqualsAndHashCode
@ToString
public class InstanceManagerStatus implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private InstanceManagerState currentState;
    private String ip;
    private String nodeBootId;
    private Map<String, InstanceProcess> instances;
    private Map<String, Object> additionalProperties;

    public InstanceManagerState getCurrentState() {
        return currentState;
    }

    public void setCurrentState(InstanceManagerState currentState) {
        this.currentState = currentState;
    }

    /**
     * @return  IP address of the manager pod, empty unless the manager is running
     */
    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    @JsonProperty("nodeBootID")
    public String getNodeBootId() {
        return nodeBootId;
    }

    @JsonProperty("nodeBootID")
    public void setNodeBootId(String nodeBootId) {
        this.nodeBootId = nodeBootId;
    }

    /**
     * @return  Processes known to this instance manager keyed by process name
     */
    public Map<String, InstanceProcess> getInstances() {
        return instances;
    }

    public void setInstances(Map<String, InstanceProcess> instances) {
        this.instances = instances;
    }

    @Override
    public Map<String, Object> getAdditionalProperties() {
        return this.additionalProperties != null ? this.additionalProperties : emptyMap();
    }

    @Override
    public void setAdditionalProperty(String name, Object value) {
        if (this.additionalProperties == null) {
            this.additionalProperties = new HashMap<>(2);
        }
        this.additionalProperties.put(name, value);
    }
}

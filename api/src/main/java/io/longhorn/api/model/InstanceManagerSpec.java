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
 * Desired state of an instance manager: where it runs, who controls it and which role it has.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"nodeID", "ownerID", "type", "engineImage"})
@EqualsAndHashCode
@ToString
public class InstanceManagerSpec implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private String nodeId;
    private String ownerId;
    private InstanceManagerType type;
    private String engineImage;
    private Map<String, Object> additionalProperties;

    /**
     * @return  Name of the node this instance manager is bound to
     */
    @JsonProperty("nodeID")
    public String getNodeId() {
        return nodeId;
    }

    @JsonProperty("nodeID")
    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    /**
     * @return  Identity of the controller currently responsible for this instance manager. Empty when unclaimed.
     */
    @JsonProperty("ownerID")
    public String getOwnerId() {
        return ownerId;
    }

    @JsonProperty("ownerID")
    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public InstanceManagerType getType() {
        return type;
    }

    public void setType(InstanceManagerType type) {
        this.type = type;
    }

    /**
     * @return  Name of the EngineImage resource the manager pod is built from
     */
    public String getEngineImage() {
        return engineImage;
    }

    public void setEngineImage(String engineImage) {
        this.engineImage = engineImage;
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

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * Identity of a process. The {@code createdAt} and {@code deletedAt} timestamps are owned by whoever
 * creates and deletes the process; the instance manager controller only carries them along.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "uuid", "createdAt", "deletedAt"})
@EqualsAndHashCode
@ToString
public class InstanceProcessSpec implements Serializable {
    private static final long serialVersionUID = 1L;

    private String name;
    private String uuid;
    private String createdAt;
    private String deletedAt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return  Identifier of this incarnation of the process. A process re-created under the same name gets a new one.
     */
    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * @return  Time the deletion of the process was requested, or null when it was not. Once set it is never cleared.
     */
    public String getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(String deletedAt) {
        this.deletedAt = deletedAt;
    }

    /**
     * @return  True when a deletion of this process was requested
     */
    @JsonIgnore
    public boolean isDeletionRequested() {
        return deletedAt != null && !deletedAt.isEmpty();
    }
}

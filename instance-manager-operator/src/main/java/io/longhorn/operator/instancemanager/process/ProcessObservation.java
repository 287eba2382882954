/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.longhorn.api.model.InstanceProcess;

/**
 * A single process as seen by the management daemon, either in a list response or as a watch event.
 *
 * @param process   The process converted to the custom resource representation
 * @param deleted   Whether the daemon reports the process as deleted
 */
public record ProcessObservation(InstanceProcess process, boolean deleted) {
    /**
     * @return  Name of the observed process
     */
    public String name() {
        return process.getSpec().getName();
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.longhorn.api.model.InstanceProcess;
import io.longhorn.api.model.InstanceProcessSpec;
import io.longhorn.operator.common.ReconciliationLogger;

import java.util.Map;
import java.util.Objects;

/**
 * Merges the processes observed on a management daemon into the status of the instance manager. The watch and the
 * poller deliver observations in no particular order and may repeat them, so the merge only accepts observations of
 * the same process incarnation which are strictly newer than what is stored.
 */
public class InstanceProcessMerger {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InstanceProcessMerger.class);

    private InstanceProcessMerger() {
    }

    /**
     * Merges one observation into the local processes.
     *
     * @param instanceManagerName   Name of the instance manager (used for logging)
     * @param instances             Processes from the instance manager status. Modified in place.
     * @param observation           The observed process
     *
     * @return  Outcome of the merge
     */
    public static MergeOutcome merge(String instanceManagerName, Map<String, InstanceProcess> instances, ProcessObservation observation) {
        InstanceProcess incoming = observation.process();
        String name = observation.name();
        InstanceProcess current = instances != null ? instances.get(name) : null;

        if (current == null) {
            LOGGER.warnOp("Cannot find instance {} in instance manager {}", name, instanceManagerName);
            return MergeOutcome.UNKNOWN_PROCESS;
        }

        InstanceProcessSpec currentSpec = current.getSpec() != null ? current.getSpec() : new InstanceProcessSpec();

        // Timestamps are owned by whoever manages the process lifecycle, never by the daemon
        incoming.getSpec().setCreatedAt(currentSpec.getCreatedAt());
        incoming.getSpec().setDeletedAt(currentSpec.getDeletedAt());

        // A process re-created under the same name has a new UUID. Events of the old one must not leak into it.
        if (!Objects.equals(incoming.getSpec().getUuid(), currentSpec.getUuid())) {
            LOGGER.debugOp("Instance manager {} will ignore the instance process {}: new instance UUID {} is not the same as existing instance UUID {}",
                    instanceManagerName, name, incoming.getSpec().getUuid(), currentSpec.getUuid());
            return MergeOutcome.UUID_MISMATCH;
        }

        long currentVersion = current.getStatus() != null ? current.getStatus().getResourceVersion() : 0L;
        if (currentVersion >= incoming.getStatus().getResourceVersion()) {
            LOGGER.debugOp("Instance manager {} will ignore expired instance process {} (version {} is not newer than {})",
                    instanceManagerName, name, incoming.getStatus().getResourceVersion(), currentVersion);
            return MergeOutcome.STALE;
        }

        if (observation.deleted()) {
            if (currentSpec.isDeletionRequested()) {
                instances.remove(name);
                LOGGER.debugOp("Instance process {} was removed from instance manager {}", name, instanceManagerName);
                return MergeOutcome.DELETED;
            } else {
                LOGGER.debugOp("Instance process {} of instance manager {} is deleted without a deletion request and is kept", name, instanceManagerName);
                return MergeOutcome.DELETION_PENDING;
            }
        }

        instances.put(name, incoming);
        return MergeOutcome.UPDATED;
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceProcess;
import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationLogger;

import java.util.ArrayList;
import java.util.Map;

/**
 * Resynchronizes the processes of a running instance manager by listing them on its daemon. It catches up on
 * whatever the watch missed while it was reconnecting.
 */
public class ProcessPoller {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ProcessPoller.class);

    private final ProcessManagerClientFactory clientFactory;

    /**
     * @param clientFactory     Factory for the daemon clients
     */
    public ProcessPoller(ProcessManagerClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Merges the processes listed by the daemon into the status of the instance manager. Processes the daemon does
     * not know any more are removed only when their deletion was requested. Processes which are only known to the
     * daemon are ignored.
     *
     * @param reconciliation    Reconciliation marker
     * @param instanceManager   Instance manager whose status is modified in place
     * @param role              Role of the instance manager
     *
     * @throws ProcessManagerException  When the daemon cannot be listed
     */
    public void poll(Reconciliation reconciliation, InstanceManager instanceManager, ManagerRole role) throws ProcessManagerException {
        String ip = instanceManager.getStatus().getIp();
        if (ip == null || ip.isEmpty()) {
            throw new IllegalStateException("Instance Manager IP was not set before polling");
        }

        Map<String, ProcessObservation> remote = clientFactory.create(ip, role).list();
        Map<String, InstanceProcess> instances = instanceManager.getStatus().getInstances();

        if (instances == null || instances.isEmpty()) {
            LOGGER.traceCr(reconciliation, "No processes to resynchronize");
            return;
        }

        for (String name : new ArrayList<>(instances.keySet())) {
            ProcessObservation observation = remote.get(name);

            if (observation == null) {
                // Not started yet or already gone. Only a requested deletion allows dropping it.
                InstanceProcess local = instances.get(name);
                if (local.getSpec() != null && local.getSpec().isDeletionRequested()) {
                    LOGGER.debugCr(reconciliation, "Removing deleted instance process {}", name);
                    instances.remove(name);
                }
                continue;
            }

            MergeOutcome outcome = InstanceProcessMerger.merge(reconciliation.name(), instances, observation);
            LOGGER.traceCr(reconciliation, "Polled instance process {}: {}", name, outcome);
        }
    }
}

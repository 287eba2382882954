/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationLogger;

/**
 * Decides whether this controller is responsible for an instance manager and claims it when needed. The controller
 * running on the node of the instance manager always takes it back. Other controllers take over only instance
 * managers without an owner or whose owner's node is down.
 */
public class OwnershipResolver {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(OwnershipResolver.class);

    /**
     * Result of the ownership check
     */
    public enum Decision {
        /**
         * This controller owns the instance manager and should reconcile it
         */
        PROCEED,
        /**
         * Someone else owns the instance manager or won the race for it
         */
        SKIP,
        /**
         * The claim lost a race, but this controller should own the instance manager. Try again later.
         */
        REQUEUE
    }

    private final InstanceManagerStore store;
    private final String controllerId;

    /**
     * @param store         Store for reading nodes and writing the instance manager
     * @param controllerId  Identity of this controller
     */
    public OwnershipResolver(InstanceManagerStore store, String controllerId) {
        this.store = store;
        this.controllerId = controllerId;
    }

    /**
     * Resolves the ownership. When this controller claims the instance manager, the claim is written immediately and
     * the passed resource is updated with the new resource version.
     *
     * @param reconciliation    Reconciliation marker
     * @param instanceManager   The instance manager
     *
     * @return  What the reconciliation should do next
     */
    public Decision resolve(Reconciliation reconciliation, InstanceManager instanceManager) {
        String nodeId = instanceManager.getSpec().getNodeId();
        String ownerId = instanceManager.getSpec().getOwnerId();

        if (controllerId.equals(nodeId) && !controllerId.equals(ownerId)) {
            // The node of the instance manager is back, so its controller takes it back
            UpdateResult result = claim(instanceManager);
            if (result == UpdateResult.CONFLICT) {
                LOGGER.debugCr(reconciliation, "Conflict while taking back instance manager, will try again");
                return Decision.REQUEUE;
            } else if (result == UpdateResult.NOT_FOUND) {
                return Decision.SKIP;
            }

            LOGGER.infoCr(reconciliation, "Instance manager controller {} picked up {} from {}", controllerId, reconciliation.name(), ownerId);
            return Decision.PROCEED;
        } else if (ownerId == null || ownerId.isEmpty() || (!controllerId.equals(ownerId) && isNodeDown(reconciliation, ownerId))) {
            // Nobody owns it yet or its owner is gone. Hold it until the right controller can take over.
            UpdateResult result = claim(instanceManager);
            if (result != UpdateResult.UPDATED) {
                LOGGER.debugCr(reconciliation, "Another controller claimed the instance manager first");
                return Decision.SKIP;
            }

            LOGGER.infoCr(reconciliation, "Instance manager controller {} picked up {}", controllerId, reconciliation.name());
            return Decision.PROCEED;
        } else if (!controllerId.equals(ownerId)) {
            LOGGER.traceCr(reconciliation, "Instance manager is owned by {}", ownerId);
            return Decision.SKIP;
        }

        return Decision.PROCEED;
    }

    private UpdateResult claim(InstanceManager instanceManager) {
        instanceManager.getSpec().setOwnerId(controllerId);
        return store.update(instanceManager);
    }

    /**
     * Failures to find out the state of the node are logged and treated as the node being up.
     */
    private boolean isNodeDown(Reconciliation reconciliation, String nodeName) {
        try {
            return store.isNodeDownOrDeleted(nodeName);
        } catch (KubernetesClientException e) {
            LOGGER.warnCr(reconciliation, "Found error while checking if owner {} is down or deleted: {}", nodeName, e.getMessage());
            return false;
        }
    }
}

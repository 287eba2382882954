/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Pod;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationException;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.common.controller.ReconcileResult;
import io.longhorn.operator.instancemanager.process.ProcessManagerException;
import io.longhorn.operator.instancemanager.process.ProcessWatchRegistry;

import java.io.IOException;
import java.util.Objects;

/**
 * <p>Reconciles a single instance manager. The reconciliation:</p>
 * <ol>
 *     <li>loads the instance manager and ends when it does not exist any more,</li>
 *     <li>resolves the ownership and ends when another controller is responsible,</li>
 *     <li>finishes the deletion when the instance manager is being deleted,</li>
 *     <li>runs the pod lifecycle state machine on a copy of the instance manager and writes the copy when it
 *     changed.</li>
 * </ol>
 *
 * <p>Conflicting writes are not errors. They either mean that another controller took the instance manager or that
 * the work should be repeated on the latest version.</p>
 */
public class InstanceManagerReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InstanceManagerReconciler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InstanceManagerStore store;
    private final OwnershipResolver ownershipResolver;
    private final PodLifecycleDriver podLifecycleDriver;
    private final ProcessWatchRegistry watchRegistry;

    /**
     * Creates the reconciler
     *
     * @param store                 Store for the Kubernetes resources
     * @param ownershipResolver     Ownership resolver
     * @param podLifecycleDriver    Driver of the pod lifecycle
     * @param watchRegistry         Registry of the process watches
     */
    public InstanceManagerReconciler(InstanceManagerStore store, OwnershipResolver ownershipResolver, PodLifecycleDriver podLifecycleDriver, ProcessWatchRegistry watchRegistry) {
        this.store = store;
        this.ownershipResolver = ownershipResolver;
        this.podLifecycleDriver = podLifecycleDriver;
        this.watchRegistry = watchRegistry;
    }

    /**
     * Reconciles the instance manager
     *
     * @param reconciliation    Reconciliation marker identifying the instance manager
     *
     * @return  Whether the instance manager is done or should be reconciled again
     */
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        if (!store.namespace().equals(reconciliation.namespace())) {
            LOGGER.debugCr(reconciliation, "Ignoring instance manager outside of namespace {}", store.namespace());
            return ReconcileResult.DONE;
        }

        InstanceManager instanceManager = store.getInstanceManager(reconciliation.name());
        if (instanceManager == null) {
            LOGGER.infoCr(reconciliation, "Instance manager has been deleted");
            watchRegistry.stop(reconciliation.name());
            return ReconcileResult.DONE;
        }

        switch (ownershipResolver.resolve(reconciliation, instanceManager)) {
            case SKIP:
                return ReconcileResult.DONE;
            case REQUEUE:
                return ReconcileResult.REQUEUE;
            default:
                break;
        }

        if (instanceManager.getMetadata().getDeletionTimestamp() != null) {
            return delete(reconciliation, instanceManager);
        }

        InstanceManager current = deepCopy(reconciliation, instanceManager);
        InstanceManager desired = deepCopy(reconciliation, instanceManager);

        EngineImage engineImage = store.getEngineImage(desired.getSpec().getEngineImage());
        if (engineImage == null) {
            LOGGER.infoCr(reconciliation, "Engine image {} has been deleted", desired.getSpec().getEngineImage());
            return ReconcileResult.DONE;
        }

        Pod pod = store.getPod(reconciliation.name());

        try {
            podLifecycleDriver.sync(reconciliation, desired, engineImage, pod);
        } catch (ProcessManagerException e) {
            throw new ReconciliationException(reconciliation.key(), "error running resync of processes for instance manager " + reconciliation.name(), e);
        }

        if (Objects.equals(current.getSpec(), desired.getSpec()) && Objects.equals(current.getStatus(), desired.getStatus())) {
            LOGGER.debugCr(reconciliation, "Instance manager is up to date (state {})", desired.getStatus().getCurrentState());
            return ReconcileResult.DONE;
        }

        UpdateResult result = store.update(desired);
        if (result == UpdateResult.CONFLICT) {
            LOGGER.debugCr(reconciliation, "Requeue due to conflict");
            return ReconcileResult.REQUEUE;
        } else if (result == UpdateResult.NOT_FOUND) {
            LOGGER.infoCr(reconciliation, "Instance manager was deleted during the reconciliation");
            return ReconcileResult.DONE;
        }

        LOGGER.infoCr(reconciliation, "Instance manager is in state {}", desired.getStatus().getCurrentState());
        return ReconcileResult.DONE;
    }

    private ReconcileResult delete(Reconciliation reconciliation, InstanceManager instanceManager) {
        LOGGER.infoCr(reconciliation, "Cleaning up deleted instance manager");
        podLifecycleDriver.cleanup(reconciliation, instanceManager);

        UpdateResult result = store.removeFinalizer(instanceManager);
        if (result == UpdateResult.CONFLICT) {
            LOGGER.debugCr(reconciliation, "Conflict while removing the finalizer, will try again");
            return ReconcileResult.REQUEUE;
        }

        return ReconcileResult.DONE;
    }

    /**
     * Copies the instance manager through its JSON form. Both copies compared for changes go through the same
     * conversion, so that its normalization does not show up as a change.
     */
    private static InstanceManager deepCopy(Reconciliation reconciliation, InstanceManager instanceManager) {
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(instanceManager), InstanceManager.class);
        } catch (IOException e) {
            throw new ReconciliationException(reconciliation.key(), "Failed to copy the instance manager", e);
        }
    }
}

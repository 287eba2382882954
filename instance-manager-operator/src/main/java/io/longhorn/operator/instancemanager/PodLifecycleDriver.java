/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerState;
import io.longhorn.api.model.InstanceManagerStatus;
import io.longhorn.api.model.InstanceProcess;
import io.longhorn.api.model.InstanceProcessStatus;
import io.longhorn.api.model.InstanceState;
import io.longhorn.operator.common.Reconciliation;
import io.longhorn.operator.common.ReconciliationException;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.instancemanager.model.InstanceManagerPods;
import io.longhorn.operator.instancemanager.process.ManagerRole;
import io.longhorn.operator.instancemanager.process.ProcessManagerClientFactory;
import io.longhorn.operator.instancemanager.process.ProcessManagerException;
import io.longhorn.operator.instancemanager.process.ProcessPoller;
import io.longhorn.operator.instancemanager.process.ProcessWatch;
import io.longhorn.operator.instancemanager.process.ProcessWatchRegistry;

import java.util.List;

/**
 * Moves the instance manager through its states based on the state of its pod. It creates and deletes the pod, and
 * once the pod runs it keeps the process watch open and resynchronizes the processes.
 */
public class PodLifecycleDriver {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(PodLifecycleDriver.class);

    /**
     * Error message set on the processes of an instance manager which failed
     */
    public static final String INSTANCE_MANAGER_ERRORED = "Instance Manager errored";

    private final InstanceManagerStore store;
    private final ProcessWatchRegistry watchRegistry;
    private final ProcessManagerClientFactory clientFactory;
    private final ProcessPoller poller;
    private final String controllerId;
    private final int managerPort;
    private final long watchReconnectIntervalMs;
    private final long updateRetryIntervalMs;

    /**
     * Creates the driver
     *
     * @param store                     Store for pods, nodes and instance managers
     * @param watchRegistry             Registry of the process watches of this controller
     * @param clientFactory             Factory for the daemon clients
     * @param controllerId              Identity of this controller (the name of its node)
     * @param managerPort               Management port of the daemons
     * @param watchReconnectIntervalMs  Reconnect interval of the process watches
     * @param updateRetryIntervalMs     Conflict retry interval of the process watches
     */
    public PodLifecycleDriver(InstanceManagerStore store, ProcessWatchRegistry watchRegistry, ProcessManagerClientFactory clientFactory,
                              String controllerId, int managerPort, long watchReconnectIntervalMs, long updateRetryIntervalMs) {
        this.store = store;
        this.watchRegistry = watchRegistry;
        this.clientFactory = clientFactory;
        this.poller = new ProcessPoller(clientFactory);
        this.controllerId = controllerId;
        this.managerPort = managerPort;
        this.watchReconnectIntervalMs = watchReconnectIntervalMs;
        this.updateRetryIntervalMs = updateRetryIntervalMs;
    }

    /**
     * Runs one step of the state machine. Only the passed instance manager is modified, writing it is up to the
     * caller.
     *
     * @param reconciliation    Reconciliation marker
     * @param instanceManager   The instance manager
     * @param engineImage       Engine image used for new pods
     * @param pod               The current pod of the instance manager or null when there is none
     *
     * @throws ProcessManagerException  When the processes cannot be listed on the daemon
     */
    public void sync(Reconciliation reconciliation, InstanceManager instanceManager, EngineImage engineImage, Pod pod) throws ProcessManagerException {
        InstanceManagerStatus status = instanceManager.getStatus();
        InstanceManagerState state = status.getCurrentState();

        // The node of the instance manager is down or it was not picked up by its controller yet
        if (!controllerId.equals(instanceManager.getSpec().getNodeId())) {
            // The daemon on the other node is not ours to follow any more
            if (watchRegistry.stop(instanceManager.getMetadata().getName())) {
                LOGGER.infoCr(reconciliation, "Process watch was stopped because the instance manager belongs to node {}", instanceManager.getSpec().getNodeId());
            }

            status.setCurrentState(InstanceManagerState.UNKNOWN);
            return;
        }

        // A state which was never written counts as unknown, so the pod decides where the instance manager is
        if (state == null) {
            state = InstanceManagerState.UNKNOWN;
            status.setCurrentState(state);
        }

        if (state == InstanceManagerState.ERROR) {
            LOGGER.infoCr(reconciliation, "Recovering instance manager from error");
            cleanup(reconciliation, instanceManager);
            createPod(reconciliation, instanceManager, engineImage);
            status.setCurrentState(InstanceManagerState.STARTING);
            return;
        }

        if (pod == null) {
            if (state != InstanceManagerState.STOPPED) {
                // The next reconciliation recovers from the error
                status.setCurrentState(InstanceManagerState.ERROR);
            } else {
                createPod(reconciliation, instanceManager, engineImage);
                status.setCurrentState(InstanceManagerState.STARTING);
            }
            return;
        }

        String phase = pod.getStatus() != null ? pod.getStatus().getPhase() : null;

        // A pod without a phase was not picked up by the scheduler yet
        if (phase == null || "Pending".equals(phase)) {
            if (state == InstanceManagerState.UNKNOWN) {
                status.setCurrentState(InstanceManagerState.STARTING);
            } else if (state != InstanceManagerState.STARTING) {
                LOGGER.errorCr(reconciliation, "BUG: Instance Manager Pod is pending but doesn't match Instance Manager state {}", state);
                status.setCurrentState(InstanceManagerState.ERROR);
            }
        } else if ("Running".equals(phase)) {
            if (!allContainersReady(pod)) {
                LOGGER.debugCr(reconciliation, "Instance manager pod is not ready yet");
                return;
            }

            if (state == InstanceManagerState.RUNNING) {
                ManagerRole role = role(reconciliation, instanceManager);
                ensureWatch(reconciliation, instanceManager, role);
                poller.poll(reconciliation, instanceManager, role);
            } else if (state == InstanceManagerState.STARTING || state == InstanceManagerState.UNKNOWN) {
                String nodeName = pod.getSpec() != null ? pod.getSpec().getNodeName() : null;
                Node node = nodeName != null ? store.getNode(nodeName) : null;
                if (node == null) {
                    throw new ReconciliationException(reconciliation.key(), "Node " + nodeName + " of the instance manager pod was not found");
                }

                status.setCurrentState(InstanceManagerState.RUNNING);
                status.setIp(pod.getStatus().getPodIP());
                status.setNodeBootId(node.getStatus() != null && node.getStatus().getNodeInfo() != null ? node.getStatus().getNodeInfo().getBootID() : null);
                LOGGER.infoCr(reconciliation, "Instance manager is running at {}", status.getIp());
            }
        } else {
            LOGGER.infoCr(reconciliation, "Instance manager pod is in phase {}", phase);
            status.setCurrentState(InstanceManagerState.ERROR);
        }
    }

    /**
     * Cleans up after a failed or deleted instance manager: stops the process watch, marks all processes as failed
     * and deletes the pod. Calling it again is safe.
     *
     * @param reconciliation    Reconciliation marker
     * @param instanceManager   The instance manager. Only its status is modified.
     */
    public void cleanup(Reconciliation reconciliation, InstanceManager instanceManager) {
        String name = instanceManager.getMetadata().getName();
        InstanceManagerStatus status = instanceManager.getStatus();

        status.setIp(null);
        status.setNodeBootId(null);

        // Stopping waits for the watch to finish its writes, so it cannot overwrite the changes made here later
        if (watchRegistry.stop(name)) {
            LOGGER.debugCr(reconciliation, "Process watch was stopped");
        }

        if (status.getInstances() != null) {
            for (InstanceProcess process : status.getInstances().values()) {
                if (process.getStatus() == null) {
                    process.setStatus(new InstanceProcessStatus());
                }

                process.getStatus().setState(InstanceState.ERROR);
                process.getStatus().setErrorMsg(INSTANCE_MANAGER_ERRORED);
            }
        }

        if (store.getPod(name) != null) {
            LOGGER.infoCr(reconciliation, "Deleting instance manager pod");
            store.deletePod(name);
        }
    }

    private void createPod(Reconciliation reconciliation, InstanceManager instanceManager, EngineImage engineImage) {
        Pod pod;
        try {
            pod = InstanceManagerPods.createPod(instanceManager, engineImage, store.namespace(), controllerId, managerPort);
        } catch (IllegalArgumentException e) {
            throw new ReconciliationException(reconciliation.key(), "BUG: cannot create pod for instance manager " + reconciliation.name(), e);
        }

        store.createPod(pod);
        LOGGER.infoCr(reconciliation, "Created instance manager pod {}", pod.getMetadata().getName());
    }

    private void ensureWatch(Reconciliation reconciliation, InstanceManager instanceManager, ManagerRole role) {
        String name = instanceManager.getMetadata().getName();
        String ip = instanceManager.getStatus().getIp();

        boolean created = watchRegistry.startIfAbsent(name, () -> {
            if (ip == null || ip.isEmpty()) {
                throw new IllegalStateException("Instance Manager IP was not set before creating watch");
            }

            return new ProcessWatch(name, clientFactory.create(ip, role), store, watchReconnectIntervalMs, updateRetryIntervalMs);
        });

        if (created) {
            LOGGER.infoCr(reconciliation, "Started process watch for {} at {}", role, ip);
        }
    }

    private static ManagerRole role(Reconciliation reconciliation, InstanceManager instanceManager) {
        ManagerRole role = ManagerRole.forType(instanceManager.getSpec().getType());

        if (role == null) {
            throw new ReconciliationException(reconciliation.key(), "BUG: instance manager " + reconciliation.name() + " has invalid type");
        }

        return role;
    }

    private static boolean allContainersReady(Pod pod) {
        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();

        if (statuses != null) {
            for (ContainerStatus containerStatus : statuses) {
                if (!Boolean.TRUE.equals(containerStatus.getReady())) {
                    return false;
                }
            }
        }

        return true;
    }
}

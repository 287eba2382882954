/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.longhorn.api.Crds;
import io.longhorn.api.model.Constants;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerList;
import io.longhorn.operator.common.ReconciliationLogger;

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;

/**
 * Access to the Kubernetes resources used by the instance manager controller. All namespaced resources live in the
 * namespace of the controller. Writes of instance managers use optimistic concurrency and report conflicts as a
 * result instead of an exception.
 */
public class InstanceManagerStore {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InstanceManagerStore.class);

    private final KubernetesClient client;
    private final String namespace;

    /**
     * @param client        Kubernetes client
     * @param namespace     Namespace of the instance managers and their pods
     */
    public InstanceManagerStore(KubernetesClient client, String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    /**
     * @return  Namespace used by this store
     */
    public String namespace() {
        return namespace;
    }

    private MixedOperation<InstanceManager, InstanceManagerList, Resource<InstanceManager>> instanceManagers() {
        return Crds.instanceManagerOperation(client);
    }

    /**
     * @param name  Name of the instance manager
     *
     * @return  The instance manager or null if it does not exist
     */
    public InstanceManager getInstanceManager(String name) {
        return instanceManagers().inNamespace(namespace).withName(name).get();
    }

    /**
     * Replaces the instance manager. The write succeeds only when the resource version of the passed resource is
     * still the current one. On success, the metadata of the passed resource is replaced with the metadata returned
     * by the API server, so that the resource can be written again.
     *
     * @param instanceManager   The desired instance manager
     *
     * @return  Result of the write
     */
    public UpdateResult update(InstanceManager instanceManager) {
        try {
            InstanceManager updated = instanceManagers().inNamespace(namespace).resource(instanceManager).update();
            instanceManager.setMetadata(updated.getMetadata());
            return UpdateResult.UPDATED;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                LOGGER.debugOp("Conflict while updating instance manager {}", instanceManager.getMetadata().getName());
                return UpdateResult.CONFLICT;
            } else if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                LOGGER.debugOp("Instance manager {} was not found while updating it", instanceManager.getMetadata().getName());
                return UpdateResult.NOT_FOUND;
            }

            throw e;
        }
    }

    /**
     * Removes the Longhorn finalizer so that Kubernetes can finish the deletion of the instance manager. The rest of
     * the passed resource is written as well.
     *
     * @param instanceManager   The instance manager
     *
     * @return  Result of the write
     */
    public UpdateResult removeFinalizer(InstanceManager instanceManager) {
        List<String> finalizers = instanceManager.getMetadata().getFinalizers();

        if (finalizers == null || !finalizers.contains(Constants.LONGHORN_FINALIZER)) {
            return UpdateResult.UPDATED;
        }

        List<String> remaining = new ArrayList<>(finalizers);
        remaining.remove(Constants.LONGHORN_FINALIZER);
        instanceManager.getMetadata().setFinalizers(remaining);

        return update(instanceManager);
    }

    /**
     * @param name  Name of the pod
     *
     * @return  The pod or null if it does not exist
     */
    public Pod getPod(String name) {
        return client.pods().inNamespace(namespace).withName(name).get();
    }

    public Pod createPod(Pod pod) {
        return client.pods().inNamespace(namespace).resource(pod).create();
    }

    /**
     * Deletes the pod. Missing pods are ignored.
     *
     * @param name  Name of the pod
     */
    public void deletePod(String name) {
        client.pods().inNamespace(namespace).withName(name).delete();
    }

    public Node getNode(String name) {
        return client.nodes().withName(name).get();
    }

    /**
     * Checks whether a node is down or deleted. A node is down when its Ready condition is not True.
     *
     * @param name  Name of the node
     *
     * @return  True when the node does not exist or is not ready
     */
    public boolean isNodeDownOrDeleted(String name) {
        Node node = getNode(name);

        if (node == null) {
            return true;
        }

        if (node.getStatus() != null && node.getStatus().getConditions() != null) {
            for (NodeCondition condition : node.getStatus().getConditions()) {
                if ("Ready".equals(condition.getType())) {
                    return !"True".equals(condition.getStatus());
                }
            }
        }

        return true;
    }

    /**
     * @param name  Name of the engine image
     *
     * @return  The engine image or null if it does not exist
     */
    public EngineImage getEngineImage(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }

        return Crds.engineImageOperation(client).inNamespace(namespace).withName(name).get();
    }
}

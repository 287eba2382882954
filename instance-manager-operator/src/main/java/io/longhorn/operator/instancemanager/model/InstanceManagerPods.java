/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.model;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.longhorn.api.model.Constants;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerType;

import java.util.List;
import java.util.Map;

/**
 * Builds the pods running the instance manager daemons
 */
public class InstanceManagerPods {
    public static final String ENGINE_MANAGER_CONTAINER_NAME = "engine-manager";
    public static final String REPLICA_MANAGER_CONTAINER_NAME = "replica-manager";

    /**
     * Label with the name of the instance manager which owns the pod
     */
    public static final String INSTANCE_MANAGER_LABEL = Constants.RESOURCE_GROUP_NAME + "/instance-manager";

    /*test*/ static final String ENGINE_BINARIES_IN_CONTAINER = "/engine-binaries/";
    /*test*/ static final String ENGINE_BINARIES_ON_HOST = "/var/lib/longhorn/engine-binaries/";

    private static final int PROBE_INITIAL_DELAY_SECONDS = 1;
    private static final int PROBE_PERIOD_SECONDS = 1;
    private static final int LIVENESS_FAILURE_THRESHOLD = 60;
    private static final int READINESS_FAILURE_THRESHOLD = 15;

    private InstanceManagerPods() {
    }

    /**
     * Checks whether the pod runs an instance manager daemon
     *
     * @param pod   Pod which should be checked
     *
     * @return  True when the pod has an engine manager or replica manager container
     */
    public static boolean isInstanceManagerPod(Pod pod) {
        if (pod == null || pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return false;
        }

        for (Container container : pod.getSpec().getContainers()) {
            if (ENGINE_MANAGER_CONTAINER_NAME.equals(container.getName())
                    || REPLICA_MANAGER_CONTAINER_NAME.equals(container.getName())) {
                return true;
            }
        }

        return false;
    }

    /**
     * Creates the pod of an instance manager. The pod has the name of the instance manager, is owned by it and is
     * pinned to the node of the controller.
     *
     * @param instanceManager   The instance manager
     * @param engineImage       Engine image providing the container image
     * @param namespace         Namespace of the pod
     * @param nodeName          Node on which the pod should run
     * @param managerPort       Management port of the daemon
     *
     * @return  The pod definition
     */
    public static Pod createPod(InstanceManager instanceManager, EngineImage engineImage, String namespace, String nodeName, int managerPort) {
        InstanceManagerType type = instanceManager.getSpec().getType();
        if (type == null) {
            throw new IllegalArgumentException("Instance manager " + instanceManager.getMetadata().getName() + " has an invalid type");
        }

        Container container = switch (type) {
            case ENGINE -> engineManagerContainer(engineImage.getSpec().getImage(), managerPort);
            case REPLICA -> replicaManagerContainer(engineImage.getSpec().getImage(), managerPort);
        };

        List<Volume> volumes = switch (type) {
            case ENGINE -> List.of(
                    hostPathVolume("dev", "/dev"),
                    hostPathVolume("proc", "/proc"),
                    hostPathVolume("engine-binaries", ENGINE_BINARIES_ON_HOST));
            case REPLICA -> List.of(hostPathVolume("host", "/"));
        };

        String name = instanceManager.getMetadata().getName();

        return new PodBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(Map.of(INSTANCE_MANAGER_LABEL, name))
                    .withOwnerReferences(ownerReference(instanceManager))
                .endMetadata()
                .withNewSpec()
                    .withContainers(container)
                    .withVolumes(volumes)
                    .withNodeName(nodeName)
                    .withRestartPolicy("Never")
                .endSpec()
                .build();
    }

    private static OwnerReference ownerReference(InstanceManager instanceManager) {
        return new OwnerReferenceBuilder()
                .withApiVersion(Constants.V1BETA1_API_VERSION)
                .withKind(InstanceManager.RESOURCE_KIND)
                .withName(instanceManager.getMetadata().getName())
                .withUid(instanceManager.getMetadata().getUid())
                .build();
    }

    private static Container engineManagerContainer(String image, int managerPort) {
        return baseContainer(ENGINE_MANAGER_CONTAINER_NAME, image, managerPort)
                .withCommand("engine-manager", "daemon", "--listen", "0.0.0.0:" + managerPort)
                .withVolumeMounts(
                        volumeMount("dev", "/host/dev"),
                        volumeMount("proc", "/host/proc"),
                        volumeMount("engine-binaries", ENGINE_BINARIES_IN_CONTAINER))
                .build();
    }

    private static Container replicaManagerContainer(String image, int managerPort) {
        return baseContainer(REPLICA_MANAGER_CONTAINER_NAME, image, managerPort)
                .withCommand("longhorn-instance-manager", "daemon", "--listen", "0.0.0.0:" + managerPort)
                .withVolumeMounts(volumeMount("host", "/host"))
                .build();
    }

    private static ContainerBuilder baseContainer(String name, String image, int managerPort) {
        return new ContainerBuilder()
                .withName(name)
                .withImage(image)
                .withLivenessProbe(healthProbe(managerPort, LIVENESS_FAILURE_THRESHOLD))
                .withReadinessProbe(healthProbe(managerPort, READINESS_FAILURE_THRESHOLD))
                .withNewSecurityContext()
                    .withPrivileged(true)
                .endSecurityContext();
    }

    private static Probe healthProbe(int managerPort, int failureThreshold) {
        return new ProbeBuilder()
                .withNewExec()
                    .withCommand("/usr/local/bin/grpc_health_probe", "-addr=:" + managerPort)
                .endExec()
                .withInitialDelaySeconds(PROBE_INITIAL_DELAY_SECONDS)
                .withPeriodSeconds(PROBE_PERIOD_SECONDS)
                .withFailureThreshold(failureThreshold)
                .build();
    }

    private static Volume hostPathVolume(String name, String path) {
        return new VolumeBuilder()
                .withName(name)
                .withNewHostPath()
                    .withPath(path)
                .endHostPath()
                .build();
    }

    private static VolumeMount volumeMount(String name, String mountPath) {
        return new VolumeMountBuilder()
                .withName(name)
                .withMountPath(mountPath)
                .build();
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.model;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.longhorn.api.model.Constants;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerState;
import io.longhorn.api.model.InstanceManagerType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.longhorn.operator.instancemanager.ResourceUtils.IMAGE;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAME;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAMESPACE;
import static io.longhorn.operator.instancemanager.ResourceUtils.NODE;
import static io.longhorn.operator.instancemanager.ResourceUtils.createEngineImage;
import static io.longhorn.operator.instancemanager.ResourceUtils.createInstanceManager;
import static io.longhorn.operator.instancemanager.ResourceUtils.createPod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InstanceManagerPodsTest {
    private static final int PORT = 8500;

    @Test
    public void testEngineManagerPod() {
        InstanceManager im = createInstanceManager(NODE, NODE, InstanceManagerState.STOPPED);
        im.getMetadata().setUid("c0ffee");

        Pod pod = InstanceManagerPods.createPod(im, createEngineImage(), NAMESPACE, NODE, PORT);

        assertThat(pod.getMetadata().getName(), is(NAME));
        assertThat(pod.getMetadata().getNamespace(), is(NAMESPACE));
        assertThat(pod.getMetadata().getLabels().get(InstanceManagerPods.INSTANCE_MANAGER_LABEL), is(NAME));
        assertThat(pod.getMetadata().getOwnerReferences().size(), is(1));
        assertThat(pod.getMetadata().getOwnerReferences().get(0).getKind(), is("InstanceManager"));
        assertThat(pod.getMetadata().getOwnerReferences().get(0).getApiVersion(), is(Constants.V1BETA1_API_VERSION));
        assertThat(pod.getMetadata().getOwnerReferences().get(0).getUid(), is("c0ffee"));

        assertThat(pod.getSpec().getNodeName(), is(NODE));
        assertThat(pod.getSpec().getRestartPolicy(), is("Never"));
        assertThat(pod.getSpec().getContainers().size(), is(1));

        Container container = pod.getSpec().getContainers().get(0);
        assertThat(container.getName(), is(InstanceManagerPods.ENGINE_MANAGER_CONTAINER_NAME));
        assertThat(container.getImage(), is(IMAGE));
        assertThat(container.getCommand(), contains("engine-manager", "daemon", "--listen", "0.0.0.0:8500"));
        assertThat(container.getSecurityContext().getPrivileged(), is(true));
        assertThat(container.getLivenessProbe().getExec().getCommand(), hasItem("-addr=:8500"));
        assertThat(container.getLivenessProbe().getFailureThreshold(), is(60));
        assertThat(container.getReadinessProbe().getFailureThreshold(), is(15));
        assertThat(container.getReadinessProbe().getPeriodSeconds(), is(1));
        assertThat(container.getVolumeMounts().stream().map(m -> m.getMountPath()).collect(Collectors.toList()),
                containsInAnyOrder("/host/dev", "/host/proc", InstanceManagerPods.ENGINE_BINARIES_IN_CONTAINER));

        List<Volume> volumes = pod.getSpec().getVolumes();
        assertThat(volumes.stream().map(v -> v.getHostPath().getPath()).collect(Collectors.toList()),
                containsInAnyOrder("/dev", "/proc", InstanceManagerPods.ENGINE_BINARIES_ON_HOST));

        assertThat(InstanceManagerPods.isInstanceManagerPod(pod), is(true));
    }

    @Test
    public void testReplicaManagerPod() {
        InstanceManager im = createInstanceManager(NODE, NODE, InstanceManagerState.STOPPED);
        im.getSpec().setType(InstanceManagerType.REPLICA);

        Pod pod = InstanceManagerPods.createPod(im, createEngineImage(), NAMESPACE, NODE, PORT);

        Container container = pod.getSpec().getContainers().get(0);
        assertThat(container.getName(), is(InstanceManagerPods.REPLICA_MANAGER_CONTAINER_NAME));
        assertThat(container.getCommand().get(0), is("longhorn-instance-manager"));
        assertThat(container.getVolumeMounts().get(0).getMountPath(), is("/host"));
        assertThat(pod.getSpec().getVolumes().size(), is(1));
        assertThat(pod.getSpec().getVolumes().get(0).getHostPath().getPath(), is("/"));

        assertThat(InstanceManagerPods.isInstanceManagerPod(pod), is(true));
    }

    @Test
    public void testPodWithoutTypeCannotBeCreated() {
        InstanceManager im = createInstanceManager(NODE, NODE, InstanceManagerState.STOPPED);
        im.getSpec().setType(null);

        assertThrows(IllegalArgumentException.class, () -> InstanceManagerPods.createPod(im, createEngineImage(), NAMESPACE, NODE, PORT));
    }

    @Test
    public void testOtherPodsAreNotInstanceManagerPods() {
        Pod other = new PodBuilder()
                .withNewMetadata()
                    .withName("longhorn-ui")
                .endMetadata()
                .withNewSpec()
                    .addNewContainer()
                        .withName("longhorn-ui")
                    .endContainer()
                .endSpec()
                .build();

        assertThat(InstanceManagerPods.isInstanceManagerPod(other), is(false));
        assertThat(InstanceManagerPods.isInstanceManagerPod(new Pod()), is(false));
        assertThat(InstanceManagerPods.isInstanceManagerPod(null), is(false));
        assertThat(InstanceManagerPods.isInstanceManagerPod(createPod("Running", true)), is(true));
    }
}

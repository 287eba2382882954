/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.api.model.ContainerStatusBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.longhorn.api.Crds;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerState;
import io.longhorn.operator.common.MetricsProvider;
import io.longhorn.operator.common.MicrometerMetricsProvider;
import io.longhorn.operator.common.metrics.MetricsHolder;
import io.longhorn.operator.instancemanager.model.InstanceManagerPods;
import io.longhorn.operator.instancemanager.process.ProcessManagerClient;
import io.longhorn.operator.instancemanager.process.ProcessManagerClientFactory;
import io.longhorn.test.TestUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.longhorn.operator.instancemanager.ResourceUtils.IP;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAME;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAMESPACE;
import static io.longhorn.operator.instancemanager.ResourceUtils.NODE;
import static io.longhorn.operator.instancemanager.ResourceUtils.createEngineImage;
import static io.longhorn.operator.instancemanager.ResourceUtils.createInstanceManager;
import static io.longhorn.operator.instancemanager.ResourceUtils.createNode;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
public class InstanceManagerControllerTest {
    // Injected by Fabric8 Mock Kubernetes Server
    @SuppressWarnings("unused")
    private KubernetesClient client;

    private ProcessManagerClientFactory clientFactory;

    @BeforeEach
    public void beforeEach() {
        client.apiextensions().v1().customResourceDefinitions().resource(Crds.instanceManager()).create();
        client.apiextensions().v1().customResourceDefinitions().resource(Crds.engineImage()).create();

        EngineImage engineImage = createEngineImage();
        Crds.engineImageOperation(client).inNamespace(NAMESPACE).resource(engineImage).create();
        client.nodes().resource(createNode(NODE, true)).create();

        ProcessManagerClient processClient = mock(ProcessManagerClient.class);
        clientFactory = mock(ProcessManagerClientFactory.class);
        when(clientFactory.create(anyString(), any())).thenReturn(processClient);
    }

    private InstanceManager getInstanceManager() {
        return Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).withName(NAME).get();
    }

    private Pod getPod() {
        return client.pods().inNamespace(NAMESPACE).withName(NAME).get();
    }

    private boolean hasState(InstanceManagerState state) {
        InstanceManager im = getInstanceManager();
        return im != null && im.getStatus() != null && state == im.getStatus().getCurrentState();
    }

    @Test
    public void testInstanceManagerLifecycle() {
        MetricsProvider metrics = new MicrometerMetricsProvider(new SimpleMeterRegistry());

        InstanceManager im = createInstanceManager(NODE, NODE, InstanceManagerState.STOPPED);
        im.getMetadata().setResourceVersion(null);
        Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).resource(im).create();

        InstanceManagerController controller = new InstanceManagerController(ResourceUtils.createConfig(NAMESPACE), client, clientFactory, metrics);
        controller.start();

        try {
            // The stopped instance manager gets its pod
            TestUtils.waitFor("Instance manager pod is created", 100, 10_000, () -> getPod() != null);
            TestUtils.waitFor("Instance manager is starting", 100, 10_000, () -> hasState(InstanceManagerState.STARTING));

            Pod pod = getPod();
            assertThat(InstanceManagerPods.isInstanceManagerPod(pod), is(true));
            assertThat(pod.getSpec().getNodeName(), is(NODE));
            assertThat(pod.getMetadata().getOwnerReferences().get(0).getName(), is(NAME));

            // The pod comes up => the instance manager is running
            client.pods().inNamespace(NAMESPACE).withName(NAME).editStatus(p -> new PodBuilder(p)
                    .editOrNewStatus()
                        .withPhase("Running")
                        .withPodIP(IP)
                        .withContainerStatuses(List.of(new ContainerStatusBuilder()
                                .withName(InstanceManagerPods.ENGINE_MANAGER_CONTAINER_NAME)
                                .withReady(true)
                                .build()))
                    .endStatus()
                    .build());

            TestUtils.waitFor("Instance manager is running", 100, 10_000, () -> hasState(InstanceManagerState.RUNNING));
            assertThat(getInstanceManager().getStatus().getIp(), is(IP));

            // The running instance manager is watched
            TestUtils.waitFor("Process watch is started", 100, 10_000, () -> controller.watchRegistry().contains(NAME));

            assertThat(controller.isAlive(), is(true));
            assertThat(controller.isReady(), is(true));

            assertThat(metrics.meterRegistry().get(MetricsHolder.METRICS_RESOURCES).tag("kind", "InstanceManager").tag("namespace", NAMESPACE).gauge().value(), is(1.0));
            assertThat(metrics.meterRegistry().get(MetricsHolder.METRICS_RECONCILIATIONS_SUCCESSFUL).tag("kind", "InstanceManager").tag("namespace", NAMESPACE).counter().count(), is(greaterThanOrEqualTo(2.0)));
            assertThat(metrics.meterRegistry().get(InstanceManagerMetricsHolder.METRICS_PROCESS_WATCHES).tag("kind", "InstanceManager").tag("namespace", NAMESPACE).gauge().value(), is(1.0));

            // Deletion removes the pod, the watch and finally the finalizer
            Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).withName(NAME).delete();

            TestUtils.waitFor("Instance manager pod is deleted", 100, 10_000, () -> getPod() == null);
            TestUtils.waitFor("Finalizer is removed", 100, 10_000, () -> {
                InstanceManager deleted = getInstanceManager();
                return deleted == null || deleted.getMetadata().getFinalizers() == null || deleted.getMetadata().getFinalizers().isEmpty();
            });
            TestUtils.waitFor("Process watch is stopped", 100, 10_000, () -> !controller.watchRegistry().contains(NAME));
        } finally {
            controller.stop();
        }
    }
}

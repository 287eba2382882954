/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.longhorn.api.Crds;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.longhorn.operator.instancemanager.ResourceUtils.ENGINE_IMAGE;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAME;
import static io.longhorn.operator.instancemanager.ResourceUtils.NAMESPACE;
import static io.longhorn.operator.instancemanager.ResourceUtils.NODE;
import static io.longhorn.operator.instancemanager.ResourceUtils.createEngineImage;
import static io.longhorn.operator.instancemanager.ResourceUtils.createInstanceManager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

@EnableKubernetesMockClient(crud = true)
public class InstanceManagerStoreTest {
    // Injected by Fabric8 Mock Kubernetes Server
    @SuppressWarnings("unused")
    private KubernetesClient client;

    private InstanceManagerStore store;

    @BeforeEach
    public void beforeEach() {
        client.apiextensions().v1().customResourceDefinitions().resource(Crds.instanceManager()).create();
        store = new InstanceManagerStore(client, NAMESPACE);
    }

    private InstanceManager createInstanceManagerResource() {
        InstanceManager im = createInstanceManager(NODE, NODE, InstanceManagerState.STOPPED);
        im.getMetadata().setResourceVersion(null);
        return Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).resource(im).create();
    }

    @Test
    public void testUpdateRefreshesMetadata() {
        InstanceManager im = createInstanceManagerResource();
        String resourceVersion = im.getMetadata().getResourceVersion();

        im.getStatus().setCurrentState(InstanceManagerState.STARTING);
        assertThat(store.update(im), is(UpdateResult.UPDATED));
        assertThat(im.getMetadata().getResourceVersion(), is(not(resourceVersion)));

        // The refreshed resource version allows the next write
        im.getStatus().setCurrentState(InstanceManagerState.RUNNING);
        assertThat(store.update(im), is(UpdateResult.UPDATED));
        assertThat(store.getInstanceManager(NAME).getStatus().getCurrentState(), is(InstanceManagerState.RUNNING));
    }

    @Test
    public void testStaleUpdateIsConflict() {
        createInstanceManagerResource();
        InstanceManager first = store.getInstanceManager(NAME);
        InstanceManager second = store.getInstanceManager(NAME);

        first.getSpec().setOwnerId("node-2");
        assertThat(store.update(first), is(UpdateResult.UPDATED));

        second.getSpec().setOwnerId("node-3");
        assertThat(store.update(second), is(UpdateResult.CONFLICT));
        assertThat(store.getInstanceManager(NAME).getSpec().getOwnerId(), is("node-2"));
    }

    @Test
    public void testUpdateOfDeletedInstanceManagerIsNotFound() {
        InstanceManager im = createInstanceManagerResource();
        Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).withName(NAME).edit(i -> {
            i.getMetadata().setFinalizers(null);
            return i;
        });
        Crds.instanceManagerOperation(client).inNamespace(NAMESPACE).withName(NAME).delete();
        assertThat(store.getInstanceManager(NAME), is(nullValue()));

        assertThat(store.update(im), is(UpdateResult.NOT_FOUND));
    }

    @Test
    public void testRemoveFinalizer() {
        InstanceManager im = createInstanceManagerResource();

        assertThat(store.removeFinalizer(im), is(UpdateResult.UPDATED));
        assertThat(store.getInstanceManager(NAME).getMetadata().getFinalizers().isEmpty(), is(true));

        // Nothing to remove
        assertThat(store.removeFinalizer(store.getInstanceManager(NAME)), is(UpdateResult.UPDATED));
    }

    @Test
    public void testMissingResources() {
        assertThat(store.getInstanceManager(NAME), is(nullValue()));
        assertThat(store.getPod(NAME), is(nullValue()));
        assertThat(store.getEngineImage(ENGINE_IMAGE), is(nullValue()));
        assertThat(store.getEngineImage(""), is(nullValue()));
        assertThat(store.isNodeDownOrDeleted(NODE), is(true));
    }

    @Test
    public void testGetEngineImage() {
        Crds.engineImageOperation(client).inNamespace(NAMESPACE).resource(createEngineImage()).create();

        assertThat(store.getEngineImage(ENGINE_IMAGE), is(notNullValue()));
        assertThat(store.getEngineImage(ENGINE_IMAGE).getSpec().getImage(), is(ResourceUtils.IMAGE));
    }
}

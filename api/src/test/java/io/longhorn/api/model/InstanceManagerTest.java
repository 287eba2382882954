/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.longhorn.api.Crds;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

/**
 * The purpose of this test is to ensure:
 *
 * 1. we get a correct tree of POJOs when reading a YAML `InstanceManager` resource.
 * 2. fields unknown to the model survive a read and write cycle.
 */
public class InstanceManagerTest {
    private InstanceManager load() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("InstanceManager.yaml")) {
            return new YAMLMapper().readValue(is, InstanceManager.class);
        }
    }

    @Test
    public void testReadInstanceManager() throws IOException {
        InstanceManager im = load();

        assertThat(im.getMetadata().getName(), is("instance-manager-e-0b1c2d3e"));
        assertThat(im.getMetadata().getFinalizers().contains(Constants.LONGHORN_FINALIZER), is(true));
        assertThat(im.getSpec().getNodeId(), is("node-1"));
        assertThat(im.getSpec().getOwnerId(), is("node-1"));
        assertThat(im.getSpec().getType(), is(InstanceManagerType.ENGINE));
        assertThat(im.getSpec().getEngineImage(), is("ei-d4c3b2a1"));

        assertThat(im.getStatus().getCurrentState(), is(InstanceManagerState.RUNNING));
        assertThat(im.getStatus().getIp(), is("10.42.0.17"));
        assertThat(im.getStatus().getNodeBootId(), is("5e1d5c4b-0f3a-4a1e-8c6f-2a9d8b7c6e5f"));

        InstanceProcess process = im.getStatus().getInstances().get("pvc-1-e-0");
        assertThat(process.getSpec().getUuid(), is("8a7c1b2e"));
        assertThat(process.getSpec().getCreatedAt(), is("2020-01-01T00:00:00Z"));
        assertThat(process.getSpec().getDeletedAt(), is(nullValue()));
        assertThat(process.getSpec().isDeletionRequested(), is(false));
        assertThat(process.getStatus().getState(), is(InstanceState.RUNNING));
        assertThat(process.getStatus().getResourceVersion(), is(4L));
        assertThat(process.getStatus().getPortStart(), is(10000));
        assertThat(process.getStatus().getPortEnd(), is(10001));
    }

    @Test
    public void testUnknownFieldsArePreserved() throws IOException {
        InstanceManager im = load();
        assertThat(im.getSpec().getAdditionalProperties().get("image"), is("longhornio/longhorn-instance-manager:v1"));

        String json = new ObjectMapper().writeValueAsString(im);
        assertThat(json, containsString("\"image\":\"longhornio/longhorn-instance-manager:v1\""));
        assertThat(json, containsString("\"apiMinVersion\":1"));
        assertThat(json, containsString("\"nodeID\":\"node-1\""));
        assertThat(json, containsString("\"nodeBootID\""));
        assertThat(json, not(containsString("nodeId")));
        assertThat(json, not(containsString("deletionRequested")));
    }

    @Test
    public void testStatesUseLowerCaseWireValues() {
        assertThat(InstanceManagerState.forValue("stopped"), is(InstanceManagerState.STOPPED));
        assertThat(InstanceManagerState.forValue("bogus"), is(nullValue()));
        assertThat(InstanceManagerState.ERROR.toValue(), is("error"));
        assertThat(InstanceState.forValue("stopping"), is(InstanceState.STOPPING));
        assertThat(InstanceManagerType.forValue("replica"), is(InstanceManagerType.REPLICA));
        assertThat(InstanceManagerType.forValue(""), is(nullValue()));
    }

    @Test
    public void testCrds() {
        CustomResourceDefinition crd = Crds.instanceManager();
        assertThat(crd.getMetadata().getName(), is(InstanceManager.CRD_NAME));
        assertThat(crd.getSpec().getNames().getKind(), is("InstanceManager"));
        assertThat(crd.getSpec().getVersions().get(0).getName(), is("v1beta1"));
        assertThat(crd.getSpec().getVersions().get(0).getSubresources(), is(nullValue()));

        assertThat(Crds.engineImage().getMetadata().getName(), is("engineimages.longhorn.io"));
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionVersion;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionVersionBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.longhorn.api.model.Constants;
import io.longhorn.api.model.EngineImage;
import io.longhorn.api.model.EngineImageList;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceManagerList;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.singletonList;

/**
 * "Static" information about the Longhorn CRDs used by the operators
 */
public class Crds {
    private Crds() {
    }

    private static CustomResourceDefinition crd(Class<? extends CustomResource<?, ?>> cls) {
        String scope, plural, singular, group, kind, listKind, shortName;
        List<String> versions;

        if (cls.equals(InstanceManager.class)) {
            scope = InstanceManager.SCOPE;
            plural = InstanceManager.RESOURCE_PLURAL;
            singular = InstanceManager.RESOURCE_SINGULAR;
            group = InstanceManager.RESOURCE_GROUP;
            kind = InstanceManager.RESOURCE_KIND;
            listKind = InstanceManager.RESOURCE_LIST_KIND;
            shortName = InstanceManager.SHORT_NAME;
            versions = InstanceManager.VERSIONS;
        } else if (cls.equals(EngineImage.class)) {
            scope = EngineImage.SCOPE;
            plural = EngineImage.RESOURCE_PLURAL;
            singular = EngineImage.RESOURCE_SINGULAR;
            group = EngineImage.RESOURCE_GROUP;
            kind = EngineImage.RESOURCE_KIND;
            listKind = EngineImage.RESOURCE_LIST_KIND;
            shortName = EngineImage.SHORT_NAME;
            versions = EngineImage.VERSIONS;
        } else {
            throw new RuntimeException("Unsupported custom resource " + cls.getName());
        }

        // No status subresource: the instance manager controller persists spec and status in a single update
        List<CustomResourceDefinitionVersion> crVersions = new ArrayList<>(versions.size());
        for (String apiVersion : versions)  {
            crVersions.add(new CustomResourceDefinitionVersionBuilder()
                    .withName(apiVersion)
                    .withNewSchema()
                        .withNewOpenAPIV3Schema()
                            .withType("object")
                            .withXKubernetesPreserveUnknownFields(true)
                        .endOpenAPIV3Schema()
                    .endSchema()
                    .withStorage(Constants.V1BETA1.equals(apiVersion))
                    .withServed(true)
                    .build());
        }

        return new CustomResourceDefinitionBuilder()
                .withNewMetadata()
                    .withName(plural + "." + group)
                .endMetadata()
                .withNewSpec()
                    .withScope(scope)
                    .withGroup(group)
                    .withVersions(crVersions)
                    .withNewNames()
                        .withSingular(singular)
                        .withPlural(plural)
                        .withKind(kind)
                        .withListKind(listKind)
                        .withShortNames(singletonList(shortName))
                        .withCategories(singletonList(Constants.LONGHORN_CATEGORY))
                    .endNames()
                .endSpec()
                .build();
    }

    public static CustomResourceDefinition instanceManager() {
        return crd(InstanceManager.class);
    }

    public static MixedOperation<InstanceManager, InstanceManagerList, Resource<InstanceManager>> instanceManagerOperation(KubernetesClient client) {
        return client.resources(InstanceManager.class, InstanceManagerList.class);
    }

    public static CustomResourceDefinition engineImage() {
        return crd(EngineImage.class);
    }

    public static MixedOperation<EngineImage, EngineImageList, Resource<EngineImage>> engineImageOperation(KubernetesClient client) {
        return client.resources(EngineImage.class, EngineImageList.class);
    }
}

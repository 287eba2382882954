/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Builds the Kubernetes clients used by the operators. Every client identifies itself with a user agent made of the
 * component name and version, which makes the operator requests easy to find in the API server audit logs.
 */
public class OperatorKubernetesClientBuilder {
    private final String componentName;
    private final String version;

    /**
     * @param componentName  The name of the component using the client.
     * @param version        The version of the component using the client.
     */
    public OperatorKubernetesClientBuilder(final String componentName, final String version) {
        this.componentName = componentName;
        this.version = version;
    }

    /**
     * Builds the client from the in-cluster or kubeconfig based configuration.
     *
     * @param namespace     Default namespace of the client
     *
     * @return the Kubernetes Client
     */
    public KubernetesClient build(final String namespace) {
        final Config kubernetesClientConfig = new ConfigBuilder()
                .withUserAgent(componentName + "/" + (version != null ? version : "unknown"))
                .withNamespace(namespace)
                .build();
        return new KubernetesClientBuilder().withConfig(kubernetesClientConfig).build();
    }
}

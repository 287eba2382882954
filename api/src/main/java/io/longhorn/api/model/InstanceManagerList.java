/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * A {@code DefaultKubernetesResourceList<InstanceManager>} required for using Fabric8 CRD support.
 */
public class InstanceManagerList extends DefaultKubernetesResourceList<InstanceManager> {
    private static final long serialVersionUID = 1L;
}

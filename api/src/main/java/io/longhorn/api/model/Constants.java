/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.api.model;

/**
 * Constants shared by the Longhorn custom resources
 */
public class Constants {
    public static final String RESOURCE_GROUP_NAME = "longhorn.io";
    public static final String V1BETA1 = "v1beta1";
    public static final String V1BETA1_API_VERSION = RESOURCE_GROUP_NAME + "/" + V1BETA1;
    public static final String LONGHORN_CATEGORY = "longhorn";

    /**
     * Finalizer put on the Longhorn resources which need a cleanup by their controller before they go away
     */
    public static final String LONGHORN_FINALIZER = RESOURCE_GROUP_NAME;

    private Constants() {
    }
}

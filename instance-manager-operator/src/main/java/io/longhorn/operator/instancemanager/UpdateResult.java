/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

/**
 * Result of an optimistic-concurrency write of an instance manager
 */
public enum UpdateResult {
    /**
     * The write succeeded
     */
    UPDATED,
    /**
     * Someone else modified the resource since it was read
     */
    CONFLICT,
    /**
     * The resource does not exist any more
     */
    NOT_FOUND
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

/**
 * What happened when an observed process was merged into the status of an instance manager
 */
public enum MergeOutcome {
    /**
     * No local entry exists for the process. The observation was discarded.
     */
    UNKNOWN_PROCESS,
    /**
     * The observation belongs to another incarnation of the process. It was discarded.
     */
    UUID_MISMATCH,
    /**
     * The observation is not newer than the local entry. It was discarded.
     */
    STALE,
    /**
     * The process was deleted and its local entry removed.
     */
    DELETED,
    /**
     * The process was deleted, but nobody requested the deletion yet. The local entry was kept.
     */
    DELETION_PENDING,
    /**
     * The local entry was replaced by the observation.
     */
    UPDATED;

    /**
     * @return  True when the merge modified the local processes
     */
    public boolean changed() {
        return this == DELETED || this == UPDATED;
    }
}

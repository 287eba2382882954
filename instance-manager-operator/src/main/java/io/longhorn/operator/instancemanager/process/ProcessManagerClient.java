/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import java.util.Map;

/**
 * Client for the management daemon of a single instance manager
 */
public interface ProcessManagerClient {
    /**
     * Lists all processes currently known to the daemon.
     *
     * @return  Map of process name to the observed process
     *
     * @throws ProcessManagerException  When the daemon cannot be reached or returns an invalid answer
     */
    Map<String, ProcessObservation> list() throws ProcessManagerException;

    /**
     * Opens a stream of process events.
     *
     * @return  The open stream. The caller is responsible for closing it.
     *
     * @throws ProcessManagerException  When the stream cannot be opened
     */
    ProcessStream watch() throws ProcessManagerException;
}

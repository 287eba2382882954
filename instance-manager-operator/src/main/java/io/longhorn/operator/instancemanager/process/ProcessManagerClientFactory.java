/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

/**
 * Creates clients for the management daemons. Allows the tests to replace the HTTP based client.
 */
@FunctionalInterface
public interface ProcessManagerClientFactory {
    /**
     * @param ip    IP address of the instance manager pod
     * @param role  Role of the instance manager which decides the API used to talk to it
     *
     * @return  Client for the daemon
     */
    ProcessManagerClient create(String ip, ManagerRole role);
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

/**
 * Open subscription to the process events of one management daemon
 */
public interface ProcessStream extends AutoCloseable {
    /**
     * Blocks until the daemon sends the next process event.
     *
     * @return  The next observed process
     *
     * @throws ProcessManagerException  When the stream broke, was closed or the event could not be decoded
     */
    ProcessObservation receive() throws ProcessManagerException;

    /**
     * Closes the subscription. A thread blocked in {@link #receive()} fails with an exception.
     */
    @Override
    void close();
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.test;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;

/**
 * Helpers shared by the unit and mock-server tests of the operator modules
 */
public final class TestUtils {
    private static final Logger LOGGER = LogManager.getLogger(TestUtils.class);

    private TestUtils() {
        // All static methods
    }

    /**
     * Poll the given {@code ready} function every {@code pollIntervalMs} milliseconds until it returns true,
     * or throw a WaitException if it doesn't return true within {@code timeoutMs} milliseconds.
     *
     * @param description       Description of what we are waiting for (used for logging purposes)
     * @param pollIntervalMs    Poll interval in milliseconds
     * @param timeoutMs         Timeout interval in milliseconds
     * @param ready             Supplier to decide if the wait is complete or not
     *
     * @return  The remaining time left until timeout occurs
     */
    public static long waitFor(String description, long pollIntervalMs, long timeoutMs, BooleanSupplier ready) {
        LOGGER.debug("Waiting for {}", description);
        long deadline = System.currentTimeMillis() + timeoutMs;
        String lastExceptionMessage = null;

        while (true) {
            boolean result;
            try {
                result = ready.getAsBoolean();
            } catch (Exception e) {
                lastExceptionMessage = e.getMessage();
                result = false;
            }

            long timeLeft = deadline - System.currentTimeMillis();
            if (result) {
                return timeLeft;
            }

            if (timeLeft <= 0) {
                if (lastExceptionMessage != null) {
                    LOGGER.error("Exception waiting for {}: {}", description, lastExceptionMessage);
                }
                throw new WaitException("Timeout after " + timeoutMs + " ms waiting for " + description);
            }

            long sleepTime = Math.min(pollIntervalMs, timeLeft);
            LOGGER.trace("{} not ready, will try again in {} ms ({}ms till timeout)", description, sleepTime, timeLeft);
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(sleepTime));
        }
    }

    /**
     * Finds a free TCP port on the local machine
     *
     * @return  Free port number
     */
    public static int getFreePort()   {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get a free port", e);
        }
    }
}

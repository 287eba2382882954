/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

import java.util.Map;
import java.util.TreeMap;

/**
 * Miscellaneous helpers shared by the operators
 */
public class Util {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Util.class);

    private Util() {
    }

    /**
     * Logs the environment variables with the given prefix, in alphabetical order. Values of variables which look
     * like they hold a secret are masked.
     *
     * @param prefix    Prefix of the variables which should be logged
     */
    public static void printEnvInfo(String prefix) {
        Map<String, String> env = new TreeMap<>(System.getenv());
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<String, String> entry : env.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                sb.append("\t").append(entry.getKey()).append(": ").append(maskSecret(entry.getKey(), entry.getValue())).append("\n");
            }
        }

        LOGGER.infoOp("Using config:\n" + sb);
    }

    /* test */ static String maskSecret(String key, String value)  {
        if (key.contains("PASSWORD") || key.contains("TOKEN"))  {
            return "********";
        } else {
            return value;
        }
    }

    /**
     * Sleeps for the given time. The interrupted flag is restored when the sleep is interrupted.
     *
     * @param millis    How long to sleep
     *
     * @return  False when the sleep was interrupted, true otherwise
     */
    public static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common;

/**
 * <p>Computes the delays of an exponential back-off for an operation which has to be retried.</p>
 * <p>Each call to {@link #delayMs()} accounts for one retry and returns how long to wait before it:</p>
 * <pre>  delayMs(retry) = min(scaleMs * base ^ (retry - 1), maxDelayMs)</pre>
 * <p>Once {@code maxRetries} delays were handed out, the back-off is {@link #done()} and any further
 * call fails with {@link MaxAttemptsExceededException}.</p>
 */
public class BackOff {
    private static final long DEFAULT_SCALE_MS = 200L;
    private static final int DEFAULT_BASE = 2;
    private static final long DEFAULT_MAX_DELAY_MS = 60_000L;

    private final long scaleMs;
    private final int base;
    private final int maxRetries;
    private final long maxDelayMs;
    private int retries = 0;

    /**
     * Computes delays according to {@code 200 * 2^(retry - 1)}, capped at one minute.
     *
     * @param maxRetries    The maximum number of retries.
     */
    public BackOff(int maxRetries) {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, maxRetries, DEFAULT_MAX_DELAY_MS);
    }

    /**
     * Computes delays according to {@code scaleMs * base^(retry - 1)}, capped at {@code maxDelayMs}.
     *
     * @param scaleMs       The delay before the first retry.
     * @param base          The base of the exponent.
     * @param maxRetries    The maximum number of retries before {@code MaxAttemptsExceededException} is thrown.
     * @param maxDelayMs    The upper bound of a single delay.
     */
    public BackOff(long scaleMs, int base, int maxRetries, long maxDelayMs) {
        if (scaleMs <= 0) {
            throw new IllegalArgumentException("scaleMs must be positive");
        }
        if (base <= 0) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (maxDelayMs < scaleMs) {
            throw new IllegalArgumentException("maxDelayMs must not be lower than scaleMs");
        }
        this.scaleMs = scaleMs;
        this.base = base;
        this.maxRetries = maxRetries;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Returns the delay before the next retry, in milliseconds.
     *
     * @return  The delay before the next retry
     *
     * @throws MaxAttemptsExceededException if all retries were already used.
     */
    public long delayMs() {
        if (done()) {
            throw new MaxAttemptsExceededException(maxRetries);
        }

        return delay(++retries);
    }

    /**
     * @return  Whether the next call to {@link #delayMs()} will throw MaxAttemptsExceededException.
     */
    public boolean done() {
        return retries >= maxRetries;
    }

    /**
     * @return  Number of retries handed out so far
     */
    public int retries() {
        return retries;
    }

    /**
     * @return  The maximum number of retries
     */
    public int maxRetries() {
        return maxRetries;
    }

    private long delay(int retry) {
        long delay = scaleMs;
        for (int i = 1; i < retry; i++) {
            delay *= base;
            if (delay >= maxDelayMs) {
                return maxDelayMs;
            }
        }
        return Math.min(delay, maxDelayMs);
    }
}

/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

import io.longhorn.operator.common.MetricsProvider;
import io.longhorn.operator.common.MicrometerMetricsProvider;
import io.longhorn.operator.common.metrics.ControllerMetricsHolder;
import io.longhorn.test.TestUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class ControllerQueueTest {
    private MeterRegistry metricsRegistry;
    private ControllerMetricsHolder metrics;
    private ScheduledExecutorService scheduledExecutor;

    @BeforeEach
    public void setUp() {
        metricsRegistry = new SimpleMeterRegistry();
        MetricsProvider metricsProvider = new MicrometerMetricsProvider(metricsRegistry);
        metrics = new ControllerMetricsHolder("kind", metricsProvider);
        scheduledExecutor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() {
        scheduledExecutor.shutdownNow();
    }

    @Test
    public void testEnqueueingEnqueued() {
        ControllerQueue q = new ControllerQueue(10, 3, 10, metrics, scheduledExecutor);

        SimplifiedReconciliation r1 = new SimplifiedReconciliation("kind", "my-namespace", "my-name", "watch");
        SimplifiedReconciliation r2 = new SimplifiedReconciliation("kind", "my-namespace", "my-name", "timer");
        SimplifiedReconciliation r3 = new SimplifiedReconciliation("kind", "my-namespace", "my-other-name", "watch");

        q.enqueue(r1);
        q.enqueue(r3);
        q.enqueue(r2);

        assertThat(q.queue.size(), is(2));
        assertThat(q.queue.contains(r1), is(true));
        assertThat(q.queue.contains(r3), is(true));

        assertThat(metricsRegistry.get("longhorn.reconciliations.already.enqueued").tag("kind", "kind").tag("namespace", "my-namespace").counter().count(), is(1.0));
    }

    @Test
    public void testFullQueueDropsEvents() {
        ControllerQueue q = new ControllerQueue(1, 3, 10, metrics, scheduledExecutor);

        q.enqueue(new SimplifiedReconciliation("kind", "my-namespace", "a"));
        q.enqueue(new SimplifiedReconciliation("kind", "my-namespace", "b"));

        assertThat(q.queue.size(), is(1));
    }

    @Test
    public void testEnqueueWithBackOff() throws InterruptedException {
        ControllerQueue q = new ControllerQueue(10, 3, 10, metrics, scheduledExecutor);
        SimplifiedReconciliation r = new SimplifiedReconciliation("kind", "my-namespace", "my-name");

        assertThat(q.enqueueWithBackOff(r), is(true));
        assertThat(q.numRequeues(r), is(1));

        TestUtils.waitFor("retry to be enqueued", 10, 5_000, () -> q.queue.size() == 1);
        SimplifiedReconciliation retried = q.take();
        assertThat(retried, is(r));
        assertThat(retried.trigger(), is("retry"));

        q.forget(r);
        assertThat(q.numRequeues(r), is(0));
    }

    @Test
    public void testDroppedAfterMaxRetries() {
        ControllerQueue q = new ControllerQueue(10, 2, 10, metrics, scheduledExecutor);
        SimplifiedReconciliation r = new SimplifiedReconciliation("kind", "my-namespace", "my-name");

        assertThat(q.enqueueWithBackOff(r), is(true));
        assertThat(q.enqueueWithBackOff(r), is(true));
        assertThat(q.numRequeues(r), is(2));
        assertThat(q.enqueueWithBackOff(r), is(false));

        // The history is forgotten, so a later failure starts from scratch
        assertThat(q.numRequeues(r), is(0));
        assertThat(q.backOffs.isEmpty(), is(true));
        assertThat(metricsRegistry.get("longhorn.reconciliations.dropped").tag("kind", "kind").tag("namespace", "my-namespace").counter().count(), is(1.0));
    }

    @Test
    public void testConflictRequeueIgnoresRetryLimit() throws InterruptedException {
        ControllerQueue q = new ControllerQueue(10, 0, 10, metrics, scheduledExecutor);
        SimplifiedReconciliation r = new SimplifiedReconciliation("kind", "my-namespace", "my-name");

        for (int i = 0; i < 3; i++) {
            assertThat(q.enqueueAfterConflict(r), is(true));
            TestUtils.waitFor("conflict retry to be enqueued", 10, 5_000, () -> q.queue.size() == 1);
            assertThat(q.take().trigger(), is("retry"));
        }

        assertThat(q.numRequeues(r), is(0));
        assertThat(metricsRegistry.find("longhorn.reconciliations.dropped").counters().stream().mapToDouble(c -> c.count()).sum(), is(0.0));
    }

    @Test
    public void testRetryAfterShutdownIsRejected() {
        ControllerQueue q = new ControllerQueue(10, 3, 10, metrics, scheduledExecutor);
        scheduledExecutor.shutdownNow();

        assertThat(q.enqueueWithBackOff(new SimplifiedReconciliation("kind", "my-namespace", "my-name")), is(false));
    }
}

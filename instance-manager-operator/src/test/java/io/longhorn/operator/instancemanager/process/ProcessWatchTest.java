/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import io.longhorn.api.model.InstanceManager;
import io.longhorn.api.model.InstanceState;
import io.longhorn.operator.instancemanager.InstanceManagerStore;
import io.longhorn.operator.instancemanager.UpdateResult;
import io.longhorn.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.longhorn.operator.instancemanager.ResourceUtils.NAME;
import static io.longhorn.operator.instancemanager.ResourceUtils.createProcess;
import static io.longhorn.operator.instancemanager.ResourceUtils.createRunningInstanceManager;
import static io.longhorn.operator.instancemanager.ResourceUtils.observe;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ProcessWatchTest {
    private static final String PROCESS = "pvc-1-e-0";

    private InstanceManagerStore store;
    private ProcessManagerClient client;
    private List<QueueStream> streams;
    private ProcessWatch watch;

    private static InstanceManager instanceManagerWithProcess() {
        InstanceManager im = createRunningInstanceManager();
        im.getStatus().getInstances().put(PROCESS, createProcess(PROCESS, "uuid-1", InstanceState.STARTING, 1L));
        return im;
    }

    @BeforeEach
    public void beforeEach() throws ProcessManagerException {
        store = mock(InstanceManagerStore.class);
        when(store.getInstanceManager(NAME)).thenAnswer(i -> instanceManagerWithProcess());

        streams = new CopyOnWriteArrayList<>();
        client = mock(ProcessManagerClient.class);
        when(client.watch()).thenAnswer(i -> openStream());

        watch = new ProcessWatch(NAME, client, store, 50L, 50L);
    }

    private QueueStream openStream() {
        QueueStream stream = new QueueStream();
        streams.add(stream);
        return stream;
    }

    private QueueStream stream(int index) {
        TestUtils.waitFor("Stream " + index + " opened", 10, 5_000, () -> streams.size() > index);
        return streams.get(index);
    }

    @AfterEach
    public void afterEach() {
        watch.stop();
    }

    @Test
    public void testObservationIsWrittenIntoInstanceManager() {
        when(store.update(any())).thenReturn(UpdateResult.UPDATED);
        watch.start();

        stream(0).push(observe(PROCESS, "uuid-1", InstanceState.RUNNING, 2L, false));

        ArgumentCaptor<InstanceManager> captor = ArgumentCaptor.forClass(InstanceManager.class);
        verify(store, timeout(5_000)).update(captor.capture());

        InstanceManager updated = captor.getValue();
        assertThat(updated.getStatus().getInstances().get(PROCESS).getStatus().getState(), is(InstanceState.RUNNING));
        assertThat(updated.getStatus().getInstances().get(PROCESS).getSpec().getCreatedAt(), is("2020-01-01T00:00:00Z"));
    }

    @Test
    public void testConflictIsRetriedOnFreshInstanceManager() {
        when(store.update(any())).thenReturn(UpdateResult.CONFLICT, UpdateResult.UPDATED);
        watch.start();

        stream(0).push(observe(PROCESS, "uuid-1", InstanceState.RUNNING, 2L, false));

        verify(store, timeout(5_000).times(2)).update(any());
        verify(store, times(2)).getInstanceManager(NAME);
    }

    @Test
    public void testObservationsWhichChangeNothingAreNotWritten() {
        watch.start();

        stream(0).push(observe(PROCESS, "uuid-1", InstanceState.RUNNING, 1L, false));
        stream(0).push(observe(PROCESS, "uuid-0", InstanceState.RUNNING, 9L, false));
        stream(0).push(observe("pvc-2-e-0", "uuid-2", InstanceState.RUNNING, 9L, false));

        verify(store, timeout(5_000).times(3)).getInstanceManager(NAME);
        verify(store, after(200).never()).update(any());
    }

    @Test
    public void testMissingInstanceManagerDropsObservation() {
        doReturn(null).when(store).getInstanceManager(NAME);
        watch.start();

        stream(0).push(observe(PROCESS, "uuid-1", InstanceState.RUNNING, 2L, false));

        verify(store, timeout(5_000)).getInstanceManager(NAME);
        verify(store, after(200).never()).update(any());
        assertThat(watch.isAlive(), is(true));
    }

    @Test
    public void testBrokenStreamIsReopened() throws ProcessManagerException {
        when(store.update(any())).thenReturn(UpdateResult.UPDATED);
        watch.start();

        stream(0).fail();
        stream(1);

        assertThat(stream(0).closed.get(), is(true));
        verify(client, times(2)).watch();
    }

    @Test
    public void testFailedOpenIsRetried() throws ProcessManagerException {
        doThrow(new ProcessManagerException("connection refused")).doAnswer(i -> openStream()).when(client).watch();
        when(store.update(any())).thenReturn(UpdateResult.UPDATED);
        watch.start();

        stream(0).push(observe(PROCESS, "uuid-1", InstanceState.RUNNING, 2L, false));

        verify(store, timeout(5_000)).update(any());
        verify(client, atLeast(2)).watch();
    }

    @Test
    public void testStopEndsBlockedReceive() {
        watch.start();
        QueueStream stream = stream(0);

        assertThat(watch.stop(), is(true));

        assertThat(watch.isDone(), is(true));
        assertThat(watch.isAlive(), is(false));
        assertThat(stream.closed.get(), is(true));

        // Stop is one-shot
        assertThat(watch.stop(), is(false));
    }

    @Test
    public void testStopInterruptsStreamWhichIsBeingOpened() throws ProcessManagerException, InterruptedException {
        CountDownLatch opening = new CountDownLatch(1);
        CountDownLatch answer = new CountDownLatch(1);
        // The daemon accepts the connection but never answers
        doAnswer(i -> {
            opening.countDown();
            try {
                answer.await();
            } catch (InterruptedException e) {
                throw new ProcessManagerException("interrupted", e);
            }
            return openStream();
        }).when(client).watch();

        watch.start();
        assertThat(opening.await(5, TimeUnit.SECONDS), is(true));

        long start = System.currentTimeMillis();
        assertThat(watch.stop(), is(true));

        assertThat(System.currentTimeMillis() - start, is(lessThan(5_000L)));
        assertThat(watch.isDone(), is(true));
        assertThat(watch.isAlive(), is(false));
        assertThat(streams.isEmpty(), is(true));
        verify(store, never()).getInstanceManager(any());
    }

    @Test
    public void testStopBeforeStart() throws ProcessManagerException {
        assertThat(watch.stop(), is(true));

        watch.start();

        assertThat(watch.isDone(), is(true));
        assertThat(watch.isAlive(), is(false));
        verify(client, after(200).never()).watch();
        verify(store, never()).getInstanceManager(any());
    }

    /**
     * Stream backed by a queue. An empty optional makes the receive fail.
     */
    static class QueueStream implements ProcessStream {
        private final BlockingQueue<Optional<ProcessObservation>> queue = new LinkedBlockingQueue<>();
        final AtomicBoolean closed = new AtomicBoolean(false);

        void push(ProcessObservation observation) {
            queue.add(Optional.of(observation));
        }

        void fail() {
            queue.add(Optional.empty());
        }

        @Override
        public ProcessObservation receive() throws ProcessManagerException {
            try {
                Optional<ProcessObservation> next = queue.take();
                if (next.isEmpty()) {
                    throw new ProcessManagerException("stream broken");
                }

                return next.get();
            } catch (InterruptedException e) {
                throw new ProcessManagerException("interrupted", e);
            }
        }

        @Override
        public void close() {
            closed.set(true);
            // Wakes up a pending receive the way closing a connection does
            fail();
        }
    }
}

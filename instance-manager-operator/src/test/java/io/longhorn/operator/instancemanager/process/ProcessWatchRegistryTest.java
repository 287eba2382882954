/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class ProcessWatchRegistryTest {
    @Test
    public void testWatchIsStartedOnlyOnce() {
        AtomicInteger gauge = new AtomicInteger();
        ProcessWatchRegistry registry = new ProcessWatchRegistry(gauge);
        ProcessWatch watch = mock(ProcessWatch.class);
        ProcessWatch second = mock(ProcessWatch.class);

        assertThat(registry.startIfAbsent("im-1", () -> watch), is(true));
        assertThat(registry.startIfAbsent("im-1", () -> second), is(false));

        verify(watch).start();
        verify(second, never()).start();
        assertThat(registry.contains("im-1"), is(true));
        assertThat(registry.size(), is(1));
        assertThat(gauge.get(), is(1));
    }

    @Test
    public void testStopRemovesTheWatch() {
        AtomicInteger gauge = new AtomicInteger();
        ProcessWatchRegistry registry = new ProcessWatchRegistry(gauge);
        ProcessWatch watch = mock(ProcessWatch.class);

        registry.startIfAbsent("im-1", () -> watch);

        assertThat(registry.stop("im-1"), is(true));
        verify(watch).stop();
        assertThat(registry.contains("im-1"), is(false));
        assertThat(gauge.get(), is(0));

        // Nothing left to stop
        assertThat(registry.stop("im-1"), is(false));

        // A new watch can be registered after the old one was stopped
        ProcessWatch next = mock(ProcessWatch.class);
        assertThat(registry.startIfAbsent("im-1", () -> next), is(true));
        verify(next).start();
    }

    @Test
    public void testStopAll() {
        AtomicInteger gauge = new AtomicInteger();
        ProcessWatchRegistry registry = new ProcessWatchRegistry(gauge);
        ProcessWatch watch1 = mock(ProcessWatch.class);
        ProcessWatch watch2 = mock(ProcessWatch.class);

        registry.startIfAbsent("im-1", () -> watch1);
        registry.startIfAbsent("im-2", () -> watch2);
        assertThat(gauge.get(), is(2));

        registry.stopAll();

        verify(watch1).stop();
        verify(watch2).stop();
        assertThat(registry.size(), is(0));
        assertThat(gauge.get(), is(0));
    }

    @Test
    public void testFailingFactoryRegistersNothing() {
        ProcessWatchRegistry registry = new ProcessWatchRegistry(new AtomicInteger());

        assertThrows(IllegalStateException.class, () -> registry.startIfAbsent("im-1", () -> {
            throw new IllegalStateException("Instance Manager IP was not set before creating watch");
        }));

        assertThat(registry.contains("im-1"), is(false));
    }
}

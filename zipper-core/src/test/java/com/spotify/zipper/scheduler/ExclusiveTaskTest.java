package com.spotify.zipper.scheduler;

import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.AsyncFuture;
import eu.toolchain.async.ResolvableFuture;
import eu.toolchain.async.TinyAsync;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ExclusiveTaskTest {
    private final AsyncFramework async = TinyAsync.builder().build();

    private List<ResolvableFuture<Void>> invocations;
    private List<Throwable> errors;
    private ExclusiveTask task;

    @Before
    public void setup() {
        invocations = new ArrayList<>();
        errors = new ArrayList<>();

        task = new ExclusiveTask("test") {
            @Override
            public AsyncFuture<Void> invoke() {
                final ResolvableFuture<Void> future = async.future();
                invocations.add(future);
                return future;
            }

            @Override
            public void error(final Throwable cause) {
                errors.add(cause);
            }
        };
    }

    @Test
    public void testSkipsWhileRunning() {
        task.run();
        task.run();

        assertEquals(1, invocations.size());
        assertTrue(task.isRunning());

        invocations.get(0).resolve(null);
        assertFalse(task.isRunning());

        task.run();
        assertEquals(2, invocations.size());
    }

    @Test
    public void testFailureIsReported() {
        task.run();

        final IllegalStateException cause = new IllegalStateException("boom");
        invocations.get(0).fail(cause);

        assertFalse(task.isRunning());
        assertEquals(1, errors.size());
        assertEquals(cause, errors.get(0));
    }

    @Test
    public void testStopCancels() {
        task.run();
        task.stop();

        assertTrue(invocations.get(0).isCancelled());
        assertFalse(task.isRunning());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testInvokeThrowing() {
        final ExclusiveTask throwing = new ExclusiveTask("throwing") {
            @Override
            public AsyncFuture<Void> invoke() throws Exception {
                throw new Exception("cannot start");
            }

            @Override
            public void error(final Throwable cause) {
                errors.add(cause);
            }
        };

        throwing.run();

        assertFalse(throwing.isRunning());
        assertEquals(1, errors.size());
    }
}

package com.spotify.zipper.broadcast;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Uninterruptibles;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.broadcast.ScatterGather.Gathered;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.CoreServerLimiter;
import eu.toolchain.async.TinyAsync;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScatterGatherTest {
    private ExecutorService executor;
    private CoreServerLimiter limiter;
    private ScatterGather<String> gather;

    @Before
    public void setup() {
        executor = Executors.newCachedThreadPool();
        limiter = new CoreServerLimiter(ImmutableList.of("a", "b"), 1);
        gather = new ScatterGather<>("g", TinyAsync.builder().executor(executor).build(), limiter,
            (x, y) -> x + y);
    }

    @After
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testStragglerReleasesSlotWhenGatheringEnds() throws Exception {
        final CountDownLatch unblock = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(1);

        final Gathered<String> first = gather.run(
            QueryContext.background().withTimeout(100, TimeUnit.MILLISECONDS),
            ImmutableList.of(ScatterGather.unit("a", c -> {
                try {
                    Uninterruptibles.awaitUninterruptibly(unblock);
                    return ok("late");
                } finally {
                    finished.countDown();
                }
            })));

        assertFalse(first.getResponse().isPresent());
        assertEquals(ImmutableList.of("a"), first.getNoAnswer());
        assertEquals(1, first.getStats().get(Stats.TIMEOUTS));
        assertTrue(ZipperException.is(first.getErrors().get(0), ErrorKind.TIMEOUT_EXCEEDED));
        assertEquals(1, limiter.available("a"));

        final Gathered<String> second = gather.run(
            QueryContext.background().withTimeout(1, TimeUnit.SECONDS),
            ImmutableList.of(ScatterGather.unit("a", c -> ok("next"))));

        assertEquals("next", second.getResponse().get());
        assertTrue(second.getNoAnswer().isEmpty());

        unblock.countDown();
        assertTrue(finished.await(1, TimeUnit.SECONDS));
        Thread.sleep(50);

        assertEquals(1, limiter.available("a"));
    }

    @Test
    public void testFailedUnitIsAnError() {
        final Gathered<String> gathered = gather.run(QueryContext.background(), ImmutableList.of(
            ScatterGather.unit("a", c -> ok("x")),
            ScatterGather.<String>unit("b", c -> {
                throw new IllegalStateException("boom");
            })));

        assertEquals("x", gathered.getResponse().get());
        assertEquals(2, gathered.getAnswered());
        assertEquals(1, gathered.getErrors().size());
        assertEquals(1, limiter.available("a"));
        assertEquals(1, limiter.available("b"));
    }

    @Test
    public void testCancelledContextStopsGathering() {
        final QueryContext ctx = QueryContext.background();

        executor.execute(() -> {
            Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
            ctx.cancel();
        });

        final Gathered<String> gathered = gather.run(ctx, ImmutableList.of(
            ScatterGather.<String>unlimited("a", c -> {
                while (!c.isDone()) {
                    Uninterruptibles.sleepUninterruptibly(5, TimeUnit.MILLISECONDS);
                }

                return BackendResult.failed(c.error());
            })));

        assertEquals(ImmutableList.of("a"), gathered.getNoAnswer());
    }

    private static BackendResult<String> ok(final String value) {
        return BackendResult.ok(value, Stats.empty());
    }
}

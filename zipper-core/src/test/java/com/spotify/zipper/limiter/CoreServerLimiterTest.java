package com.spotify.zipper.limiter;

import com.google.common.collect.ImmutableList;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CoreServerLimiterTest {
    private CoreServerLimiter limiter;

    @Before
    public void setup() {
        limiter = new CoreServerLimiter(ImmutableList.of("a", "b"), 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacity() {
        new CoreServerLimiter(ImmutableList.of("a"), 0);
    }

    @Test
    public void testEnterLeave() {
        final QueryContext ctx = QueryContext.background();

        limiter.enter(ctx, "a");
        limiter.enter(ctx, "a");
        assertEquals(0, limiter.available("a"));
        assertEquals(2, limiter.available("b"));

        limiter.leave("a");
        assertEquals(1, limiter.available("a"));
        assertEquals(2, limiter.capacity());
    }

    @Test
    public void testUnknownNameGetsSlots() {
        limiter.enter(QueryContext.background(), "c");
        assertEquals(1, limiter.available("c"));
    }

    @Test
    public void testTimeoutWhenFull() {
        final QueryContext background = QueryContext.background();
        limiter.enter(background, "a");
        limiter.enter(background, "a");

        try (QueryContext ctx = background.withTimeout(100, TimeUnit.MILLISECONDS)) {
            limiter.enter(ctx, "a");
            fail("expected timeout");
        } catch (final ZipperException e) {
            assertEquals(ErrorKind.TIMEOUT_EXCEEDED, e.getKind());
            assertEquals("a", e.getServer().get());
        }

        assertEquals(0, limiter.available("a"));
    }

    @Test
    public void testCancelledWhileWaiting() throws Exception {
        final QueryContext background = QueryContext.background();
        limiter.enter(background, "a");
        limiter.enter(background, "a");

        final QueryContext ctx = background.fork();
        final CountDownLatch done = new CountDownLatch(1);
        final AtomicReference<ZipperException> error = new AtomicReference<>();

        final Thread waiter = new Thread(() -> {
            try {
                limiter.enter(ctx, "a");
            } catch (final ZipperException e) {
                error.set(e);
            } finally {
                done.countDown();
            }
        });

        waiter.start();
        ctx.cancel();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(ErrorKind.CANCELLED, error.get().getKind());
    }

    @Test
    public void testWaiterGetsReleasedSlot() throws Exception {
        final QueryContext background = QueryContext.background();
        limiter.enter(background, "b");
        limiter.enter(background, "b");

        final CountDownLatch entered = new CountDownLatch(1);

        final Thread waiter = new Thread(() -> {
            limiter.enter(background, "b");
            entered.countDown();
        });

        waiter.start();
        limiter.leave("b");

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(0, limiter.available("b"));
    }
}

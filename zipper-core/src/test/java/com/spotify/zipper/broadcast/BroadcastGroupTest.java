package com.spotify.zipper.broadcast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.cache.RoutingCache;
import com.spotify.zipper.common.Duration;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.common.Timeouts;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.metric.FetchRequest;
import com.spotify.zipper.metric.FetchResponse;
import com.spotify.zipper.metric.GlobMatch;
import com.spotify.zipper.metric.GlobResponse;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.MetricInfo;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import com.spotify.zipper.test.FakeBackend;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.TinyAsync;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BroadcastGroupTest {
    private static final Timeouts SHORT = Timeouts.of(Duration.of(300, TimeUnit.MILLISECONDS),
        Duration.of(300, TimeUnit.MILLISECONDS), Duration.of(100, TimeUnit.MILLISECONDS));

    private ExecutorService executor;
    private AsyncFramework async;
    private QueryContext ctx;

    @Before
    public void setup() {
        executor = Executors.newCachedThreadPool();
        async = TinyAsync.builder().executor(executor).build();
        ctx = QueryContext.background();
    }

    @After
    public void teardown() {
        executor.shutdownNow();
    }

    @Test(expected = ZipperException.class)
    public void testNoChildren() {
        BroadcastGroup.builder("empty").async(async).build();
    }

    @Test(expected = NullPointerException.class)
    public void testAsyncIsRequired() {
        BroadcastGroup.builder("g").children(ImmutableList.of(serving("a"))).build();
    }

    @Test
    public void testAllChildrenTimeOut() {
        final BroadcastGroup group = group("g", SHORT, FakeBackend.builder("a").hang().build(),
            FakeBackend.builder("b").hang().build(), FakeBackend.builder("c").hang().build());

        final BackendResult<MultiGlobResponse> result =
            group.find(ctx, MultiGlobRequest.of("a.*"));

        assertTrue(result.isFatal());
        assertFalse(result.getResponse().isPresent());
        assertEquals(3, result.getStats().get(Stats.TIMEOUTS));
        assertEquals(HttpErrors.SERVICE_UNAVAILABLE, HttpErrors.httpCode(result.getErrors()
            .first().get()));
    }

    @Test
    public void testAllChildrenTimeOutOnFetch() {
        final BroadcastGroup group = group("g", SHORT, FakeBackend.builder("a").hang().build(),
            FakeBackend.builder("b").hang().build(), FakeBackend.builder("c").hang().build());

        final BackendResult<MultiFetchResponse> result =
            group.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.bar", 0, 120)));

        assertTrue(result.isFatal());
        assertFalse(result.getResponse().isPresent());
        assertEquals(3, result.getStats().get(Stats.TIMEOUTS));
        assertEquals(HttpErrors.SERVICE_UNAVAILABLE, HttpErrors.httpCode(result.getErrors()
            .first().get()));
    }

    @Test
    public void testTimedOutRequestReleasesSlot() {
        final FakeBackend child =
            FakeBackend.builder("a").hangFirst(1).fetch(BroadcastGroupTest::echo).build();

        final BroadcastGroup group = BroadcastGroup
            .builder("g")
            .children(ImmutableList.of(child))
            .timeouts(SHORT)
            .concurrencyLimit(1)
            .async(async)
            .build();

        final MultiFetchRequest request = MultiFetchRequest.of(FetchRequest.of("foo", 0, 60));

        final BackendResult<MultiFetchResponse> first = group.fetch(ctx, request);
        assertTrue(first.isFatal());
        assertEquals(1, first.getStats().get(Stats.TIMEOUTS));

        final BackendResult<MultiFetchResponse> second = group.fetch(ctx, request);
        assertFalse(second.isFatal());
        assertEquals(0, second.getStats().get(Stats.TIMEOUTS));
        assertEquals("foo", second.getResponse().get().getMetrics().get(0).getName());
        assertEquals(2, child.calls());
    }

    @Test
    public void testPartialFailureIsNotFatal() {
        final BroadcastGroup group = group("g", SHORT, serving("a"),
            FakeBackend.builder("b").failing(new ZipperException(ErrorKind.BACKEND_ERROR)).build());

        final BackendResult<MultiFetchResponse> result =
            group.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.bar", 0, 120)));

        assertFalse(result.isFatal());
        assertEquals(1, result.getErrors().getErrors().size());
        assertEquals(1, result.getResponse().get().getMetrics().size());
        assertEquals("foo.bar", result.getResponse().get().getMetrics().get(0).getName());
    }

    @Test
    public void testRequireSuccessAll() {
        final BroadcastGroup group = BroadcastGroup
            .builder("g")
            .children(ImmutableList.of(serving("a"),
                FakeBackend.builder("b").failing(new ZipperException(ErrorKind.BACKEND_ERROR))
                    .build()))
            .timeouts(SHORT)
            .requireSuccessAll(true)
            .async(async)
            .build();

        final BackendResult<MultiFetchResponse> result =
            group.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.bar", 0, 120)));

        assertTrue(result.isFatal());
        assertTrue(result.getErrors().contains(ErrorKind.FAILED_TO_FETCH));
    }

    @Test
    public void testAllNotFound() {
        final BroadcastGroup group = group("g", SHORT,
            FakeBackend.builder("a").failing(new ZipperException(ErrorKind.NOT_FOUND)).build(),
            FakeBackend.builder("b").failing(new ZipperException(ErrorKind.NOT_FOUND)).build());

        final BackendResult<MultiFetchResponse> result =
            group.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.bar", 0, 120)));

        assertTrue(result.isFatal());
        assertTrue(result.getErrors().contains(ErrorKind.NOT_FOUND));
        assertEquals(HttpErrors.NOT_FOUND, HttpErrors.httpCode(result.getErrors().first().get()));
    }

    @Test
    public void testFetchMergesGaps() {
        final FakeBackend a = FakeBackend
            .builder("a")
            .fetch(MultiFetchResponse.of(FetchResponse.of("foo", 0, 60, 1.0, Double.NaN, 3.0)))
            .build();
        final FakeBackend b = FakeBackend
            .builder("b")
            .fetch(MultiFetchResponse.of(FetchResponse.of("foo", 0, 60, Double.NaN, 2.0, 3.0)))
            .build();

        final BackendResult<MultiFetchResponse> result =
            group("g", SHORT, a, b)
                .fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo", 0, 120)));

        final FetchResponse series = result.getResponse().get().getMetrics().get(0);
        assertEquals(1.0, series.getValues()[0], 0.0);
        assertEquals(2.0, series.getValues()[1], 0.0);
        assertEquals(3.0, series.getValues()[2], 0.0);
        assertEquals(120, series.getStopTime());
        assertEquals(2, result.getStats().get(Stats.RENDER_REQUESTS));
    }

    @Test
    public void testFindDeduplicates() {
        final MultiGlobResponse found = MultiGlobResponse.of(new GlobResponse("a.b.*",
            ImmutableList.of(GlobMatch.leaf("a.b.c"), GlobMatch.leaf("a.b.d"))));

        final BroadcastGroup group = group("g", SHORT, FakeBackend.builder("x").find(found).build(),
            FakeBackend.builder("y").find(found).build());

        final BackendResult<MultiGlobResponse> result =
            group.find(ctx, MultiGlobRequest.of("a.b.*"));

        assertFalse(result.hasErrors());
        assertEquals(2, result.getResponse().get().totalMatches());
        assertEquals(2, result.getStats().get(Stats.TOTAL_METRICS_COUNT));
        assertEquals(2, result.getStats().get(Stats.ZIPPER_REQUESTS));
        assertEquals(2, result.getStats().get(Stats.FIND_REQUESTS));
    }

    @Test
    public void testFindSamePathIsOneMatch() {
        final BroadcastGroup group = group("g", SHORT,
            FakeBackend.builder("x").find(MultiGlobResponse.of(
                new GlobResponse("a.*", ImmutableList.of(GlobMatch.leaf("a.b"))))).build(),
            FakeBackend.builder("y").find(MultiGlobResponse.of(
                new GlobResponse("a.*", ImmutableList.of(GlobMatch.branch("a.b"))))).build());

        final BackendResult<MultiGlobResponse> result = group.find(ctx, MultiGlobRequest.of("a.*"));

        assertEquals(ImmutableList.of(GlobMatch.leaf("a.b")),
            result.getResponse().get().getMetrics().get(0).getMatches());
        assertEquals(1, result.getStats().get(Stats.TOTAL_METRICS_COUNT));
    }

    @Test
    public void testInfoFromAllServers() {
        final MetricInfo info = new MetricInfo("foo", "average", 0.5, 86400, ImmutableList.of());

        final BroadcastGroup group = group("g", SHORT,
            FakeBackend.builder("a").info(r -> ok(InfoResponse.of("a", ImmutableList.of(info))))
                .build(),
            FakeBackend.builder("b").failing(new ZipperException(ErrorKind.BACKEND_ERROR)).build());

        final BackendResult<InfoResponse> result =
            group.info(ctx, new MultiMetricsInfoRequest(ImmutableList.of("foo")));

        assertFalse(result.isFatal());
        assertEquals(ImmutableSet.of("a"), result.getResponse().get().getServers().keySet());
        assertEquals(1, result.getErrors().getErrors().size());
    }

    @Test
    public void testTagsUnionAndLimit() {
        final BroadcastGroup group = group("g", SHORT,
            FakeBackend.builder("a").tagNames(ImmutableList.of("c", "a")).build(),
            FakeBackend.builder("b").tagNames(ImmutableList.of("b", "a", "d")).build());

        final BackendResult<List<String>> limited = group.tagNames(ctx, "", 2);
        assertEquals(ImmutableList.of("a", "b"), limited.getResponse().get());

        final BackendResult<List<String>> all = group.tagNames(ctx, "", -1);
        assertThat(all.getResponse().get(), containsInAnyOrder("a", "b", "c", "d"));
    }

    @Test
    public void testRootProbeWritesCache() {
        final RoutingCache cache = new RoutingCache(Duration.of(10, TimeUnit.MINUTES));
        final FakeBackend a =
            FakeBackend.builder("a").probe(ImmutableList.of("foo", "bar")).build();
        final FakeBackend b = FakeBackend.builder("b").probe(ImmutableList.of("bar")).build();

        final BroadcastGroup root = BroadcastGroup
            .builder("root")
            .children(ImmutableList.of(a, b))
            .timeouts(SHORT)
            .cache(cache)
            .root(true)
            .async(async)
            .build();

        final BackendResult<List<String>> result = root.probeTLDs(ctx);

        assertThat(result.getResponse().get(), containsInAnyOrder("foo", "bar"));
        assertEquals(ImmutableList.of(a), cache.get("foo").get());
        assertEquals(ImmutableSet.of(a, b), new HashSet<>(cache.get("bar").get()));
    }

    @Test
    public void testNonRootProbeLeavesCache() {
        final RoutingCache cache = new RoutingCache(Duration.of(10, TimeUnit.MINUTES));

        final BroadcastGroup group = BroadcastGroup
            .builder("group")
            .children(ImmutableList.of(FakeBackend.builder("a").probe(ImmutableList.of("foo"))
                .build()))
            .timeouts(SHORT)
            .cache(cache)
            .async(async)
            .build();

        final BackendResult<List<String>> result = group.probeTLDs(ctx);

        assertEquals(ImmutableList.of("foo"), result.getResponse().get());
        assertEquals(0, cache.size());
    }

    @Test
    public void testFilterServersByTld() {
        final RoutingCache cache = new RoutingCache(Duration.of(10, TimeUnit.MINUTES));
        final FakeBackend a = FakeBackend.builder("a").build();
        final FakeBackend b = FakeBackend.builder("b").build();
        cache.put("foo", ImmutableList.of(a));

        final BroadcastGroup root = BroadcastGroup
            .builder("root")
            .children(ImmutableList.of(a, b))
            .cache(cache)
            .root(true)
            .async(async)
            .build();

        final BroadcastGroup.Filtered hit = root.filterServersByTLD(ImmutableList.of("foo.bar"));
        assertEquals(ImmutableList.of(a), hit.getServers());
        assertEquals(1, hit.getStats().get(Stats.CACHE_HITS));

        final BroadcastGroup.Filtered miss = root.filterServersByTLD(ImmutableList.of("baz.bar"));
        assertEquals(ImmutableList.of(a, b), miss.getServers());
        assertEquals(1, miss.getStats().get(Stats.CACHE_MISSES));

        final BroadcastGroup.Filtered tagged =
            root.filterServersByTLD(ImmutableList.of("foo.x", "seriesByTag('name=foo')"));
        assertEquals(ImmutableList.of(a, b), tagged.getServers());
    }

    @Test
    public void testSplitRequest() {
        final FakeBackend child = FakeBackend
            .builder("a")
            .maxMetricsPerRequest(2)
            .find(MultiGlobResponse.of(new GlobResponse("foo.*", ImmutableList.of(
                GlobMatch.leaf("foo.a"), GlobMatch.branch("foo.b"), GlobMatch.leaf("foo.c")))))
            .build();

        final BroadcastGroup group = group("g", SHORT, child);
        final MultiFetchRequest request = MultiFetchRequest.of(FetchRequest.of("bar", 0, 60),
            FetchRequest.of("foo.*", 0, 60), FetchRequest.of("baz", 0, 60));

        final BroadcastGroup.Split split = group.splitRequest(ctx, request, child);

        assertTrue(split.getErrors().isEmpty());
        assertEquals(2, split.getBatches().size());
        assertEquals(ImmutableList.of("bar", "foo.a"), split.getBatches().get(0).names());
        assertEquals(ImmutableList.of("foo.c", "baz"), split.getBatches().get(1).names());
        assertEquals("foo.*", split.getBatches().get(0).getMetrics().get(1).getPathExpression());
    }

    @Test
    public void testSplitRequestWithoutLimit() {
        final FakeBackend child = FakeBackend.builder("a").build();
        final MultiFetchRequest request = MultiFetchRequest.of(FetchRequest.of("foo.*", 0, 60));

        final BroadcastGroup.Split split =
            group("g", SHORT, child).splitRequest(ctx, request, child);

        assertEquals(1, split.getBatches().size());
        assertSame(request, split.getBatches().get(0));
        assertEquals(0, child.calls());
    }

    @Test
    public void testSplitRequestFailedGlob() {
        final FakeBackend child = FakeBackend
            .builder("a")
            .maxMetricsPerRequest(10)
            .find(MultiGlobResponse.empty())
            .build();

        final MultiFetchRequest request =
            MultiFetchRequest.of(FetchRequest.of("foo.*", 0, 60), FetchRequest.of("bar", 0, 60));
        final BroadcastGroup.Split split =
            group("g", SHORT, child).splitRequest(ctx, request, child);

        assertEquals(1, split.getErrors().size());
        assertTrue(ZipperException.is(split.getErrors().get(0), ErrorKind.NO_METRICS_FETCHED));
        assertEquals(ImmutableList.of("bar"), split.getBatches().get(0).names());
    }

    @Test
    public void testConcurrencyLimitPerChild() {
        final FakeBackend child = FakeBackend
            .builder("a")
            .maxMetricsPerRequest(1)
            .delay(50, TimeUnit.MILLISECONDS)
            .fetch(BroadcastGroupTest::echo)
            .build();

        final BroadcastGroup group = BroadcastGroup
            .builder("g")
            .children(ImmutableList.of(child))
            .concurrencyLimit(1)
            .doMultipleRequestsIfSplit(true)
            .async(async)
            .build();

        final BackendResult<MultiFetchResponse> result = group.fetch(ctx,
            MultiFetchRequest.of(FetchRequest.of("a", 0, 60), FetchRequest.of("b", 0, 60),
                FetchRequest.of("c", 0, 60), FetchRequest.of("d", 0, 60)));

        assertFalse(result.hasErrors());
        assertEquals(4, result.getResponse().get().getMetrics().size());
        assertEquals(4, child.calls());
        assertEquals(1, child.maxInFlight());
    }

    @Test
    public void testChildrenAreSplitConcurrently() {
        final Timeouts timeouts = Timeouts.of(Duration.of(900, TimeUnit.MILLISECONDS),
            Duration.of(900, TimeUnit.MILLISECONDS), Duration.of(100, TimeUnit.MILLISECONDS));
        final MultiGlobResponse leaves = MultiGlobResponse.of(new GlobResponse("foo.*",
            ImmutableList.of(GlobMatch.leaf("foo.a"), GlobMatch.leaf("foo.b"))));

        final List<BackendServer> children = ImmutableList.of("a", "b", "c")
            .stream()
            .map(name -> FakeBackend
                .builder(name)
                .maxMetricsPerRequest(1)
                .delay(250, TimeUnit.MILLISECONDS)
                .find(leaves)
                .fetch(BroadcastGroupTest::echo)
                .build())
            .collect(Collectors.toList());

        final BroadcastGroup group = BroadcastGroup
            .builder("g")
            .children(children)
            .timeouts(timeouts)
            .doMultipleRequestsIfSplit(true)
            .async(async)
            .build();

        final BackendResult<MultiFetchResponse> result =
            group.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.*", 0, 60)));

        assertFalse(result.isFatal());
        assertEquals(0, result.getStats().get(Stats.TIMEOUTS));
        assertThat(result
            .getResponse()
            .get()
            .getMetrics()
            .stream()
            .map(FetchResponse::getName)
            .collect(Collectors.toList()), containsInAnyOrder("foo.a", "foo.b"));
    }

    @Test
    public void testSequentialSplit() {
        final FakeBackend child = FakeBackend
            .builder("a")
            .maxMetricsPerRequest(2)
            .fetch(BroadcastGroupTest::echo)
            .build();

        final BackendResult<MultiFetchResponse> result = group("g", SHORT, child).fetch(ctx,
            MultiFetchRequest.of(FetchRequest.of("a", 0, 60), FetchRequest.of("b", 0, 60),
                FetchRequest.of("c", 0, 60)));

        assertEquals(ImmutableList.of("a", "b", "c"), result
            .getResponse()
            .get()
            .getMetrics()
            .stream()
            .map(FetchResponse::getName)
            .collect(Collectors.toList()));
        assertEquals(2, child.calls());
    }

    @Test
    public void testBackendsAreFlattened() {
        final BroadcastGroup inner = group("inner", SHORT, FakeBackend.builder("a").build(),
            FakeBackend.builder("b").build());
        final BroadcastGroup outer = group("outer", SHORT, inner, FakeBackend.builder("a").build(),
            FakeBackend.builder("c").build());

        assertEquals(ImmutableList.of("a", "b", "c"), outer.backends());
    }

    private BroadcastGroup group(
        final String name, final Timeouts timeouts, final BackendServer... children
    ) {
        return BroadcastGroup
            .builder(name)
            .children(ImmutableList.copyOf(children))
            .timeouts(timeouts)
            .async(async)
            .build();
    }

    private static FakeBackend serving(final String name) {
        return FakeBackend.builder(name).fetch(BroadcastGroupTest::echo).build();
    }

    private static BackendResult<MultiFetchResponse> echo(final MultiFetchRequest request) {
        return ok(new MultiFetchResponse(request
            .getMetrics()
            .stream()
            .map(m -> FetchResponse.of(m.getName(), m.getStartTime(), 60, 1.0, 2.0))
            .collect(Collectors.toList())));
    }

    private static <T> BackendResult<T> ok(final T response) {
        return BackendResult.ok(response, Stats.empty());
    }
}

package com.spotify.zipper.prometheus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.config.BackendConfig;
import com.spotify.zipper.config.ZipperConfig;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.NoopLimiter;
import com.spotify.zipper.metric.FetchRequest;
import com.spotify.zipper.metric.FetchResponse;
import com.spotify.zipper.metric.GlobMatch;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.MetricInfo;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import com.spotify.zipper.metric.Retention;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PrometheusBackendTest {
    private static final String MATRIX = "{\"status\":\"success\",\"data\":{\"resultType\":" +
        "\"matrix\",\"result\":[{\"metric\":{\"__name__\":\"foo\",\"dc\":\"us\"}," +
        "\"values\":[[0,\"1\"],[60,\"NaN\"],[120,\"3\"]]}]}}";

    private MockWebServer server;
    private String address;
    private PrometheusBackend backend;
    private QueryContext ctx;

    @Before
    public void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        address = "http://" + server.getHostName() + ":" + server.getPort();
        backend = backend(ImmutableMap.of(PrometheusBackend.STEP_OPTION, 60));
        ctx = QueryContext.background();
    }

    @After
    public void teardown() throws Exception {
        server.shutdown();
    }

    @Test
    public void testFetch() throws Exception {
        server.enqueue(json(MATRIX));

        final BackendResult<MultiFetchResponse> result =
            backend.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo", 0, 120)));

        final HttpUrl url = server.takeRequest().getRequestUrl();
        assertEquals("/api/v1/query_range", url.encodedPath());
        assertEquals("foo", url.queryParameter("query"));
        assertEquals("0", url.queryParameter("start"));
        assertEquals("120", url.queryParameter("end"));
        assertEquals("60", url.queryParameter("step"));

        assertFalse(result.hasErrors());
        final FetchResponse series = result.getResponse().get().getMetrics().get(0);
        assertEquals("foo;dc=us", series.getName());
        assertEquals("foo", series.getPathExpression());
        assertEquals(60, series.getStepTime());
        assertEquals(120, series.getStopTime());
        assertEquals(1.0, series.getValues()[0], 0.0);
        assertTrue(Double.isNaN(series.getValues()[1]));
        assertEquals(3.0, series.getValues()[2], 0.0);
        assertEquals(1, result.getStats().get(Stats.RENDER_REQUESTS));
    }

    @Test
    public void testFetchTagged() throws Exception {
        server.enqueue(json(MATRIX));

        backend.fetch(ctx, MultiFetchRequest.of(
            FetchRequest.of("seriesByTag('name=foo','dc=us','__step__=120')", 0, 120)));

        final HttpUrl url = server.takeRequest().getRequestUrl();
        assertEquals("foo{dc=\"us\"}", url.queryParameter("query"));
        assertEquals("120", url.queryParameter("step"));
    }

    @Test
    public void testFetchGlob() throws Exception {
        server.enqueue(json(MATRIX));

        backend.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo.*", 0, 120)));

        assertEquals("{__name__=~\"^foo\\..*$\"}",
            server.takeRequest().getRequestUrl().queryParameter("query"));
    }

    @Test
    public void testFetchInvalidStep() {
        final BackendResult<MultiFetchResponse> result = backend.fetch(ctx, MultiFetchRequest.of(
            FetchRequest.of("seriesByTag('name=foo','__step__=abc')", 0, 120)));

        assertTrue(result.isFatal());
        assertTrue(result.getErrors().contains(ErrorKind.INVALID_ARGUMENT));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    public void testFetchBadData() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody(
            "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}"));

        final BackendResult<MultiFetchResponse> result =
            backend.fetch(ctx, MultiFetchRequest.of(FetchRequest.of("foo", 0, 120)));

        assertTrue(result.isFatal());
        final ZipperException error = (ZipperException) result.getErrors().first().get();
        assertEquals(ErrorKind.INVALID_ARGUMENT, error.getKind());
        assertEquals("parse error", error.getMessage());
        assertEquals(address, error.getServer().get());
    }

    @Test
    public void testFindAll() throws Exception {
        server.enqueue(json("{\"status\":\"success\",\"data\":[\"foo.bar\",\"baz\"]}"));

        final BackendResult<MultiGlobResponse> result = backend.find(ctx, MultiGlobRequest.of("*"));

        assertEquals("/api/v1/label/__name__/values", server.takeRequest().getPath());
        assertEquals(ImmutableList.of(GlobMatch.branch("foo"), GlobMatch.leaf("baz")),
            result.getResponse().get().getMetrics().get(0).getMatches());
    }

    @Test
    public void testFindGlob() throws Exception {
        server.enqueue(json("{\"status\":\"success\",\"data\":[{\"__name__\":\"foo.bar\"}," +
            "{\"__name__\":\"foo.baz.qux\"},{\"__name__\":\"foo.baz.quux\"},{\"job\":\"x\"}]}"));

        final BackendResult<MultiGlobResponse> result =
            backend.find(ctx, MultiGlobRequest.of("foo.*"));

        final RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/series", request.getRequestUrl().encodedPath());
        assertEquals("{__name__=~\"^foo\\..*$\"}",
            request.getRequestUrl().queryParameter("match[]"));
        assertEquals(ImmutableList.of(GlobMatch.leaf("foo.bar"), GlobMatch.branch("foo.baz")),
            result.getResponse().get().getMetrics().get(0).getMatches());
    }

    @Test
    public void testProbe() {
        server.enqueue(json("{\"status\":\"success\",\"data\":[\"foo.bar\",\"baz\"]}"));

        assertEquals(ImmutableList.of("foo", "baz"), backend.probeTLDs(ctx).getResponse().get());
    }

    @Test
    public void testInfo() {
        final BackendResult<InfoResponse> result =
            backend.info(ctx, MultiMetricsInfoRequest.of("foo"));

        final MetricInfo info = result.getResponse().get().getServers().get(address).get(0);
        assertEquals("foo", info.getName());
        assertEquals(60 * PrometheusBackend.DEFAULT_MAX_POINTS_PER_QUERY, info.getMaxRetention());
        assertEquals(ImmutableList.of(
            new Retention(60, PrometheusBackend.DEFAULT_MAX_POINTS_PER_QUERY)),
            info.getRetentions());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    public void testTagNames() throws Exception {
        server.enqueue(json("{\"status\":\"success\",\"data\":[\"__name__\",\"dc\",\"host\"]}"));

        final BackendResult<List<String>> result =
            backend.tagNames(ctx, "tagPrefix=d&expr=name%3Dfoo", 10);

        final HttpUrl url = server.takeRequest().getRequestUrl();
        assertEquals("/api/v1/labels", url.encodedPath());
        assertEquals("{__name__=\"foo\"}", url.queryParameter("match[]"));
        assertEquals(ImmutableList.of("dc"), result.getResponse().get());
    }

    @Test
    public void testTagNamesLimit() {
        server.enqueue(json("{\"status\":\"success\",\"data\":[\"__name__\",\"dc\",\"host\"]}"));

        final BackendResult<List<String>> result = backend.tagNames(ctx, "", 2);

        assertEquals(ImmutableList.of("name", "dc"), result.getResponse().get());
    }

    @Test
    public void testTagValues() throws Exception {
        server.enqueue(json("{\"status\":\"success\",\"data\":[\"foo\",\"bar\",\"foobar\"]}"));

        final BackendResult<List<String>> result =
            backend.tagValues(ctx, "tag=name&valuePrefix=foo", -1);

        assertEquals("/api/v1/label/__name__/values", server.takeRequest().getPath());
        assertEquals(ImmutableList.of("foo", "foobar"), result.getResponse().get());
    }

    @Test
    public void testTagValuesRequiresTag() {
        final BackendResult<List<String>> result = backend.tagValues(ctx, "valuePrefix=foo", -1);

        assertTrue(result.isFatal());
        assertTrue(result.getErrors().contains(ErrorKind.INVALID_ARGUMENT));

        final BackendResult<List<String>> invalid = backend.tagValues(ctx, "tag=a%2Fb", -1);
        assertTrue(invalid.getErrors().contains(ErrorKind.INVALID_ARGUMENT));
        assertEquals(0, server.getRequestCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidStepOption() {
        backend(ImmutableMap.of(PrometheusBackend.STEP_OPTION, 0));
    }

    private PrometheusBackend backend(final ImmutableMap<String, Object> options) {
        return new PrometheusBackend(BackendConfig
            .builder("prometheus", "prometheus")
            .servers(ImmutableList.of(address))
            .backendOptions(options)
            .build()
            .resolve(ZipperConfig.builder().build()), NoopLimiter.get());
    }

    private static MockResponse json(final String body) {
        return new MockResponse().setHeader("Content-Type", PrometheusBackend.CONTENT_TYPE)
            .setBody(body);
    }
}

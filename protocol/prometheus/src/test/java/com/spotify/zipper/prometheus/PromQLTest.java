package com.spotify.zipper.prometheus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.zipper.errors.ZipperException;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PromQLTest {
    @Test
    public void testParseTag() {
        assertEquals(new PromQL.TagExpression("dc", "=", "us"), PromQL.parseTag("dc=us"));
        assertEquals(new PromQL.TagExpression("dc", "!=", "us"), PromQL.parseTag("dc!=us"));
        assertEquals(new PromQL.TagExpression("dc", "=~", "us.*"), PromQL.parseTag("dc=~us.*"));
        assertEquals(new PromQL.TagExpression("dc", "!~", "us.*"), PromQL.parseTag("dc!=~us.*"));
        assertEquals(new PromQL.TagExpression("dc", "=", ""), PromQL.parseTag("dc="));
    }

    @Test(expected = ZipperException.class)
    public void testParseTagWithoutOperator() {
        PromQL.parseTag("dc");
    }

    @Test
    public void testSeriesByTag() {
        final PromQL.Selector selector =
            PromQL.seriesByTag("seriesByTag('name=foo', 'host=~web.*', 'dc=us')");

        assertEquals("foo{dc=\"us\", host=~\"web.*\"}", selector.getQuery());
        assertEquals(Optional.empty(), selector.getStep());
    }

    @Test
    public void testSeriesByTagNameRegex() {
        final PromQL.Selector selector =
            PromQL.seriesByTag("seriesByTag(\"name=~foo.*\",\"__step__=60\")");

        assertEquals("{__name__=~\"foo.*\"}", selector.getQuery());
        assertEquals(Optional.of("60"), selector.getStep());
    }

    @Test(expected = ZipperException.class)
    public void testSeriesByTagUnterminated() {
        PromQL.seriesByTag("seriesByTag('name=foo'");
    }

    @Test
    public void testGlobToRegex() {
        assertEquals("foo\\.bar", PromQL.globToRegex("foo.bar"));
        assertEquals("foo\\.[^.]*?\\.baz", PromQL.globToRegex("foo.*.baz"));
        assertEquals("foo\\..*", PromQL.globToRegex("foo.*"));
        assertEquals("foo\\.(a|b)\\.c", PromQL.globToRegex("foo.{a,b}.c"));
        assertEquals("foo\\.[0-9]x", PromQL.globToRegex("foo.[0-9]x"));
        assertEquals("foo\\.\\{a", PromQL.globToRegex("foo.{a"));
        assertTrue("foo.bar.baz".matches(PromQL.globToRegex("foo.*.baz")));
        assertTrue(!"foo.a.b.baz".matches(PromQL.globToRegex("foo.*.baz")));
    }

    @Test
    public void testToGraphiteName() {
        assertEquals("foo;a=1;b=2",
            PromQL.toGraphiteName(ImmutableMap.of("b", "2", "__name__", "foo", "a", "1")));
        assertEquals(";a=1", PromQL.toGraphiteName(ImmutableMap.of("a", "1")));
    }

    @Test
    public void testAlignValues() {
        final double[] values = PromQL.alignValues(0, 180, 60, ImmutableList.of(
            new Sample(0, 1.0), new Sample(30, 9.0), new Sample(120, 3.0)));

        assertEquals(4, values.length);
        assertEquals(1.0, values[0], 0.0);
        assertTrue(Double.isNaN(values[1]));
        assertEquals(3.0, values[2], 0.0);
        assertTrue(Double.isNaN(values[3]));
    }

    @Test
    public void testAdjustStep() {
        assertEquals(15, PromQL.adjustStep(0, 3600, 11000, 15));
        assertEquals(300, PromQL.adjustStep(0, 30 * 86400, 11000, 15));
        assertEquals(120, PromQL.adjustStep(0, 3600, 11000, 120));
        assertEquals(86400, PromQL.adjustStep(0, 100L * 365 * 86400, 1000, 15));
    }

    @Test
    public void testParseValue() {
        assertTrue(Double.isNaN(Sample.parseValue("NaN")));
        assertEquals(Double.POSITIVE_INFINITY, Sample.parseValue("+Inf"), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, Sample.parseValue("-Inf"), 0.0);
        assertEquals(1.5, Sample.parseValue("1.5"), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSampleShape() {
        Sample.fromPair(ImmutableList.of(1));
    }
}

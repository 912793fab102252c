package com.trading.brownian.io;

import com.trading.brownian.api.Observation;
import com.trading.brownian.interp.LinearStreamingInterpolator;
import com.trading.brownian.interp.NearestNeighborStreamingInterpolator;
import com.trading.brownian.process.BrownianProcess;
import com.trading.brownian.process.InvalidParameterException;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.Set;

import static org.junit.Assert.*;

public class ModelLoaderTest {
    private ModelLoader loader;

    @Before
    public void setUp() {
        loader = new ModelLoader();
    }

    @Test
    public void testLoadResource() throws IOException {
        ModelContext ctx = loader.compile(loader.parseResource("models/rates.json"));

        assertEquals("rates", ctx.name());
        assertEquals(Set.of("short_rate", "short_rate_mirror", "observed"), ctx.processNames());
        assertEquals(Set.of("curve", "steps"), ctx.interpolatorNames());

        BrownianProcess rate = ctx.process("short_rate");
        assertEquals(0.2, rate.getSigma(), 0.0);
        assertEquals(0.01, rate.getDrift(), 0.0);
        assertEquals(1.5, rate.getPossibleValueDistr(0.0).mean(), 0.0);

        assertTrue(ctx.interpolator("curve") instanceof LinearStreamingInterpolator);
        assertTrue(ctx.interpolator("steps") instanceof NearestNeighborStreamingInterpolator);
        assertEquals(40.0, ctx.interpolator("curve").getInterpolatedVal(4.0), 1e-12);
        assertEquals(100.0, ctx.interpolator("steps").getInterpolatedVal(7.0), 0.0);
    }

    @Test
    public void testSharedHistoryAndInitialObservations() throws IOException {
        ModelContext ctx = loader.compile(loader.parseResource("models/rates.json"));

        BrownianProcess rate = ctx.process("short_rate");
        BrownianProcess mirror = ctx.process("short_rate_mirror");
        assertSame(rate.getHistory(), mirror.getHistory());
        // The first seed is kept
        assertEquals(1.5, mirror.getPossibleValueDistr(0.0).mean(), 0.0);

        double v = rate.getValue(2.0);
        assertEquals(v, mirror.getPossibleValueDistr(2.0).mean(), 0.0);

        BrownianProcess observed = ctx.process("observed");
        assertEquals(3, observed.getHistory().size());
        assertEquals(new Observation(20.0, -2.0), observed.getHistory().get(20.0));
    }

    @Test
    public void testSeededProcessesAreReproducible() throws IOException {
        ModelContext a = loader.compile(loader.parseResource("models/rates.json"));
        ModelContext b = loader.compile(loader.parseResource("models/rates.json"));

        assertArrayEquals(a.process("short_rate").getValues(1.0, 3.0, 2.0),
                b.process("short_rate").getValues(1.0, 3.0, 2.0), 0.0);
    }

    @Test
    public void testMissingSigma() {
        String json = "{\"model\":{\"name\":\"m\",\"processes\":[{\"name\":\"p\"}]}}";
        try {
            loader.compile(loader.parse(json));
            fail("Missing sigma should be rejected");
        } catch (InvalidParameterException e) {
            assertTrue(e.getMessage().contains("sigma"));
        }
    }

    @Test
    public void testNegativeSigma() {
        String json = "{\"model\":{\"processes\":[{\"name\":\"p\",\"sigma\":-1}]}}";
        try {
            loader.compile(loader.parse(json));
            fail("Negative sigma should be rejected");
        } catch (InvalidParameterException e) {
            assertTrue(e.getMessage().contains("sigma"));
        }
    }

    @Test
    public void testDuplicateNames() {
        String json = "{\"model\":{\"processes\":[{\"name\":\"x\",\"sigma\":1}],"
                + "\"interpolators\":[{\"name\":\"x\",\"type\":\"linear\"}]}}";
        try {
            loader.compile(loader.parse(json));
            fail("Duplicate names should be rejected");
        } catch (InvalidParameterException e) {
            assertTrue(e.getMessage().contains("Duplicate"));
        }
    }

    @Test
    public void testUnknownSharedHistory() {
        String json = "{\"model\":{\"processes\":[{\"name\":\"a\",\"sigma\":1,\"history\":\"b\"},"
                + "{\"name\":\"b\",\"sigma\":1}]}}";
        try {
            loader.compile(loader.parse(json));
            fail("Forward history reference should be rejected");
        } catch (InvalidParameterException e) {
            assertTrue(e.getMessage().contains("'b'"));
        }
    }

    @Test
    public void testBadObservationPair() {
        String json = "{\"model\":{\"interpolators\":[{\"name\":\"i\",\"type\":\"linear\","
                + "\"observations\":[[1,2,3]]}]}}";
        try {
            loader.compile(loader.parse(json));
            fail("Triple should be rejected");
        } catch (InvalidParameterException e) {
            assertTrue(e.getMessage().contains("pair"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInterpolatorType() {
        String json = "{\"model\":{\"interpolators\":[{\"name\":\"i\",\"type\":\"spline\"}]}}";
        loader.compile(loader.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        loader.parse("{\"model\": ");
    }

    @Test
    public void testMalformedResourceReportedLikeMalformedString() throws IOException {
        try {
            loader.parseResource("models/truncated.json");
            fail("Truncated resource should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Malformed model definition"));
        }
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        loader.parseResource("models/does_not_exist.json");
    }

    @Test(expected = InvalidParameterException.class)
    public void testMissingModelKey() {
        loader.compile(loader.parse("{}"));
    }

    @Test
    public void testUnknownLookupsFail() throws IOException {
        ModelContext ctx = loader.compile(loader.parseResource("models/rates.json"));
        try {
            ctx.process("nope");
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("nope"));
        }
        try {
            ctx.interpolator("nope");
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("nope"));
        }
    }
}

package com.trading.brownian.interp;

import com.trading.brownian.store.TreeObservationStore;
import org.junit.Test;

import static org.junit.Assert.*;

public class LinearStreamingInterpolatorTest {

    @Test
    public void testEmptyReturnsNaN() {
        assertTrue(Double.isNaN(new LinearStreamingInterpolator().getInterpolatedVal(1.0)));
    }

    @Test
    public void testSinglePointAnswersEverywhere() {
        LinearStreamingInterpolator interp = new LinearStreamingInterpolator();
        interp.insert(5.0, 10.0);

        assertEquals(10.0, interp.getInterpolatedVal(5.0), 0.0);
        assertEquals(10.0, interp.getInterpolatedVal(-100.0), 0.0);
        assertEquals(10.0, interp.getInterpolatedVal(1e6), 0.0);
    }

    @Test
    public void testInterpolatesBetweenNeighbors() {
        LinearStreamingInterpolator interp = new LinearStreamingInterpolator();
        interp.insert(10.0, 100.0);
        interp.insert(0.0, 0.0);

        assertEquals(40.0, interp.getInterpolatedVal(4.0), 1e-12);
        assertEquals(75.0, interp.getInterpolatedVal(7.5), 1e-12);
        assertEquals(0.0, interp.getInterpolatedVal(0.0), 0.0);
        assertEquals(100.0, interp.getInterpolatedVal(10.0), 0.0);
    }

    @Test
    public void testNoExtrapolation() {
        LinearStreamingInterpolator interp = new LinearStreamingInterpolator();
        interp.insert(0.0, 0.0);
        interp.insert(10.0, 100.0);

        assertEquals(0.0, interp.getInterpolatedVal(-5.0), 0.0);
        assertEquals(100.0, interp.getInterpolatedVal(15.0), 0.0);
    }

    @Test
    public void testStreamedPointsNarrowTheBracket() {
        LinearStreamingInterpolator interp = new LinearStreamingInterpolator();
        interp.insert(0.0, 0.0);
        interp.insert(10.0, 100.0);
        assertEquals(50.0, interp.getInterpolatedVal(5.0), 1e-12);

        interp.insert(6.0, 0.0);
        assertEquals(0.0, interp.getInterpolatedVal(5.0), 1e-12);
        assertEquals(50.0, interp.getInterpolatedVal(8.0), 1e-12);
    }

    @Test
    public void testKeysNearDoubleRangeLimits() {
        LinearStreamingInterpolator interp = new LinearStreamingInterpolator();
        interp.insert(-1.5e308, 0.0);
        interp.insert(1.5e308, 100.0);

        assertEquals(50.0, interp.getInterpolatedVal(0.0), 1e-9);
        assertEquals(75.0, interp.getInterpolatedVal(0.75e308), 1e-9);
        assertFalse(Double.isNaN(interp.getInterpolatedVal(1.4e308)));
    }

    @Test
    public void testSharedStore() {
        TreeObservationStore store = new TreeObservationStore();
        LinearStreamingInterpolator a = new LinearStreamingInterpolator(store);
        NearestNeighborStreamingInterpolator b = new NearestNeighborStreamingInterpolator(store);

        a.insert(0.0, 0.0);
        b.insert(10.0, 100.0);

        assertEquals(30.0, a.getInterpolatedVal(3.0), 1e-12);
        assertEquals(0.0, b.getInterpolatedVal(3.0), 0.0);
        assertSame(store, a.getStore());
    }

    @Test
    public void testType() {
        assertEquals(InterpolatorType.LINEAR, new LinearStreamingInterpolator().type());
    }
}

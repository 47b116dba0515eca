package com.farmer.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class TanWcsTest {

    private static final double SCALE = 1.55 / 3600.0;

    @Test
    public void referencePixelMapsToReferenceCoordinates() {
        TanWcs wcs = new TanWcs(150.0, 2.2, 101, 51, -SCALE, 0, 0, SCALE);
        // CRPIX está en base 1
        CelestialPoint p = wcs.pixelToWorld(100, 50);
        assertEquals(150.0, p.ra(), 1e-9);
        assertEquals(2.2, p.dec(), 1e-9);
    }

    @Test
    public void offsetsFollowTheCdMatrix() {
        TanWcs wcs = new TanWcs(10.0, 0.0, 1, 1, -SCALE, 0, 0, SCALE);
        CelestialPoint p = wcs.pixelToWorld(0, 100);
        assertEquals(10.0, p.ra(), 1e-9);
        assertEquals(100 * SCALE, p.dec(), 1e-7);

        CelestialPoint q = wcs.pixelToWorld(100, 0);
        assertTrue(q.ra() < 10.0);
    }

    @Test
    public void raWrapsIntoRange() {
        TanWcs wcs = new TanWcs(0.0, 0.0, 1, 1, -SCALE, 0, 0, SCALE);
        CelestialPoint p = wcs.pixelToWorld(10, 0);
        assertTrue(p.ra() > 359.0 && p.ra() < 360.0);
    }

    @Test
    public void pixelScaleInArcsec() {
        TanWcs wcs = new TanWcs(0, 0, 1, 1, -SCALE, 0, 0, SCALE);
        assertEquals(1.55, wcs.pixelScaleArcsec(), 1e-9);
    }
}

package com.farmer.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class FitConfigTest {

    @Test
    public void defaults() {
        FitConfig c = FitConfig.defaults();
        assertEquals(0.85, c.sparseThreshold, 0.0);
        assertEquals(1000, c.sparseSize);
        assertEquals(100, c.maxSteps);
        assertEquals(0.1, c.convergenceThreshold, 0.0);
        assertEquals(0.5, c.expDevThreshold, 0.0);
        assertEquals(4, c.threads);
    }

    @Test
    public void radiiAreConvertedToPixels() {
        FitConfig c = FitConfig.builder().pixelScale(2.0).apertureRadii(2, 4).build();
        assertArrayEquals(new double[]{1, 2}, c.apertureRadiiPixels(), 1e-12);
        assertEquals(SimpleGalaxy.RADIUS_ARCSEC / 2.0, c.simpleGalaxyRadius(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositivePixelScale() {
        FitConfig.builder().pixelScale(0).build();
    }

    @Test
    public void apertureListRoundTripsThroughPreferencesFormat() {
        assertEquals("2.00,4.00,8.00", AppConfig.formatList(new double[]{2, 4, 8}));
        assertArrayEquals(new double[]{1.5, 3}, AppConfig.parseList(" 1.5, 3 ,"), 0.0);
        assertEquals(0, AppConfig.parseList("").length);
    }
}

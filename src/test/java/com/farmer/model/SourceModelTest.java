package com.farmer.model;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class SourceModelTest {

    private static final String[] BANDS = {"g", "r"};

    @Test
    public void pointSourceFreezesByGroup() {
        PointSource ps = new PointSource(3.0, 4.0, BANDS, new double[]{10, 20});
        assertEquals(4, ps.numberOfParams());

        ps.freezeParams(SourceModel.POS);
        assertTrue(ps.isFrozen(SourceModel.POS));
        assertEquals(2, ps.numberOfParams());
        assertEquals(Arrays.asList("brightness.g", "brightness.r"), ps.thawedParameterNames());
        assertArrayEquals(new double[]{10, 20}, ps.getThawedParams(), 0.0);

        ps.thawAllParams();
        assertEquals(4, ps.numberOfParams());
    }

    @Test
    public void freezeAllButBrightnessLeavesOneParameterPerBand() {
        ExpGalaxy g = new ExpGalaxy(1, 1, BANDS, new double[]{1, 1}, new GalaxyShape(2.0, 0.5, 30));
        assertEquals(7, g.numberOfParams());
        g.freezeAllBut(SourceModel.BRIGHTNESS);
        assertEquals(2, g.numberOfParams());
        assertFalse(g.isFrozen(SourceModel.BRIGHTNESS));
        assertTrue(g.isFrozen("shape"));
    }

    @Test
    public void setThawedParamsReadsFromOffset() {
        PointSource ps = new PointSource(0, 0, BANDS, new double[]{1, 1});
        ps.freezeParams(SourceModel.POS);
        ps.setThawedParams(new double[]{99, 99, 5, 6}, 2);
        assertEquals(5, ps.getFlux(0), 0.0);
        assertEquals(6, ps.getFlux(1), 0.0);
        assertEquals(0, ps.getX(), 0.0);
    }

    @Test
    public void copyIsIndependent() {
        DevGalaxy g = new DevGalaxy(5, 5, BANDS, new double[]{3, 4}, new GalaxyShape(1.5, 0.8, 45));
        g.freezeParams(SourceModel.POS);
        SourceModel c = g.copy();
        c.setPosition(7, 7);
        c.setFluxes(new double[]{0, 0});

        assertEquals(5, g.getX(), 0.0);
        assertEquals(3, g.getFlux(0), 0.0);
        assertTrue(c.isFrozen(SourceModel.POS));
        assertEquals(ModelFamily.DEV_GALAXY, c.family());
    }

    @Test
    public void galaxyShapeIsClamped() {
        ExpGalaxy g = new ExpGalaxy(0, 0, BANDS, new double[]{1, 1}, new GalaxyShape(-1.0, 1.5, 190.0));
        GalaxyShape s = g.getShape();
        assertTrue(s.re() > 0);
        assertEquals(1.0, s.ab(), 0.0);
        assertEquals(10.0, s.phi(), 1e-9);

        g.setThawedParams(new double[]{0, 0, 1, 1, 2.0, 0.5, -30.0}, 0);
        assertEquals(150.0, g.getShape().phi(), 1e-9);
    }

    @Test
    public void compositeReportsDominantComponent() {
        GalaxyShape exp = new GalaxyShape(3.0, 0.4, 10);
        GalaxyShape dev = new GalaxyShape(1.0, 0.9, 80);
        CompositeGalaxy devLike = new CompositeGalaxy(0, 0, BANDS, new double[]{1, 1}, 0.7, exp, dev);
        assertEquals(dev, devLike.getShape());
        assertEquals("shapeDev", devLike.shapeGroup());

        CompositeGalaxy expLike = new CompositeGalaxy(0, 0, BANDS, new double[]{1, 1}, 0.3, exp, dev);
        assertEquals(exp, expLike.getShape());
        assertEquals("shapeExp", expLike.shapeGroup());
    }

    @Test
    public void fracDevStaysInUnitInterval() {
        CompositeGalaxy c = new CompositeGalaxy(0, 0, BANDS, new double[]{1, 1}, 1.7,
                new GalaxyShape(1, 1, 0), new GalaxyShape(1, 1, 0));
        assertEquals(1.0, c.getFracDev(), 0.0);
    }

    @Test
    public void simpleGalaxyHasNoFreeShape() {
        SimpleGalaxy sg = new SimpleGalaxy(0, 0, BANDS, new double[]{1, 1}, 0.3);
        assertEquals(4, sg.numberOfParams());
        assertNull(sg.getShape());
        assertEquals(0.3, sg.radius(), 0.0);
        assertFalse(sg.family().isExtended());
    }
}

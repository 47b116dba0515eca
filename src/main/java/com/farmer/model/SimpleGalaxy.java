package com.farmer.model;

import java.util.List;

/**
 * Galaxia compacta: perfil exponencial redondo de radio fijo. Solo posición y flujo son libres.
 */
public class SimpleGalaxy extends SourceModel {

    public static final double RADIUS_ARCSEC = 0.45;

    private final GalaxyShape shape;

    public SimpleGalaxy(double x, double y, String[] bands, double[] fluxes, double radiusPixels) {
        super(bands, baseNames(bands), baseParams(x, y, fluxes, 0));
        this.shape = new GalaxyShape(radiusPixels, 1.0, 0.0);
    }

    private SimpleGalaxy(SimpleGalaxy other) {
        super(other);
        this.shape = other.shape;
    }

    @Override
    public ModelFamily family() { return ModelFamily.SIMPLE_GALAXY; }

    @Override
    public SourceModel copy() { return new SimpleGalaxy(this); }

    public double radius() { return shape.re(); }

    @Override
    public void addComponents(int band, Psf psf, List<GaussianComponent> out) {
        MixtureProfile.EXPONENTIAL.addComponents(getFlux(band), getX(), getY(), shape, psf, out);
    }
}

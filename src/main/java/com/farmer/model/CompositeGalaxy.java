package com.farmer.model;

import java.util.List;

/**
 * Suma de un disco exponencial y un perfil de de Vaucouleurs con el mismo centro.
 * fracDev es la fracción del flujo en la componente de Vaucouleurs.
 */
public class CompositeGalaxy extends SourceModel {

    public CompositeGalaxy(double x, double y, String[] bands, double[] fluxes, double fracDev,
                           GalaxyShape shapeExp, GalaxyShape shapeDev) {
        super(bands, concat(baseNames(bands), new String[]{"fracDev",
                        "shapeExp.re", "shapeExp.ab", "shapeExp.phi",
                        "shapeDev.re", "shapeDev.ab", "shapeDev.phi"}),
                build(x, y, fluxes, fracDev, shapeExp, shapeDev));
        normalize();
    }

    private CompositeGalaxy(CompositeGalaxy other) {
        super(other);
    }

    private static double[] build(double x, double y, double[] fluxes, double fracDev, GalaxyShape exp, GalaxyShape dev) {
        double[] p = baseParams(x, y, fluxes, 7);
        int o = 2 + fluxes.length;
        p[o] = fracDev;
        GalaxyModel.withShape(p, o + 1, exp);
        GalaxyModel.withShape(p, o + 4, dev);
        return p;
    }

    private int fracOffset() { return 2 + bands.length; }

    @Override
    public ModelFamily family() { return ModelFamily.COMPOSITE_GALAXY; }

    @Override
    public SourceModel copy() { return new CompositeGalaxy(this); }

    public double getFracDev() { return params[fracOffset()]; }

    public GalaxyShape getShapeExp() {
        int o = fracOffset() + 1;
        return new GalaxyShape(params[o], params[o + 1], params[o + 2]);
    }

    public GalaxyShape getShapeDev() {
        int o = fracOffset() + 4;
        return new GalaxyShape(params[o], params[o + 1], params[o + 2]);
    }

    // Se reporta la forma de la componente dominante
    @Override
    public GalaxyShape getShape() {
        return getFracDev() >= 0.5 ? getShapeDev() : getShapeExp();
    }

    @Override
    public String shapeGroup() {
        return getFracDev() >= 0.5 ? "shapeDev" : "shapeExp";
    }

    @Override
    public void addComponents(int band, Psf psf, List<GaussianComponent> out) {
        double flux = getFlux(band);
        double f = getFracDev();
        MixtureProfile.EXPONENTIAL.addComponents(flux * (1.0 - f), getX(), getY(), getShapeExp(), psf, out);
        MixtureProfile.DE_VAUCOULEURS.addComponents(flux * f, getX(), getY(), getShapeDev(), psf, out);
    }

    @Override
    protected void normalize() {
        int o = fracOffset();
        if (!(params[o] > 0)) params[o] = 0;
        if (params[o] > 1) params[o] = 1;
        GalaxyModel.clampShape(params, o + 1);
        GalaxyModel.clampShape(params, o + 4);
    }
}

package com.farmer.model;

import java.util.List;

/**
 * Galaxia de un solo perfil con forma libre (grupo "shape": re, ab, phi).
 */
public abstract class GalaxyModel extends SourceModel {

    static final double MIN_RE = 1e-2;
    static final double MIN_AB = 1e-2;

    protected GalaxyModel(double x, double y, String[] bands, double[] fluxes, GalaxyShape shape) {
        super(bands, concat(baseNames(bands), new String[]{"shape.re", "shape.ab", "shape.phi"}),
                withShape(baseParams(x, y, fluxes, 3), 2 + bands.length, shape));
        normalize();
    }

    protected GalaxyModel(GalaxyModel other) {
        super(other);
    }

    protected abstract MixtureProfile profile();

    private int shapeOffset() { return 2 + bands.length; }

    @Override
    public GalaxyShape getShape() {
        int o = shapeOffset();
        return new GalaxyShape(params[o], params[o + 1], params[o + 2]);
    }

    @Override
    public String shapeGroup() { return "shape"; }

    @Override
    public void addComponents(int band, Psf psf, List<GaussianComponent> out) {
        profile().addComponents(getFlux(band), getX(), getY(), getShape(), psf, out);
    }

    @Override
    protected void normalize() {
        clampShape(params, shapeOffset());
    }

    static double[] withShape(double[] p, int offset, GalaxyShape shape) {
        p[offset] = shape.re();
        p[offset + 1] = shape.ab();
        p[offset + 2] = shape.phi();
        return p;
    }

    static void clampShape(double[] p, int o) {
        if (!(p[o] > MIN_RE)) p[o] = MIN_RE;
        if (!(p[o + 1] > MIN_AB)) p[o + 1] = MIN_AB;
        if (p[o + 1] > 1.0) p[o + 1] = 1.0;
        double phi = p[o + 2] % 180.0;
        p[o + 2] = phi < 0 ? phi + 180.0 : phi;
    }
}

package com.farmer.model;

import java.util.List;

public class PointSource extends SourceModel {

    public PointSource(double x, double y, String[] bands, double[] fluxes) {
        super(bands, baseNames(bands), baseParams(x, y, fluxes, 0));
    }

    private PointSource(PointSource other) {
        super(other);
    }

    @Override
    public ModelFamily family() { return ModelFamily.POINT_SOURCE; }

    @Override
    public SourceModel copy() { return new PointSource(this); }

    @Override
    public void addComponents(int band, Psf psf, List<GaussianComponent> out) {
        double flux = getFlux(band);
        for (int k = 0; k < psf.size(); k++) {
            double v = psf.variance(k);
            out.add(new GaussianComponent(flux * psf.weight(k), getX(), getY(), v, 0, v));
        }
    }
}

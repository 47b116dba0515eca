package com.farmer.model;

public class ExpGalaxy extends GalaxyModel {

    public ExpGalaxy(double x, double y, String[] bands, double[] fluxes, GalaxyShape shape) {
        super(x, y, bands, fluxes, shape);
    }

    private ExpGalaxy(ExpGalaxy other) {
        super(other);
    }

    @Override
    public ModelFamily family() { return ModelFamily.EXP_GALAXY; }

    @Override
    public SourceModel copy() { return new ExpGalaxy(this); }

    @Override
    protected MixtureProfile profile() { return MixtureProfile.EXPONENTIAL; }
}

package com.farmer.model;

public class DevGalaxy extends GalaxyModel {

    public DevGalaxy(double x, double y, String[] bands, double[] fluxes, GalaxyShape shape) {
        super(x, y, bands, fluxes, shape);
    }

    private DevGalaxy(DevGalaxy other) {
        super(other);
    }

    @Override
    public ModelFamily family() { return ModelFamily.DEV_GALAXY; }

    @Override
    public SourceModel copy() { return new DevGalaxy(this); }

    @Override
    protected MixtureProfile profile() { return MixtureProfile.DE_VAUCOULEURS; }
}

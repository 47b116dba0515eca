package com.farmer.model;

public enum ModelFamily {
    POINT_SOURCE(1, "PointSource"),
    SIMPLE_GALAXY(2, "SimpleGalaxy"),
    EXP_GALAXY(3, "ExpGalaxy"),
    DEV_GALAXY(4, "DevGalaxy"),
    COMPOSITE_GALAXY(5, "CompositeGalaxy");

    private final int id;
    private final String modelName;

    ModelFamily(int id, String modelName) {
        this.id = id;
        this.modelName = modelName;
    }

    public int id() { return id; }
    public String modelName() { return modelName; }

    // Solo estas familias reportan forma (reff, ab, phi)
    public boolean isExtended() {
        return this == EXP_GALAXY || this == DEV_GALAXY || this == COMPOSITE_GALAXY;
    }

    public static ModelFamily fromId(int id) {
        for (ModelFamily f : values()) if (f.id == id) return f;
        throw new IllegalArgumentException("Unknown model family id: " + id);
    }
}

package com.farmer.model;

public interface CoordinateTransform {
    /** Coordenadas de píxel (base 0) a cielo. */
    CelestialPoint pixelToWorld(double x, double y);
}

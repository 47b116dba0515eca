package com.farmer.model;

/**
 * Gaussiana 2D ya convolucionada con la PSF. amplitude es el flujo total de la componente.
 */
public record GaussianComponent(double amplitude, double x, double y, double cxx, double cxy, double cyy) {

    public double determinant() {
        return cxx * cyy - cxy * cxy;
    }

    // Radio que cubre ~6 sigma sobre el eje mayor
    public double extent() {
        double tr = (cxx + cyy) / 2.0;
        double disc = Math.sqrt(Math.max(0, tr * tr - determinant()));
        return 6.0 * Math.sqrt(tr + disc);
    }
}

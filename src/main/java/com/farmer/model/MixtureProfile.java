package com.farmer.model;

import java.util.List;

/**
 * Aproximaciones de perfiles de Sérsic por mezcla de gaussianas (Hogg &amp; Lang 2013).
 * Las varianzas están en unidades de re²; las amplitudes se normalizan a flujo 1.
 */
public final class MixtureProfile {

    public static final MixtureProfile EXPONENTIAL = new MixtureProfile(
            new double[]{2.34853813e-03, 3.07995260e-02, 2.23364214e-01, 1.17949102e+00, 4.33873750e+00, 5.99820770e+00},
            new double[]{1.20078965e-03, 8.84526493e-03, 3.91463084e-02, 1.39976817e-01, 4.60962500e-01, 1.50159566e+00});

    public static final MixtureProfile DE_VAUCOULEURS = new MixtureProfile(
            new double[]{4.26347652e-02, 2.40127183e-01, 6.85907632e-01, 1.51937350e+00,
                    2.83627243e+00, 4.46467501e+00, 5.72440830e+00, 5.60989349e+00},
            new double[]{2.23759216e-04, 1.00220099e-03, 4.18731126e-03, 1.69432589e-02,
                    6.84850479e-02, 2.87207080e-01, 1.33320254e+00, 8.40146955e+00});

    private final double[] amplitudes;
    private final double[] variances;

    private MixtureProfile(double[] amplitudes, double[] variances) {
        double total = 0;
        for (double a : amplitudes) total += a;
        this.amplitudes = new double[amplitudes.length];
        for (int i = 0; i < amplitudes.length; i++) this.amplitudes[i] = amplitudes[i] / total;
        this.variances = variances.clone();
    }

    /** Añade las componentes del perfil, escaladas por flux y convolucionadas con cada gaussiana de la PSF. */
    public void addComponents(double flux, double x, double y, GalaxyShape shape, Psf psf, List<GaussianComponent> out) {
        double phi = Math.toRadians(shape.phi());
        double c = Math.cos(phi), s = Math.sin(phi);
        double ab2 = shape.ab() * shape.ab();
        double mxx = c * c + ab2 * s * s;
        double myy = s * s + ab2 * c * c;
        double mxy = c * s * (1.0 - ab2);
        double re2 = shape.re() * shape.re();
        for (int j = 0; j < amplitudes.length; j++) {
            double v = re2 * variances[j];
            for (int k = 0; k < psf.size(); k++) {
                double pv = psf.variance(k);
                out.add(new GaussianComponent(flux * amplitudes[j] * psf.weight(k), x, y,
                        v * mxx + pv, v * mxy, v * myy + pv));
            }
        }
    }
}

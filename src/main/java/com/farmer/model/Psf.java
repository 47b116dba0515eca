package com.farmer.model;

import java.util.Arrays;

/**
 * PSF como mezcla de gaussianas circulares centradas.
 */
public final class Psf {

    private static final double DEFAULT_SIGMA = 2.0;

    private final double[] weights;
    private final double[] variances;

    private Psf(double[] weights, double[] variances) {
        this.weights = weights;
        this.variances = variances;
    }

    public static Psf circularGaussians(double[] sigmas, double[] weights) {
        if (sigmas.length != weights.length || sigmas.length == 0) {
            throw new IllegalArgumentException("PSF needs matching, non-empty sigma/weight lists");
        }
        double total = Arrays.stream(weights).sum();
        double[] w = new double[weights.length];
        double[] v = new double[sigmas.length];
        for (int i = 0; i < sigmas.length; i++) {
            w[i] = weights[i] / total;
            v[i] = sigmas[i] * sigmas[i];
        }
        return new Psf(w, v);
    }

    // Sin PSF medida: una gaussiana circular de sigma 2 px
    public static Psf defaultPsf() {
        return circularGaussians(new double[]{DEFAULT_SIGMA}, new double[]{1.0});
    }

    /**
     * Reduce una PSF pixelizada a la gaussiana circular con los mismos segundos momentos.
     * Un stamp nulo es el centinela de "sin PSF medida".
     */
    public static Psf fromStamp(double[][] stamp) {
        if (stamp == null) return defaultPsf();
        double sum = 0, sx = 0, sy = 0;
        for (int y = 0; y < stamp.length; y++) {
            for (int x = 0; x < stamp[y].length; x++) {
                double v = Math.max(0, stamp[y][x]);
                sum += v; sx += v * x; sy += v * y;
            }
        }
        if (sum <= 0) return defaultPsf();
        double cx = sx / sum, cy = sy / sum;
        double m2 = 0;
        for (int y = 0; y < stamp.length; y++) {
            for (int x = 0; x < stamp[y].length; x++) {
                double v = Math.max(0, stamp[y][x]);
                m2 += v * ((x - cx) * (x - cx) + (y - cy) * (y - cy));
            }
        }
        double variance = m2 / sum / 2.0;
        if (variance <= 0) return defaultPsf();
        return new Psf(new double[]{1.0}, new double[]{variance});
    }

    public int size() { return weights.length; }
    public double weight(int i) { return weights[i]; }
    public double variance(int i) { return variances[i]; }
}

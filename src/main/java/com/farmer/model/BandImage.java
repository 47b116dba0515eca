package com.farmer.model;

/**
 * Imagen renderizable de una banda: datos, inverso de la varianza (0 = píxel enmascarado),
 * PSF, calibración fotométrica lineal y cielo constante.
 */
public class BandImage {
    public final String band;
    public final double[][] data;
    public final double[][] invvar;
    public final Psf psf;
    public final double photoScale;
    public final double sky;

    public BandImage(String band, double[][] data, double[][] invvar, Psf psf, double photoScale, double sky) {
        if (data.length != invvar.length || data[0].length != invvar[0].length) {
            throw new IllegalArgumentException("Band " + band + ": data and weight shapes differ");
        }
        this.band = band;
        this.data = data;
        this.invvar = invvar;
        this.psf = psf;
        this.photoScale = photoScale;
        this.sky = sky;
    }

    public int width() { return data[0].length; }
    public int height() { return data.length; }
}

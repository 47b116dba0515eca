package com.farmer.service;

import com.farmer.model.TanWcs;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;

/**
 * Lectura y escritura de imágenes FITS 2D. Las matrices se devuelven indexadas [y][x].
 */
public class FitsImageService {

    public double[][] readImage(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = firstImage(fits, file);
            Header header = hdu.getHeader();
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            double bzero = header.getDoubleValue("BZERO", 0.0);
            return toDoubleRaw(hdu.getKernel(), bscale, bzero, file);
        }
    }

    public int[][] readLabels(File file) throws IOException, FitsException {
        double[][] d = readImage(file);
        int[][] out = new int[d.length][d[0].length];
        for (int y = 0; y < d.length; y++) for (int x = 0; x < d[y].length; x++) out[y][x] = (int) Math.round(d[y][x]);
        return out;
    }

    /**
     * WCS TAN de la cabecera. Sin CRVAL1/CRVAL2 devuelve null.
     */
    public TanWcs readWcs(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            Header header = firstImage(fits, file).getHeader();
            if (!header.containsKey("CRVAL1") || !header.containsKey("CRVAL2")) return null;

            double cd11, cd12, cd21, cd22;
            if (header.containsKey("CD1_1")) {
                cd11 = header.getDoubleValue("CD1_1", 0);
                cd12 = header.getDoubleValue("CD1_2", 0);
                cd21 = header.getDoubleValue("CD2_1", 0);
                cd22 = header.getDoubleValue("CD2_2", 0);
            } else {
                // CDELT + CROTA2
                double cdelt1 = header.getDoubleValue("CDELT1", 1.0);
                double cdelt2 = header.getDoubleValue("CDELT2", 1.0);
                double rot = Math.toRadians(header.getDoubleValue("CROTA2", 0.0));
                cd11 = cdelt1 * Math.cos(rot);
                cd12 = -cdelt2 * Math.sin(rot);
                cd21 = cdelt1 * Math.sin(rot);
                cd22 = cdelt2 * Math.cos(rot);
            }
            return new TanWcs(header.getDoubleValue("CRVAL1", 0), header.getDoubleValue("CRVAL2", 0),
                    header.getDoubleValue("CRPIX1", 1), header.getDoubleValue("CRPIX2", 1), cd11, cd12, cd21, cd22);
        }
    }

    public void writeImage(File file, double[][] data) throws IOException, FitsException {
        float[][] f = new float[data.length][data[0].length];
        for (int y = 0; y < data.length; y++) for (int x = 0; x < data[y].length; x++) f[y][x] = (float) data[y][x];
        try (Fits fits = new Fits();
             DataOutputStream out = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(file)))) {
            fits.addHDU(Fits.makeHDU(f));
            fits.write(out);
        }
    }

    // El HDU primario puede venir vacío con la imagen en la primera extensión
    private static BasicHDU<?> firstImage(Fits fits, File file) throws IOException, FitsException {
        BasicHDU<?> hdu;
        int i = 0;
        while ((hdu = fits.getHDU(i++)) != null) {
            int[] axes = hdu.getAxes();
            if (axes != null && axes.length == 2) return hdu;
        }
        throw new FitsException("No 2D image HDU in " + file.getName());
    }

    private static double[][] toDoubleRaw(Object k, double bscale, double bzero, File file) throws FitsException {
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (s[i][j] & 0xFF) * bscale + bzero;
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof double[][]) {
            double[][] f = (double[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j] * bscale + bzero;
            return d;
        }
        throw new FitsException("Unsupported FITS pixel type in " + file.getName() + ": " + (k == null ? "null" : k.getClass().getSimpleName()));
    }
}

package com.farmer.service;

import com.farmer.model.BackgroundEstimate;
import com.farmer.model.ResidualSource;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

import java.util.ArrayList;
import java.util.List;

public class ImageProcessingService {

    private static final double MAX_THRESHOLD = 1e30;

    // Los píxeles enmascarados pasan como NaN y ImageJ los excluye de las estadísticas
    public static FloatProcessor toFloatProcessor(double[][] data, boolean[][] mask) {
        int h = data.length, w = data[0].length;
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                boolean masked = mask != null && mask[y][x];
                px[y * w + x] = masked ? Float.NaN : (float) data[y][x];
            }
        }
        return ip;
    }

    public BackgroundEstimate estimateBackground(double[][] data, boolean[][] mask) {
        FloatProcessor ip = toFloatProcessor(data, mask);
        ImageStatistics stats = ImageStatistics.getStatistics(ip,
                Measurements.MEAN | Measurements.MODE | Measurements.STD_DEV | Measurements.MIN_MAX, null);
        double skyLevel = stats.dmode;
        if (skyLevel == 0) skyLevel = stats.mean;
        return new BackgroundEstimate(skyLevel, stats.stdDev);
    }

    /**
     * Detecta regiones conexas por encima del umbral con el ParticleAnalyzer de ImageJ.
     * Las coordenadas devueltas son centros de píxel en base 0.
     */
    public List<ResidualSource> detect(FloatProcessor ip, double threshold, int minArea) {
        FloatProcessor work = (FloatProcessor) ip.duplicate();
        work.setThreshold(threshold, MAX_THRESHOLD, FloatProcessor.NO_LUT_UPDATE);

        // --- DETECCIÓN ---
        int measurements = Measurements.AREA | Measurements.CENTROID | Measurements.INTEGRATED_DENSITY;
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE, measurements, rt, minArea, Double.POSITIVE_INFINITY);
        pa.setHideOutputImage(true);
        pa.analyze(new ImagePlus("", work));

        List<ResidualSource> found = new ArrayList<>();
        for (int i = 0; i < rt.getCounter(); i++) {
            double x = rt.getValue("X", i) - 0.5;
            double y = rt.getValue("Y", i) - 0.5;
            found.add(new ResidualSource(x, y, rt.getValue("Area", i), rt.getValue("RawIntDen", i)));
        }
        return found;
    }
}

package com.farmer.service;

import com.farmer.engine.ModelRenderer;
import com.farmer.model.BackgroundEstimate;
import com.farmer.model.ResidualDetection;
import com.farmer.model.ResidualSource;
import com.farmer.model.SourceModel;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Busca fuentes que el modelo no explica en el residuo imagen - modelo de una banda.
 */
public class ResidualDetectionService {
    private static final Logger logger = LoggerFactory.getLogger(ResidualDetectionService.class);

    private final ImageProcessingService imageService;
    private final double threshold;
    private final int minArea;
    private final int deblendNThresh;
    private final double deblendCont;

    public ResidualDetectionService(ImageProcessingService imageService, double threshold, int minArea,
                                    int deblendNThresh, double deblendCont) {
        this.imageService = imageService;
        this.threshold = threshold;
        this.minArea = minArea;
        this.deblendNThresh = deblendNThresh;
        this.deblendCont = deblendCont;
    }

    public ResidualDetection detect(Blob blob, String band, boolean subBackground) {
        int b = blob.bandIndex(band);
        List<SourceModel> solution = blob.getSolutionCatalog();
        if (solution.isEmpty()) throw new IllegalStateException("Blob " + blob.getBlobId() + " has no solution to subtract");

        double[][] image = blob.getImage(b);
        double[][] weight = blob.getWeight(b);
        boolean[][] mask = blob.getMask(b);
        double[][] model = ModelRenderer.render(solution, b, blob.getBandImages().get(b));
        BackgroundEstimate background = imageService.estimateBackground(image, mask);

        boolean unweighted = true;
        for (double[] row : weight) for (double w : row) if (w != 1.0) { unweighted = false; break; }

        // --- IMAGEN DE DETECCIÓN ---
        // Con pesos se detecta en S/N; sin pesos, en unidades de la imagen con umbral en sigmas del fondo
        double thresh;
        double[][] signal = new double[image.length][image[0].length];
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[y].length; x++) {
                double r = image[y][x] - model[y][x];
                if (subBackground) r -= background.level();
                signal[y][x] = unweighted ? r : r * Math.sqrt(Math.max(weight[y][x], 0.0));
            }
        }
        if (unweighted) {
            thresh = threshold * background.rms();
            if (!subBackground) thresh += background.level();
        } else {
            thresh = threshold;
        }

        FloatProcessor ip = ImageProcessingService.toFloatProcessor(signal, mask);
        List<ResidualSource> found = imageService.detect(ip, thresh, minArea);
        if (found.isEmpty()) {
            logger.debug("Blob {}: no residual sources in {}", blob.getBlobId(), band);
            return new ResidualDetection(band, Collections.emptyList(), 0);
        }

        int count = deblend(ip, thresh, found);
        logger.info("Blob {}: found {} residual sources in {}", blob.getBlobId(), count, band);
        return new ResidualDetection(band, found, count);
    }

    /**
     * Detecta y escribe &lt;banda&gt;_n_residual_sources en todas las fuentes del blob.
     */
    public ResidualDetection detectAndStore(Blob blob, String band, boolean subBackground) {
        ResidualDetection result = detect(blob, band, subBackground);
        blob.getParentCatalog().merge(blob.getBlobId(), columns(blob, result));
        return result;
    }

    public static Map<Integer, Map<String, Object>> columns(Blob blob, ResidualDetection result) {
        String column = result.band().replace(' ', '_') + "_n_residual_sources";
        Map<Integer, Map<String, Object>> updates = new HashMap<>();
        for (int i = 0; i < blob.sourceCount(); i++) {
            Map<String, Object> row = new HashMap<>();
            row.put(column, result.count());
            updates.put(blob.getSeeds().get(i).id(), row);
        }
        return updates;
    }

    // Umbrales espaciados exponencialmente entre el umbral de detección y el pico
    int deblend(FloatProcessor ip, double thresh, List<ResidualSource> base) {
        double total = 0;
        for (ResidualSource s : base) total += s.signal();
        double minSignal = deblendCont * total;

        double peak = Double.NEGATIVE_INFINITY;
        float[] px = (float[]) ip.getPixels();
        for (float v : px) if (!Float.isNaN(v) && v > peak) peak = v;

        int best = countAbove(base, minSignal);
        if (!(thresh > 0) || !(peak > thresh) || deblendNThresh < 2) return Math.max(best, 1);

        for (int k = 1; k < deblendNThresh; k++) {
            double level = thresh * Math.pow(peak / thresh, (double) k / deblendNThresh);
            int n = countAbove(imageService.detect(ip, level, 1), minSignal);
            best = Math.max(best, n);
        }
        return Math.max(best, 1);
    }

    private static int countAbove(List<ResidualSource> sources, double minSignal) {
        int n = 0;
        for (ResidualSource s : sources) if (s.signal() >= minSignal) n++;
        return n;
    }
}

package com.farmer.service;

import com.farmer.engine.ModelRenderer;
import com.farmer.model.AperturePhotometryResult;
import com.farmer.model.BackgroundEstimate;
import com.farmer.model.ImageType;
import com.farmer.model.SourceModel;
import ij.gui.OvalRoi;
import ij.measure.Measurements;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fotometría de apertura circular sobre la imagen, el modelo o el residuo de un blob resuelto.
 */
public class AperturePhotometryService {

    private final ImageProcessingService imageService;
    private final double[] radiiPixels;

    public AperturePhotometryService(ImageProcessingService imageService, double[] radiiPixels) {
        this.imageService = imageService;
        this.radiiPixels = radiiPixels.clone();
    }

    public AperturePhotometryResult measure(Blob blob, String band, String imageType, boolean subBackground) {
        ImageType type = ImageType.parse(imageType);
        int b = blob.bandIndex(band);
        List<SourceModel> solution = blob.getSolutionCatalog();
        if (solution.isEmpty()) throw new IllegalStateException("Blob " + blob.getBlobId() + " has no solution for aperture photometry");

        double[][] observed = blob.getImage(b);
        double[][] image;
        switch (type) {
            case IMAGE:
                image = copy(observed);
                break;
            case MODEL:
                image = ModelRenderer.render(solution, b, blob.getBandImages().get(b));
                break;
            case RESIDUAL:
                image = copy(observed);
                double[][] model = ModelRenderer.render(solution, b, blob.getBandImages().get(b));
                for (int y = 0; y < image.length; y++) for (int x = 0; x < image[y].length; x++) image[y][x] -= model[y][x];
                break;
            default:
                throw new IllegalArgumentException("Unsupported image type " + type);
        }

        // --- FONDO Y VARIANZA ---
        BackgroundEstimate background = imageService.estimateBackground(observed, blob.getMask(b));
        if (subBackground) {
            for (double[] row : image) for (int x = 0; x < row.length; x++) row[x] -= background.level();
        }
        double[][] variance = variance(blob.getBandImages().get(b).invvar, background);

        FloatProcessor ip = ImageProcessingService.toFloatProcessor(image, null);
        FloatProcessor vp = ImageProcessingService.toFloatProcessor(variance, null);

        // --- APERTURAS ---
        int n = solution.size();
        int[] ids = new int[n];
        double[][] flux = new double[n][radiiPixels.length];
        double[][] fluxErr = new double[n][radiiPixels.length];
        for (int i = 0; i < n; i++) {
            SourceModel m = solution.get(i);
            ids[i] = blob.getSeeds().get(i).id();
            boolean inside = m.getX() >= 0 && m.getY() >= 0 && m.getX() <= blob.width() - 1 && m.getY() <= blob.height() - 1;
            for (int k = 0; k < radiiPixels.length; k++) {
                if (!inside) {
                    flux[i][k] = Double.NaN;
                    fluxErr[i][k] = Double.NaN;
                    continue;
                }
                flux[i][k] = apertureSum(ip, m.getX(), m.getY(), radiiPixels[k]);
                fluxErr[i][k] = Math.sqrt(apertureSum(vp, m.getX(), m.getY(), radiiPixels[k]));
            }
        }
        return new AperturePhotometryResult(band, type, radiiPixels.clone(), ids, flux, fluxErr);
    }

    /**
     * Mide y escribe las columnas aperphot_&lt;banda&gt;_&lt;tipo&gt; en el catálogo padre.
     */
    public AperturePhotometryResult measureAndStore(Blob blob, String band, String imageType, boolean subBackground) {
        AperturePhotometryResult result = measure(blob, band, imageType, subBackground);
        blob.getParentCatalog().merge(blob.getBlobId(), columns(result));
        return result;
    }

    public static Map<Integer, Map<String, Object>> columns(AperturePhotometryResult result) {
        String column = "aperphot_" + result.band.replace(' ', '_') + "_" + result.imageType.label();
        Map<Integer, Map<String, Object>> updates = new HashMap<>();
        for (int i = 0; i < result.sourceIds.length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(column, result.flux[i]);
            row.put(column + "_err", result.fluxErr[i]);
            updates.put(result.sourceIds[i], row);
        }
        return updates;
    }

    static double apertureSum(FloatProcessor ip, double x, double y, double radius) {
        // Centro del píxel i en coordenadas ImageJ: i + 0.5
        OvalRoi roi = new OvalRoi(x + 0.5 - radius, y + 0.5 - radius, 2 * radius, 2 * radius);
        ip.setRoi(roi);
        ImageStatistics stats = ImageStatistics.getStatistics(ip, Measurements.AREA | Measurements.MEAN, null);
        ip.resetRoi();
        return stats.pixelCount == 0 ? 0.0 : stats.mean * stats.pixelCount;
    }

    // Pesos ya a cero fuera del blob. Sin pesos reales (todos 1 o 0) se usa el rms global del fondo
    static double[][] variance(double[][] invvar, BackgroundEstimate background) {
        boolean unweighted = true;
        for (double[] row : invvar) for (double w : row) if (w != 1.0 && w != 0.0) { unweighted = false; break; }
        double[][] var = new double[invvar.length][invvar[0].length];
        for (int y = 0; y < var.length; y++) {
            for (int x = 0; x < var[y].length; x++) {
                if (!(invvar[y][x] > 0)) continue;
                var[y][x] = unweighted ? background.rms() * background.rms() : 1.0 / invvar[y][x];
            }
        }
        return var;
    }

    private static double[][] copy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int y = 0; y < src.length; y++) out[y] = src[y].clone();
        return out;
    }
}

package com.farmer.engine;

import com.farmer.model.BandImage;
import com.farmer.model.SourceModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conjunto de imágenes y modelos que se optimizan juntos. Los parámetros libres
 * de todos los modelos forman un único vector, en el orden de las fuentes.
 */
public class JointFit {

    private final List<BandImage> images;
    private final List<SourceModel> models;

    public JointFit(List<BandImage> images, List<SourceModel> models) {
        if (images.isEmpty()) throw new IllegalArgumentException("A joint fit needs at least one image");
        this.images = Collections.unmodifiableList(new ArrayList<>(images));
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
    }

    public List<BandImage> getImages() { return images; }
    public List<SourceModel> getCatalog() { return models; }

    public int numberOfParams() {
        int n = 0;
        for (SourceModel m : models) n += m.numberOfParams();
        return n;
    }

    public double[] getParams() {
        double[] out = new double[numberOfParams()];
        int k = 0;
        for (SourceModel m : models) {
            double[] p = m.getThawedParams();
            System.arraycopy(p, 0, out, k, p.length);
            k += p.length;
        }
        return out;
    }

    public void setParams(double[] values) {
        if (values.length != numberOfParams()) {
            throw new IllegalArgumentException("Expected " + numberOfParams() + " parameters, got " + values.length);
        }
        int k = 0;
        for (SourceModel m : models) {
            m.setThawedParams(values, k);
            k += m.numberOfParams();
        }
    }

    public double[][] getModelImage(int band) {
        return ModelRenderer.render(models, band, images.get(band));
    }

    /** (datos - modelo) * sqrt(invvar); cero en píxeles enmascarados. */
    public double[][] getChiImage(int band) {
        BandImage img = images.get(band);
        double[][] model = getModelImage(band);
        double[][] chi = new double[img.height()][img.width()];
        for (int y = 0; y < img.height(); y++) {
            for (int x = 0; x < img.width(); x++) {
                double w = img.invvar[y][x];
                chi[y][x] = w > 0 ? (img.data[y][x] - model[y][x]) * Math.sqrt(w) : 0.0;
            }
        }
        return chi;
    }

    public double chiSquared() {
        double total = 0;
        for (int b = 0; b < images.size(); b++) {
            for (double[] row : getChiImage(b)) for (double v : row) total += v * v;
        }
        return total;
    }
}

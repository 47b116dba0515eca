package com.farmer.engine;

import com.farmer.model.BandImage;
import com.farmer.model.GaussianComponent;
import com.farmer.model.SourceModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renderiza modelos sobre la grilla de una banda, evaluando cada gaussiana en el centro del píxel.
 */
public final class ModelRenderer {

    private ModelRenderer() {}

    public static double[][] render(List<SourceModel> models, int band, BandImage image) {
        double[][] out = new double[image.height()][image.width()];
        if (image.sky != 0) {
            for (double[] row : out) Arrays.fill(row, image.sky);
        }
        for (SourceModel m : models) addSource(m, band, image, out);
        return out;
    }

    public static double[][] renderSource(SourceModel model, int band, BandImage image) {
        double[][] out = new double[image.height()][image.width()];
        addSource(model, band, image, out);
        return out;
    }

    public static void addSource(SourceModel model, int band, BandImage image, double[][] target) {
        List<GaussianComponent> comps = new ArrayList<>();
        model.addComponents(band, image.psf, comps);
        for (GaussianComponent c : comps) addComponent(c, image.photoScale, target);
    }

    static void addComponent(GaussianComponent c, double scale, double[][] target) {
        double det = c.determinant();
        if (!(det > 0) || c.amplitude() == 0) return;
        int h = target.length, w = target[0].length;
        double ext = c.extent();
        int x0 = Math.max(0, (int) Math.floor(c.x() - ext));
        int x1 = Math.min(w - 1, (int) Math.ceil(c.x() + ext));
        int y0 = Math.max(0, (int) Math.floor(c.y() - ext));
        int y1 = Math.min(h - 1, (int) Math.ceil(c.y() + ext));
        if (x0 > x1 || y0 > y1) return;

        double ixx = c.cyy() / det, iyy = c.cxx() / det, ixy = -c.cxy() / det;
        double norm = scale * c.amplitude() / (2.0 * Math.PI * Math.sqrt(det));
        for (int y = y0; y <= y1; y++) {
            double dy = y - c.y();
            double[] row = target[y];
            for (int x = x0; x <= x1; x++) {
                double dx = x - c.x();
                double q = ixx * dx * dx + 2.0 * ixy * dx * dy + iyy * dy * dy;
                row[x] += norm * Math.exp(-0.5 * q);
            }
        }
    }
}

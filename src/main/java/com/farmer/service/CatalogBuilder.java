package com.farmer.service;

import com.farmer.model.CatalogRow;
import com.farmer.model.SourceCatalog;

import java.util.Map;
import java.util.TreeMap;

/**
 * Catálogo semilla a partir de la imagen de detección y el mapa de segmentación:
 * centroide ponderado, flujo sumado y elipse de segundos momentos.
 */
public class CatalogBuilder {

    private static final class Moments {
        int n;
        double sum, sumPos;
        double sx, sy, sxx, syy, sxy;
        double gx, gy, gxx, gyy, gxy;
    }

    public SourceCatalog build(double[][] image, int[][] segmap) {
        Map<Integer, Moments> byId = new TreeMap<>();
        for (int y = 0; y < segmap.length; y++) {
            for (int x = 0; x < segmap[y].length; x++) {
                int id = segmap[y][x];
                if (id <= 0) continue;
                Moments m = byId.computeIfAbsent(id, k -> new Moments());
                double v = Double.isFinite(image[y][x]) ? image[y][x] : 0.0;
                m.n++;
                m.sum += v;
                m.gx += x; m.gy += y; m.gxx += x * x; m.gyy += y * y; m.gxy += x * y;
                if (v > 0) {
                    m.sumPos += v;
                    m.sx += v * x; m.sy += v * y;
                    m.sxx += v * x * x; m.syy += v * y * y; m.sxy += v * x * y;
                }
            }
        }

        SourceCatalog catalog = new SourceCatalog();
        for (Map.Entry<Integer, Moments> e : byId.entrySet()) {
            Moments m = e.getValue();
            double w, cx, cy, x2, y2, xy;
            if (m.sumPos > 0) {
                w = m.sumPos;
                cx = m.sx / w; cy = m.sy / w;
                x2 = m.sxx / w - cx * cx; y2 = m.syy / w - cy * cy; xy = m.sxy / w - cx * cy;
            } else {
                // Sin señal positiva: momentos geométricos
                w = m.n;
                cx = m.gx / w; cy = m.gy / w;
                x2 = m.gxx / w - cx * cx; y2 = m.gyy / w - cy * cy; xy = m.gxy / w - cx * cy;
            }
            double half = (x2 + y2) / 2.0;
            double root = Math.sqrt(((x2 - y2) / 2.0) * ((x2 - y2) / 2.0) + xy * xy);
            double a = Math.sqrt(Math.max(half + root, 0.0));
            double b = Math.sqrt(Math.max(half - root, 0.0));
            double theta = Math.toDegrees(0.5 * Math.atan2(2.0 * xy, x2 - y2));
            catalog.add(new CatalogRow(e.getKey(), cx, cy, m.sum, a, b, theta));
        }
        return catalog;
    }
}

package com.farmer.service;

import com.farmer.model.CatalogRow;
import com.farmer.model.CoordinateTransform;
import com.farmer.model.FitConfig;
import com.farmer.model.Psf;
import com.farmer.model.SourceCatalog;
import com.farmer.model.SourceSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Campo completo: imágenes por banda, pesos, máscaras, PSFs, mapa de segmentación,
 * mapa de blobs y catálogo padre. Las imágenes se indexan [y][x].
 */
public class Brick {
    private static final Logger logger = LoggerFactory.getLogger(Brick.class);

    private final String[] bands;
    private final double[][][] images;
    private final double[][][] weights;
    private final boolean[][][] masks;
    private final double[][][] psfStamps;
    private final int[][] segmap;
    private final int[][] blobmap;
    private final SourceCatalog catalog;
    private final CoordinateTransform wcs;

    public Brick(String[] bands, double[][][] images, double[][][] weights, boolean[][][] masks, double[][][] psfStamps,
                 int[][] segmap, int[][] blobmap, SourceCatalog catalog, CoordinateTransform wcs) {
        int h = segmap.length, w = segmap[0].length;
        if (blobmap.length != h || blobmap[0].length != w) throw new IllegalArgumentException("segmap and blobmap shapes differ");
        for (int b = 0; b < bands.length; b++) {
            if (images[b].length != h || images[b][0].length != w) {
                throw new IllegalArgumentException("Band " + bands[b] + " image does not match the segmentation map");
            }
        }
        this.bands = bands.clone();
        this.images = images;
        this.weights = weights != null ? weights : ones(bands.length, h, w);
        this.masks = masks != null ? masks : new boolean[bands.length][h][w];
        this.psfStamps = psfStamps != null ? psfStamps : new double[bands.length][][];
        this.segmap = segmap;
        this.blobmap = blobmap;
        this.catalog = catalog;
        this.wcs = wcs;
    }

    private static double[][][] ones(int n, int h, int w) {
        double[][][] out = new double[n][h][w];
        for (double[][] plane : out) for (double[] row : plane) Arrays.fill(row, 1.0);
        return out;
    }

    public String[] getBands() { return bands.clone(); }
    public double[][] getImage(int band) { return images[band]; }
    public int[][] getSegmap() { return segmap; }
    public int[][] getBlobmap() { return blobmap; }
    public SourceCatalog getCatalog() { return catalog; }
    public CoordinateTransform getWcs() { return wcs; }
    public int width() { return segmap[0].length; }
    public int height() { return segmap.length; }

    public List<Integer> blobIds() {
        TreeSet<Integer> ids = new TreeSet<>();
        for (int[] row : blobmap) for (int v : row) if (v > 0) ids.add(v);
        return new ArrayList<>(ids);
    }

    /**
     * Recorta el blob con un margen, enmascara los píxeles ajenos y traslada el catálogo
     * a coordenadas locales.
     *
     * @throws DegenerateBlobException si el blob no tiene píxeles o su máscara es demasiado dispersa
     */
    public Blob extractBlob(int blobId, FitConfig config) throws DegenerateBlobException {
        int h = height(), w = width();

        // --- CAJA DEL BLOB ---
        int xlo = w, xhi = -1, ylo = h, yhi = -1, count = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (blobmap[y][x] != blobId) continue;
                count++;
                xlo = Math.min(xlo, x); xhi = Math.max(xhi, x);
                ylo = Math.min(ylo, y); yhi = Math.max(yhi, y);
            }
        }
        if (count == 0) throw new DegenerateBlobException(blobId, "no pixels in blob map");

        int boxSize = (xhi - xlo + 1) * (yhi - ylo + 1);
        double maskFrac = 1.0 - (double) count / boxSize;
        if (maskFrac > config.sparseThreshold && boxSize > config.sparseSize) {
            logger.warn("Blob {} rejected: mask is sparse ({} of {} box pixels masked) - likely an artefact", blobId,
                    boxSize - count, boxSize);
            throw new DegenerateBlobException(blobId, String.format("sparse mask (%.2f masked over %d pixels)", maskFrac, boxSize));
        }

        // --- RECORTE CON MARGEN ---
        int x0 = Math.max(0, xlo - config.blobBuffer), x1 = Math.min(w - 1, xhi + config.blobBuffer);
        int y0 = Math.max(0, ylo - config.blobBuffer), y1 = Math.min(h - 1, yhi + config.blobBuffer);
        int cw = x1 - x0 + 1, ch = y1 - y0 + 1;

        int nb = bands.length;
        double[][][] cImages = new double[nb][ch][cw];
        double[][][] cWeights = new double[nb][ch][cw];
        boolean[][][] cMasks = new boolean[nb][ch][cw];
        int[][] cSeg = new int[ch][cw];
        TreeSet<Integer> sourceIds = new TreeSet<>();
        for (int y = 0; y < ch; y++) {
            for (int x = 0; x < cw; x++) {
                boolean inBlob = blobmap[y + y0][x + x0] == blobId;
                cSeg[y][x] = segmap[y + y0][x + x0];
                if (inBlob && cSeg[y][x] > 0) sourceIds.add(cSeg[y][x]);
                for (int b = 0; b < nb; b++) {
                    cImages[b][y][x] = images[b][y + y0][x + x0];
                    cWeights[b][y][x] = weights[b][y + y0][x + x0];
                    cMasks[b][y][x] = masks[b][y + y0][x + x0] || !inBlob;
                }
            }
        }

        // --- CATÁLOGO LOCAL ---
        List<SourceSeed> seeds = new ArrayList<>();
        for (int sid : sourceIds) {
            CatalogRow row = catalog.find(sid).orElseThrow(() -> new IllegalStateException(
                    "Blob " + blobId + ": segmentation id " + sid + " has no catalog row"));
            seeds.add(new SourceSeed(sid, row.x - x0, row.y - y0, row.flux, row.axisRatio(), row.theta));
        }
        if (seeds.isEmpty()) throw new DegenerateBlobException(blobId, "no segmented sources inside blob");

        Psf[] psfs = new Psf[nb];
        for (int b = 0; b < nb; b++) psfs[b] = Psf.fromStamp(psfStamps[b]);

        logger.debug("Blob {}: {} sources in {}x{} cutout at ({}, {})", blobId, seeds.size(), cw, ch, x0, y0);
        return new Blob(blobId, bands, cImages, cWeights, cMasks, psfs, cSeg, x0, y0, seeds, catalog, wcs);
    }
}

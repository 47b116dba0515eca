package com.farmer.service;

import com.farmer.engine.JointFit;
import com.farmer.model.BandImage;
import com.farmer.model.CoordinateTransform;
import com.farmer.model.Psf;
import com.farmer.model.SourceCatalog;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceSeed;
import com.farmer.model.SourceState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// El catálogo padre solo se lee y se escribe por id
public class Blob {

    private final int blobId;
    private final String[] bands;
    private final double[][][] images;
    private final double[][][] weights;
    private final boolean[][][] masks;
    private final int[][] segmap;
    private final int offsetX, offsetY;
    private final List<SourceSeed> seeds;
    private final List<SourceState> states;
    private final List<BandImage> bandImages;

    private final SourceCatalog parentCatalog;
    private final CoordinateTransform wcs;

    private List<SourceModel> modelCatalog = Collections.emptyList();
    private List<SourceModel> solutionCatalog = Collections.emptyList();
    private JointFit solutionFit;
    private boolean forcedPhotometryDone = false;

    Blob(int blobId, String[] bands, double[][][] images, double[][][] weights, boolean[][][] masks, Psf[] psfs,
         int[][] segmap, int offsetX, int offsetY, List<SourceSeed> seeds,
         SourceCatalog parentCatalog, CoordinateTransform wcs) {
        this.blobId = blobId;
        this.bands = bands.clone();
        this.images = images;
        this.weights = weights;
        this.masks = masks;
        this.segmap = segmap;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.seeds = Collections.unmodifiableList(new ArrayList<>(seeds));
        this.parentCatalog = parentCatalog;
        this.wcs = wcs;

        List<SourceState> st = new ArrayList<>();
        for (int i = 0; i < seeds.size(); i++) st.add(new SourceState(i, seeds.get(i)));
        this.states = Collections.unmodifiableList(st);
        this.bandImages = Collections.unmodifiableList(stageImages(psfs));
    }

    // Los píxeles enmascarados quedan con peso 0
    private List<BandImage> stageImages(Psf[] psfs) {
        List<BandImage> out = new ArrayList<>();
        for (int b = 0; b < bands.length; b++) {
            double[][] w = new double[weights[b].length][];
            for (int y = 0; y < w.length; y++) {
                w[y] = weights[b][y].clone();
                for (int x = 0; x < w[y].length; x++) if (masks[b][y][x]) w[y][x] = 0;
            }
            out.add(new BandImage(bands[b], images[b], w, psfs[b], 1.0, 0.0));
        }
        return out;
    }

    public int getBlobId() { return blobId; }
    public String[] getBands() { return bands.clone(); }
    public int bandCount() { return bands.length; }
    public int sourceCount() { return seeds.size(); }

    public int bandIndex(String band) {
        for (int b = 0; b < bands.length; b++) if (bands[b].equals(band)) return b;
        throw new IllegalArgumentException("Blob " + blobId + " has no band " + band);
    }

    public double[][] getImage(int band) { return images[band]; }
    public double[][] getWeight(int band) { return weights[band]; }
    public boolean[][] getMask(int band) { return masks[band]; }
    public int[][] getSegmap() { return segmap; }
    public int getOffsetX() { return offsetX; }
    public int getOffsetY() { return offsetY; }
    public int width() { return images[0][0].length; }
    public int height() { return images[0].length; }

    public List<SourceSeed> getSeeds() { return seeds; }
    public List<SourceState> getStates() { return states; }
    public List<BandImage> getBandImages() { return bandImages; }

    public SourceCatalog getParentCatalog() { return parentCatalog; }
    public CoordinateTransform getWcs() { return wcs; }

    public boolean allSolved() {
        for (SourceState s : states) if (!s.isSolved()) return false;
        return true;
    }

    // --- CATÁLOGOS DE TRABAJO ---

    public List<SourceModel> getModelCatalog() { return modelCatalog; }
    void setModelCatalog(List<SourceModel> models) { this.modelCatalog = Collections.unmodifiableList(new ArrayList<>(models)); }

    public List<SourceModel> getSolutionCatalog() { return solutionCatalog; }
    public JointFit getSolutionFit() { return solutionFit; }
    public boolean isForcedPhotometryDone() { return forcedPhotometryDone; }

    void setSolution(JointFit fit, boolean forced) {
        this.solutionFit = fit;
        this.solutionCatalog = fit.getCatalog();
        this.forcedPhotometryDone = forced;
    }

    /** Chi² de la fuente i sobre los píxeles que le asigna el mapa de segmentación. */
    public double sourceChisq(double[][] chi, int sourceIndex) {
        int sid = seeds.get(sourceIndex).id();
        double total = 0;
        for (int y = 0; y < segmap.length; y++)
            for (int x = 0; x < segmap[y].length; x++)
                if (segmap[y][x] == sid) total += chi[y][x] * chi[y][x];
        return total;
    }

    @Override
    public String toString() {
        return "Blob " + blobId + " (" + seeds.size() + " sources, " + width() + "x" + height() + ")";
    }
}

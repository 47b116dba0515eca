package com.farmer.model;

public class AperturePhotometryResult {
    public final String band;
    public final ImageType imageType;
    public final double[] radiiPixels;
    public final int[] sourceIds;
    // [fuente][apertura]
    public final double[][] flux;
    public final double[][] fluxErr;

    public AperturePhotometryResult(String band, ImageType imageType, double[] radiiPixels, int[] sourceIds,
                                    double[][] flux, double[][] fluxErr) {
        this.band = band;
        this.imageType = imageType;
        this.radiiPixels = radiiPixels;
        this.sourceIds = sourceIds;
        this.flux = flux;
        this.fluxErr = fluxErr;
    }
}

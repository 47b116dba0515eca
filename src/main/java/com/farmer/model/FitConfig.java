package com.farmer.model;

import java.util.Arrays;

/**
 * Parámetros inmutables de una corrida. Se construye desde {@link AppConfig} o con el builder.
 */
public class FitConfig {

    // Rechazo de blobs dispersos
    public final double sparseThreshold;
    public final int sparseSize;
    public final int blobBuffer;

    // Optimizador
    public final int maxSteps;
    public final double convergenceThreshold;

    // Cascada
    public final double expDevThreshold;

    // Fotometría
    public final double pixelScale;
    public final double[] apertureRadii;
    public final double residualThreshold;
    public final int residualMinArea;
    public final int deblendNThresh;
    public final double deblendCont;

    // Lote
    public final int threads;
    public final boolean aperturePhotometry;
    public final boolean residualDetection;

    private FitConfig(Builder b) {
        this.sparseThreshold = b.sparseThreshold;
        this.sparseSize = b.sparseSize;
        this.blobBuffer = b.blobBuffer;
        this.maxSteps = b.maxSteps;
        this.convergenceThreshold = b.convergenceThreshold;
        this.expDevThreshold = b.expDevThreshold;
        this.pixelScale = b.pixelScale;
        this.apertureRadii = b.apertureRadii.clone();
        this.residualThreshold = b.residualThreshold;
        this.residualMinArea = b.residualMinArea;
        this.deblendNThresh = b.deblendNThresh;
        this.deblendCont = b.deblendCont;
        this.threads = b.threads;
        this.aperturePhotometry = b.aperturePhotometry;
        this.residualDetection = b.residualDetection;
    }

    public static FitConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Radio fijo de la galaxia compacta, en píxeles. */
    public double simpleGalaxyRadius() {
        return SimpleGalaxy.RADIUS_ARCSEC / pixelScale;
    }

    public double[] apertureRadiiPixels() {
        return Arrays.stream(apertureRadii).map(r -> r / pixelScale).toArray();
    }

    public static class Builder {
        private double sparseThreshold = 0.85;
        private int sparseSize = 1000;
        private int blobBuffer = 5;
        private int maxSteps = 100;
        private double convergenceThreshold = 0.1;
        private double expDevThreshold = 0.5;
        private double pixelScale = 1.55;
        private double[] apertureRadii = {2.0, 4.0, 8.0};
        private double residualThreshold = 5.0;
        private int residualMinArea = 3;
        private int deblendNThresh = 32;
        private double deblendCont = 0.005;
        private int threads = 4;
        private boolean aperturePhotometry = true;
        private boolean residualDetection = true;

        public Builder sparseThreshold(double v) { sparseThreshold = v; return this; }
        public Builder sparseSize(int v) { sparseSize = v; return this; }
        public Builder blobBuffer(int v) { blobBuffer = v; return this; }
        public Builder maxSteps(int v) { maxSteps = v; return this; }
        public Builder convergenceThreshold(double v) { convergenceThreshold = v; return this; }
        public Builder expDevThreshold(double v) { expDevThreshold = v; return this; }
        public Builder pixelScale(double v) { pixelScale = v; return this; }
        public Builder apertureRadii(double... v) { apertureRadii = v.clone(); return this; }
        public Builder residualThreshold(double v) { residualThreshold = v; return this; }
        public Builder residualMinArea(int v) { residualMinArea = v; return this; }
        public Builder deblendNThresh(int v) { deblendNThresh = v; return this; }
        public Builder deblendCont(double v) { deblendCont = v; return this; }
        public Builder threads(int v) { threads = v; return this; }
        public Builder aperturePhotometry(boolean v) { aperturePhotometry = v; return this; }
        public Builder residualDetection(boolean v) { residualDetection = v; return this; }

        public FitConfig build() {
            if (maxSteps < 1) throw new IllegalArgumentException("maxSteps must be >= 1");
            if (pixelScale <= 0) throw new IllegalArgumentException("pixelScale must be > 0");
            if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
            return new FitConfig(this);
        }
    }
}

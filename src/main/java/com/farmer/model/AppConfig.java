package com.farmer.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.prefs.Preferences;
import java.util.stream.Collectors;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final FitConfig DEFAULTS = FitConfig.defaults();

    // Claves
    private static final String KEY_SPARSE_THRESH = "sparse_thresh";
    private static final String KEY_SPARSE_SIZE = "sparse_size";
    private static final String KEY_BLOB_BUFFER = "blob_buffer";
    private static final String KEY_MAXSTEPS = "tractor_maxsteps";
    private static final String KEY_CONTHRESH = "tractor_conthresh";
    private static final String KEY_EXP_DEV = "exp_dev_thresh";
    private static final String KEY_SCALE = "pixel_scale";
    private static final String KEY_APER = "aper_phot";
    private static final String KEY_RES_THRESH = "res_thresh";
    private static final String KEY_RES_MINAREA = "res_minarea";
    private static final String KEY_DEBLEND_NTHRESH = "res_deblend_nthresh";
    private static final String KEY_DEBLEND_CONT = "res_deblend_cont";
    private static final String KEY_THREADS = "threads";
    private static final String KEY_APER_ENABLED = "aper_phot_enabled";
    private static final String KEY_RES_ENABLED = "res_detect_enabled";
    private static final String KEY_LAST_DIR = "last_brick_dir";

    // --- GETTERS & SETTERS ---
    public static double getSparseThreshold() { return prefs.getDouble(KEY_SPARSE_THRESH, DEFAULTS.sparseThreshold); }
    public static void setSparseThreshold(double v) { prefs.putDouble(KEY_SPARSE_THRESH, v); }

    public static int getSparseSize() { return prefs.getInt(KEY_SPARSE_SIZE, DEFAULTS.sparseSize); }
    public static void setSparseSize(int v) { prefs.putInt(KEY_SPARSE_SIZE, v); }

    public static int getBlobBuffer() { return prefs.getInt(KEY_BLOB_BUFFER, DEFAULTS.blobBuffer); }
    public static void setBlobBuffer(int v) { prefs.putInt(KEY_BLOB_BUFFER, v); }

    public static int getMaxSteps() { return prefs.getInt(KEY_MAXSTEPS, DEFAULTS.maxSteps); }
    public static void setMaxSteps(int v) { prefs.putInt(KEY_MAXSTEPS, v); }

    public static double getConvergenceThreshold() { return prefs.getDouble(KEY_CONTHRESH, DEFAULTS.convergenceThreshold); }
    public static void setConvergenceThreshold(double v) { prefs.putDouble(KEY_CONTHRESH, v); }

    public static double getExpDevThreshold() { return prefs.getDouble(KEY_EXP_DEV, DEFAULTS.expDevThreshold); }
    public static void setExpDevThreshold(double v) { prefs.putDouble(KEY_EXP_DEV, v); }

    public static double getPixelScale() { return prefs.getDouble(KEY_SCALE, DEFAULTS.pixelScale); }
    public static void setPixelScale(double v) { prefs.putDouble(KEY_SCALE, v); }

    public static double[] getApertureRadii() {
        return parseList(prefs.get(KEY_APER, formatList(DEFAULTS.apertureRadii)));
    }
    public static void setApertureRadii(double[] v) { prefs.put(KEY_APER, formatList(v)); }

    public static double getResidualThreshold() { return prefs.getDouble(KEY_RES_THRESH, DEFAULTS.residualThreshold); }
    public static void setResidualThreshold(double v) { prefs.putDouble(KEY_RES_THRESH, v); }

    public static int getResidualMinArea() { return prefs.getInt(KEY_RES_MINAREA, DEFAULTS.residualMinArea); }
    public static void setResidualMinArea(int v) { prefs.putInt(KEY_RES_MINAREA, v); }

    public static int getDeblendNThresh() { return prefs.getInt(KEY_DEBLEND_NTHRESH, DEFAULTS.deblendNThresh); }
    public static void setDeblendNThresh(int v) { prefs.putInt(KEY_DEBLEND_NTHRESH, v); }

    public static double getDeblendCont() { return prefs.getDouble(KEY_DEBLEND_CONT, DEFAULTS.deblendCont); }
    public static void setDeblendCont(double v) { prefs.putDouble(KEY_DEBLEND_CONT, v); }

    public static int getThreads() { return prefs.getInt(KEY_THREADS, DEFAULTS.threads); }
    public static void setThreads(int v) { prefs.putInt(KEY_THREADS, v); }

    public static boolean isAperturePhotometry() { return prefs.getBoolean(KEY_APER_ENABLED, DEFAULTS.aperturePhotometry); }
    public static void setAperturePhotometry(boolean v) { prefs.putBoolean(KEY_APER_ENABLED, v); }

    public static boolean isResidualDetection() { return prefs.getBoolean(KEY_RES_ENABLED, DEFAULTS.residualDetection); }
    public static void setResidualDetection(boolean v) { prefs.putBoolean(KEY_RES_ENABLED, v); }

    public static String getLastBrickDir() { return prefs.get(KEY_LAST_DIR, ""); }
    public static void setLastBrickDir(String v) { prefs.put(KEY_LAST_DIR, v); }

    public static FitConfig toFitConfig() {
        return FitConfig.builder()
                .sparseThreshold(getSparseThreshold())
                .sparseSize(getSparseSize())
                .blobBuffer(getBlobBuffer())
                .maxSteps(getMaxSteps())
                .convergenceThreshold(getConvergenceThreshold())
                .expDevThreshold(getExpDevThreshold())
                .pixelScale(getPixelScale())
                .apertureRadii(getApertureRadii())
                .residualThreshold(getResidualThreshold())
                .residualMinArea(getResidualMinArea())
                .deblendNThresh(getDeblendNThresh())
                .deblendCont(getDeblendCont())
                .threads(getThreads())
                .aperturePhotometry(isAperturePhotometry())
                .residualDetection(isResidualDetection())
                .build();
    }

    public static String formatList(double[] values) {
        return Arrays.stream(values).mapToObj(v -> String.format(Locale.US, "%.2f", v)).collect(Collectors.joining(","));
    }

    public static double[] parseList(String text) {
        if (text == null || text.isBlank()) return new double[0];
        return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .mapToDouble(Double::parseDouble).toArray();
    }
}

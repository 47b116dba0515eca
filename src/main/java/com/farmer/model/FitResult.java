package com.farmer.model;

import java.util.Collections;
import java.util.List;

public final class FitResult {

    private final boolean success;
    private final String stage;
    private final String reason;
    private final int steps;
    private final List<double[]> variance;

    private FitResult(boolean success, String stage, String reason, int steps, List<double[]> variance) {
        this.success = success;
        this.stage = stage;
        this.reason = reason;
        this.steps = steps;
        this.variance = variance;
    }

    public static FitResult success(String stage, int steps, List<double[]> variance) {
        return new FitResult(true, stage, null, steps, Collections.unmodifiableList(variance));
    }

    public static FitResult failure(String stage, String reason) {
        return new FitResult(false, stage, reason, 0, Collections.emptyList());
    }

    public boolean isSuccess() { return success; }
    public String stage() { return stage; }
    public String reason() { return reason; }
    public int steps() { return steps; }

    /** Varianza de los parámetros libres de cada fuente, en el orden de las fuentes. */
    public List<double[]> variance() { return variance; }

    @Override
    public String toString() {
        return success ? "OK [" + stage + ", " + steps + " steps]" : "FAILED [" + stage + "]: " + reason;
    }
}

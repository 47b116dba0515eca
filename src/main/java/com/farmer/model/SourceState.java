package com.farmer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estado de selección de modelo de una fuente dentro de un blob.
 * Una vez resuelta, familia, solución y chi² de la decisión no cambian.
 */
public class SourceState {

    public static final int LEVELS = 3;
    public static final int SUBLEVELS = 2;

    private final int index;
    private final SourceSeed seed;

    private ModelFamily family = ModelFamily.POINT_SOURCE;
    private int level = 0;
    private final TrialResult[][] trials = new TrialResult[LEVELS][SUBLEVELS];

    private boolean solved = false;
    private SourceModel solution;
    private double solvedChisq = Double.NaN;
    private boolean fallbackDecision = false;

    private double finalChisq = Double.NaN;
    private double[] positionVariance;
    private Map<String, Double> parameterVariance = Collections.emptyMap();
    private double[] forcedVariance;
    private double[] forcedChisq;

    public SourceState(int index, SourceSeed seed) {
        this.index = index;
        this.seed = seed;
    }

    public int index() { return index; }
    public SourceSeed seed() { return seed; }
    public int sourceId() { return seed.id(); }

    public ModelFamily family() { return family; }
    public int level() { return level; }
    public boolean isSolved() { return solved; }
    public SourceModel solution() { return solution; }
    public double solvedChisq() { return solvedChisq; }
    public boolean isFallbackDecision() { return fallbackDecision; }

    public TrialResult trial(int level, int sublevel) { return trials[level][sublevel]; }

    public double chisq(int level, int sublevel) {
        TrialResult t = trials[level][sublevel];
        if (t == null) throw new IllegalStateException("Source " + seed.id() + " has no trial at (" + level + ", " + sublevel + ")");
        return t.chisq();
    }

    public void setFamily(ModelFamily family) {
        requireUnsolved();
        this.family = family;
    }

    public void advanceTo(int newLevel) {
        if (newLevel < level) {
            throw new IllegalStateException("Source " + seed.id() + " cannot move back from level " + level + " to " + newLevel);
        }
        this.level = newLevel;
    }

    public void record(int level, int sublevel, TrialResult result) {
        requireUnsolved();
        trials[level][sublevel] = result;
    }

    /** Marca la fuente como resuelta con el ensayo (level, sublevel). */
    public void solve(int level, int sublevel, boolean fallback) {
        requireUnsolved();
        TrialResult t = trials[level][sublevel];
        if (t == null) throw new IllegalStateException("Source " + seed.id() + " cannot be solved from empty trial (" + level + ", " + sublevel + ")");
        this.family = t.family();
        this.solution = t.model().copy();
        this.solvedChisq = t.chisq();
        this.fallbackDecision = fallback;
        this.solved = true;
    }

    private void requireUnsolved() {
        if (solved) throw new IllegalStateException("Source " + seed.id() + " is already solved as " + family.modelName());
    }

    // --- VARIANZAS Y CHI² FINALES ---

    public double[] positionVariance() { return positionVariance == null ? null : positionVariance.clone(); }

    // Se captura una sola vez, en el ensayo (0,0)
    public void capturePositionVariance(double varX, double varY) {
        if (positionVariance == null) positionVariance = new double[]{varX, varY};
    }

    public Map<String, Double> parameterVariance() { return parameterVariance; }

    public void setParameterVariance(Map<String, Double> variance) {
        this.parameterVariance = Collections.unmodifiableMap(new LinkedHashMap<>(variance));
    }

    public double finalChisq() { return finalChisq; }
    public void setFinalChisq(double v) { this.finalChisq = v; }

    public double[] forcedVariance() { return forcedVariance == null ? null : forcedVariance.clone(); }
    public void setForcedVariance(double[] v) { this.forcedVariance = v.clone(); }

    public double[] forcedChisq() { return forcedChisq == null ? null : forcedChisq.clone(); }
    public void setForcedChisq(double[] v) { this.forcedChisq = v.clone(); }
}

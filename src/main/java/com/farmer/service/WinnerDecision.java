package com.farmer.service;

import com.farmer.model.ModelFamily;

/**
 * Reglas de decisión de la cascada. Funciones puras sobre los chi² de los ensayos de una fuente.
 */
public final class WinnerDecision {

    public enum Outcome { SOLVE, PROMOTE }

    private final Outcome outcome;
    private final ModelFamily family;
    private final int level;
    private final int sublevel;
    private final boolean fallback;

    private WinnerDecision(Outcome outcome, ModelFamily family, int level, int sublevel, boolean fallback) {
        this.outcome = outcome;
        this.family = family;
        this.level = level;
        this.sublevel = sublevel;
        this.fallback = fallback;
    }

    static WinnerDecision solve(ModelFamily family, int level, int sublevel) {
        return new WinnerDecision(Outcome.SOLVE, family, level, sublevel, false);
    }

    static WinnerDecision fallback(ModelFamily family, int level, int sublevel) {
        return new WinnerDecision(Outcome.SOLVE, family, level, sublevel, true);
    }

    static WinnerDecision promote(ModelFamily family, int toLevel) {
        return new WinnerDecision(Outcome.PROMOTE, family, toLevel, 0, false);
    }

    public Outcome outcome() { return outcome; }
    public boolean isSolved() { return outcome == Outcome.SOLVE; }

    /** Familia ganadora, o la familia con la que sigue la fuente si se promueve. */
    public ModelFamily family() { return family; }

    /** Ensayo ganador (nivel, subnivel); si se promueve, nivel de destino. */
    public int level() { return level; }
    public int sublevel() { return sublevel; }

    /** Decisión tomada por la regla de respaldo, no por una de las reglas principales. */
    public boolean isFallback() { return fallback; }

    // --- NIVEL 0: fuente puntual contra galaxia compacta ---

    public static WinnerDecision level0(double chisqPointSource, double chisqSimpleGalaxy) {
        if (chisqPointSource < chisqSimpleGalaxy) return solve(ModelFamily.POINT_SOURCE, 0, 0);
        return promote(ModelFamily.EXP_GALAXY, 1);
    }

    // --- NIVEL 1: exponencial contra de Vaucouleurs, con la galaxia compacta como referencia ---

    public static WinnerDecision level1(double chisqSimpleGalaxy, double chisqExp, double chisqDev, double closeThreshold) {
        boolean nearTie = Math.abs(chisqExp - chisqDev) < closeThreshold;
        boolean expBeatsSg = chisqExp < chisqSimpleGalaxy;
        boolean devBeatsSg = chisqDev < chisqSimpleGalaxy;

        if (!expBeatsSg && !devBeatsSg) return solve(ModelFamily.SIMPLE_GALAXY, 0, 1);
        if (expBeatsSg && devBeatsSg && nearTie) return promote(ModelFamily.COMPOSITE_GALAXY, 2);
        if (expBeatsSg && !nearTie && chisqExp < chisqDev) return solve(ModelFamily.EXP_GALAXY, 1, 0);
        if (devBeatsSg && !nearTie && chisqDev < chisqExp) return solve(ModelFamily.DEV_GALAXY, 1, 1);

        // Caso no cubierto (p.ej. casi empate con un solo modelo bajo la referencia): gana el menor chi²,
        // los empates van a la familia más simple
        if (chisqSimpleGalaxy <= chisqExp && chisqSimpleGalaxy <= chisqDev) return fallback(ModelFamily.SIMPLE_GALAXY, 0, 1);
        if (chisqExp <= chisqDev) return fallback(ModelFamily.EXP_GALAXY, 1, 0);
        return fallback(ModelFamily.DEV_GALAXY, 1, 1);
    }

    // --- NIVEL 2: compuesta contra la mejor de exponencial/de Vaucouleurs ---

    public static WinnerDecision level2(double chisqExp, double chisqDev, double chisqComposite) {
        if (chisqComposite < chisqExp && chisqComposite < chisqDev) return solve(ModelFamily.COMPOSITE_GALAXY, 2, 0);
        if (chisqExp < chisqDev) return solve(ModelFamily.EXP_GALAXY, 1, 0);
        if (chisqDev < chisqExp) return solve(ModelFamily.DEV_GALAXY, 1, 1);
        return fallback(ModelFamily.EXP_GALAXY, 1, 0);
    }

    @Override
    public String toString() {
        if (outcome == Outcome.PROMOTE) return "promote to level " + level + " as " + family.modelName();
        return (fallback ? "fallback " : "") + family.modelName() + " from trial (" + level + ", " + sublevel + ")";
    }
}

package com.farmer.service;

import com.farmer.engine.JointFit;
import com.farmer.model.BandImage;
import com.farmer.model.FitConfig;
import com.farmer.model.FitResult;
import com.farmer.model.ModelFamily;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceState;
import com.farmer.model.TrialResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selección de modelo por niveles: puntual/compacta, exponencial/de Vaucouleurs y compuesta.
 * Cada ensayo ajusta todas las fuentes del blob juntas sobre todas las bandas; el chi² de la
 * decisión se mide solo en la banda de modelado (banda 0). Solo se anotan resultados para las
 * fuentes sin resolver.
 */
public class ModelSelectionCascade {
    private static final Logger logger = LoggerFactory.getLogger(ModelSelectionCascade.class);

    static final ModelFamily[][] TRIAL_FAMILIES = {
            {ModelFamily.POINT_SOURCE, ModelFamily.SIMPLE_GALAXY},
            {ModelFamily.EXP_GALAXY, ModelFamily.DEV_GALAXY},
            {ModelFamily.COMPOSITE_GALAXY}
    };

    private static final int MODELING_BAND = 0;

    private final ModelStager stager;
    private final OptimizationDriver driver;
    private final double expDevThreshold;

    public ModelSelectionCascade(ModelStager stager, OptimizationDriver driver, double expDevThreshold) {
        this.stager = stager;
        this.driver = driver;
        this.expDevThreshold = expDevThreshold;
    }

    public ModelSelectionCascade(FitConfig config, OptimizationDriver driver) {
        this(new ModelStager(config.simpleGalaxyRadius()), driver, config.expDevThreshold);
    }

    /**
     * Resuelve todas las fuentes del blob y hace el ajuste conjunto final.
     * Un fallo del optimizador en cualquier ensayo aborta el blob completo.
     */
    public FitResult run(Blob blob) {
        List<BandImage> images = blob.getBandImages();

        for (int level = 0; !blob.allSolved(); level++) {
            if (level >= SourceState.LEVELS) {
                throw new IllegalStateException("Blob " + blob.getBlobId() + ": sources left unsolved after level " + (level - 1));
            }
            for (int sublevel = 0; sublevel < TRIAL_FAMILIES[level].length; sublevel++) {
                FitResult trial = runTrial(blob, images, level, sublevel);
                if (!trial.isSuccess()) {
                    logger.error("Blob {}: fit failed at level {} sublevel {} ({}): {}", blob.getBlobId(), level, sublevel,
                            trial.stage(), trial.reason());
                    return trial;
                }
            }
            decide(blob, level);
        }
        return finalOptimization(blob, images);
    }

    // --- ENSAYOS ---

    private FitResult runTrial(Blob blob, List<BandImage> images, int level, int sublevel) {
        ModelFamily family = TRIAL_FAMILIES[level][sublevel];
        for (SourceState s : blob.getStates()) if (!s.isSolved()) s.setFamily(family);

        List<SourceModel> models = stager.stage(blob);
        JointFit fit = new JointFit(images, models);
        String stage = "trial (" + level + ", " + sublevel + ") " + family.modelName();
        FitResult result = driver.optimize(fit, stage);
        if (!result.isSuccess()) return result;

        double[][] chi = fit.getChiImage(MODELING_BAND);
        for (SourceState s : blob.getStates()) {
            int i = s.index();
            if (s.isSolved()) continue;
            SourceModel m = models.get(i);
            double chisq = blob.sourceChisq(chi, i);
            s.record(level, sublevel, new TrialResult(family, m.copy(), chisq));
            if (level == 0 && sublevel == 0) {
                Map<String, Double> var = byName(m, result.variance().get(i));
                s.capturePositionVariance(var.getOrDefault("pos.x", Double.NaN), var.getOrDefault("pos.y", Double.NaN));
            }
        }
        logger.debug("Blob {}: {} done in {} steps", blob.getBlobId(), stage, result.steps());
        return result;
    }

    // --- DECISIÓN ---

    private void decide(Blob blob, int level) {
        for (SourceState s : blob.getStates()) {
            if (s.isSolved()) continue;
            WinnerDecision d = decision(s, level);
            if (d.isSolved()) {
                s.advanceTo(level);
                s.solve(d.level(), d.sublevel(), d.isFallback());
                if (d.isFallback()) {
                    logger.info("Blob {}: source {} resolved by fallback rule at level {} -> {}", blob.getBlobId(),
                            s.sourceId(), level, d.family().modelName());
                }
            } else {
                s.setFamily(d.family());
                s.advanceTo(d.level());
            }
            logger.debug("Blob {}: source {} at level {}: {}", blob.getBlobId(), s.sourceId(), level, d);
        }
    }

    WinnerDecision decision(SourceState s, int level) {
        switch (level) {
            case 0:
                return WinnerDecision.level0(s.chisq(0, 0), s.chisq(0, 1));
            case 1:
                return WinnerDecision.level1(s.chisq(0, 1), s.chisq(1, 0), s.chisq(1, 1), expDevThreshold);
            case 2:
                return WinnerDecision.level2(s.chisq(1, 0), s.chisq(1, 1), s.chisq(2, 0));
            default:
                throw new IllegalArgumentException("No decision rule for level " + level);
        }
    }

    // --- AJUSTE FINAL ---

    private FitResult finalOptimization(Blob blob, List<BandImage> images) {
        List<SourceModel> solution = new ArrayList<>();
        for (SourceState s : blob.getStates()) solution.add(s.solution().copy());
        blob.setModelCatalog(solution);

        JointFit fit = new JointFit(images, solution);
        FitResult result = driver.optimize(fit, "final optimization");
        if (!result.isSuccess()) {
            logger.error("Blob {}: final optimization failed: {}", blob.getBlobId(), result.reason());
            return result;
        }

        double[][] chi = fit.getChiImage(MODELING_BAND);
        for (SourceState s : blob.getStates()) {
            int i = s.index();
            s.setFinalChisq(blob.sourceChisq(chi, i));
            s.setParameterVariance(byName(solution.get(i), result.variance().get(i)));
        }
        blob.setSolution(fit, false);
        logger.info("Blob {}: solved {} sources", blob.getBlobId(), blob.sourceCount());
        return result;
    }

    static Map<String, Double> byName(SourceModel model, double[] variance) {
        List<String> names = model.thawedParameterNames();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int k = 0; k < names.size(); k++) out.put(names.get(k), variance[k]);
        return out;
    }
}

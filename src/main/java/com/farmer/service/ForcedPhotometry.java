package com.farmer.service;

import com.farmer.engine.JointFit;
import com.farmer.model.FitResult;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reajusta solo el flujo, en todas las bandas a la vez, sobre la morfología ya resuelta.
 */
public class ForcedPhotometry {
    private static final Logger logger = LoggerFactory.getLogger(ForcedPhotometry.class);

    private final OptimizationDriver driver;

    public ForcedPhotometry(OptimizationDriver driver) {
        this.driver = driver;
    }

    public FitResult run(Blob blob) {
        List<SourceModel> solved = blob.getSolutionCatalog();
        if (solved.isEmpty()) {
            throw new IllegalStateException("Blob " + blob.getBlobId() + " has no solution catalog; run the cascade first");
        }

        List<SourceModel> models = new ArrayList<>(solved.size());
        for (SourceModel s : solved) {
            SourceModel m = s.copy();
            double[] fluxes = new double[m.bandCount()];
            Arrays.fill(fluxes, m.getFlux(0));
            m.setFluxes(fluxes);
            m.freezeAllBut(SourceModel.BRIGHTNESS);
            models.add(m);
        }

        JointFit fit = new JointFit(blob.getBandImages(), models);
        FitResult result = driver.optimize(fit, "forced photometry");
        if (!result.isSuccess()) {
            logger.error("Blob {}: forced photometry failed: {}", blob.getBlobId(), result.reason());
            return result;
        }

        // --- CHI² Y VARIANZA POR BANDA ---
        int nb = blob.bandCount();
        double[][] chisq = new double[blob.sourceCount()][nb];
        for (int b = 0; b < nb; b++) {
            double[][] chi = fit.getChiImage(b);
            for (int i = 0; i < blob.sourceCount(); i++) chisq[i][b] = blob.sourceChisq(chi, i);
        }
        for (SourceState s : blob.getStates()) {
            int i = s.index();
            s.setForcedChisq(chisq[i]);
            s.setForcedVariance(result.variance().get(i));
        }

        blob.setSolution(fit, true);
        logger.debug("Blob {}: forced photometry over {} bands in {} steps", blob.getBlobId(), nb, result.steps());
        return result;
    }
}

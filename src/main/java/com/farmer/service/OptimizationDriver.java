package com.farmer.service;

import com.farmer.engine.JointFit;
import com.farmer.engine.OptimizationException;
import com.farmer.engine.Optimizer;
import com.farmer.engine.OptimizerStep;
import com.farmer.model.FitResult;
import com.farmer.model.SourceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bucle acotado sobre el optimizador externo. Termina al caer dlnp bajo el umbral o al
 * agotar los pasos; un fallo del optimizador se devuelve como {@link FitResult#failure}, sin reintentos.
 */
public class OptimizationDriver {
    private static final Logger logger = LoggerFactory.getLogger(OptimizationDriver.class);

    private final Optimizer optimizer;
    private final int maxSteps;
    private final double convergenceThreshold;

    public OptimizationDriver(Optimizer optimizer, int maxSteps, double convergenceThreshold) {
        this.optimizer = optimizer;
        this.maxSteps = maxSteps;
        this.convergenceThreshold = convergenceThreshold;
    }

    public FitResult optimize(JointFit fit, String stage) {
        OptimizerStep last = null;
        int steps = 0;
        long start = System.currentTimeMillis();
        for (int i = 0; i < maxSteps; i++) {
            try {
                last = optimizer.step(fit);
            } catch (OptimizationException e) {
                logger.warn("{}: optimizer failed at step {}: {}", stage, i, e.getMessage());
                return FitResult.failure(stage, e.getMessage());
            }
            steps++;
            if (last.dlnp() < convergenceThreshold) break;
        }
        logger.debug("{}: {} steps in {} ms (last dlnp {})", stage, steps, System.currentTimeMillis() - start,
                last == null ? 0 : last.dlnp());
        double[] variance = last == null ? new double[0] : last.variance();
        return FitResult.success(stage, steps, partitionVariance(variance, fit.getCatalog()));
    }

    /**
     * Reparte la varianza plana entre las fuentes según el número de parámetros libres de cada modelo.
     */
    public static List<double[]> partitionVariance(double[] variance, List<SourceModel> models) {
        int expected = 0;
        for (SourceModel m : models) expected += m.numberOfParams();
        if (expected != variance.length) {
            throw new IllegalStateException("Optimizer returned " + variance.length + " variances for " + expected + " free parameters");
        }
        List<double[]> out = new ArrayList<>(models.size());
        int counter = 0;
        for (SourceModel m : models) {
            int n = m.numberOfParams();
            out.add(Arrays.copyOfRange(variance, counter, counter + n));
            counter += n;
        }
        return out;
    }
}

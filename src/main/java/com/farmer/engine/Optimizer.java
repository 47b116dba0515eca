package com.farmer.engine;

public interface Optimizer {
    /**
     * Ejecuta un paso sobre todos los parámetros libres de todos los modelos del ajuste.
     */
    OptimizerStep step(JointFit fit) throws OptimizationException;
}
